package org.javai.springai.usecases.connection;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Supported relational backends.
 */
public enum BackendKind {
	MYSQL("mysql", "mariadb"),
	POSTGRES("postgres", "postgresql", "pg");

	private final List<String> names;

	BackendKind(String... names) {
		this.names = List.of(names);
	}

	/**
	 * @return the canonical lowercase name, as used in configuration
	 */
	public String configName() {
		return names.get(0);
	}

	/**
	 * Resolves a backend from its configuration name (case-insensitive).
	 *
	 * @throws ConfigurationException if the name is blank or unsupported
	 */
	public static BackendKind parse(String name) {
		if (name == null || name.isBlank()) {
			throw new ConfigurationException("Database backend is not configured");
		}
		String normalized = name.trim().toLowerCase(Locale.ROOT);
		return Arrays.stream(values())
				.filter(kind -> kind.names.contains(normalized))
				.findFirst()
				.orElseThrow(() -> new ConfigurationException("Unsupported database backend: " + name));
	}
}
