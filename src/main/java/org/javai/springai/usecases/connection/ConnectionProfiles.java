package org.javai.springai.usecases.connection;

import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads connection profiles from YAML documents or environment variables.
 *
 * <p>YAML documents hold a {@code connection} section:</p>
 *
 * <pre>
 * connection:
 *   backend: postgres
 *   host: localhost
 *   port: 5432
 *   database: finance
 *   user: app
 *   password: secret
 *   connectTimeoutSeconds: 10
 * </pre>
 *
 * <p>The environment uses {@code DB_TYPE}, {@code DB_HOST}, {@code DB_PORT}, {@code DB_NAME},
 * {@code DB_USER} and {@code DB_PASSWORD}.</p>
 *
 * <p>Loading does not validate; see {@link ConnectionProfile#validate()}.</p>
 */
public final class ConnectionProfiles {

	private ConnectionProfiles() {
	}

	public static ConnectionProfile fromYaml(InputStream inputStream) {
		Objects.requireNonNull(inputStream, "inputStream must not be null");
		try {
			return fromDocument(new Yaml().load(inputStream));
		}
		catch (YAMLException e) {
			throw new ConfigurationException("Failed to read connection profile YAML: " + e.getMessage(), e);
		}
	}

	public static ConnectionProfile fromYaml(String yamlContent) {
		Objects.requireNonNull(yamlContent, "yamlContent must not be null");
		try {
			return fromDocument(new Yaml().load(yamlContent));
		}
		catch (YAMLException e) {
			throw new ConfigurationException("Failed to read connection profile YAML: " + e.getMessage(), e);
		}
	}

	public static ConnectionProfile fromEnvironment() {
		return fromEnvironment(System.getenv());
	}

	public static ConnectionProfile fromEnvironment(Map<String, String> environment) {
		Objects.requireNonNull(environment, "environment must not be null");
		return ConnectionProfile.builder()
				.backend(environment.get("DB_TYPE"))
				.host(environment.get("DB_HOST"))
				.port(environment.get("DB_PORT"))
				.database(environment.get("DB_NAME"))
				.user(environment.get("DB_USER"))
				.password(environment.get("DB_PASSWORD"))
				.build();
	}

	private static ConnectionProfile fromDocument(Object document) {
		if (!(document instanceof Map<?, ?> root) || !(root.get("connection") instanceof Map<?, ?> section)) {
			throw new ConfigurationException("Missing required 'connection' section");
		}
		Object timeout = section.get("connectTimeoutSeconds");
		return ConnectionProfile.builder()
				.backend(text(section.get("backend")))
				.host(text(section.get("host")))
				.port(text(section.get("port")))
				.database(text(section.get("database")))
				.user(text(section.get("user")))
				.password(text(section.get("password")))
				.connectTimeout(timeout != null ? Duration.ofSeconds(seconds(timeout)) : null)
				.build();
	}

	private static long seconds(Object value) {
		if (value instanceof Number number) {
			return number.longValue();
		}
		try {
			return Long.parseLong(value.toString().trim());
		}
		catch (NumberFormatException e) {
			throw new ConfigurationException("connectTimeoutSeconds is not numeric: " + value, e);
		}
	}

	private static String text(Object value) {
		return value != null ? value.toString() : null;
	}
}
