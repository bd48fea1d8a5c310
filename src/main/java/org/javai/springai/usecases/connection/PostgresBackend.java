package org.javai.springai.usecases.connection;

import java.util.Properties;

/**
 * PostgreSQL through pgJDBC.
 */
public class PostgresBackend implements Backend {

	@Override
	public BackendKind kind() {
		return BackendKind.POSTGRES;
	}

	@Override
	public int defaultPort() {
		return 5432;
	}

	@Override
	public String jdbcUrl(ConnectionProfile profile) {
		return "jdbc:postgresql://%s:%d/%s".formatted(profile.host(), profile.effectivePort(defaultPort()), profile.database());
	}

	@Override
	public Properties connectProperties(ConnectionProfile profile) {
		Properties properties = new Properties();
		// pgJDBC takes seconds
		properties.setProperty("connectTimeout", Long.toString(Math.max(1, profile.connectTimeout().toSeconds())));
		return properties;
	}

	@Override
	public String statementDialectHints() {
		return "Use PostgreSQL syntax only. Use double quotes for column names and single quotes for values.";
	}
}
