package org.javai.springai.usecases.connection;

import java.util.Properties;

/**
 * MySQL and MariaDB through Connector/J.
 */
public class MySqlBackend implements Backend {

	@Override
	public BackendKind kind() {
		return BackendKind.MYSQL;
	}

	@Override
	public int defaultPort() {
		return 3306;
	}

	@Override
	public String jdbcUrl(ConnectionProfile profile) {
		return "jdbc:mysql://%s:%d/%s".formatted(profile.host(), profile.effectivePort(defaultPort()), profile.database());
	}

	@Override
	public Properties connectProperties(ConnectionProfile profile) {
		Properties properties = new Properties();
		// Connector/J takes milliseconds
		properties.setProperty("connectTimeout", Long.toString(profile.connectTimeout().toMillis()));
		return properties;
	}

	@Override
	public String statementDialectHints() {
		return "Use MySQL syntax only.";
	}
}
