package org.javai.springai.usecases.connection;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * The backend-specific knowledge needed to reach a database.
 */
public interface Backend {

	BackendKind kind();

	int defaultPort();

	/**
	 * Builds the JDBC URL for the given profile, falling back to {@link #defaultPort()}.
	 */
	String jdbcUrl(ConnectionProfile profile);

	/**
	 * Driver property carrying the connect timeout, with the unit the driver expects.
	 */
	Properties connectProperties(ConnectionProfile profile);

	/**
	 * Syntax instruction handed to statement generators targeting this backend.
	 */
	String statementDialectHints();

	/**
	 * Opens a new connection with auto-commit disabled.
	 *
	 * @throws SQLException if the driver cannot connect
	 */
	default Connection connect(ConnectionProfile profile) throws SQLException {
		Properties properties = connectProperties(profile);
		if (profile.user() != null) {
			properties.setProperty("user", profile.user());
		}
		if (profile.password() != null) {
			properties.setProperty("password", profile.password());
		}
		return withManualCommit(DriverManager.getConnection(jdbcUrl(profile), properties));
	}

	/**
	 * Disables auto-commit on a freshly opened connection, closing it if that fails.
	 *
	 * @throws SQLException if auto-commit cannot be disabled
	 */
	static Connection withManualCommit(Connection connection) throws SQLException {
		try {
			connection.setAutoCommit(false);
			return connection;
		}
		catch (SQLException | RuntimeException e) {
			try {
				connection.close();
			}
			catch (SQLException closeFailure) {
				e.addSuppressed(closeFailure);
			}
			throw e;
		}
	}
}
