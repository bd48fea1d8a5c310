package org.javai.springai.usecases.testsupport;

import java.util.Properties;
import org.javai.springai.usecases.connection.Backend;
import org.javai.springai.usecases.connection.BackendKind;
import org.javai.springai.usecases.connection.ConnectionProfile;

/**
 * Stands in for PostgreSQL with an in-memory H2 database in PostgreSQL mode. The profile's
 * database name selects the in-memory database; host and port are ignored.
 */
public class H2Backend implements Backend {

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
		return H2Databases.url(profile.database());
	}

	@Override
	public Properties connectProperties(ConnectionProfile profile) {
		return new Properties();
	}

	@Override
	public String statementDialectHints() {
		return "Use PostgreSQL syntax only.";
	}
}
