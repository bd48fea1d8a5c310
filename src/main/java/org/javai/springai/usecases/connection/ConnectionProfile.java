package org.javai.springai.usecases.connection;

import java.time.Duration;
import java.util.OptionalInt;

/**
 * Where and how to connect.
 *
 * <p>Fields are kept as supplied so that a profile read from configuration can be reported back
 * as-is; {@link #validate()} checks them. The port is optional; when absent the backend's
 * default port is used.</p>
 *
 * @param backend backend name, e.g. {@code mysql} or {@code postgres}
 * @param host database host
 * @param port port as text, or null for the backend default
 * @param database database (schema) name
 * @param user user name
 * @param password password, never logged
 * @param connectTimeout driver connect timeout
 */
public record ConnectionProfile(
		String backend,
		String host,
		String port,
		String database,
		String user,
		String password,
		Duration connectTimeout) {

	public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);

	public ConnectionProfile {
		port = port == null || port.isBlank() ? null : port.trim();
		connectTimeout = connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * @throws ConfigurationException if the backend is unsupported
	 */
	public BackendKind backendKind() {
		return BackendKind.parse(backend);
	}

	/**
	 * @return the configured port, or {@code defaultPort} when none is configured
	 * @throws ConfigurationException if the configured port is not a number in 1..65535
	 */
	public int effectivePort(int defaultPort) {
		return portNumber().orElse(defaultPort);
	}

	/**
	 * Checks that the profile can be used to connect.
	 *
	 * @return this profile
	 * @throws ConfigurationException describing the first problem found
	 */
	public ConnectionProfile validate() {
		backendKind();
		if (host == null || host.isBlank()) {
			throw new ConfigurationException("Database host is not configured");
		}
		if (database == null || database.isBlank()) {
			throw new ConfigurationException("Database name is not configured");
		}
		portNumber();
		if (connectTimeout.isNegative() || connectTimeout.isZero()) {
			throw new ConfigurationException("Connect timeout must be positive: " + connectTimeout);
		}
		return this;
	}

	private OptionalInt portNumber() {
		if (port == null) {
			return OptionalInt.empty();
		}
		int number;
		try {
			number = Integer.parseInt(port);
		}
		catch (NumberFormatException e) {
			throw new ConfigurationException("Database port is not numeric: " + port, e);
		}
		if (number < 1 || number > 65535) {
			throw new ConfigurationException("Database port out of range: " + port);
		}
		return OptionalInt.of(number);
	}

	@Override
	public String toString() {
		return "ConnectionProfile[backend=%s, host=%s, port=%s, database=%s, user=%s, password=%s, connectTimeout=%s]"
				.formatted(backend, host, port, database, user, password == null ? null : "****", connectTimeout);
	}

	public static final class Builder {
		private String backend;
		private String host;
		private String port;
		private String database;
		private String user;
		private String password;
		private Duration connectTimeout;

		private Builder() {
		}

		public Builder backend(String backend) {
			this.backend = backend;
			return this;
		}

		public Builder backend(BackendKind kind) {
			this.backend = kind.configName();
			return this;
		}

		public Builder host(String host) {
			this.host = host;
			return this;
		}

		public Builder port(String port) {
			this.port = port;
			return this;
		}

		public Builder port(int port) {
			this.port = Integer.toString(port);
			return this;
		}

		public Builder database(String database) {
			this.database = database;
			return this;
		}

		public Builder user(String user) {
			this.user = user;
			return this;
		}

		public Builder password(String password) {
			this.password = password;
			return this;
		}

		public Builder connectTimeout(Duration connectTimeout) {
			this.connectTimeout = connectTimeout;
			return this;
		}

		public ConnectionProfile build() {
			return new ConnectionProfile(backend, host, port, database, user, password, connectTimeout);
		}
	}
}
