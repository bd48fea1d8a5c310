package org.javai.springai.usecases.connection;

/**
 * Exception thrown when a connection profile is incomplete or names something unsupported.
 * Raised before any connection attempt is made.
 */
public class ConfigurationException extends RuntimeException {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
