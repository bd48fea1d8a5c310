package org.javai.springai.usecases.connection;

/**
 * Exception thrown when a session cannot be opened against the configured backend.
 */
public class ConnectionException extends RuntimeException {

	public ConnectionException(String message, Throwable cause) {
		super(message, cause);
	}
}
