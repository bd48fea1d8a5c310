package org.javai.springai.usecases.execution;

/**
 * Classification of a failed execution.
 */
public enum ErrorKind {
	/** The connection profile is invalid; no connection was attempted. */
	CONFIGURATION,
	/** The backend could not be reached when the session was opened. */
	CONNECTION,
	/** A data or referential constraint rejected the statement. */
	CONSTRAINT_VIOLATION,
	/** The backend could not parse the statement or resolve a name in it. */
	SYNTAX_DEFECT,
	/** Lock timeouts, deadlocks, cancellations, lost connections and other transient backend conditions. */
	OPERATIONAL,
	/** The requested use case does not exist. */
	NOT_FOUND,
	UNKNOWN
}
