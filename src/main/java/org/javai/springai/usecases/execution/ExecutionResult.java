package org.javai.springai.usecases.execution;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one statement execution.
 */
public sealed interface ExecutionResult {

	/**
	 * Rows returned by a query, each an ordered column-to-value map.
	 */
	record RowSet(List<Map<String, Object>> rows) implements ExecutionResult {
		public RowSet {
			rows = List.copyOf(rows);
		}
	}

	/**
	 * A query that matched no rows.
	 */
	record NoRecords() implements ExecutionResult {}

	/**
	 * @param count rows affected by the statement itself
	 * @param clearedDependents references set to null before a delete so that it could proceed
	 */
	record Affected(int count, int clearedDependents) implements ExecutionResult {
		public Affected(int count) {
			this(count, 0);
		}
	}

	/**
	 * @param kind classification of the failure
	 * @param message summary suitable for an end user
	 * @param detail the backend's own message, verbatim
	 * @param suggestedFix a repaired statement the caller may choose to run, or null
	 */
	record Failure(ErrorKind kind, String message, String detail, String suggestedFix) implements ExecutionResult {
		public Failure {
			Objects.requireNonNull(kind, "kind must not be null");
			Objects.requireNonNull(message, "message must not be null");
		}

		public Failure(ErrorKind kind, String message) {
			this(kind, message, message, null);
		}

		public Optional<String> suggestion() {
			return Optional.ofNullable(suggestedFix);
		}
	}

	default boolean isSuccess() {
		return !(this instanceof Failure);
	}
}
