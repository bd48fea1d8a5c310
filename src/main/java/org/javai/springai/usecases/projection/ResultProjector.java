package org.javai.springai.usecases.projection;

import org.javai.springai.usecases.catalog.UseCase;
import org.javai.springai.usecases.execution.BoundStatement;
import org.javai.springai.usecases.execution.ExecutionResult;
import org.javai.springai.usecases.execution.ExecutionResult.Affected;
import org.javai.springai.usecases.execution.ExecutionResult.Failure;
import org.javai.springai.usecases.execution.ExecutionResult.NoRecords;
import org.javai.springai.usecases.execution.ExecutionResult.RowSet;
import org.javai.springai.usecases.sql.StatementKind;

/**
 * Wraps an execution outcome with the use case, the executed statement and the bound inputs.
 */
public class ResultProjector {

	static final String NO_RECORDS = "No records found.";
	static final String DELETED = "Record deleted successfully.";
	static final String DELETED_WITH_DEPENDENTS = "Record deleted successfully after resolving %d dependent reference(s).";
	static final String EXECUTED = "Query executed successfully.";

	public ProjectedResult project(UseCase useCase, BoundStatement bound, ExecutionResult result) {
		String statement = bound != null ? bound.statement().statement() : null;
		StatementKind kind = bound != null ? bound.statement().kind() : StatementKind.UNKNOWN;
		return new ProjectedResult(useCase, statement, bound != null ? bound.values() : null, result,
				message(kind, result));
	}

	String message(StatementKind kind, ExecutionResult result) {
		if (result instanceof RowSet rowSet) {
			return rowSet.rows().size() + " record(s) found.";
		}
		if (result instanceof NoRecords) {
			return NO_RECORDS;
		}
		if (result instanceof Affected affected) {
			if (kind != StatementKind.DELETE) {
				return EXECUTED;
			}
			return affected.clearedDependents() > 0
					? DELETED_WITH_DEPENDENTS.formatted(affected.clearedDependents())
					: DELETED;
		}
		return ((Failure) result).message();
	}
}
