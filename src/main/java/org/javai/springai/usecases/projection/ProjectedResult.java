package org.javai.springai.usecases.projection;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.usecases.catalog.UseCase;
import org.javai.springai.usecases.execution.ExecutionResult;

/**
 * What a caller gets back from executing a use case.
 *
 * @param useCase the use case executed, or null if it could not be resolved
 * @param statementExecuted the statement text after normalization
 * @param boundInputColumns values bound by parameter name, echoed even on failure
 * @param outcome the execution outcome
 * @param message one-line human summary of the outcome
 */
public record ProjectedResult(
		UseCase useCase,
		String statementExecuted,
		Map<String, Object> boundInputColumns,
		ExecutionResult outcome,
		String message) {

	public ProjectedResult {
		Objects.requireNonNull(outcome, "outcome must not be null");
		Objects.requireNonNull(message, "message must not be null");
		boundInputColumns = boundInputColumns != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(boundInputColumns))
				: Map.of();
	}

	public boolean isSuccess() {
		return outcome.isSuccess();
	}
}
