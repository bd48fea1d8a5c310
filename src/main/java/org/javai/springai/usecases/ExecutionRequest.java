package org.javai.springai.usecases;

import java.util.Objects;
import java.util.stream.Stream;
import org.javai.springai.usecases.execution.ParameterValues;

/**
 * A request to execute either a catalog use case, found by id or by description, or a raw
 * statement template. Exactly one of the three targets is set.
 *
 * @param useCaseId id of a catalog use case
 * @param useCaseDescription description of a catalog use case
 * @param template a raw statement template
 * @param values the caller's parameter values
 */
public record ExecutionRequest(String useCaseId, String useCaseDescription, String template, ParameterValues values) {

	public ExecutionRequest {
		long targets = Stream.of(useCaseId, useCaseDescription, template).filter(Objects::nonNull).count();
		if (targets != 1) {
			throw new IllegalArgumentException("Exactly one of useCaseId, useCaseDescription or template must be set");
		}
		values = values != null ? values : ParameterValues.none();
	}

	public static ExecutionRequest forUseCase(String useCaseId, ParameterValues values) {
		return new ExecutionRequest(Objects.requireNonNull(useCaseId, "useCaseId must not be null"), null, null, values);
	}

	public static ExecutionRequest forDescription(String description, ParameterValues values) {
		return new ExecutionRequest(null, Objects.requireNonNull(description, "description must not be null"), null,
				values);
	}

	public static ExecutionRequest forTemplate(String template, ParameterValues values) {
		return new ExecutionRequest(null, null, Objects.requireNonNull(template, "template must not be null"), values);
	}

	public boolean isRawTemplate() {
		return template != null;
	}
}
