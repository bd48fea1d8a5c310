package org.javai.springai.usecases.projection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.javai.springai.usecases.execution.ExecutionResult.Failure;
import org.javai.springai.usecases.execution.ExecutionResult.NoRecords;
import org.javai.springai.usecases.execution.ExecutionResult.RowSet;

/**
 * Renders a {@link ProjectedResult} as the JSON envelope served over HTTP.
 *
 * <p>Queries carry their rows under {@code results}; other successes carry the summary message
 * there. Every envelope carries the summary under {@code message}. Failures carry {@code error} and {@code error_kind}, plus
 * {@code suggested_fix} when a repaired statement is available.</p>
 */
public final class ProjectedResultJsonMapper {

	private static final ObjectMapper mapper = new ObjectMapper()
			.registerModule(new JavaTimeModule())
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

	private ProjectedResultJsonMapper() {
	}

	public static ObjectNode toJson(ProjectedResult result) {
		ObjectNode node = mapper.createObjectNode();
		if (result.useCase() != null) {
			node.put("use_case_id", result.useCase().id());
			node.put("use_case", result.useCase().description());
		}
		node.put("query", result.statementExecuted());
		node.set("user_input_columns", mapper.valueToTree(result.boundInputColumns()));
		if (result.outcome() instanceof RowSet rowSet) {
			node.set("results", mapper.valueToTree(rowSet.rows()));
		}
		else if (result.outcome() instanceof NoRecords) {
			node.putArray("results");
		}
		else if (result.outcome() instanceof Failure failure) {
			node.put("error", failure.message());
			node.put("error_kind", failure.kind().name());
			if (failure.detail() != null && !failure.detail().equals(failure.message())) {
				node.put("detail", failure.detail());
			}
			failure.suggestion().ifPresent(fix -> node.put("suggested_fix", fix));
		}
		else {
			node.put("results", result.message());
		}
		node.put("message", result.message());
		return node;
	}

	public static String toJsonString(ProjectedResult result) {
		try {
			return mapper.writeValueAsString(toJson(result));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render result as JSON", e);
		}
	}
}
