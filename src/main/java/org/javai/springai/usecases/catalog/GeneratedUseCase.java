package org.javai.springai.usecases.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

/**
 * A use case as a generator emits it, before validation.
 *
 * @param id optional identifier; one is assigned when absent
 * @param description business description
 * @param query the statement template
 * @param affectedColumns columns the statement affects
 * @param inputParameters declared input parameters (name to type)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeneratedUseCase(
		@JsonProperty("use_case_id") String id,
		@JsonProperty("use_case") String description,
		@JsonProperty("query") String query,
		@JsonProperty("affected_columns") List<String> affectedColumns,
		@JsonProperty("user_input_columns") Map<String, String> inputParameters) {
}
