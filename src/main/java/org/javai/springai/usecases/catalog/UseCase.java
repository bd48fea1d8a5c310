package org.javai.springai.usecases.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named, categorized SQL statement template with declared input parameters.
 *
 * <p>Instances are built through {@link UseCaseFactory}, which guarantees that the category
 * matches the statement's leading keyword and that every placeholder in the template is
 * declared in {@code inputParameters}.</p>
 *
 * @param id unique identifier
 * @param description business description of the use case
 * @param category CRUD category
 * @param template the statement template with named placeholders
 * @param inputParameters declared parameters (name to declared type), in declaration order
 * @param inputColumns columns the statement takes user input for
 * @param affectedColumns columns the generator reported as affected (informational)
 */
public record UseCase(
		String id,
		String description,
		Category category,
		String template,
		Map<String, String> inputParameters,
		List<String> inputColumns,
		List<String> affectedColumns) {

	public UseCase {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(category, "category must not be null");
		Objects.requireNonNull(template, "template must not be null");
		description = description != null ? description : "";
		inputParameters = inputParameters != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(inputParameters))
				: Map.of();
		inputColumns = inputColumns != null ? List.copyOf(inputColumns) : List.of();
		affectedColumns = affectedColumns != null ? List.copyOf(affectedColumns) : List.of();
	}
}
