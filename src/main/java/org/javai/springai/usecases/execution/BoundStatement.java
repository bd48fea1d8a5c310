package org.javai.springai.usecases.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.usecases.sql.NormalizedStatement;

/**
 * A normalized statement together with the values bound to its parameters.
 *
 * @param statement the statement to execute
 * @param values bound values by parameter name, in binding order; values may be null
 * @param unbound placeholders for which no value was supplied
 */
public record BoundStatement(NormalizedStatement statement, Map<String, Object> values, List<String> unbound) {

	public BoundStatement {
		Objects.requireNonNull(statement, "statement must not be null");
		values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
		unbound = List.copyOf(unbound);
	}

	public boolean isFullyBound() {
		return unbound.isEmpty();
	}
}
