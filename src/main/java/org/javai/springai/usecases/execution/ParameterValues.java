package org.javai.springai.usecases.execution;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-supplied values for a statement's placeholders, either by name or by position.
 */
public sealed interface ParameterValues {

	/**
	 * Values keyed by declared parameter name. Null values are bound as SQL NULL.
	 */
	record Named(Map<String, Object> values) implements ParameterValues {
		public Named {
			Objects.requireNonNull(values, "values must not be null");
			values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
		}
	}

	/**
	 * Values in order of first appearance of the placeholders in the statement.
	 */
	record Positional(List<Object> values) implements ParameterValues {
		public Positional {
			Objects.requireNonNull(values, "values must not be null");
			values = Collections.unmodifiableList(new ArrayList<>(values));
		}
	}

	static ParameterValues named(Map<String, ?> values) {
		return new Named(new LinkedHashMap<>(values));
	}

	static ParameterValues positional(Object... values) {
		return new Positional(Arrays.asList(values));
	}

	static ParameterValues none() {
		return new Named(Map.of());
	}
}
