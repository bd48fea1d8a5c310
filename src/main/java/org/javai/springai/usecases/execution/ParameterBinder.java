package org.javai.springai.usecases.execution;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.usecases.sql.NormalizedStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches caller-supplied values to a statement's declared parameters.
 *
 * <p>Named values are matched by declared parameter name. Positional values are matched to the
 * statement's placeholders in order of first appearance. Values with no matching parameter are
 * ignored. Parameters without a value stay unbound; executing the statement then fails in the
 * backend.</p>
 */
public class ParameterBinder {

	private static final Logger logger = LoggerFactory.getLogger(ParameterBinder.class);

	/**
	 * @param statement the normalized statement
	 * @param declaredParameters declared parameter names and types
	 * @param values the caller's values
	 */
	public BoundStatement bind(NormalizedStatement statement, Map<String, String> declaredParameters,
			ParameterValues values) {
		Objects.requireNonNull(statement, "statement must not be null");
		Objects.requireNonNull(declaredParameters, "declaredParameters must not be null");
		Objects.requireNonNull(values, "values must not be null");

		Map<String, Object> bound = new LinkedHashMap<>();
		if (values instanceof ParameterValues.Named named) {
			for (Map.Entry<String, String> declared : declaredParameters.entrySet()) {
				if (named.values().containsKey(declared.getKey())) {
					bound.put(declared.getKey(), ParameterTypes.coerce(named.values().get(declared.getKey()), declared.getValue()));
				}
			}
			logIgnored(named.values().size() - bound.size());
		}
		else if (values instanceof ParameterValues.Positional positional) {
			List<String> placeholders = statement.placeholders();
			int count = Math.min(placeholders.size(), positional.values().size());
			for (int i = 0; i < count; i++) {
				String name = placeholders.get(i);
				bound.put(name, ParameterTypes.coerce(positional.values().get(i), declaredParameters.get(name)));
			}
			logIgnored(positional.values().size() - count);
		}

		List<String> unbound = new ArrayList<>();
		for (String placeholder : statement.placeholders()) {
			if (!bound.containsKey(placeholder)) {
				unbound.add(placeholder);
			}
		}
		if (!unbound.isEmpty()) {
			logger.debug("No value supplied for {}", unbound);
		}
		return new BoundStatement(statement, bound, unbound);
	}

	private void logIgnored(int ignored) {
		if (ignored > 0) {
			logger.debug("Ignoring {} value(s) with no matching parameter", ignored);
		}
	}
}
