package org.javai.springai.usecases.sql;

import java.util.List;
import java.util.Objects;

/**
 * An executable, fully-specified statement derived from a raw template.
 *
 * @param original the template as supplied
 * @param statement the statement after placeholder unification and operator repair
 * @param kind the statement kind from its leading keyword
 * @param placeholders distinct placeholder names in order of first appearance
 * @param inputColumns column names the statement takes user input for
 */
public record NormalizedStatement(
		String original,
		String statement,
		StatementKind kind,
		List<String> placeholders,
		List<String> inputColumns) {

	public NormalizedStatement {
		Objects.requireNonNull(original, "original must not be null");
		Objects.requireNonNull(statement, "statement must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
		placeholders = List.copyOf(placeholders);
		inputColumns = List.copyOf(inputColumns);
	}

	/**
	 * @return true if normalization changed the text of the template
	 */
	public boolean repaired() {
		return !original.equals(statement);
	}

	/**
	 * @return the statement with placeholders translated to JDBC markers
	 */
	public NamedParameterSql toJdbc() {
		return NamedParameterSql.parse(statement);
	}
}
