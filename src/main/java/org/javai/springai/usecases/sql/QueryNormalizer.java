package org.javai.springai.usecases.sql;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites raw statement templates into executable statements.
 *
 * <p>Normalization is advisory and never blocks execution: a template whose leading keyword is
 * not recognized is returned unchanged, and a template JSqlParser cannot read is still unified,
 * repaired and scanned textually. The backend has the final word on validity.</p>
 *
 * <p>Normalization is idempotent: feeding a normalized statement back in yields the same
 * statement.</p>
 */
public class QueryNormalizer {

	private static final Logger logger = LoggerFactory.getLogger(QueryNormalizer.class);

	/**
	 * Normalizes the given template.
	 *
	 * @param template the raw template, possibly with bracketed placeholders or omitted operators
	 * @return the normalized statement
	 */
	public NormalizedStatement normalize(String template) {
		Objects.requireNonNull(template, "template must not be null");
		StatementKind kind = StatementKind.detect(template);
		if (kind == StatementKind.UNKNOWN) {
			logger.debug("No recognizable statement keyword; leaving template unchanged");
			return new NormalizedStatement(template, template, kind,
					NamedParameterSql.parse(template).placeholderNames(), List.of());
		}

		String unified = SyntaxRepair.unifyPlaceholders(template);
		String repaired = SyntaxRepair.repairOmittedOperators(unified);
		if (!repaired.equals(unified)) {
			logger.info("Repaired omitted comparison operator in {} template", kind);
		}

		List<String> placeholders = NamedParameterSql.parse(repaired).placeholderNames();
		List<String> inputColumns = ColumnExtractor.extract(repaired, kind);
		return new NormalizedStatement(template, repaired, kind, placeholders, inputColumns);
	}

	/**
	 * Extracts the user-input columns of a statement; see {@link ColumnExtractor}.
	 */
	public List<String> extractColumns(String statement) {
		return normalize(statement).inputColumns();
	}

	/**
	 * Runs one more, more lenient repair pass over a statement the backend rejected.
	 *
	 * <p>The result is a suggestion for the caller; it is never executed automatically.</p>
	 *
	 * @param statement the statement that failed
	 * @return the repaired statement, or empty if the repair table has nothing to offer
	 */
	public Optional<String> suggestRepair(String statement) {
		if (statement == null || statement.isBlank()) {
			return Optional.empty();
		}
		String suggestion = SyntaxRepair.repairOmittedOperatorsLeniently(SyntaxRepair.unifyPlaceholders(statement));
		return suggestion.equals(statement) ? Optional.empty() : Optional.of(suggestion);
	}
}
