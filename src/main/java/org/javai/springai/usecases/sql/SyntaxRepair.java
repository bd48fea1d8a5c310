package org.javai.springai.usecases.sql;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual repairs for the malformed statements that template generators tend to emit.
 *
 * <p>This is a small table of known defects, not a parser. Every function here is pure
 * and idempotent: applying a repair to its own output changes nothing.</p>
 *
 * <ul>
 *   <li><b>Placeholder styles</b> - {@code <name>}, {@code {name}} and {@code %(name)s} are
 *       rewritten to the named form {@code :name}; doubled brackets such as {@code {{name}}}
 *       are consumed whole</li>
 *   <li><b>Omitted operator</b> - in predicate position, {@code salary  :salary} (two or more
 *       spaces, no operator) becomes {@code salary > :salary}</li>
 * </ul>
 */
public final class SyntaxRepair {

	private static final String IDENTIFIER = "[A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)?";
	private static final String PLACEHOLDER = ":[A-Za-z_][A-Za-z0-9_]*";
	private static final String PREDICATE_START = "((?:\\b(?:WHERE|AND|OR|ON|HAVING|NOT)\\b|\\()[ \\t\\r\\n]*)";

	private static final List<PlaceholderRule> PLACEHOLDER_RULES = List.of(
			new PlaceholderRule("angle brackets", Pattern.compile("<+\\s*:?([A-Za-z_][A-Za-z0-9_]*)\\s*>+")),
			new PlaceholderRule("braces", Pattern.compile("(?<![$#{])\\{+\\s*:?([A-Za-z_][A-Za-z0-9_]*)\\s*}+")),
			new PlaceholderRule("pyformat", Pattern.compile("%\\(([A-Za-z_][A-Za-z0-9_]*)\\)s"))
	);

	/** Identifier, two or more blanks, then a placeholder or identifier. */
	private static final Pattern MISSING_OPERATOR = Pattern.compile(
			"(?i)" + PREDICATE_START + "(" + IDENTIFIER + ")[ \\t]{2,}(" + PLACEHOLDER + "|" + IDENTIFIER + ")(?![A-Za-z0-9_.(:])");

	/** Identifier, any blank run, then a placeholder. Only used for suggestions. */
	private static final Pattern MISSING_OPERATOR_LENIENT = Pattern.compile(
			"(?i)" + PREDICATE_START + "(" + IDENTIFIER + ")[ \\t]+(" + PLACEHOLDER + ")(?![A-Za-z0-9_])");

	private static final Set<String> KEYWORDS = Set.of(
			"ALL", "AND", "ANY", "AS", "ASC", "BETWEEN", "BY", "CASE", "CROSS", "DEFAULT", "DELETE", "DESC",
			"DISTINCT", "ELSE", "END", "EXISTS", "FALSE", "FROM", "FULL", "GROUP", "HAVING", "ILIKE", "IN",
			"INNER", "INSERT", "INTO", "IS", "JOIN", "LEFT", "LIKE", "LIMIT", "NOT", "NULL", "OFFSET", "ON",
			"OR", "ORDER", "OUTER", "REGEXP", "RIGHT", "SELECT", "SET", "SIMILAR", "SOME", "THEN", "TRUE",
			"UNION", "UPDATE", "USING", "VALUES", "WHEN", "WHERE");

	private SyntaxRepair() {
	}

	/**
	 * Rewrites every bracketed or pyformat placeholder to the {@code :name} form.
	 */
	public static String unifyPlaceholders(String sql) {
		if (sql == null || sql.isEmpty()) {
			return sql;
		}
		return outsideLiterals(sql, code -> {
			String result = code;
			for (PlaceholderRule rule : PLACEHOLDER_RULES) {
				result = rule.pattern().matcher(result).replaceAll(":$1");
			}
			return result;
		});
	}

	/**
	 * Inserts a {@code >} between an identifier and a placeholder or identifier separated only by
	 * two or more blanks in predicate position.
	 */
	public static String repairOmittedOperators(String sql) {
		return insertOperator(sql, MISSING_OPERATOR);
	}

	/**
	 * Like {@link #repairOmittedOperators(String)}, but also accepts a single blank between an
	 * identifier and a placeholder. Too eager to run before execution; used to suggest a fix after
	 * the backend has rejected a statement.
	 */
	public static String repairOmittedOperatorsLeniently(String sql) {
		return insertOperator(repairOmittedOperators(sql), MISSING_OPERATOR_LENIENT);
	}

	private static String insertOperator(String sql, Pattern pattern) {
		if (sql == null || sql.isEmpty()) {
			return sql;
		}
		return outsideLiterals(sql, code -> {
			Matcher matcher = pattern.matcher(code);
			StringBuilder sb = new StringBuilder();
			while (matcher.find()) {
				String prefix = matcher.group(1);
				String left = matcher.group(2);
				String right = matcher.group(3);
				if (isKeyword(left) || isKeyword(right)) {
					matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group(0)));
				} else {
					matcher.appendReplacement(sb, Matcher.quoteReplacement(prefix + left + " > " + right));
				}
			}
			matcher.appendTail(sb);
			return sb.toString();
		});
	}

	/**
	 * Applies a rewrite to each stretch of statement text between string literals, quoted
	 * identifiers and comments. Those are copied through untouched.
	 */
	private static String outsideLiterals(String sql, UnaryOperator<String> rewrite) {
		StringBuilder result = new StringBuilder(sql.length());
		int codeStart = 0;
		int i = 0;
		while (i < sql.length()) {
			int end = NamedParameterSql.literalOrCommentEnd(sql, i);
			if (end > i) {
				result.append(rewrite.apply(sql.substring(codeStart, i)));
				result.append(sql, i, end);
				codeStart = end;
				i = end;
			} else {
				i++;
			}
		}
		result.append(rewrite.apply(sql.substring(codeStart)));
		return result.toString();
	}

	private static boolean isKeyword(String token) {
		return !token.startsWith(":") && KEYWORDS.contains(token.toUpperCase(Locale.ROOT));
	}

	private record PlaceholderRule(String name, Pattern pattern) {
	}
}
