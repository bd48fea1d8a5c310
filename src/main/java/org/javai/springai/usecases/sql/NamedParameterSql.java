package org.javai.springai.usecases.sql;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * A statement with {@code :name} placeholders translated to JDBC positional markers.
 *
 * <p>String literals, quoted identifiers, comments and PostgreSQL {@code ::type} casts are
 * skipped, so a colon inside any of them is never taken for a placeholder.</p>
 *
 * @param original the statement as written, with named placeholders
 * @param jdbcSql the statement with every placeholder replaced by {@code ?}
 * @param parameterNames placeholder name for each {@code ?}, in positional order
 */
public record NamedParameterSql(String original, String jdbcSql, List<String> parameterNames) {

	public NamedParameterSql {
		Objects.requireNonNull(original, "original must not be null");
		Objects.requireNonNull(jdbcSql, "jdbcSql must not be null");
		parameterNames = List.copyOf(parameterNames);
	}

	/**
	 * Parses the named placeholders out of the given statement.
	 */
	public static NamedParameterSql parse(String sql) {
		Objects.requireNonNull(sql, "sql must not be null");
		StringBuilder jdbc = new StringBuilder(sql.length());
		List<String> names = new ArrayList<>();
		int i = 0;
		int length = sql.length();
		while (i < length) {
			char c = sql.charAt(i);
			int skipped = literalOrCommentEnd(sql, i);
			if (skipped > i) {
				jdbc.append(sql, i, skipped);
				i = skipped;
			} else if (c == ':' && i + 1 < length && sql.charAt(i + 1) == ':') {
				jdbc.append("::");
				i += 2;
			} else if (c == ':' && i + 1 < length && isNameStart(sql.charAt(i + 1))
					&& (i == 0 || !isNamePart(sql.charAt(i - 1)))) {
				int end = i + 1;
				while (end < length && isNamePart(sql.charAt(end))) {
					end++;
				}
				names.add(sql.substring(i + 1, end));
				jdbc.append('?');
				i = end;
			} else {
				jdbc.append(c);
				i++;
			}
		}
		return new NamedParameterSql(sql, jdbc.toString(), names);
	}

	/**
	 * Distinct placeholder names in order of first appearance.
	 */
	public List<String> placeholderNames() {
		return List.copyOf(new LinkedHashSet<>(parameterNames));
	}

	/**
	 * @return the index just past the string literal, quoted identifier or comment starting at
	 *         {@code start}, or -1 if none starts there
	 */
	static int literalOrCommentEnd(String sql, int start) {
		char c = sql.charAt(start);
		if (c == '\'' || c == '"' || c == '`') {
			return skipQuoted(sql, start, c);
		}
		if (sql.startsWith("--", start)) {
			int end = sql.indexOf('\n', start);
			return end < 0 ? sql.length() : end;
		}
		if (sql.startsWith("/*", start)) {
			int end = sql.indexOf("*/", start + 2);
			return end < 0 ? sql.length() : end + 2;
		}
		return -1;
	}

	private static int skipQuoted(String sql, int start, char quote) {
		int i = start + 1;
		while (i < sql.length()) {
			char c = sql.charAt(i);
			if (c == quote) {
				// doubled quote is an escaped quote
				if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
					i += 2;
					continue;
				}
				return i + 1;
			}
			if (c == '\\' && quote == '\'' && i + 1 < sql.length()) {
				i += 2;
				continue;
			}
			i++;
		}
		return sql.length();
	}

	private static boolean isNameStart(char c) {
		return Character.isLetter(c) || c == '_';
	}

	private static boolean isNamePart(char c) {
		return Character.isLetterOrDigit(c) || c == '_';
	}
}
