package org.javai.springai.usecases.sql;

import java.util.Locale;

/**
 * Statement shape, determined solely by the leading keyword of a statement.
 */
public enum StatementKind {
	SELECT,
	INSERT,
	UPDATE,
	DELETE,
	/** No recognizable leading keyword. */
	UNKNOWN;

	/**
	 * Detects the kind of the given statement from its leading keyword.
	 * Leading whitespace, SQL comments and opening parentheses are skipped.
	 * A {@code WITH} prefix is treated as a read.
	 *
	 * @param statement the statement text (may be null)
	 * @return the detected kind, {@link #UNKNOWN} when no keyword is recognized
	 */
	public static StatementKind detect(String statement) {
		if (statement == null) {
			return UNKNOWN;
		}
		String keyword = leadingKeyword(statement);
		return switch (keyword) {
			case "SELECT", "WITH" -> SELECT;
			case "INSERT" -> INSERT;
			case "UPDATE" -> UPDATE;
			case "DELETE" -> DELETE;
			default -> UNKNOWN;
		};
	}

	private static String leadingKeyword(String statement) {
		int i = 0;
		int length = statement.length();
		while (i < length) {
			char c = statement.charAt(i);
			if (Character.isWhitespace(c) || c == '(') {
				i++;
			} else if (statement.startsWith("--", i)) {
				int end = statement.indexOf('\n', i);
				i = end < 0 ? length : end + 1;
			} else if (statement.startsWith("/*", i)) {
				int end = statement.indexOf("*/", i + 2);
				i = end < 0 ? length : end + 2;
			} else {
				break;
			}
		}
		int start = i;
		while (i < length && Character.isLetter(statement.charAt(i))) {
			i++;
		}
		return statement.substring(start, i).toUpperCase(Locale.ROOT);
	}
}
