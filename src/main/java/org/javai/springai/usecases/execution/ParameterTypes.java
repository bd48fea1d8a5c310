package org.javai.springai.usecases.execution;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coerces textual input to the Java type matching a declared parameter type.
 *
 * <p>Only strings are coerced, and only when the declared type is recognizably integral,
 * decimal, boolean, date or timestamp. Text that does not parse is passed through unchanged
 * so that the backend reports the mismatch.</p>
 */
final class ParameterTypes {

	private static final Logger logger = LoggerFactory.getLogger(ParameterTypes.class);

	private static final Pattern INTEGRAL = Pattern.compile("(?:tiny|small|medium|big)?int(?:eger)?\\d*(?: unsigned)?|(?:big|small)?serial|long");
	private static final Pattern DECIMAL = Pattern.compile("decimal|numeric|number|float\\d*|double(?: precision)?|real|money");
	private static final Pattern BOOLEAN = Pattern.compile("bool(?:ean)?");
	private static final Pattern TIMESTAMP = Pattern.compile("timestamp.*|datetime");
	private static final Pattern DATE = Pattern.compile("date");

	private ParameterTypes() {
	}

	static Object coerce(Object value, String declaredType) {
		if (!(value instanceof String text) || declaredType == null) {
			return value;
		}
		String type = baseType(declaredType);
		String trimmed = text.trim();
		try {
			if (INTEGRAL.matcher(type).matches()) {
				return Long.valueOf(trimmed);
			}
			if (DECIMAL.matcher(type).matches()) {
				return new BigDecimal(trimmed);
			}
			if (BOOLEAN.matcher(type).matches()) {
				if (trimmed.equalsIgnoreCase("true") || trimmed.equalsIgnoreCase("false")) {
					return Boolean.valueOf(trimmed);
				}
				return text;
			}
			if (TIMESTAMP.matcher(type).matches()) {
				return LocalDateTime.parse(trimmed.replace(' ', 'T'));
			}
			if (DATE.matcher(type).matches()) {
				return LocalDate.parse(trimmed);
			}
		}
		catch (NumberFormatException | DateTimeParseException e) {
			logger.debug("Passing '{}' through uncoerced as {}: {}", text, declaredType, e.getMessage());
		}
		return text;
	}

	private static String baseType(String declaredType) {
		String type = declaredType.trim().toLowerCase(Locale.ROOT);
		int paren = type.indexOf('(');
		if (paren >= 0) {
			int close = type.indexOf(')', paren);
			type = (type.substring(0, paren) + (close >= 0 ? type.substring(close + 1) : "")).trim();
		}
		return type;
	}
}
