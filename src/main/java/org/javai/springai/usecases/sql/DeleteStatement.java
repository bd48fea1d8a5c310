package org.javai.springai.usecases.sql;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The parts of a single-table {@code DELETE ... WHERE ...} statement needed to find the rows it
 * targets before it runs.
 *
 * @param table the target table, possibly schema-qualified
 * @param alias the table alias, or null
 * @param where the predicate text, placeholders intact
 */
public record DeleteStatement(String table, String alias, String where) {

	private static final Logger logger = LoggerFactory.getLogger(DeleteStatement.class);

	private static final Pattern SINGLE_TABLE_DELETE = Pattern.compile(
			"(?is)^\\s*DELETE\\s+FROM\\s+([\\w.\"`]+)(?:\\s+(?:AS\\s+)?(?!WHERE\\b)([A-Za-z_][\\w]*))?\\s+WHERE\\s+(.+?)\\s*;?\\s*$");

	/**
	 * Dissects a delete statement.
	 *
	 * @return the dissected statement, or empty for multi-table deletes and deletes without a
	 *         {@code WHERE} clause
	 */
	public static Optional<DeleteStatement> parse(String statement) {
		if (statement == null || StatementKind.detect(statement) != StatementKind.DELETE) {
			return Optional.empty();
		}
		try {
			Statement parsed = CCJSqlParserUtil.parse(statement);
			if (parsed instanceof Delete delete) {
				return fromAst(delete);
			}
		} catch (JSQLParserException e) {
			logger.debug("Dissecting delete textually: {}", e.getMessage());
		}
		Matcher matcher = SINGLE_TABLE_DELETE.matcher(statement);
		if (!matcher.matches()) {
			return Optional.empty();
		}
		return Optional.of(new DeleteStatement(unquote(matcher.group(1)), matcher.group(2), matcher.group(3)));
	}

	private static Optional<DeleteStatement> fromAst(Delete delete) {
		boolean multiTable = (delete.getTables() != null && !delete.getTables().isEmpty())
				|| (delete.getJoins() != null && !delete.getJoins().isEmpty());
		if (multiTable || delete.getWhere() == null || delete.getTable() == null) {
			return Optional.empty();
		}
		Table table = delete.getTable();
		String alias = table.getAlias() != null ? table.getAlias().getName() : null;
		return Optional.of(new DeleteStatement(unquote(table.getFullyQualifiedName()), alias, delete.getWhere().toString()));
	}

	/**
	 * Builds a query selecting the given key column of every row this delete targets.
	 */
	public String selectKeysSql(String keyColumn) {
		String qualifier = alias != null ? alias + "." : "";
		String from = alias != null ? table + " " + alias : table;
		return "SELECT " + qualifier + keyColumn + " FROM " + from + " WHERE " + where;
	}

	private static String unquote(String name) {
		return name.replace("`", "").replace("\"", "");
	}
}
