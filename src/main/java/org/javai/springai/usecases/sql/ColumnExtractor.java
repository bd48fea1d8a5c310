package org.javai.springai.usecases.sql;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.BinaryExpression;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;
import net.sf.jsqlparser.expression.operators.relational.Between;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.delete.Delete;
import net.sf.jsqlparser.statement.insert.Insert;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.update.Update;
import net.sf.jsqlparser.statement.update.UpdateSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts the column names a statement takes user input for.
 *
 * <ul>
 *   <li>INSERT - the columns listed in parentheses after the table name</li>
 *   <li>UPDATE - the left-hand side of each {@code SET} assignment</li>
 *   <li>DELETE / SELECT - the left-hand side of each {@code WHERE} predicate</li>
 * </ul>
 *
 * <p>The statement is parsed with JSqlParser first. Templates the parser rejects (generated SQL
 * is often slightly off) fall back to a textual scan, so extraction never fails.</p>
 */
final class ColumnExtractor {

	private static final Logger logger = LoggerFactory.getLogger(ColumnExtractor.class);

	private static final Pattern INSERT_COLUMNS = Pattern.compile(
			"(?is)INSERT\\s+INTO\\s+[\\w.\"`]+\\s*\\(([^)]*)\\)");
	private static final Pattern UPDATE_SET = Pattern.compile(
			"(?is)UPDATE\\s+.+?\\s+SET\\s+(.*?)(?:\\s+WHERE\\s|\\s+RETURNING\\s|;|$)");
	private static final Pattern WHERE_CLAUSE = Pattern.compile(
			"(?is)\\bWHERE\\s+(.*?)(?:\\s+(?:GROUP\\s+BY|ORDER\\s+BY|LIMIT|HAVING|RETURNING|UNION)\\b|;|$)");
	private static final Pattern PREDICATE_SEPARATOR = Pattern.compile("(?i)\\s+AND\\s+|\\s+OR\\s+|,");
	private static final Pattern OPERATOR = Pattern.compile(
			"(?i)\\s*(?:=|<>|!=|>=|<=|>|<|\\bNOT\\s+LIKE\\b|\\bLIKE\\b|\\bNOT\\s+IN\\b|\\bIN\\b|\\bIS\\b|\\bBETWEEN\\b)");

	private ColumnExtractor() {
	}

	static List<String> extract(String statement, StatementKind kind) {
		if (statement == null || statement.isBlank() || kind == StatementKind.UNKNOWN) {
			return List.of();
		}
		Statement parsed;
		try {
			parsed = CCJSqlParserUtil.parse(statement);
		} catch (JSQLParserException e) {
			logger.debug("Falling back to textual column extraction: {}", e.getMessage());
			return extractTextually(statement, kind);
		}
		return switch (kind) {
			case INSERT -> parsed instanceof Insert insert ? insertColumns(insert) : extractTextually(statement, kind);
			case UPDATE -> parsed instanceof Update update ? updateColumns(update) : extractTextually(statement, kind);
			case DELETE -> parsed instanceof Delete delete ? predicateColumns(delete.getWhere()) : extractTextually(statement, kind);
			case SELECT -> parsed instanceof PlainSelect select ? predicateColumns(select.getWhere()) : extractTextually(statement, kind);
			case UNKNOWN -> List.of();
		};
	}

	private static List<String> insertColumns(Insert insert) {
		Set<String> columns = new LinkedHashSet<>();
		if (insert.getColumns() != null) {
			for (Column column : insert.getColumns()) {
				columns.add(clean(column.getFullyQualifiedName()));
			}
		}
		return List.copyOf(columns);
	}

	private static List<String> updateColumns(Update update) {
		Set<String> columns = new LinkedHashSet<>();
		if (update.getUpdateSets() != null) {
			for (UpdateSet updateSet : update.getUpdateSets()) {
				for (Column column : updateSet.getColumns()) {
					columns.add(clean(column.getFullyQualifiedName()));
				}
			}
		}
		return List.copyOf(columns);
	}

	private static List<String> predicateColumns(Expression where) {
		if (where == null) {
			return List.of();
		}
		Set<String> columns = new LinkedHashSet<>();
		where.accept(new ExpressionVisitorAdapter() {
			@Override
			protected void visitBinaryExpression(BinaryExpression expr) {
				if (expr instanceof AndExpression || expr instanceof OrExpression) {
					super.visitBinaryExpression(expr);
				} else {
					columns.add(operandName(expr.getLeftExpression()));
				}
			}

			@Override
			public void visit(InExpression expr) {
				columns.add(operandName(expr.getLeftExpression()));
			}

			@Override
			public void visit(Between expr) {
				columns.add(operandName(expr.getLeftExpression()));
			}

			@Override
			public void visit(IsNullExpression expr) {
				columns.add(operandName(expr.getLeftExpression()));
			}
		});
		return List.copyOf(columns);
	}

	private static String operandName(Expression operand) {
		if (operand instanceof Column column) {
			return clean(column.getFullyQualifiedName());
		}
		return clean(String.valueOf(operand));
	}

	private static List<String> extractTextually(String statement, StatementKind kind) {
		List<String> columns = new ArrayList<>();
		switch (kind) {
			case INSERT -> {
				Matcher matcher = INSERT_COLUMNS.matcher(statement);
				if (matcher.find()) {
					for (String column : matcher.group(1).split(",")) {
						columns.add(clean(column));
					}
				}
			}
			case UPDATE -> {
				Matcher matcher = UPDATE_SET.matcher(statement);
				if (matcher.find()) {
					for (String assignment : matcher.group(1).split(",")) {
						columns.add(clean(assignment.split("=", 2)[0]));
					}
				}
			}
			case DELETE, SELECT -> {
				Matcher matcher = WHERE_CLAUSE.matcher(statement);
				if (matcher.find()) {
					for (String predicate : PREDICATE_SEPARATOR.split(matcher.group(1))) {
						columns.add(clean(OPERATOR.split(predicate, 2)[0]));
					}
				}
			}
			case UNKNOWN -> {
				// nothing to extract
			}
		}
		return List.copyOf(new LinkedHashSet<>(columns.stream().filter(c -> !c.isEmpty()).toList()));
	}

	private static String clean(String column) {
		String cleaned = column.replace("`", "").replace("\"", "").trim();
		while (cleaned.startsWith("(")) {
			cleaned = cleaned.substring(1).trim();
		}
		if (cleaned.regionMatches(true, 0, "NOT ", 0, 4)) {
			cleaned = cleaned.substring(4).trim();
		}
		return cleaned;
	}
}
