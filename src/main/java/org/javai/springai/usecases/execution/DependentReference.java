package org.javai.springai.usecases.execution;

import java.util.Objects;

/**
 * A foreign key column that refers to rows of a table about to be deleted from.
 *
 * @param table table holding the referring column
 * @param column the referring column
 * @param referencedColumn the referenced key column in the target table
 * @param nullable whether the referring column accepts null; only nullable references are cleared
 */
public record DependentReference(String table, String column, String referencedColumn, boolean nullable) {

	public DependentReference {
		Objects.requireNonNull(table, "table must not be null");
		Objects.requireNonNull(column, "column must not be null");
		Objects.requireNonNull(referencedColumn, "referencedColumn must not be null");
	}

	String countSql() {
		return "SELECT COUNT(*) FROM " + table + " WHERE " + column + " = ?";
	}

	String clearSql() {
		return "UPDATE " + table + " SET " + column + " = NULL WHERE " + column + " = ?";
	}
}
