package org.javai.springai.usecases.execution;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;

/**
 * Finds the foreign key references pointing at a table.
 */
@FunctionalInterface
public interface DependentReferenceResolver {

	/**
	 * @param connection connection of the running transaction
	 * @param table the table rows will be deleted from, possibly schema-qualified
	 * @return references to the table, nullable or not
	 */
	List<DependentReference> resolve(Connection connection, String table) throws SQLException;

	/**
	 * A resolver that always answers with the given references for the given table, and with no
	 * references for any other table.
	 */
	static DependentReferenceResolver fixed(String table, List<DependentReference> references) {
		List<DependentReference> copy = List.copyOf(references);
		String key = table.toLowerCase(Locale.ROOT);
		return (connection, target) -> target.toLowerCase(Locale.ROOT).equals(key) ? copy : List.of();
	}

	static DependentReferenceResolver none() {
		return (connection, target) -> List.of();
	}
}
