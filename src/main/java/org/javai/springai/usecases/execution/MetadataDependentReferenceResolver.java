package org.javai.springai.usecases.execution;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves dependent references from the foreign keys the database exports for a table.
 *
 * <p>Composite foreign keys are reported as not nullable, so they are never cleared column by
 * column.</p>
 */
public class MetadataDependentReferenceResolver implements DependentReferenceResolver {

	private static final Logger logger = LoggerFactory.getLogger(MetadataDependentReferenceResolver.class);

	@Override
	public List<DependentReference> resolve(Connection connection, String table) throws SQLException {
		DatabaseMetaData metaData = connection.getMetaData();
		String schema = connection.getSchema();
		String tableName = table;
		int dot = table.lastIndexOf('.');
		if (dot >= 0) {
			schema = table.substring(0, dot);
			tableName = table.substring(dot + 1);
		}
		schema = schema != null ? storedCase(metaData, schema) : null;
		tableName = storedCase(metaData, tableName);
		String catalog = connection.getCatalog();

		Map<String, List<ExportedColumn>> keyColumns = new LinkedHashMap<>();
		try (ResultSet rs = metaData.getExportedKeys(catalog, schema, tableName)) {
			while (rs.next()) {
				String fkTable = qualified(rs.getString("FKTABLE_SCHEM"), rs.getString("FKTABLE_NAME"), schema);
				String fkName = rs.getString("FK_NAME");
				String key = fkTable + "/" + (fkName != null ? fkName : rs.getString("FKCOLUMN_NAME"));
				keyColumns.computeIfAbsent(key, k -> new ArrayList<>()).add(new ExportedColumn(
						rs.getString("FKTABLE_CAT"), rs.getString("FKTABLE_SCHEM"), rs.getString("FKTABLE_NAME"),
						fkTable, rs.getString("FKCOLUMN_NAME"), rs.getString("PKCOLUMN_NAME")));
			}
		}

		List<DependentReference> references = new ArrayList<>();
		for (List<ExportedColumn> columns : keyColumns.values()) {
			boolean composite = columns.size() > 1;
			for (ExportedColumn column : columns) {
				boolean nullable = !composite && isNullable(metaData, column);
				references.add(new DependentReference(column.qualifiedTable(), column.column(), column.referencedColumn(),
						nullable));
			}
		}
		logger.debug("Table {} is referenced by {}", table, references);
		return references;
	}

	private boolean isNullable(DatabaseMetaData metaData, ExportedColumn column) throws SQLException {
		String escape = metaData.getSearchStringEscape();
		try (ResultSet rs = metaData.getColumns(column.catalog(), literalPattern(column.schema(), escape),
				literalPattern(column.table(), escape), literalPattern(column.column(), escape))) {
			// drivers that ignore the escape still match '_' as a wildcard
			while (rs.next()) {
				if (column.table().equals(rs.getString("TABLE_NAME")) && column.column().equals(rs.getString("COLUMN_NAME"))) {
					return rs.getInt("NULLABLE") == DatabaseMetaData.columnNullable;
				}
			}
			return false;
		}
	}

	static String literalPattern(String name, String escape) {
		if (name == null || escape == null || escape.isEmpty()) {
			return name;
		}
		StringBuilder pattern = new StringBuilder(name.length());
		for (char c : name.toCharArray()) {
			if (c == '_' || c == '%') {
				pattern.append(escape);
			}
			pattern.append(c);
		}
		return pattern.toString();
	}

	private String qualified(String fkSchema, String fkTable, String targetSchema) {
		if (fkSchema == null || fkSchema.equals(targetSchema)) {
			return fkTable;
		}
		return fkSchema + "." + fkTable;
	}

	private String storedCase(DatabaseMetaData metaData, String identifier) throws SQLException {
		String unquoted = identifier.replace("\"", "").replace("`", "");
		if (!unquoted.equals(identifier)) {
			return unquoted;
		}
		if (metaData.storesUpperCaseIdentifiers()) {
			return identifier.toUpperCase(Locale.ROOT);
		}
		if (metaData.storesLowerCaseIdentifiers()) {
			return identifier.toLowerCase(Locale.ROOT);
		}
		return identifier;
	}

	private record ExportedColumn(String catalog, String schema, String table, String qualifiedTable, String column,
			String referencedColumn) {
	}
}
