package org.javai.springai.usecases.schema;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.springai.usecases.connection.ConnectionManager;
import org.javai.springai.usecases.connection.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders the schema of the active database from JDBC metadata.
 *
 * <p>Each table is rendered as:</p>
 *
 * <pre>
 * Table: employees
 * id (INTEGER) NOT NULL
 * manager_id (INTEGER) NULL
 *
 * Foreign Keys:
 * FK: fk_manager - [manager_id] → employees
 * </pre>
 *
 * <p>Tables are separated by a blank line.</p>
 */
public class JdbcSchemaIntrospector implements SchemaIntrospector {

	private static final Logger logger = LoggerFactory.getLogger(JdbcSchemaIntrospector.class);

	// some drivers report ordinary tables as BASE TABLE
	private static final String[] TABLE_TYPES = { "TABLE", "BASE TABLE" };

	private final ConnectionManager connectionManager;

	public JdbcSchemaIntrospector(ConnectionManager connectionManager) {
		this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager must not be null");
	}

	@Override
	public String getSchema() {
		logger.info("Starting schema extraction");
		try (Session session = connectionManager.openSession()) {
			Connection connection = session.connection();
			DatabaseMetaData metaData = connection.getMetaData();
			String catalog = connection.getCatalog();
			String schemaPattern = connection.getSchema();
			List<String> tables = tableNames(metaData, catalog, schemaPattern);
			logger.info("Found {} tables", tables.size());

			List<String> rendered = new ArrayList<>();
			for (String table : tables) {
				rendered.add(renderTable(metaData, catalog, schemaPattern, table));
			}
			session.commit();
			String schema = String.join("\n\n", rendered);
			logger.info("Schema extraction completed. Schema length: {}", schema.length());
			return schema;
		}
		catch (SQLException e) {
			throw new SchemaIntrospectionException("Failed to read schema: " + e.getMessage(), e);
		}
	}

	private List<String> tableNames(DatabaseMetaData metaData, String catalog, String schemaPattern) throws SQLException {
		List<String> tables = new ArrayList<>();
		try (ResultSet rs = metaData.getTables(catalog, schemaPattern, "%", TABLE_TYPES)) {
			while (rs.next()) {
				tables.add(rs.getString("TABLE_NAME"));
			}
		}
		return tables;
	}

	private String renderTable(DatabaseMetaData metaData, String catalog, String schemaPattern, String table)
			throws SQLException {
		List<String> columns = new ArrayList<>();
		try (ResultSet rs = metaData.getColumns(catalog, schemaPattern, table, "%")) {
			while (rs.next()) {
				String nullable = rs.getInt("NULLABLE") == DatabaseMetaData.columnNoNulls ? "NOT NULL" : "NULL";
				columns.add("%s (%s) %s".formatted(rs.getString("COLUMN_NAME"), rs.getString("TYPE_NAME"), nullable));
			}
		}
		logger.info("Extracting schema for table: {} with {} columns", table, columns.size());

		StringBuilder rendered = new StringBuilder("Table: ").append(table).append('\n');
		rendered.append(String.join("\n", columns));
		List<String> foreignKeys = foreignKeys(metaData, catalog, schemaPattern, table);
		if (!foreignKeys.isEmpty()) {
			rendered.append("\n\nForeign Keys:\n").append(String.join("\n", foreignKeys));
		}
		return rendered.toString();
	}

	private List<String> foreignKeys(DatabaseMetaData metaData, String catalog, String schemaPattern, String table)
			throws SQLException {
		// one entry per constraint; composite keys span several rows
		Map<String, List<String>> columnsByKey = new LinkedHashMap<>();
		Map<String, String> referredTable = new LinkedHashMap<>();
		try (ResultSet rs = metaData.getImportedKeys(catalog, schemaPattern, table)) {
			while (rs.next()) {
				String name = rs.getString("FK_NAME");
				String key = name != null ? name : "Unknown";
				columnsByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(rs.getString("FKCOLUMN_NAME"));
				referredTable.put(key, rs.getString("PKTABLE_NAME"));
			}
		}
		List<String> rendered = new ArrayList<>();
		columnsByKey.forEach((name, cols) ->
				rendered.add("FK: %s - %s → %s".formatted(name, cols, referredTable.get(name))));
		return rendered;
	}
}
