package org.javai.springai.usecases.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.springai.usecases.connection.Backend;
import org.javai.springai.usecases.connection.BackendKind;
import org.javai.springai.usecases.connection.ConnectionManager;
import org.javai.springai.usecases.testsupport.H2Databases;
import org.javai.springai.usecases.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class JdbcSchemaIntrospectorTest {

	private static String schema;

	@BeforeAll
	static void readSchema() {
		schema = new JdbcSchemaIntrospector(H2Databases.manager(H2Databases.newEmployeesDatabase())).getSchema();
	}

	@Test
	void rendersEveryTable() {
		assertThat(schema)
				.containsIgnoringCase("Table: departments")
				.containsIgnoringCase("Table: employees")
				.containsIgnoringCase("Table: timesheets");
	}

	@Test
	void rendersColumnsWithTypeAndNullability() {
		assertThat(schema)
				.containsIgnoringCase("id (INTEGER) NOT NULL")
				.containsIgnoringCase("manager_id (INTEGER) NULL")
				.containsIgnoringCase("employee_id (INTEGER) NOT NULL");
	}

	@Test
	void rendersForeignKeysUnderTheirTable() {
		assertThat(schema)
				.contains("Foreign Keys:")
				.containsIgnoringCase("FK: fk_manager - [manager_id] → employees")
				.containsIgnoringCase("FK: fk_department - [department_id] → departments")
				.containsIgnoringCase("FK: fk_timesheet_employee - [employee_id] → employees");
	}

	@Test
	void separatesTablesWithBlankLine() {
		assertThat(schema.split("\n\n(?=Table: )")).hasSize(3);
	}

	@Test
	void logsTableCount() {
		String database = H2Databases.newEmployeesDatabase();
		try (LogCaptorAppender captor = LogCaptorAppender.capture(JdbcSchemaIntrospector.class, Level.INFO)) {
			new JdbcSchemaIntrospector(H2Databases.manager(database)).getSchema();

			assertThat(captor.messagesAt(Level.INFO)).contains("Found 3 tables");
		}
	}

	@Test
	void metadataFailureBecomesIntrospectionException() throws SQLException {
		Backend backend = mock(Backend.class);
		Connection connection = mock(Connection.class);
		when(backend.kind()).thenReturn(BackendKind.POSTGRES);
		when(backend.connect(any())).thenReturn(connection);
		when(connection.getMetaData()).thenThrow(new SQLException("metadata unavailable"));
		ConnectionManager manager = new ConnectionManager(H2Databases.profile("unused"),
				Map.of(BackendKind.POSTGRES, backend));

		assertThatThrownBy(() -> new JdbcSchemaIntrospector(manager).getSchema())
				.isInstanceOf(SchemaIntrospectionException.class)
				.hasMessageContaining("metadata unavailable");
		verify(connection).rollback();
		verify(connection).close();
	}
}
