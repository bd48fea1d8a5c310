package org.javai.springai.usecases.execution;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.javai.springai.usecases.catalog.UseCase;
import org.javai.springai.usecases.connection.BackendKind;
import org.javai.springai.usecases.connection.ConfigurationException;
import org.javai.springai.usecases.connection.ConnectionException;
import org.javai.springai.usecases.connection.ConnectionManager;
import org.javai.springai.usecases.connection.Session;
import org.javai.springai.usecases.sql.DeleteStatement;
import org.javai.springai.usecases.sql.NamedParameterSql;
import org.javai.springai.usecases.sql.NormalizedStatement;
import org.javai.springai.usecases.sql.QueryNormalizer;
import org.javai.springai.usecases.sql.StatementKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes bound statements, one session and one transaction per execution.
 *
 * <p>Only queries and the three data-modifying statements run. Anything else is refused with a
 * {@link ErrorKind#SYNTAX_DEFECT} failure before a session is opened.</p>
 *
 * <p>Every execution either commits once or rolls back once, and always closes its session.
 * Failures are returned as {@link ExecutionResult.Failure}; nothing is retried.</p>
 *
 * <p>Deletes are dependency-aware. Before a single-table delete runs, the keys of the rows it
 * targets are selected with the delete's own predicate and bindings. Each nullable foreign key
 * referring to one of those rows is then set to null, and only then does the delete run. Foreign
 * keys that are not nullable are left alone; if they block the delete, the whole transaction is
 * rolled back, including any references already cleared.</p>
 */
public class QueryExecutor {

	private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

	static final String UNSUPPORTED_STATEMENT = "Only SELECT, INSERT, UPDATE and DELETE statements can be executed";

	private final ConnectionManager connectionManager;
	private final QueryNormalizer normalizer;
	private final ParameterBinder binder;
	private final DependentReferenceResolver dependentReferenceResolver;
	private final ErrorClassifier errorClassifier;

	public QueryExecutor(ConnectionManager connectionManager, QueryNormalizer normalizer,
			DependentReferenceResolver dependentReferenceResolver, ErrorClassifier errorClassifier) {
		this.connectionManager = Objects.requireNonNull(connectionManager, "connectionManager must not be null");
		this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
		this.dependentReferenceResolver = Objects.requireNonNull(dependentReferenceResolver,
				"dependentReferenceResolver must not be null");
		this.errorClassifier = Objects.requireNonNull(errorClassifier, "errorClassifier must not be null");
		this.binder = new ParameterBinder();
	}

	public QueryExecutor(ConnectionManager connectionManager) {
		this(connectionManager, new QueryNormalizer(), new MetadataDependentReferenceResolver(), new ErrorClassifier());
	}

	/**
	 * Normalizes the use case's template and binds the caller's values to it.
	 */
	public BoundStatement prepare(UseCase useCase, ParameterValues values) {
		Objects.requireNonNull(useCase, "useCase must not be null");
		return prepare(useCase.template(), useCase.inputParameters(), values);
	}

	/**
	 * Normalizes a template and binds the caller's values to its declared parameters.
	 */
	public BoundStatement prepare(String template, Map<String, String> declaredParameters, ParameterValues values) {
		NormalizedStatement statement = normalizer.normalize(template);
		return binder.bind(statement, declaredParameters, values);
	}

	/**
	 * Executes the statement in a new session.
	 */
	public ExecutionResult execute(BoundStatement bound) {
		Objects.requireNonNull(bound, "bound must not be null");
		StatementKind kind = bound.statement().kind();
		if (kind == StatementKind.UNKNOWN) {
			logger.warn("Refusing to execute statement without a SELECT, INSERT, UPDATE or DELETE keyword");
			return new ExecutionResult.Failure(ErrorKind.SYNTAX_DEFECT, UNSUPPORTED_STATEMENT);
		}
		try (Session session = connectionManager.openSession()) {
			try {
				ExecutionResult result = dispatch(session.connection(), bound);
				session.commit();
				logger.debug("Committed {} statement: {}", kind, result);
				return result;
			}
			catch (SQLException | RuntimeException e) {
				rollback(session, e);
				return failure(bound, session.backend().kind(), e);
			}
		}
		catch (ConfigurationException | ConnectionException e) {
			return failure(bound, null, e);
		}
	}

	private ExecutionResult dispatch(Connection connection, BoundStatement bound) throws SQLException {
		return switch (bound.statement().kind()) {
			case SELECT -> query(connection, bound);
			case INSERT, UPDATE -> new ExecutionResult.Affected(update(connection, bound.statement().toJdbc(), bound.values()));
			case DELETE -> delete(connection, bound);
			case UNKNOWN -> throw new IllegalStateException(UNSUPPORTED_STATEMENT);
		};
	}

	private ExecutionResult query(Connection connection, BoundStatement bound) throws SQLException {
		try (PreparedStatement ps = prepareStatement(connection, bound.statement().toJdbc(), bound.values());
				ResultSet rs = ps.executeQuery()) {
			return rows(rs);
		}
	}

	private ExecutionResult delete(Connection connection, BoundStatement bound) throws SQLException {
		Optional<DeleteStatement> target = DeleteStatement.parse(bound.statement().statement());
		int cleared = 0;
		if (target.isPresent()) {
			cleared = clearDependents(connection, target.get(), bound.values());
		}
		else {
			logger.debug("Delete is not a single-table delete with a predicate; not resolving dependents");
		}
		int deleted = update(connection, bound.statement().toJdbc(), bound.values());
		if (cleared > 0) {
			logger.info("Cleared {} dependent reference(s) before deleting {} row(s)", cleared, deleted);
		}
		return new ExecutionResult.Affected(deleted, cleared);
	}

	private int clearDependents(Connection connection, DeleteStatement target, Map<String, Object> values)
			throws SQLException {
		List<DependentReference> references = dependentReferenceResolver.resolve(connection, target.table());
		Map<String, List<Object>> keysByColumn = new LinkedHashMap<>();
		int cleared = 0;
		for (DependentReference reference : references) {
			if (!reference.nullable()) {
				logger.debug("Leaving non-nullable reference {}.{} to the backend", reference.table(), reference.column());
				continue;
			}
			List<Object> keys = keysByColumn.get(reference.referencedColumn());
			if (keys == null) {
				keys = selectKeys(connection, target, reference.referencedColumn(), values);
				keysByColumn.put(reference.referencedColumn(), keys);
			}
			for (Object key : keys) {
				cleared += clear(connection, reference, key);
			}
		}
		return cleared;
	}

	private List<Object> selectKeys(Connection connection, DeleteStatement target, String keyColumn,
			Map<String, Object> values) throws SQLException {
		NamedParameterSql sql = NamedParameterSql.parse(target.selectKeysSql(keyColumn));
		Set<Object> keys = new LinkedHashSet<>();
		try (PreparedStatement ps = prepareStatement(connection, sql, values); ResultSet rs = ps.executeQuery()) {
			while (rs.next()) {
				Object key = rs.getObject(1);
				if (key != null) {
					keys.add(key);
				}
			}
		}
		return new ArrayList<>(keys);
	}

	private int clear(Connection connection, DependentReference reference, Object key) throws SQLException {
		long dependents;
		try (PreparedStatement count = connection.prepareStatement(reference.countSql())) {
			count.setObject(1, key);
			try (ResultSet rs = count.executeQuery()) {
				dependents = rs.next() ? rs.getLong(1) : 0;
			}
		}
		if (dependents == 0) {
			return 0;
		}
		try (PreparedStatement update = connection.prepareStatement(reference.clearSql())) {
			update.setObject(1, key);
			return update.executeUpdate();
		}
	}

	private int update(Connection connection, NamedParameterSql sql, Map<String, Object> values) throws SQLException {
		try (PreparedStatement ps = prepareStatement(connection, sql, values)) {
			return ps.executeUpdate();
		}
	}

	private PreparedStatement prepareStatement(Connection connection, NamedParameterSql sql, Map<String, Object> values)
			throws SQLException {
		PreparedStatement ps = connection.prepareStatement(sql.jdbcSql());
		try {
			List<String> names = sql.parameterNames();
			for (int i = 0; i < names.size(); i++) {
				if (!values.containsKey(names.get(i))) {
					continue;
				}
				Object value = values.get(names.get(i));
				if (value == null) {
					ps.setNull(i + 1, Types.NULL);
				}
				else {
					ps.setObject(i + 1, value);
				}
			}
			return ps;
		}
		catch (SQLException | RuntimeException e) {
			try {
				ps.close();
			}
			catch (SQLException closeFailure) {
				e.addSuppressed(closeFailure);
			}
			throw e;
		}
	}

	private ExecutionResult rows(ResultSet rs) throws SQLException {
		ResultSetMetaData metaData = rs.getMetaData();
		int columnCount = metaData.getColumnCount();
		List<String> keys = columnKeys(metaData);
		List<Map<String, Object>> rows = new ArrayList<>();
		while (rs.next()) {
			Map<String, Object> row = new LinkedHashMap<>();
			for (int i = 1; i <= columnCount; i++) {
				row.put(keys.get(i - 1), JdbcValues.toJava(rs.getObject(i)));
			}
			rows.add(row);
		}
		return rows.isEmpty() ? new ExecutionResult.NoRecords() : new ExecutionResult.RowSet(rows);
	}

	private List<String> columnKeys(ResultSetMetaData metaData) throws SQLException {
		int columnCount = metaData.getColumnCount();
		List<String> labels = new ArrayList<>();
		Set<String> seen = new LinkedHashSet<>();
		Set<String> duplicated = new LinkedHashSet<>();
		for (int i = 1; i <= columnCount; i++) {
			String label = metaData.getColumnLabel(i);
			labels.add(label);
			if (!seen.add(label)) {
				duplicated.add(label);
			}
		}
		List<String> keys = new ArrayList<>();
		Set<String> used = new LinkedHashSet<>();
		for (int i = 1; i <= columnCount; i++) {
			String label = labels.get(i - 1);
			String key = label;
			if (duplicated.contains(label)) {
				String table = metaData.getTableName(i);
				key = table != null && !table.isBlank() ? table + "." + label : label;
			}
			// same column of the same table selected twice
			String unique = key;
			for (int n = 2; !used.add(unique); n++) {
				unique = key + "_" + n;
			}
			keys.add(unique);
		}
		return keys;
	}

	private void rollback(Session session, Exception cause) {
		try {
			session.rollback();
		}
		catch (SQLException e) {
			cause.addSuppressed(e);
			logger.warn("Rollback failed: {}", e.getMessage());
		}
	}

	private ExecutionResult.Failure failure(BoundStatement bound, BackendKind backend, Exception e) {
		ErrorKind kind = errorClassifier.classify(e, backend);
		String suggestion = null;
		if (kind == ErrorKind.SYNTAX_DEFECT) {
			suggestion = normalizer.suggestRepair(bound.statement().statement()).orElse(null);
		}
		String detail = errorClassifier.detail(e);
		logger.warn("{} statement failed ({}): {}", bound.statement().kind(), kind, detail);
		return new ExecutionResult.Failure(kind, errorClassifier.message(e, kind), detail, suggestion);
	}
}
