package org.javai.springai.usecases.execution;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransactionRollbackException;
import java.sql.SQLTransientConnectionException;
import java.sql.SQLTransientException;
import java.util.Optional;
import java.util.Set;
import org.javai.springai.usecases.connection.BackendKind;
import org.javai.springai.usecases.connection.ConfigurationException;
import org.javai.springai.usecases.connection.ConnectionException;

/**
 * Maps failures to {@link ErrorKind}s.
 *
 * <p>MySQL vendor codes are consulted first, then the SQLState class, then the JDBC exception
 * subclass. PostgreSQL and H2 report standard SQLStates, so their vendor codes are not needed.</p>
 *
 * <p>{@link ErrorKind#CONNECTION} is reserved for a session that could not be opened, which
 * surfaces as a {@link ConnectionException}. A connection lost once the statement is under way is
 * {@link ErrorKind#OPERATIONAL}.</p>
 */
public class ErrorClassifier {

	static final String REFERENCED_ELSEWHERE = "Cannot delete or update this record as it is referenced elsewhere.";
	static final String CONSTRAINT_VIOLATED = "The statement violates a data constraint.";

	private static final int MYSQL_FOREIGN_KEY_PARENT = 1451;
	private static final int MYSQL_FOREIGN_KEY_CHILD = 1452;
	private static final Set<Integer> MYSQL_CONSTRAINT_CODES = Set.of(1048, 1062, 1406, 1451, 1452, 3819);
	private static final Set<Integer> MYSQL_SYNTAX_CODES = Set.of(1054, 1064, 1146, 1149);
	private static final Set<Integer> MYSQL_OPERATIONAL_CODES = Set.of(1205, 1213, 1317, 3024);
	private static final Set<Integer> MYSQL_LOST_CONNECTION_CODES = Set.of(1040, 1042, 1043, 1047, 1158, 1159, 1160,
			1161, 2002, 2003, 2006, 2013);

	private static final Set<String> REFERENTIAL_STATES = Set.of("23503", "23506");
	private static final Set<String> OPERATIONAL_STATES = Set.of("40001", "40P01", "41000", "55P03", "57014", "HYT00",
			"53100", "53200", "53300");

	/**
	 * @param failure the failure as thrown
	 * @param backend the backend the statement ran against, or null if unknown
	 */
	public ErrorKind classify(Throwable failure, BackendKind backend) {
		if (failure instanceof ConfigurationException) {
			return ErrorKind.CONFIGURATION;
		}
		if (failure instanceof ConnectionException) {
			return ErrorKind.CONNECTION;
		}
		Optional<SQLException> found = findSQLException(failure);
		if (found.isEmpty()) {
			return ErrorKind.UNKNOWN;
		}
		SQLException sqlException = found.get();

		if (backend == BackendKind.MYSQL) {
			int code = sqlException.getErrorCode();
			if (MYSQL_CONSTRAINT_CODES.contains(code)) {
				return ErrorKind.CONSTRAINT_VIOLATION;
			}
			if (MYSQL_SYNTAX_CODES.contains(code)) {
				return ErrorKind.SYNTAX_DEFECT;
			}
			if (MYSQL_OPERATIONAL_CODES.contains(code)) {
				return ErrorKind.OPERATIONAL;
			}
			if (MYSQL_LOST_CONNECTION_CODES.contains(code)) {
				return ErrorKind.OPERATIONAL;
			}
		}

		String sqlState = sqlException.getSQLState();
		if (sqlState != null) {
			if (OPERATIONAL_STATES.contains(sqlState)) {
				return ErrorKind.OPERATIONAL;
			}
			if (sqlState.startsWith("23")) {
				return ErrorKind.CONSTRAINT_VIOLATION;
			}
			if (sqlState.startsWith("42")) {
				return ErrorKind.SYNTAX_DEFECT;
			}
			if (sqlState.startsWith("08")) {
				return ErrorKind.OPERATIONAL;
			}
		}

		if (sqlException instanceof SQLIntegrityConstraintViolationException) {
			return ErrorKind.CONSTRAINT_VIOLATION;
		}
		if (sqlException instanceof SQLSyntaxErrorException) {
			return ErrorKind.SYNTAX_DEFECT;
		}
		if (sqlException instanceof SQLTransientConnectionException
				|| sqlException instanceof SQLNonTransientConnectionException) {
			return ErrorKind.OPERATIONAL;
		}
		if (sqlException instanceof SQLTimeoutException || sqlException instanceof SQLTransactionRollbackException
				|| sqlException instanceof SQLTransientException) {
			return ErrorKind.OPERATIONAL;
		}
		return ErrorKind.UNKNOWN;
	}

	/**
	 * @return true if the failure is a foreign key violation
	 */
	public boolean isReferentialViolation(Throwable failure) {
		return findSQLException(failure)
				.map(e -> e.getErrorCode() == MYSQL_FOREIGN_KEY_PARENT || e.getErrorCode() == MYSQL_FOREIGN_KEY_CHILD
						|| (e.getSQLState() != null && REFERENTIAL_STATES.contains(e.getSQLState())))
				.orElse(false);
	}

	/**
	 * Builds the user-facing message for a failure of the given kind.
	 */
	public String message(Throwable failure, ErrorKind kind) {
		if (kind == ErrorKind.CONSTRAINT_VIOLATION) {
			return isReferentialViolation(failure) ? REFERENCED_ELSEWHERE : CONSTRAINT_VIOLATED;
		}
		return detail(failure);
	}

	/**
	 * @return the message of the underlying SQL exception if there is one, else that of the failure
	 */
	public String detail(Throwable failure) {
		String message = findSQLException(failure).map(Throwable::getMessage).orElse(failure.getMessage());
		return message != null ? message : failure.getClass().getSimpleName();
	}

	private static Optional<SQLException> findSQLException(Throwable throwable) {
		Throwable cursor = throwable;
		while (cursor != null) {
			if (cursor instanceof SQLException sqlException) {
				return Optional.of(sqlException);
			}
			cursor = cursor.getCause();
		}
		return Optional.empty();
	}
}
