package org.javai.springai.usecases.connection;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One connection and the transaction running on it.
 *
 * <p>A session ends its transaction at most once, by {@link #commit()} or {@link #rollback()}.
 * Closing a session whose transaction is still open rolls it back. Closing always releases the
 * connection and the session's hold on the active profile, and must happen on the thread that
 * opened the session.</p>
 */
public class Session implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(Session.class);

	enum State {
		OPEN,
		COMMITTED,
		ROLLED_BACK,
		CLOSED
	}

	private final Connection connection;
	private final Backend backend;
	private final Lock profileLock;
	private State state = State.OPEN;
	private boolean transactionEnded;

	Session(Connection connection, Backend backend, Lock profileLock) {
		this.connection = Objects.requireNonNull(connection, "connection must not be null");
		this.backend = Objects.requireNonNull(backend, "backend must not be null");
		this.profileLock = Objects.requireNonNull(profileLock, "profileLock must not be null");
	}

	public Connection connection() {
		requireState(State.OPEN, "use");
		return connection;
	}

	public Backend backend() {
		return backend;
	}

	State state() {
		return state;
	}

	/**
	 * @throws IllegalStateException if the transaction has already ended
	 */
	public void commit() throws SQLException {
		requireState(State.OPEN, "commit");
		connection.commit();
		state = State.COMMITTED;
		transactionEnded = true;
	}

	/**
	 * @throws IllegalStateException if the transaction has already ended
	 */
	public void rollback() throws SQLException {
		requireState(State.OPEN, "roll back");
		// the transaction counts as ended even if the driver fails to roll back
		transactionEnded = true;
		state = State.ROLLED_BACK;
		connection.rollback();
	}

	@Override
	public void close() {
		if (state == State.CLOSED) {
			return;
		}
		try {
			if (!transactionEnded) {
				transactionEnded = true;
				connection.rollback();
			}
		}
		catch (SQLException e) {
			logger.warn("Rollback on close failed: {}", e.getMessage(), e);
		}
		finally {
			state = State.CLOSED;
			try {
				connection.close();
			}
			catch (SQLException e) {
				logger.warn("Closing connection failed: {}", e.getMessage(), e);
			}
			finally {
				profileLock.unlock();
			}
		}
	}

	private void requireState(State expected, String operation) {
		if (state != expected) {
			throw new IllegalStateException("Cannot " + operation + " session in state " + state);
		}
	}
}
