package org.javai.springai.usecases.connection;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the active {@link ConnectionProfile} and opens {@link Session}s against it.
 *
 * <p>Swapping the profile and using a session are mutually exclusive: every open session holds a
 * shared lock until it is closed, and {@link #updateProfile(ConnectionProfile)} waits for the
 * exclusive lock. A thread must therefore close its sessions before it updates the profile.</p>
 */
public class ConnectionManager {

	private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

	private final Map<BackendKind, Backend> backends;
	private final ReentrantReadWriteLock profileLock = new ReentrantReadWriteLock();
	private final List<Consumer<ConnectionProfile>> profileListeners = new CopyOnWriteArrayList<>();
	private volatile ConnectionProfile profile;

	/**
	 * @param profile the initial profile; it is validated only when a session is opened
	 * @param backends the backends available, keyed by kind
	 */
	public ConnectionManager(ConnectionProfile profile, Map<BackendKind, Backend> backends) {
		this.profile = Objects.requireNonNull(profile, "profile must not be null");
		Objects.requireNonNull(backends, "backends must not be null");
		this.backends = backends.isEmpty() ? Map.of() : new EnumMap<>(backends);
	}

	/**
	 * Creates a manager with the MySQL and PostgreSQL backends.
	 */
	public static ConnectionManager withDefaultBackends(ConnectionProfile profile) {
		return new ConnectionManager(profile, Map.of(
				BackendKind.MYSQL, new MySqlBackend(),
				BackendKind.POSTGRES, new PostgresBackend()));
	}

	/**
	 * Opens a session on the active profile. The caller must close it.
	 *
	 * @throws ConfigurationException if the active profile is invalid; no connection is attempted
	 * @throws ConnectionException if the driver cannot connect
	 */
	public Session openSession() {
		Lock readLock = profileLock.readLock();
		readLock.lock();
		try {
			ConnectionProfile current = profile.validate();
			Backend backend = backendFor(current.backendKind());
			Connection connection = backend.connect(current);
			logger.debug("Opened session on {}:{}/{}", current.host(), current.effectivePort(backend.defaultPort()),
					current.database());
			return new Session(connection, backend, readLock);
		}
		catch (SQLException e) {
			readLock.unlock();
			throw new ConnectionException("Failed to connect to database: " + e.getMessage(), e);
		}
		catch (RuntimeException e) {
			readLock.unlock();
			throw e;
		}
	}

	/**
	 * Validates and installs a new profile, then notifies profile listeners.
	 *
	 * <p>Waits until every open session has been closed. Sessions opened afterwards use the new
	 * profile.</p>
	 *
	 * @throws ConfigurationException if the profile is invalid; the active profile is unchanged
	 */
	public void updateProfile(ConnectionProfile newProfile) {
		Objects.requireNonNull(newProfile, "newProfile must not be null");
		newProfile.validate();
		backendFor(newProfile.backendKind());
		Lock writeLock = profileLock.writeLock();
		writeLock.lock();
		try {
			profile = newProfile;
			logger.info("Connection profile updated: {}", newProfile);
			for (Consumer<ConnectionProfile> listener : profileListeners) {
				listener.accept(newProfile);
			}
		}
		finally {
			writeLock.unlock();
		}
	}

	/**
	 * Registers a listener called, while the swap is still exclusive, after each profile update.
	 */
	public void addProfileListener(Consumer<ConnectionProfile> listener) {
		profileListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
	}

	public ConnectionProfile activeProfile() {
		return profile;
	}

	/**
	 * @throws ConfigurationException if the active profile names no available backend
	 */
	public Backend activeBackend() {
		return backendFor(profile.backendKind());
	}

	private Backend backendFor(BackendKind kind) {
		Backend backend = backends.get(kind);
		if (backend == null) {
			throw new ConfigurationException("No backend available for " + kind.configName());
		}
		return backend;
	}
}
