package org.javai.springai.usecases;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.javai.springai.usecases.catalog.Catalog;
import org.javai.springai.usecases.catalog.CatalogCache;
import org.javai.springai.usecases.catalog.CatalogGenerationException;
import org.javai.springai.usecases.catalog.CatalogGenerator;
import org.javai.springai.usecases.catalog.ChatClientCatalogGenerator;
import org.javai.springai.usecases.catalog.UseCase;
import org.javai.springai.usecases.catalog.UseCaseFactory;
import org.javai.springai.usecases.connection.Backend;
import org.javai.springai.usecases.connection.BackendKind;
import org.javai.springai.usecases.connection.ConfigurationException;
import org.javai.springai.usecases.connection.ConnectionException;
import org.javai.springai.usecases.connection.ConnectionManager;
import org.javai.springai.usecases.connection.ConnectionProfile;
import org.javai.springai.usecases.connection.MySqlBackend;
import org.javai.springai.usecases.connection.PostgresBackend;
import org.javai.springai.usecases.execution.BoundStatement;
import org.javai.springai.usecases.execution.DependentReferenceResolver;
import org.javai.springai.usecases.execution.ErrorClassifier;
import org.javai.springai.usecases.execution.ErrorKind;
import org.javai.springai.usecases.execution.ExecutionResult;
import org.javai.springai.usecases.execution.MetadataDependentReferenceResolver;
import org.javai.springai.usecases.execution.QueryExecutor;
import org.javai.springai.usecases.projection.ProjectedResult;
import org.javai.springai.usecases.projection.ResultProjector;
import org.javai.springai.usecases.schema.JdbcSchemaIntrospector;
import org.javai.springai.usecases.schema.SchemaIntrospectionException;
import org.javai.springai.usecases.schema.SchemaIntrospector;
import org.javai.springai.usecases.sql.NormalizedStatement;
import org.javai.springai.usecases.sql.QueryNormalizer;
import org.javai.springai.usecases.sql.StatementKind;
import org.springframework.ai.chat.client.ChatClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for listing and executing the use cases derived from a database schema.
 *
 * <p>The catalog is generated lazily on first use and regenerated after every connection
 * profile update. Each execution runs in its own session and transaction.</p>
 *
 * <pre>{@code
 * UseCaseEngine engine = UseCaseEngine.builder()
 *         .withConnectionProfile(ConnectionProfiles.fromEnvironment())
 *         .withChatClient(chatClient)
 *         .build();
 * ProjectedResult result = engine.execute(
 *         ExecutionRequest.forUseCase(id, ParameterValues.named(Map.of("employee_id", 7))));
 * }</pre>
 */
public class UseCaseEngine {

	private static final Logger logger = LoggerFactory.getLogger(UseCaseEngine.class);

	private final ConnectionManager connectionManager;
	private final CatalogCache catalogCache;
	private final QueryNormalizer normalizer;
	private final UseCaseFactory useCaseFactory;
	private final QueryExecutor executor;
	private final ResultProjector projector;
	private final ErrorClassifier errorClassifier;

	private UseCaseEngine(Builder builder, ConnectionManager connectionManager, CatalogGenerator generator) {
		this.connectionManager = connectionManager;
		this.normalizer = new QueryNormalizer();
		this.useCaseFactory = new UseCaseFactory(normalizer);
		this.errorClassifier = new ErrorClassifier();
		SchemaIntrospector introspector = builder.schemaIntrospector != null
				? builder.schemaIntrospector
				: new JdbcSchemaIntrospector(connectionManager);
		this.catalogCache = new CatalogCache(introspector, generator, useCaseFactory);
		this.executor = new QueryExecutor(connectionManager, normalizer,
				builder.dependentReferenceResolver != null
						? builder.dependentReferenceResolver
						: new MetadataDependentReferenceResolver(),
				errorClassifier);
		this.projector = new ResultProjector();
		connectionManager.addProfileListener(profile -> catalogCache.invalidate());
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Executes a catalog use case or a raw template.
	 *
	 * <p>Failures, including an unknown use case, are reported in the returned result's outcome
	 * rather than thrown.</p>
	 */
	public ProjectedResult execute(ExecutionRequest request) {
		Objects.requireNonNull(request, "request must not be null");
		if (request.isRawTemplate()) {
			return executeTemplate(request);
		}
		Optional<UseCase> useCase;
		try {
			useCase = request.useCaseId() != null
					? findUseCase(request.useCaseId())
					: listCatalog().findByDescription(request.useCaseDescription());
		}
		catch (CatalogGenerationException | SchemaIntrospectionException | ConnectionException
				| ConfigurationException e) {
			ErrorKind kind = errorClassifier.classify(e, null);
			logger.warn("Catalog unavailable ({}): {}", kind, e.getMessage());
			return projector.project(null, null, new ExecutionResult.Failure(kind, errorClassifier.detail(e)));
		}
		if (useCase.isEmpty()) {
			String target = request.useCaseId() != null ? request.useCaseId() : request.useCaseDescription();
			logger.info("Use case '{}' not found", target);
			return projector.project(null, null,
					new ExecutionResult.Failure(ErrorKind.NOT_FOUND, "Use case '%s' not found".formatted(target)));
		}
		BoundStatement bound = executor.prepare(useCase.get(), request.values());
		return projector.project(useCase.get(), bound, executor.execute(bound));
	}

	private ProjectedResult executeTemplate(ExecutionRequest request) {
		NormalizedStatement normalized = normalizer.normalize(request.template());
		if (normalized.kind() == StatementKind.UNKNOWN) {
			// no use case can carry an unrecognized statement; the executor refuses it
			Map<String, String> declared = new LinkedHashMap<>();
			normalized.placeholders().forEach(name -> declared.put(name, UseCaseFactory.ANY_TYPE));
			BoundStatement bound = executor.prepare(request.template(), declared, request.values());
			return projector.project(null, bound, executor.execute(bound));
		}
		UseCase useCase = useCaseFactory.adHoc(request.template());
		BoundStatement bound = executor.prepare(useCase, request.values());
		return projector.project(useCase, bound, executor.execute(bound));
	}

	/**
	 * Returns the current catalog, generating it first when none is valid.
	 *
	 * @throws CatalogGenerationException if generation fails
	 * @throws SchemaIntrospectionException if the schema cannot be read
	 * @throws ConnectionException if the database cannot be reached
	 * @throws ConfigurationException if the connection profile is invalid
	 */
	public Catalog listCatalog() {
		return catalogCache.getOrBuild();
	}

	public Optional<UseCase> findUseCase(String id) {
		return listCatalog().find(id);
	}

	/**
	 * Validates and installs a new connection profile. On success the catalog is invalidated and
	 * regenerated on next use.
	 */
	public ProfileUpdateResult updateConnectionProfile(ConnectionProfile profile) {
		try {
			connectionManager.updateProfile(profile);
			return new ProfileUpdateResult.Applied(profile);
		}
		catch (ConfigurationException e) {
			logger.warn("Rejected connection profile update: {}", e.getMessage());
			return new ProfileUpdateResult.Rejected(e.getMessage());
		}
	}

	public ConnectionProfile connectionProfile() {
		return connectionManager.activeProfile();
	}

	public static final class Builder {
		private ConnectionProfile connectionProfile;
		private ConnectionManager connectionManager;
		private final Map<BackendKind, Backend> backends = new EnumMap<>(BackendKind.class);
		private ChatClient chatClient;
		private CatalogGenerator catalogGenerator;
		private SchemaIntrospector schemaIntrospector;
		private DependentReferenceResolver dependentReferenceResolver;

		private Builder() {
			backends.put(BackendKind.MYSQL, new MySqlBackend());
			backends.put(BackendKind.POSTGRES, new PostgresBackend());
		}

		public Builder withConnectionProfile(ConnectionProfile profile) {
			this.connectionProfile = profile;
			return this;
		}

		/**
		 * Uses an existing connection manager instead of creating one from a profile.
		 */
		public Builder withConnectionManager(ConnectionManager connectionManager) {
			this.connectionManager = connectionManager;
			return this;
		}

		/**
		 * Registers a backend, replacing the built-in one of the same kind.
		 */
		public Builder withBackend(Backend backend) {
			if (backend != null) {
				backends.put(backend.kind(), backend);
			}
			return this;
		}

		public Builder withChatClient(ChatClient chatClient) {
			this.chatClient = chatClient;
			return this;
		}

		public Builder withCatalogGenerator(CatalogGenerator catalogGenerator) {
			this.catalogGenerator = catalogGenerator;
			return this;
		}

		public Builder withSchemaIntrospector(SchemaIntrospector schemaIntrospector) {
			this.schemaIntrospector = schemaIntrospector;
			return this;
		}

		public Builder withDependentReferenceResolver(DependentReferenceResolver resolver) {
			this.dependentReferenceResolver = resolver;
			return this;
		}

		/**
		 * @throws IllegalStateException if no connection or no catalog generator is configured
		 */
		public UseCaseEngine build() {
			ConnectionManager manager = connectionManager;
			if (manager == null) {
				if (connectionProfile == null) {
					throw new IllegalStateException("A connection profile or connection manager is required");
				}
				manager = new ConnectionManager(connectionProfile, backends);
			}
			CatalogGenerator generator = catalogGenerator;
			if (generator == null) {
				if (chatClient == null) {
					throw new IllegalStateException("A chat client or catalog generator is required");
				}
				ConnectionManager dialectSource = manager;
				generator = new ChatClientCatalogGenerator(chatClient,
						() -> dialectSource.activeBackend().statementDialectHints());
			}
			return new UseCaseEngine(this, manager, generator);
		}
	}
}
