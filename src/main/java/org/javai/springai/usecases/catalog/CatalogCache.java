package org.javai.springai.usecases.catalog;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.javai.springai.usecases.schema.SchemaIntrospector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lazily built, invalidatable holder of the current {@link Catalog}.
 *
 * <p>Builds are single-flight: callers arriving while no valid catalog exists queue on one lock,
 * and only the first of them introspects the schema and calls the generator. Each
 * {@link #invalidate()} starts a new epoch. A catalog is published only if no invalidation
 * happened while it was being built; otherwise the build is repeated.</p>
 */
public class CatalogCache {

	private static final Logger logger = LoggerFactory.getLogger(CatalogCache.class);

	private final SchemaIntrospector introspector;
	private final CatalogGenerator generator;
	private final UseCaseFactory useCaseFactory;

	private final ReentrantLock buildLock = new ReentrantLock();
	private final AtomicLong epoch = new AtomicLong();
	private volatile Snapshot current;

	public CatalogCache(SchemaIntrospector introspector, CatalogGenerator generator, UseCaseFactory useCaseFactory) {
		this.introspector = Objects.requireNonNull(introspector, "introspector must not be null");
		this.generator = Objects.requireNonNull(generator, "generator must not be null");
		this.useCaseFactory = Objects.requireNonNull(useCaseFactory, "useCaseFactory must not be null");
	}

	public CatalogCache(SchemaIntrospector introspector, CatalogGenerator generator) {
		this(introspector, generator, new UseCaseFactory());
	}

	/**
	 * Returns the current catalog, building it first if it was never built or has been invalidated.
	 *
	 * @throws CatalogGenerationException if the generator fails
	 */
	public Catalog getOrBuild() {
		Snapshot snapshot = current;
		if (snapshot != null && snapshot.epoch() == epoch.get()) {
			return snapshot.catalog();
		}
		buildLock.lock();
		try {
			while (true) {
				long buildEpoch = epoch.get();
				snapshot = current;
				if (snapshot != null && snapshot.epoch() == buildEpoch) {
					return snapshot.catalog();
				}
				Catalog built = build();
				if (epoch.get() == buildEpoch) {
					current = new Snapshot(buildEpoch, built);
					return built;
				}
				logger.info("Catalog invalidated while building; rebuilding");
			}
		}
		finally {
			buildLock.unlock();
		}
	}

	/**
	 * Marks the current catalog stale. The next {@link #getOrBuild()} regenerates it.
	 */
	public void invalidate() {
		long next = epoch.incrementAndGet();
		logger.debug("Catalog invalidated (epoch {})", next);
	}

	/**
	 * @return true if a catalog is built and still valid
	 */
	public boolean isValid() {
		Snapshot snapshot = current;
		return snapshot != null && snapshot.epoch() == epoch.get();
	}

	private Catalog build() {
		String schema = introspector.getSchema();
		logger.info("Generating catalog from schema ({} characters)", schema.length());
		Catalog catalog = useCaseFactory.assemble(generator.generate(schema));
		logger.info("Catalog generated with {} use case(s)", catalog.size());
		return catalog;
	}

	private record Snapshot(long epoch, Catalog catalog) {
	}
}
