package org.javai.springai.usecases.catalog;

import java.util.List;

/**
 * Produces candidate use cases from a textual schema description.
 *
 * <p>Implementations typically delegate to a language model. Their output is not trusted:
 * every candidate goes through {@link UseCaseFactory} before it enters a {@link Catalog}.</p>
 */
@FunctionalInterface
public interface CatalogGenerator {

	/**
	 * @param schema the schema description
	 * @return candidate use cases in generation order
	 * @throws CatalogGenerationException if nothing usable could be generated
	 */
	List<GeneratedUseCase> generate(String schema);
}
