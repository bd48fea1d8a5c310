package org.javai.springai.usecases.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.javai.springai.usecases.sql.NormalizedStatement;
import org.javai.springai.usecases.sql.QueryNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating validated use cases from templates.
 *
 * <p>The factory checks only the structural invariants of a use case: the category follows the
 * statement's leading keyword, and every placeholder of the normalized template has a declared
 * input parameter. It does not judge the business logic of generated statements.</p>
 */
public class UseCaseFactory {

	private static final Logger logger = LoggerFactory.getLogger(UseCaseFactory.class);

	/** Declared type of parameters that were not declared by anyone. */
	public static final String ANY_TYPE = "any";

	/** Id given to use cases built from raw templates. */
	public static final String AD_HOC_ID = "ad-hoc";

	private final QueryNormalizer normalizer;

	public UseCaseFactory(QueryNormalizer normalizer) {
		this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
	}

	public UseCaseFactory() {
		this(new QueryNormalizer());
	}

	/**
	 * Creates a use case.
	 *
	 * @param id identifier (a random one is assigned when null or blank)
	 * @param description business description
	 * @param template statement template
	 * @param inputParameters declared parameters, name to type
	 * @param affectedColumns columns affected by the statement (may be null)
	 * @return the validated use case
	 * @throws CatalogValidationException if the template violates a catalog invariant
	 */
	public UseCase create(String id, String description, String template, Map<String, String> inputParameters,
			List<String> affectedColumns) {
		if (template == null || template.isBlank()) {
			throw new CatalogValidationException("Use case '%s' has no template".formatted(description));
		}
		NormalizedStatement normalized = normalizer.normalize(template);
		Category category = Category.of(normalized.kind())
				.orElseThrow(() -> new CatalogValidationException(
						"Use case '%s' has no recognizable statement keyword".formatted(description)));

		Map<String, String> declared = inputParameters != null ? inputParameters : Map.of();
		List<String> undeclared = new ArrayList<>();
		for (String placeholder : normalized.placeholders()) {
			if (!declared.containsKey(placeholder)) {
				undeclared.add(placeholder);
			}
		}
		if (!undeclared.isEmpty()) {
			throw new CatalogValidationException(
					"Use case '%s' uses undeclared placeholders %s".formatted(description, undeclared));
		}

		String effectiveId = id == null || id.isBlank() ? UUID.randomUUID().toString() : id;
		return new UseCase(effectiveId, description, category, template, declared, normalized.inputColumns(),
				affectedColumns);
	}

	public UseCase create(GeneratedUseCase generated) {
		Objects.requireNonNull(generated, "generated must not be null");
		return create(generated.id(), generated.description(), generated.query(), generated.inputParameters(),
				generated.affectedColumns());
	}

	/**
	 * Creates a use case for a raw template supplied directly by a caller. Its input parameters are
	 * the template's placeholders, each declared as {@value #ANY_TYPE}.
	 *
	 * @throws CatalogValidationException if the template has no recognizable statement keyword
	 */
	public UseCase adHoc(String template) {
		Objects.requireNonNull(template, "template must not be null");
		Map<String, String> parameters = new LinkedHashMap<>();
		for (String placeholder : normalizer.normalize(template).placeholders()) {
			parameters.put(placeholder, ANY_TYPE);
		}
		return create(AD_HOC_ID, "Ad-hoc statement", template, parameters, List.of());
	}

	/**
	 * Assembles a catalog from one generation pass. Entries that violate an invariant are skipped
	 * and logged; at most {@link Catalog#MAX_PER_CATEGORY} use cases per category are kept.
	 */
	public Catalog assemble(List<GeneratedUseCase> generated) {
		Objects.requireNonNull(generated, "generated must not be null");
		List<UseCase> valid = new ArrayList<>();
		for (GeneratedUseCase candidate : generated) {
			try {
				valid.add(create(candidate));
			} catch (CatalogValidationException e) {
				logger.warn("Skipping generated use case: {}", e.getMessage());
			}
		}
		Catalog catalog = Catalog.fromGenerationPass(valid);
		if (catalog.size() < valid.size()) {
			logger.debug("Dropped {} use case(s) beyond {} per category", valid.size() - catalog.size(),
					Catalog.MAX_PER_CATEGORY);
		}
		return catalog;
	}
}
