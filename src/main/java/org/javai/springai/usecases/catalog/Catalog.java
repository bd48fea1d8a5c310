package org.javai.springai.usecases.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * An ordered, immutable collection of use cases derived from one schema.
 */
public final class Catalog {

	/** Maximum number of use cases per category kept from a single generation pass. */
	public static final int MAX_PER_CATEGORY = 5;

	private static final Catalog EMPTY = new Catalog(List.of());

	private final List<UseCase> useCases;

	private Catalog(List<UseCase> useCases) {
		this.useCases = List.copyOf(useCases);
	}

	public static Catalog empty() {
		return EMPTY;
	}

	/**
	 * Creates a catalog holding exactly the given use cases.
	 *
	 * @throws IllegalArgumentException if two use cases share an id
	 */
	public static Catalog of(List<UseCase> useCases) {
		Objects.requireNonNull(useCases, "useCases must not be null");
		Set<String> ids = new HashSet<>();
		for (UseCase useCase : useCases) {
			if (!ids.add(useCase.id())) {
				throw new IllegalArgumentException("Duplicate use case id: " + useCase.id());
			}
		}
		return new Catalog(useCases);
	}

	/**
	 * Creates a catalog from the output of one generation pass, keeping at most
	 * {@link #MAX_PER_CATEGORY} use cases per category in arrival order. Use cases whose id was
	 * already seen are dropped.
	 */
	public static Catalog fromGenerationPass(List<UseCase> generated) {
		Objects.requireNonNull(generated, "generated must not be null");
		Map<Category, Integer> counts = new EnumMap<>(Category.class);
		Set<String> ids = new HashSet<>();
		List<UseCase> kept = new ArrayList<>();
		for (UseCase useCase : generated) {
			int count = counts.getOrDefault(useCase.category(), 0);
			if (count < MAX_PER_CATEGORY && ids.add(useCase.id())) {
				kept.add(useCase);
				counts.put(useCase.category(), count + 1);
			}
		}
		return new Catalog(kept);
	}

	public List<UseCase> useCases() {
		return useCases;
	}

	public Optional<UseCase> find(String id) {
		if (id == null) {
			return Optional.empty();
		}
		return useCases.stream().filter(u -> u.id().equals(id)).findFirst();
	}

	/**
	 * Finds a use case by its description (case-insensitive).
	 */
	public Optional<UseCase> findByDescription(String description) {
		if (description == null || description.isBlank()) {
			return Optional.empty();
		}
		return useCases.stream().filter(u -> u.description().equalsIgnoreCase(description.trim())).findFirst();
	}

	public List<UseCase> inCategory(Category category) {
		return useCases.stream().filter(u -> u.category() == category).toList();
	}

	/**
	 * @return use cases grouped by category; every category is present, possibly with an empty list
	 */
	public Map<Category, List<UseCase>> byCategory() {
		Map<Category, List<UseCase>> grouped = new EnumMap<>(Category.class);
		for (Category category : Category.values()) {
			grouped.put(category, inCategory(category));
		}
		return Collections.unmodifiableMap(grouped);
	}

	public int size() {
		return useCases.size();
	}

	public boolean isEmpty() {
		return useCases.isEmpty();
	}

	@Override
	public String toString() {
		return "Catalog" + useCases.stream().map(UseCase::id).toList();
	}
}
