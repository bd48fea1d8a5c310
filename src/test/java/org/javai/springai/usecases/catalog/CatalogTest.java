package org.javai.springai.usecases.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CatalogTest {

	private static UseCase useCase(String id, String description, Category category, String template) {
		return new UseCase(id, description, category, template, Map.of(), List.of(), List.of());
	}

	private final Catalog catalog = Catalog.of(List.of(
			useCase("a", "List employees", Category.READ, "SELECT * FROM employees"),
			useCase("b", "Remove department", Category.DELETE, "DELETE FROM departments WHERE id = 1"),
			useCase("c", "List departments", Category.READ, "SELECT * FROM departments")));

	@Test
	void findsById() {
		assertThat(catalog.find("b")).map(UseCase::description).contains("Remove department");
		assertThat(catalog.find("missing")).isEmpty();
		assertThat(catalog.find(null)).isEmpty();
	}

	@Test
	void findsByDescriptionIgnoringCase() {
		assertThat(catalog.findByDescription("list DEPARTMENTS ")).map(UseCase::id).contains("c");
	}

	@Test
	void groupsByCategoryWithEveryCategoryPresent() {
		Map<Category, List<UseCase>> grouped = catalog.byCategory();

		assertThat(grouped).containsOnlyKeys(Category.values());
		assertThat(grouped.get(Category.READ)).extracting(UseCase::id).containsExactly("a", "c");
		assertThat(grouped.get(Category.CREATE)).isEmpty();
	}

	@Test
	void rejectsDuplicateIds() {
		assertThatThrownBy(() -> Catalog.of(List.of(
				useCase("a", "One", Category.READ, "SELECT 1"),
				useCase("a", "Two", Category.READ, "SELECT 2"))))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void generationPassDropsRepeatedIds() {
		Catalog generated = Catalog.fromGenerationPass(List.of(
				useCase("a", "One", Category.READ, "SELECT 1"),
				useCase("a", "Two", Category.READ, "SELECT 2")));

		assertThat(generated.size()).isEqualTo(1);
		assertThat(generated.find("a")).map(UseCase::description).contains("One");
	}

	@Test
	void emptyCatalogIsEmpty() {
		assertThat(Catalog.empty().isEmpty()).isTrue();
	}
}
