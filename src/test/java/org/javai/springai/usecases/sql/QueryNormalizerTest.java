package org.javai.springai.usecases.sql;

import static org.assertj.core.api.Assertions.assertThat;
import org.apache.logging.log4j.Level;
import org.javai.springai.usecases.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("QueryNormalizer")
class QueryNormalizerTest {

	private final QueryNormalizer normalizer = new QueryNormalizer();

	@Nested
	@DisplayName("Omitted operator repair")
	class OmittedOperatorRepair {

		@Test
		void insertsGreaterThanBetweenQualifiedColumnAndPlaceholder() {
			NormalizedStatement normalized = normalizer.normalize("SELECT * FROM employees e WHERE e.salary  :salary");

			assertThat(normalized.statement()).isEqualTo("SELECT * FROM employees e WHERE e.salary > :salary");
			assertThat(normalized.repaired()).isTrue();
			assertThat(normalized.kind()).isEqualTo(StatementKind.SELECT);
			assertThat(normalized.placeholders()).containsExactly("salary");
		}

		@Test
		void repairsEveryPredicateOfAConjunction() {
			NormalizedStatement normalized = normalizer.normalize(
					"SELECT name FROM employees WHERE salary   :min_salary AND hired_on  :hired_after");

			assertThat(normalized.statement())
					.isEqualTo("SELECT name FROM employees WHERE salary > :min_salary AND hired_on > :hired_after");
		}

		@ParameterizedTest
		@ValueSource(strings = {
				"SELECT * FROM employees WHERE salary >= :salary",
				"SELECT * FROM employees WHERE salary = :salary",
				"SELECT * FROM employees WHERE salary <> :salary",
				"SELECT * FROM employees WHERE name LIKE :pattern",
				"SELECT * FROM employees WHERE status  IN (:first, :second)",
				"SELECT * FROM employees WHERE manager_id  IS NULL"
		})
		void leavesWellFormedPredicatesAlone(String statement) {
			NormalizedStatement normalized = normalizer.normalize(statement);

			assertThat(normalized.statement()).isEqualTo(statement);
			assertThat(normalized.repaired()).isFalse();
		}

		@Test
		void singleBlankIsNotRepairedBeforeExecution() {
			String statement = "SELECT * FROM employees WHERE salary :salary";

			assertThat(normalizer.normalize(statement).statement()).isEqualTo(statement);
		}

		@Test
		void repairIsLoggedAtInfo() {
			try (LogCaptorAppender captor = LogCaptorAppender.capture(QueryNormalizer.class, Level.INFO)) {
				normalizer.normalize("DELETE FROM employees WHERE salary  :salary");

				assertThat(captor.messagesAt(Level.INFO)).anyMatch(m -> m.contains("Repaired omitted comparison operator"));
			}
		}
	}

	@Nested
	@DisplayName("Placeholder unification")
	class PlaceholderUnification {

		@Test
		void angleBracketsBecomeNamedPlaceholders() {
			NormalizedStatement normalized = normalizer.normalize("DELETE FROM employees WHERE id = <employee_id>");

			assertThat(normalized.statement()).isEqualTo("DELETE FROM employees WHERE id = :employee_id");
			assertThat(normalized.placeholders()).containsExactly("employee_id");
		}

		@Test
		void bracesBecomeNamedPlaceholders() {
			NormalizedStatement normalized = normalizer.normalize("SELECT * FROM employees WHERE department_id = {dept}");

			assertThat(normalized.statement()).isEqualTo("SELECT * FROM employees WHERE department_id = :dept");
		}

		@Test
		void pyformatBecomesNamedPlaceholders() {
			NormalizedStatement normalized = normalizer.normalize(
					"INSERT INTO departments (id, name) VALUES (%(id)s, %(name)s)");

			assertThat(normalized.statement()).isEqualTo("INSERT INTO departments (id, name) VALUES (:id, :name)");
			assertThat(normalized.placeholders()).containsExactly("id", "name");
		}

		@Test
		void doubledBracketsAreConsumedWhole() {
			assertThat(normalizer.normalize("SELECT * FROM employees WHERE id = {{id}}").statement())
					.isEqualTo("SELECT * FROM employees WHERE id = :id");
			assertThat(normalizer.normalize("DELETE FROM employees WHERE id = <<id>>").statement())
					.isEqualTo("DELETE FROM employees WHERE id = :id");
		}

		@Test
		void stringLiteralsAreLeftUntouched() {
			NormalizedStatement normalized = normalizer.normalize(
					"SELECT * FROM employees WHERE tags = '{admin}' AND note = 'WHERE salary  :x' AND id = :id");

			assertThat(normalized.statement()).isEqualTo(
					"SELECT * FROM employees WHERE tags = '{admin}' AND note = 'WHERE salary  :x' AND id = :id");
			assertThat(normalized.repaired()).isFalse();
			assertThat(normalized.placeholders()).containsExactly("id");
		}

		@Test
		void commentsAreLeftUntouched() {
			String statement = "SELECT * FROM employees -- WHERE salary  <min>\nWHERE id = :id /* {dept} */";

			NormalizedStatement normalized = normalizer.normalize(statement);

			assertThat(normalized.statement()).isEqualTo(statement);
			assertThat(normalized.placeholders()).containsExactly("id");
		}

		@Test
		void placeholdersAreListedOnceInOrderOfFirstAppearance() {
			NormalizedStatement normalized = normalizer.normalize(
					"SELECT * FROM employees WHERE salary > :min AND salary < :max OR bonus > :min");

			assertThat(normalized.placeholders()).containsExactly("min", "max");
		}
	}

	@Nested
	@DisplayName("Column extraction")
	class ColumnExtraction {

		@Test
		void insertTakesTheColumnList() {
			assertThat(normalizer.extractColumns("INSERT INTO employees (name, salary) VALUES (:name, :salary)"))
					.containsExactly("name", "salary");
		}

		@Test
		void updateTakesTheAssignedColumnsOnly() {
			assertThat(normalizer.extractColumns("UPDATE employees SET salary = :salary WHERE id = :id"))
					.containsExactly("salary");
		}

		@Test
		void deleteTakesThePredicateColumns() {
			assertThat(normalizer.extractColumns(
					"DELETE FROM employees WHERE department_id = :dept AND salary < :max_salary"))
					.containsExactly("department_id", "salary");
		}

		@Test
		void selectTakesThePredicateColumnsWithoutDuplicates() {
			assertThat(normalizer.extractColumns(
					"SELECT name FROM employees WHERE salary > :min OR salary < :max AND manager_id IS NULL"))
					.containsExactly("salary", "manager_id");
		}

		@Test
		void quotedColumnsAreUnquoted() {
			assertThat(normalizer.extractColumns("INSERT INTO employees (\"name\", `salary`) VALUES (:name, :salary)"))
					.containsExactly("name", "salary");
		}

		@Test
		void templatesTheParserRejectsAreScannedTextually() {
			assertThat(normalizer.extractColumns("INSERT INTO employees (name, salary) VALUES (:name, :salary"))
					.containsExactly("name", "salary");
		}
	}

	@Nested
	@DisplayName("Unrecognized statements")
	class Unrecognized {

		@Test
		void areReturnedUnchanged() {
			NormalizedStatement normalized = normalizer.normalize("SHOW TABLES  LIKE  <pattern>");

			assertThat(normalized.kind()).isEqualTo(StatementKind.UNKNOWN);
			assertThat(normalized.statement()).isEqualTo("SHOW TABLES  LIKE  <pattern>");
			assertThat(normalized.inputColumns()).isEmpty();
		}
	}

	@ParameterizedTest
	@ValueSource(strings = {
			"SELECT * FROM employees e WHERE e.salary  :salary",
			"DELETE FROM employees WHERE id = <employee_id>",
			"UPDATE employees SET salary = {salary} WHERE id  :id",
			"INSERT INTO employees (name) VALUES (%(name)s)",
			"SELECT 1",
			"SELECT * FROM employees WHERE id = {{id}}",
			"DELETE FROM employees WHERE id = <<id>>",
			"SELECT * FROM employees WHERE note = '{draft}' AND id = <id>"
	})
	void normalizationIsIdempotent(String template) {
		String once = normalizer.normalize(template).statement();

		assertThat(normalizer.normalize(once).statement()).isEqualTo(once);
	}

	@Nested
	@DisplayName("Repair suggestions")
	class RepairSuggestions {

		@Test
		void suggestsOperatorForSingleBlank() {
			assertThat(normalizer.suggestRepair("SELECT * FROM employees WHERE salary :salary"))
					.contains("SELECT * FROM employees WHERE salary > :salary");
		}

		@Test
		void offersNothingForWellFormedStatement() {
			assertThat(normalizer.suggestRepair("SELECT * FROM employees WHERE salary = :salary")).isEmpty();
		}

		@Test
		void offersNothingForBlankStatement() {
			assertThat(normalizer.suggestRepair("  ")).isEmpty();
		}
	}
}
