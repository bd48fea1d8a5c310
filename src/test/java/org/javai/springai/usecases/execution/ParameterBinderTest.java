package org.javai.springai.usecases.execution;

import static org.assertj.core.api.Assertions.assertThat;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.springai.usecases.sql.NormalizedStatement;
import org.javai.springai.usecases.sql.QueryNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("ParameterBinder")
class ParameterBinderTest {

	private final ParameterBinder binder = new ParameterBinder();
	private final NormalizedStatement statement = new QueryNormalizer()
			.normalize("UPDATE employees SET salary = :salary WHERE id = :id AND hired_on > :since");

	private static Map<String, String> declared() {
		Map<String, String> declared = new LinkedHashMap<>();
		declared.put("salary", "decimal(10,2)");
		declared.put("id", "integer");
		declared.put("since", "date");
		return declared;
	}

	@Nested
	@DisplayName("Named values")
	class NamedValues {

		@Test
		void bindsByNameAndCoercesText() {
			BoundStatement bound = binder.bind(statement, declared(),
					ParameterValues.named(Map.of("id", "7", "salary", "9100.50", "since", "2015-01-01")));

			assertThat(bound.isFullyBound()).isTrue();
			assertThat(bound.values())
					.containsEntry("salary", new BigDecimal("9100.50"))
					.containsEntry("id", 7L)
					.containsEntry("since", LocalDate.of(2015, 1, 1));
		}

		@Test
		void ignoresUndeclaredNames() {
			BoundStatement bound = binder.bind(statement, declared(),
					ParameterValues.named(Map.of("id", 7, "salary", 1, "since", "2015-01-01", "extra", "x")));

			assertThat(bound.values()).doesNotContainKey("extra").hasSize(3);
		}

		@Test
		void reportsMissingValuesAsUnbound() {
			BoundStatement bound = binder.bind(statement, declared(), ParameterValues.named(Map.of("id", 7)));

			assertThat(bound.isFullyBound()).isFalse();
			assertThat(bound.unbound()).containsExactly("salary", "since");
		}

		@Test
		void keepsExplicitNull() {
			Map<String, Object> values = new HashMap<>();
			values.put("id", 7);
			values.put("salary", null);
			values.put("since", "2015-01-01");

			BoundStatement bound = binder.bind(statement, declared(), ParameterValues.named(values));

			assertThat(bound.isFullyBound()).isTrue();
			assertThat(bound.values()).containsEntry("salary", null);
		}

		@Test
		void nonTextValuesPassThrough() {
			BoundStatement bound = binder.bind(statement, declared(),
					ParameterValues.named(Map.of("id", 7, "salary", 5.5, "since", LocalDate.of(2020, 1, 1))));

			assertThat(bound.values()).containsEntry("id", 7).containsEntry("salary", 5.5);
		}
	}

	@Nested
	@DisplayName("Positional values")
	class PositionalValues {

		@Test
		void bindsInPlaceholderOrder() {
			BoundStatement bound = binder.bind(statement, declared(), ParameterValues.positional("100", "7", "2015-01-01"));

			assertThat(bound.values()).containsExactly(
					Map.entry("salary", new BigDecimal("100")),
					Map.entry("id", 7L),
					Map.entry("since", LocalDate.of(2015, 1, 1)));
		}

		@Test
		void ignoresSurplusValues() {
			BoundStatement bound = binder.bind(statement, declared(), ParameterValues.positional(1, 2, 3, 4));

			assertThat(bound.values()).hasSize(3);
			assertThat(bound.isFullyBound()).isTrue();
		}

		@Test
		void leavesTrailingPlaceholdersUnbound() {
			BoundStatement bound = binder.bind(statement, declared(), ParameterValues.positional(1));

			assertThat(bound.unbound()).containsExactly("id", "since");
		}
	}

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
			"BIGINT          | 42         | java.lang.Long",
			"int(11)         | 42         | java.lang.Long",
			"numeric(12,4)   | 4.2        | java.math.BigDecimal",
			"boolean         | TRUE       | java.lang.Boolean",
			"boolean         | yes        | java.lang.String",
			"timestamp       | 2024-01-31 10:15:00 | java.time.LocalDateTime",
			"date            | not-a-date | java.lang.String",
			"varchar(100)    | 42         | java.lang.String",
			"any             | 42         | java.lang.String"
	})
	void coercesTextByDeclaredType(String declaredType, String value, String expectedClass) {
		assertThat(ParameterTypes.coerce(value, declaredType).getClass().getName()).isEqualTo(expectedClass);
	}

	@Test
	void parsesTimestampWithSpaceSeparator() {
		assertThat(ParameterTypes.coerce("2024-01-31 10:15:00", "datetime"))
				.isEqualTo(LocalDateTime.of(2024, 1, 31, 10, 15));
	}
}
