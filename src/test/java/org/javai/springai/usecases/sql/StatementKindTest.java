package org.javai.springai.usecases.sql;

import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class StatementKindTest {

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
			"select * from employees | SELECT",
			"  INSERT INTO t (a) VALUES (1) | INSERT",
			"Update t set a = 1 | UPDATE",
			"DELETE FROM t WHERE a = 1 | DELETE",
			"(SELECT 1) | SELECT",
			"WITH recent AS (SELECT 1) SELECT * FROM recent | SELECT",
			"/* generated */ DELETE FROM t | DELETE",
			"MERGE INTO t USING s ON (t.id = s.id) | UNKNOWN",
			"DROP TABLE employees | UNKNOWN"
	})
	void detectsKindFromLeadingKeyword(String statement, StatementKind expected) {
		assertThat(StatementKind.detect(statement)).isEqualTo(expected);
	}

	@Test
	void skipsLineComments() {
		assertThat(StatementKind.detect("-- list everyone\nSELECT * FROM employees")).isEqualTo(StatementKind.SELECT);
	}

	@Test
	void nullAndBlankAreUnknown() {
		assertThat(StatementKind.detect(null)).isEqualTo(StatementKind.UNKNOWN);
		assertThat(StatementKind.detect("   ")).isEqualTo(StatementKind.UNKNOWN);
	}
}
