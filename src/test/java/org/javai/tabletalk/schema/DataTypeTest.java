package org.javai.tabletalk.schema;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

class DataTypeTest {

	@ParameterizedTest
	@CsvSource({
			"int64, INTEGER",
			"BIGINT, INTEGER",
			"float64, FLOAT",
			"'DECIMAL(10,2)', FLOAT",
			"bool, BOOLEAN",
			"datetime64[ns], DATETIME",
			"TIMESTAMP WITH TIME ZONE, DATETIME",
			"object, STRING",
			"VARCHAR(20), STRING"
	})
	void mapsEngineTypeNames(String raw, DataType expected) {
		assertThat(DataType.fromRaw(raw)).isEqualTo(expected);
	}

	@Test
	void unknownNamesFallBackToStringButLookupIsEmpty() {
		assertThat(DataType.fromRaw("geometry")).isEqualTo(DataType.STRING);
		assertThat(DataType.lookup("customer")).isEmpty();
	}

	@Test
	void labelIsLowerCase() {
		assertThat(DataType.DATETIME.label()).isEqualTo("datetime");
		assertThat(DataType.INTEGER).hasToString("integer");
	}
}
