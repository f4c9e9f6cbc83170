package org.javai.tabletalk.inference;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ModelCapabilitiesTest {

	@ParameterizedTest
	@CsvSource({
			"phi4-mini-fc, true",
			"phi4-mini:fc, true",
			"PHI4:FC, true",
			"phi4-function-calling:latest, true",
			"phi4-mini, false",
			"llama3.2, false",
			"qwen2.5-fc, false"
	})
	void functionCallingBuilds(String modelId, boolean expected) {
		assertThat(ModelCapabilities.supportsFunctionCalling(modelId)).isEqualTo(expected);
	}

	@Test
	void unknownModel() {
		assertThat(ModelCapabilities.supportsFunctionCalling(null)).isFalse();
	}
}
