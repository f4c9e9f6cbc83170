package org.javai.tabletalk.resolve;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;

/**
 * The JSON object a structured-output model is asked to produce.
 *
 * <pre>
 * {
 *   "tool": "get_file_schema",
 *   "parameters": { "file_name": "orders.csv" },
 *   "intent": "Describe the orders file",
 *   "confidence": 0.9
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record RawPlan(
		@JsonProperty("tool") @JsonAlias({"tool_name", "name", "function"}) String tool,
		@JsonProperty("parameters") @JsonAlias({"arguments", "args", "params"}) Map<String, Object> parameters,
		@JsonProperty("intent") String intent,
		@JsonProperty("confidence") Double confidence
) {

	static RawPlan fromJson(String json, ObjectMapper mapper) throws JsonProcessingException {
		return mapper.readValue(json, RawPlan.class);
	}
}
