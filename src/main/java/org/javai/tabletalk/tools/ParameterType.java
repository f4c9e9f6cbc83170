package org.javai.tabletalk.tools;

/**
 * JSON-schema type of a tool parameter.
 */
public enum ParameterType {

	STRING("string"),
	INTEGER("integer"),
	NUMBER("number"),
	BOOLEAN("boolean");

	private final String jsonType;

	ParameterType(String jsonType) {
		this.jsonType = jsonType;
	}

	public String jsonType() {
		return jsonType;
	}

	static ParameterType forJavaType(Class<?> type) {
		if (type == int.class || type == Integer.class || type == long.class || type == Long.class) {
			return INTEGER;
		}
		if (type == double.class || type == Double.class || type == float.class || type == Float.class) {
			return NUMBER;
		}
		if (type == boolean.class || type == Boolean.class) {
			return BOOLEAN;
		}
		if (type == String.class || type.isEnum()) {
			return STRING;
		}
		throw new IllegalStateException("Unsupported tool parameter type: " + type.getName());
	}
}
