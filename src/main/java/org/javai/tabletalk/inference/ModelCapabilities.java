package org.javai.tabletalk.inference;

import java.util.Locale;
import java.util.Set;

/**
 * Capability checks keyed on the model identifier.
 */
public final class ModelCapabilities {

	private static final Set<String> FUNCTION_CALLING_MODELS = Set.of("phi4-mini-fc", "phi4-mini:fc", "phi4:fc");

	private ModelCapabilities() {
	}

	/**
	 * Whether the model is a function-calling build: one of the known tags, or a phi4 model whose
	 * name carries {@code fc} or {@code function}.
	 */
	public static boolean supportsFunctionCalling(String modelId) {
		if (modelId == null) {
			return false;
		}
		String name = modelId.toLowerCase(Locale.ROOT);
		if (FUNCTION_CALLING_MODELS.contains(name)) {
			return true;
		}
		return name.contains("phi4") && (name.contains("fc") || name.contains("function"));
	}
}
