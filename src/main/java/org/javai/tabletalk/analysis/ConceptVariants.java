package org.javai.tabletalk.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.javai.tabletalk.semantic.Concept;

/**
 * The different names one concept goes by across files.
 *
 * @param concept     the concept
 * @param filesByName each name to the files that use it
 */
public record ConceptVariants(Concept concept, Map<String, List<String>> filesByName) {

	public ConceptVariants {
		Map<String, List<String>> copy = new LinkedHashMap<>();
		filesByName.forEach((name, files) -> copy.put(name, List.copyOf(files)));
		filesByName = Collections.unmodifiableMap(copy);
	}
}
