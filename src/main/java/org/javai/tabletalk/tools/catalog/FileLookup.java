package org.javai.tabletalk.tools.catalog;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves a user-supplied file name against the scanned files: exact name (ignoring case), then
 * name without extension, then a unique partial match.
 */
record FileLookup(String requested, Optional<String> match, List<String> candidates) {

	static FileLookup find(String requested, List<String> fileNames) {
		String wanted = requested.trim().toLowerCase(Locale.ROOT);
		for (String name : fileNames) {
			if (name.toLowerCase(Locale.ROOT).equals(wanted)) {
				return found(requested, name);
			}
		}
		for (String name : fileNames) {
			if (stem(name).toLowerCase(Locale.ROOT).equals(stem(wanted))) {
				return found(requested, name);
			}
		}
		List<String> partial = fileNames.stream()
				.filter(name -> name.toLowerCase(Locale.ROOT).contains(stem(wanted)))
				.toList();
		if (partial.size() == 1) {
			return found(requested, partial.get(0));
		}
		return new FileLookup(requested, Optional.empty(), partial);
	}

	private static FileLookup found(String requested, String name) {
		return new FileLookup(requested, Optional.of(name), List.of(name));
	}

	boolean isAmbiguous() {
		return match.isEmpty() && candidates.size() > 1;
	}

	/**
	 * User-facing explanation when no single file matched.
	 */
	String describeMiss() {
		if (isAmbiguous()) {
			return "Multiple files match '" + requested + "': " + String.join(", ", candidates)
					+ "\nPlease name one of them exactly.";
		}
		return "No files found matching '" + requested + "'.";
	}

	static String stem(String fileName) {
		int dot = fileName.lastIndexOf('.');
		return dot > 0 ? fileName.substring(0, dot) : fileName;
	}
}
