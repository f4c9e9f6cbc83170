package org.javai.tabletalk.resolve;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;

/**
 * Finds file names mentioned in a question and normalizes file-name arguments.
 */
public final class FileReferences {

	private static final Set<String> DATA_EXTENSIONS = Set.of("csv", "tsv", "json", "parquet", "xlsx", "xls", "txt");
	private static final String DEFAULT_EXTENSION = ".csv";
	private static final String TOKEN_DELIMITERS = " \t\r\n,;:\"'`()[]{}?!";

	private FileReferences() {
	}

	/**
	 * File references in order of appearance, without duplicates. A token counts when it has a
	 * data-file extension, or when it equals the name of an available file without its extension,
	 * in which case the available file's full name is returned.
	 */
	public static List<String> extract(String query, List<String> availableFiles) {
		Set<String> found = new LinkedHashSet<>();
		for (String rawToken : StringUtils.split(StringUtils.defaultString(query), TOKEN_DELIMITERS)) {
			String token = StringUtils.stripEnd(rawToken, ".");
			if (token.isEmpty()) {
				continue;
			}
			if (hasDataExtension(token)) {
				found.add(token);
				continue;
			}
			for (String file : availableFiles) {
				if (stem(file).equalsIgnoreCase(token)) {
					found.add(file);
					break;
				}
			}
		}
		return new ArrayList<>(found);
	}

	/**
	 * Appends {@code .csv} to a name that has no extension; other names are returned trimmed.
	 */
	public static String withDefaultExtension(String fileName) {
		String name = fileName.trim();
		if (name.isEmpty() || extension(name).isPresent()) {
			return name;
		}
		return name + DEFAULT_EXTENSION;
	}

	static boolean hasDataExtension(String token) {
		return extension(token).map(DATA_EXTENSIONS::contains).orElse(false);
	}

	private static Optional<String> extension(String name) {
		int dot = name.lastIndexOf('.');
		if (dot <= 0 || dot == name.length() - 1) {
			return Optional.empty();
		}
		return Optional.of(name.substring(dot + 1).toLowerCase(Locale.ROOT));
	}

	private static String stem(String fileName) {
		int dot = fileName.lastIndexOf('.');
		return dot > 0 ? fileName.substring(0, dot) : fileName;
	}
}
