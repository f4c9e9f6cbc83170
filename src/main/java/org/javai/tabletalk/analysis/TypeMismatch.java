package org.javai.tabletalk.analysis;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.javai.tabletalk.schema.DataType;

/**
 * A column name stored with more than one data type.
 *
 * @param columnName  the shared column name
 * @param filesByType data type to the files using it, in {@link DataType} order
 */
public record TypeMismatch(String columnName, Map<DataType, List<String>> filesByType) {

	public TypeMismatch {
		if (filesByType.size() < 2) {
			throw new IllegalArgumentException("A type mismatch needs at least two types for " + columnName);
		}
		EnumMap<DataType, List<String>> copy = new EnumMap<>(DataType.class);
		filesByType.forEach((type, files) -> copy.put(type, List.copyOf(files)));
		filesByType = Collections.unmodifiableMap(copy);
	}

	public int typeCount() {
		return filesByType.size();
	}

	public int totalFiles() {
		return filesByType.values().stream().mapToInt(List::size).sum();
	}
}
