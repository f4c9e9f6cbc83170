package org.javai.tabletalk.analysis;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.javai.tabletalk.schema.DataType;

/**
 * A column name found in several files.
 */
public record CommonColumn(String columnName, List<String> files, Set<DataType> dataTypes) {

	public CommonColumn {
		files = List.copyOf(files);
		dataTypes = Collections.unmodifiableSet(dataTypes.isEmpty() ? EnumSet.noneOf(DataType.class) : EnumSet.copyOf(dataTypes));
	}

	public int fileCount() {
		return files.size();
	}

	public boolean hasTypeConflict() {
		return dataTypes.size() > 1;
	}
}
