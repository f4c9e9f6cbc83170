package org.javai.tabletalk.schema;

/**
 * Identifies a column within a file. Unique within a schema snapshot.
 */
public record ColumnRef(String fileName, String columnName) {

	public ColumnRef {
		if (fileName == null || columnName == null) {
			throw new IllegalArgumentException("fileName and columnName are required");
		}
	}

	@Override
	public String toString() {
		return fileName + ":" + columnName;
	}
}
