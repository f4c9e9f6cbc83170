package org.javai.tabletalk.schema;

import java.time.Instant;
import java.util.Objects;

/**
 * One scanned column of one file: the row shape of the persisted {@code schema_info} table.
 *
 * @param fileName    file name including extension, e.g. {@code orders.csv}
 * @param filePath    path the file was scanned from
 * @param columnName  column header as found in the file
 * @param dataType    normalized type
 * @param nullCount   number of null cells
 * @param uniqueCount number of distinct values
 * @param totalRows   rows in the file
 * @param fileSizeMb  size of the file in megabytes
 * @param lastScanned when the file was scanned, may be {@code null}
 */
public record ColumnDescriptor(
		String fileName,
		String filePath,
		String columnName,
		DataType dataType,
		long nullCount,
		long uniqueCount,
		long totalRows,
		double fileSizeMb,
		Instant lastScanned
) {

	public ColumnDescriptor {
		if (fileName == null || fileName.isBlank()) {
			throw new IllegalArgumentException("fileName must not be blank");
		}
		if (columnName == null || columnName.isBlank()) {
			throw new IllegalArgumentException("columnName must not be blank");
		}
		Objects.requireNonNull(dataType, "dataType must not be null");
		if (nullCount < 0 || uniqueCount < 0 || totalRows < 0) {
			throw new IllegalArgumentException("counts must not be negative");
		}
		if (filePath == null) {
			filePath = fileName;
		}
	}

	/**
	 * Shorthand for fixtures and simple callers where only name and type matter.
	 */
	public static ColumnDescriptor of(String fileName, String columnName, DataType dataType) {
		return new ColumnDescriptor(fileName, fileName, columnName, dataType, 0, 0, 0, 0.0, null);
	}

	public ColumnRef ref() {
		return new ColumnRef(fileName, columnName);
	}

	/**
	 * Share of null cells, 0 when the file has no rows.
	 */
	public double nullPercentage() {
		return totalRows == 0 ? 0.0 : (nullCount * 100.0) / totalRows;
	}
}
