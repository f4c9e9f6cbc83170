package org.javai.tabletalk.schema;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only view of the scanned column descriptors.
 * <p>
 * Implementations may be read from several sessions at once. Callers copy what they need and
 * release the store before doing anything slow, such as calling a model.
 */
public interface SchemaStore {

	/**
	 * All scanned files, ordered by file name.
	 */
	List<FileSummary> listAllFiles();

	/**
	 * Columns of one file ordered by column name, or an empty list when the file is unknown.
	 */
	List<ColumnDescriptor> getFileSchema(String fileName);

	/**
	 * Every descriptor in the store, grouped by file in file-name order.
	 */
	default List<ColumnDescriptor> allColumns() {
		List<ColumnDescriptor> columns = new ArrayList<>();
		for (FileSummary file : listAllFiles()) {
			columns.addAll(getFileSchema(file.fileName()));
		}
		return columns;
	}

	default DatabaseStats databaseStats() {
		List<FileSummary> files = listAllFiles();
		if (files.isEmpty()) {
			return DatabaseStats.empty();
		}
		int totalColumns = 0;
		Set<String> names = new HashSet<>();
		for (FileSummary file : files) {
			List<ColumnDescriptor> schema = getFileSchema(file.fileName());
			totalColumns += schema.size();
			schema.forEach(column -> names.add(column.columnName()));
		}
		double avgSize = files.stream().mapToDouble(FileSummary::fileSizeMb).average().orElse(0.0);
		Instant lastScan = files.stream()
				.map(FileSummary::lastScanned)
				.filter(Objects::nonNull)
				.max(Comparator.naturalOrder())
				.orElse(null);
		return new DatabaseStats(files.size(), totalColumns, names.size(), avgSize, lastScan);
	}
}
