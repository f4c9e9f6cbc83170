package org.javai.tabletalk.schema;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory SchemaStore for tests and embedded use.
 *
 * <p>Files are replaced wholesale, the way a scanner writes them:</p>
 *
 * <pre>{@code
 * SchemaStore store = new InMemorySchemaStore()
 *     .addColumn("orders.csv", "order_id", DataType.INTEGER)
 *     .addColumn("orders.csv", "customer_id", DataType.INTEGER)
 *     .addColumn("legacy_users.csv", "customer_id", DataType.STRING);
 * }</pre>
 */
public final class InMemorySchemaStore implements SchemaStore {

	private static final Comparator<ColumnDescriptor> BY_COLUMN_NAME = Comparator.comparing(ColumnDescriptor::columnName);

	private final ConcurrentNavigableMap<String, List<ColumnDescriptor>> files = new ConcurrentSkipListMap<>();

	/**
	 * Adds one column to a file, keeping the file's other columns.
	 *
	 * @throws IllegalStateException if the file already has a column with that name
	 */
	public InMemorySchemaStore addColumn(String fileName, String columnName, DataType dataType) {
		return addColumn(ColumnDescriptor.of(fileName, columnName, dataType));
	}

	public InMemorySchemaStore addColumn(ColumnDescriptor column) {
		Objects.requireNonNull(column, "column must not be null");
		files.compute(column.fileName(), (name, existing) -> {
			List<ColumnDescriptor> updated = existing != null ? new ArrayList<>(existing) : new ArrayList<>();
			if (updated.stream().anyMatch(c -> c.columnName().equals(column.columnName()))) {
				throw new IllegalStateException("Duplicate column " + column.columnName() + " in " + name);
			}
			updated.add(column);
			updated.sort(BY_COLUMN_NAME);
			return List.copyOf(updated);
		});
		return this;
	}

	/**
	 * Replaces every column of a file. An empty list removes the file.
	 */
	public InMemorySchemaStore replaceFile(String fileName, List<ColumnDescriptor> columns) {
		if (columns.isEmpty()) {
			files.remove(fileName);
			return this;
		}
		Set<String> seen = new HashSet<>();
		for (ColumnDescriptor column : columns) {
			if (!column.fileName().equals(fileName)) {
				throw new IllegalArgumentException("Column " + column.columnName() + " belongs to " + column.fileName()
						+ ", not " + fileName);
			}
			if (!seen.add(column.columnName())) {
				throw new IllegalStateException("Duplicate column " + column.columnName() + " in " + fileName);
			}
		}
		List<ColumnDescriptor> sorted = new ArrayList<>(columns);
		sorted.sort(BY_COLUMN_NAME);
		files.put(fileName, List.copyOf(sorted));
		return this;
	}

	@Override
	public List<FileSummary> listAllFiles() {
		List<FileSummary> summaries = new ArrayList<>();
		for (Map.Entry<String, List<ColumnDescriptor>> entry : files.entrySet()) {
			List<ColumnDescriptor> columns = entry.getValue();
			ColumnDescriptor first = columns.get(0);
			Instant lastScanned = columns.stream()
					.map(ColumnDescriptor::lastScanned)
					.filter(Objects::nonNull)
					.max(Comparator.naturalOrder())
					.orElse(null);
			summaries.add(new FileSummary(entry.getKey(), first.filePath(), columns.size(), first.totalRows(),
					first.fileSizeMb(), lastScanned));
		}
		return summaries;
	}

	@Override
	public List<ColumnDescriptor> getFileSchema(String fileName) {
		if (fileName == null) {
			return List.of();
		}
		return files.getOrDefault(fileName, List.of());
	}
}
