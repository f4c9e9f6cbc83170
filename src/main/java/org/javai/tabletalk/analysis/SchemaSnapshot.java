package org.javai.tabletalk.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.tabletalk.schema.ColumnDescriptor;
import org.javai.tabletalk.schema.ColumnRef;
import org.javai.tabletalk.schema.FileSummary;
import org.javai.tabletalk.schema.SchemaStore;

/**
 * Immutable copy of the descriptor set that every analysis runs over. Taking the snapshot is the
 * only moment the store is read, so nothing slow happens while the store is open.
 */
public final class SchemaSnapshot {

	private final List<FileSummary> files;
	private final Map<String, List<ColumnDescriptor>> columnsByFile;

	private SchemaSnapshot(List<FileSummary> files, Map<String, List<ColumnDescriptor>> columnsByFile) {
		this.files = List.copyOf(files);
		this.columnsByFile = Collections.unmodifiableMap(columnsByFile);
	}

	public static SchemaSnapshot of(SchemaStore store) {
		List<FileSummary> files = store.listAllFiles();
		Map<String, List<ColumnDescriptor>> columns = new LinkedHashMap<>();
		for (FileSummary file : files) {
			columns.put(file.fileName(), List.copyOf(store.getFileSchema(file.fileName())));
		}
		return new SchemaSnapshot(files, columns);
	}

	/**
	 * Builds a snapshot straight from descriptors; file summaries are derived from them.
	 *
	 * @throws IllegalArgumentException if a (file, column) pair appears twice
	 */
	public static SchemaSnapshot of(List<ColumnDescriptor> descriptors) {
		Map<String, List<ColumnDescriptor>> columns = new LinkedHashMap<>();
		Set<ColumnRef> seen = new LinkedHashSet<>();
		for (ColumnDescriptor descriptor : descriptors) {
			if (!seen.add(descriptor.ref())) {
				throw new IllegalArgumentException("Duplicate column " + descriptor.ref());
			}
			columns.computeIfAbsent(descriptor.fileName(), f -> new ArrayList<>()).add(descriptor);
		}
		List<FileSummary> files = new ArrayList<>();
		Map<String, List<ColumnDescriptor>> frozen = new LinkedHashMap<>();
		columns.keySet().stream().sorted().forEach(fileName -> {
			List<ColumnDescriptor> fileColumns = columns.get(fileName);
			ColumnDescriptor first = fileColumns.get(0);
			files.add(new FileSummary(fileName, first.filePath(), fileColumns.size(), first.totalRows(),
					first.fileSizeMb(), first.lastScanned()));
			frozen.put(fileName, List.copyOf(fileColumns));
		});
		return new SchemaSnapshot(files, frozen);
	}

	public static SchemaSnapshot empty() {
		return new SchemaSnapshot(List.of(), Map.of());
	}

	public boolean isEmpty() {
		return files.isEmpty();
	}

	public List<FileSummary> files() {
		return files;
	}

	public List<String> fileNames() {
		return List.copyOf(columnsByFile.keySet());
	}

	public Optional<FileSummary> file(String fileName) {
		return files.stream().filter(f -> f.fileName().equals(fileName)).findFirst();
	}

	public List<ColumnDescriptor> schemaOf(String fileName) {
		return columnsByFile.getOrDefault(fileName, List.of());
	}

	/**
	 * All descriptors, file by file.
	 */
	public List<ColumnDescriptor> columns() {
		List<ColumnDescriptor> all = new ArrayList<>();
		columnsByFile.values().forEach(all::addAll);
		return all;
	}

	public List<ColumnRef> columnRefs() {
		return columns().stream().map(ColumnDescriptor::ref).toList();
	}

	/**
	 * Column names of one file in stored order.
	 */
	public Set<String> columnNames(String fileName) {
		Set<String> names = new LinkedHashSet<>();
		schemaOf(fileName).forEach(c -> names.add(c.columnName()));
		return names;
	}

	/**
	 * Distinct column names across all files, each mapped to its occurrences.
	 */
	public Map<String, List<ColumnDescriptor>> occurrencesByName() {
		Map<String, List<ColumnDescriptor>> byName = new LinkedHashMap<>();
		for (ColumnDescriptor column : columns()) {
			byName.computeIfAbsent(column.columnName(), n -> new ArrayList<>()).add(column);
		}
		return byName;
	}
}
