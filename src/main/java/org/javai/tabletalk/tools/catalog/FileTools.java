package org.javai.tabletalk.tools.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.javai.tabletalk.analysis.SchemaSnapshot;
import org.javai.tabletalk.schema.ColumnDescriptor;
import org.javai.tabletalk.schema.FileSummary;
import org.javai.tabletalk.schema.SchemaStore;
import org.javai.tabletalk.tools.api.AnalysisTool;
import org.javai.tabletalk.tools.api.ToolParameter;

/**
 * Tools describing scanned files: listings, schemas and statistics.
 */
public class FileTools {

	public enum StatisticsScope {
		DATABASE, FILE, COLUMN;

		@Override
		public String toString() {
			return name().toLowerCase(Locale.ROOT);
		}
	}

	private final SchemaStore store;

	public FileTools(SchemaStore store) {
		this.store = Objects.requireNonNull(store, "store must not be null");
	}

	@AnalysisTool(name = "get_files", description = "List scanned data files with their column count, rows and size")
	public String getFiles(
			@ToolParameter(name = "pattern", required = false,
					description = "Case-insensitive text the file name must contain") String pattern) {
		List<FileSummary> files = store.listAllFiles();
		if (files.isEmpty()) {
			return ReportFormatter.NO_DATA;
		}
		if (pattern != null) {
			String wanted = pattern.toLowerCase(Locale.ROOT);
			files = files.stream().filter(f -> f.fileName().toLowerCase(Locale.ROOT).contains(wanted)).toList();
			if (files.isEmpty()) {
				return "No files found matching '" + pattern + "'.";
			}
		}
		return ReportFormatter.files(files);
	}

	@AnalysisTool(name = "get_file_schema",
			description = "Show the columns of one file with type, null count and unique count")
	public String getFileSchema(
			@ToolParameter(name = "file_name", description = "File to describe, including extension",
					examples = {"orders.csv"}) String fileName) {
		List<FileSummary> files = store.listAllFiles();
		if (files.isEmpty()) {
			return ReportFormatter.NO_DATA;
		}
		FileLookup lookup = FileLookup.find(fileName, files.stream().map(FileSummary::fileName).toList());
		Optional<String> match = lookup.match();
		if (match.isEmpty()) {
			return lookup.describeMiss();
		}
		return ReportFormatter.fileSchema(match.get(), store.getFileSchema(match.get()), true);
	}

	@AnalysisTool(name = "get_schemas", description = "Show the schemas of all files, or of the files matching a pattern")
	public String getSchemas(
			@ToolParameter(name = "file_pattern", required = false,
					description = "Case-insensitive text the file name must contain") String filePattern,
			@ToolParameter(name = "detailed", required = false, defaultValue = "true",
					description = "Include types and counts, not only column names") boolean detailed) {
		SchemaSnapshot snapshot = SchemaSnapshot.of(store);
		if (snapshot.isEmpty()) {
			return ReportFormatter.NO_DATA;
		}
		List<String> names = snapshot.fileNames();
		if (filePattern != null) {
			String wanted = filePattern.toLowerCase(Locale.ROOT);
			names = names.stream().filter(n -> n.toLowerCase(Locale.ROOT).contains(wanted)).toList();
			if (names.isEmpty()) {
				return "No files found matching '" + filePattern + "'.";
			}
		}
		List<String> sections = new ArrayList<>();
		for (String name : names) {
			sections.add(ReportFormatter.fileSchema(name, snapshot.schemaOf(name), detailed));
		}
		return String.join("\n\n", sections);
	}

	@AnalysisTool(name = "get_statistics",
			description = "Statistics for the whole database, one file (null and unique counts) or one column across files")
	public String getStatistics(
			@ToolParameter(name = "scope", required = false, defaultValue = "database",
					description = "What to summarize") StatisticsScope scope,
			@ToolParameter(name = "target", required = false,
					description = "File name for the file scope, column name for the column scope") String target) {
		if (scope == StatisticsScope.DATABASE || target == null) {
			return ReportFormatter.databaseStats(store.databaseStats());
		}
		SchemaSnapshot snapshot = SchemaSnapshot.of(store);
		if (snapshot.isEmpty()) {
			return ReportFormatter.NO_DATA;
		}
		return scope == StatisticsScope.FILE ? fileStatistics(snapshot, target) : columnStatistics(snapshot, target);
	}

	private String fileStatistics(SchemaSnapshot snapshot, String target) {
		FileLookup lookup = FileLookup.find(target, snapshot.fileNames());
		if (lookup.match().isEmpty()) {
			return lookup.describeMiss();
		}
		String fileName = lookup.match().get();
		List<ColumnDescriptor> columns = snapshot.schemaOf(fileName);
		StringBuilder out = new StringBuilder("Statistics for ").append(fileName).append(":\n");
		FileSummary summary = snapshot.file(fileName).orElseThrow();
		out.append(String.format(Locale.ROOT, "  %d columns, %,d rows, %.2f MB%n",
				summary.columnCount(), summary.totalRows(), summary.fileSizeMb()));
		for (ColumnDescriptor column : columns) {
			out.append(String.format(Locale.ROOT, "  %s: %.1f%% null, %,d unique%n",
					column.columnName(), column.nullPercentage(), column.uniqueCount()));
		}
		return out.toString().trim();
	}

	private String columnStatistics(SchemaSnapshot snapshot, String target) {
		List<ColumnDescriptor> occurrences = snapshot.columns().stream()
				.filter(c -> c.columnName().equalsIgnoreCase(target))
				.toList();
		if (occurrences.isEmpty()) {
			return "No column named '" + target + "' was found.";
		}
		StringBuilder out = new StringBuilder("Column '").append(target).append("' appears in ")
				.append(occurrences.size()).append(" file(s):\n");
		for (ColumnDescriptor column : occurrences) {
			out.append(String.format(Locale.ROOT, "  %s: %s, %.1f%% null, %,d unique%n",
					column.fileName(), column.dataType().label(), column.nullPercentage(), column.uniqueCount()));
		}
		return out.toString().trim();
	}
}
