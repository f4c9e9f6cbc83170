package org.javai.tabletalk.tools.catalog;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.javai.tabletalk.analysis.SchemaSnapshot;
import org.javai.tabletalk.error.EmbeddingUnavailableException;
import org.javai.tabletalk.schema.ColumnDescriptor;
import org.javai.tabletalk.schema.DataType;
import org.javai.tabletalk.schema.FileSummary;
import org.javai.tabletalk.schema.SchemaStore;
import org.javai.tabletalk.semantic.SemanticMatch;
import org.javai.tabletalk.semantic.SemanticMatcher;
import org.javai.tabletalk.tools.api.AnalysisTool;
import org.javai.tabletalk.tools.api.ToolParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metadata search by column name, file name or data type. A column search that finds no
 * substring match falls back to semantic similarity when embeddings are available.
 */
public class SearchTools {

	private static final Logger logger = LoggerFactory.getLogger(SearchTools.class);

	public enum SearchType {
		COLUMN, FILE, TYPE;

		@Override
		public String toString() {
			return name().toLowerCase(Locale.ROOT);
		}
	}

	private final SchemaStore store;
	private final SemanticMatcher matcher;
	private final double semanticThreshold;

	public SearchTools(SchemaStore store, SemanticMatcher matcher, double semanticThreshold) {
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.matcher = matcher != null ? matcher : SemanticMatcher.unavailable();
		this.semanticThreshold = semanticThreshold;
	}

	@AnalysisTool(name = "search_metadata", description = "Find columns, files or data types by name")
	public String searchMetadata(
			@ToolParameter(name = "search_term", description = "Text to look for", examples = {"customer_id"})
			String searchTerm,
			@ToolParameter(name = "search_type", required = false, defaultValue = "column",
					description = "What to search") SearchType searchType,
			@ToolParameter(name = "semantic", required = false, defaultValue = "true",
					description = "Fall back to semantic similarity when nothing matches literally") boolean semantic) {
		SchemaSnapshot snapshot = SchemaSnapshot.of(store);
		if (snapshot.isEmpty()) {
			return ReportFormatter.NO_DATA;
		}
		return switch (searchType) {
			case FILE -> searchFiles(snapshot, searchTerm);
			case TYPE -> searchTypes(snapshot, searchTerm);
			case COLUMN -> searchColumns(snapshot, searchTerm, semantic);
		};
	}

	private String searchColumns(SchemaSnapshot snapshot, String term, boolean semantic) {
		String wanted = term.toLowerCase(Locale.ROOT);
		List<SemanticMatch> literal = snapshot.columns().stream()
				.filter(c -> c.columnName().toLowerCase(Locale.ROOT).contains(wanted))
				.map(c -> new SemanticMatch(c.columnName(), c.fileName(), 1.0,
						c.columnName().equalsIgnoreCase(term) ? SemanticMatch.MatchType.EXACT : SemanticMatch.MatchType.PATTERN))
				.toList();
		if (!literal.isEmpty() || !semantic) {
			return ReportFormatter.matches(term, literal, false);
		}
		if (!matcher.isAvailable()) {
			return ReportFormatter.matches(term, literal, false) + "\n(Semantic search is unavailable.)";
		}
		try {
			List<SemanticMatch> similar = matcher.findSimilar(term, snapshot.columnRefs(), semanticThreshold);
			return ReportFormatter.matches(term, similar, true);
		}
		catch (EmbeddingUnavailableException e) {
			logger.warn("Semantic search for '{}' failed, showing literal results: {}", term, e.getMessage());
			return ReportFormatter.matches(term, literal, false) + "\n(Semantic search is unavailable.)";
		}
	}

	private String searchFiles(SchemaSnapshot snapshot, String term) {
		String wanted = term.toLowerCase(Locale.ROOT);
		List<FileSummary> files = snapshot.files().stream()
				.filter(f -> f.fileName().toLowerCase(Locale.ROOT).contains(wanted))
				.toList();
		return files.isEmpty() ? "No files found matching '" + term + "'." : ReportFormatter.files(files);
	}

	private String searchTypes(SchemaSnapshot snapshot, String term) {
		Optional<DataType> type = DataType.lookup(term);
		if (type.isEmpty()) {
			return "'" + term + "' is not a known data type. Known types: integer, float, boolean, datetime, string.";
		}
		List<ColumnDescriptor> columns = snapshot.columns().stream().filter(c -> c.dataType() == type.get()).toList();
		if (columns.isEmpty()) {
			return "No " + type.get().label() + " columns found.";
		}
		StringBuilder out = new StringBuilder("Columns of type ").append(type.get().label()).append(" (")
				.append(columns.size()).append("):\n");
		columns.forEach(c -> out.append("  ").append(c.columnName()).append(" in ").append(c.fileName()).append('\n'));
		return out.toString().trim();
	}
}
