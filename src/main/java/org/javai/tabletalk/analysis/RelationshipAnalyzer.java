package org.javai.tabletalk.analysis;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.tabletalk.error.EmbeddingUnavailableException;
import org.javai.tabletalk.schema.ColumnDescriptor;
import org.javai.tabletalk.schema.ColumnRef;
import org.javai.tabletalk.schema.DataType;
import org.javai.tabletalk.schema.FileSummary;
import org.javai.tabletalk.semantic.Concept;
import org.javai.tabletalk.semantic.SemanticMatch;
import org.javai.tabletalk.semantic.SemanticMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relationships between file schemas: shared columns, type conflicts, overlap and diffs.
 * <p>
 * Every method works on a {@link SchemaSnapshot} and returns an empty result for an empty
 * snapshot. Only {@link #diffSchemas}, {@link #conceptGroups} and {@link #conceptEvolution} use the
 * semantic matcher.
 */
public final class RelationshipAnalyzer {

	private static final Logger logger = LoggerFactory.getLogger(RelationshipAnalyzer.class);

	private final SemanticMatcher matcher;

	public RelationshipAnalyzer(SemanticMatcher matcher) {
		this.matcher = matcher != null ? matcher : SemanticMatcher.unavailable();
	}

	/**
	 * Column names stored with more than one data type, the ones spread over most files first.
	 */
	public List<TypeMismatch> detectTypeMismatches(SchemaSnapshot snapshot) {
		List<TypeMismatch> mismatches = new ArrayList<>();
		snapshot.occurrencesByName().forEach((name, occurrences) -> {
			Map<DataType, List<String>> filesByType = new EnumMap<>(DataType.class);
			for (ColumnDescriptor column : occurrences) {
				filesByType.computeIfAbsent(column.dataType(), t -> new ArrayList<>()).add(column.fileName());
			}
			if (filesByType.size() > 1) {
				filesByType.values().forEach(files -> files.sort(Comparator.naturalOrder()));
				mismatches.add(new TypeMismatch(name, filesByType));
			}
		});
		mismatches.sort(Comparator.comparingInt(TypeMismatch::totalFiles).reversed()
				.thenComparing(TypeMismatch::columnName));
		return mismatches;
	}

	/**
	 * Column names present in at least {@code threshold} distinct files, ordered by file count
	 * descending, then name.
	 */
	public List<CommonColumn> findCommonColumns(SchemaSnapshot snapshot, int threshold) {
		List<CommonColumn> common = new ArrayList<>();
		snapshot.occurrencesByName().forEach((name, occurrences) -> {
			Set<String> files = new LinkedHashSet<>();
			Set<DataType> types = EnumSet.noneOf(DataType.class);
			for (ColumnDescriptor column : occurrences) {
				files.add(column.fileName());
				types.add(column.dataType());
			}
			if (files.size() >= threshold) {
				common.add(new CommonColumn(name, files.stream().sorted().toList(), types));
			}
		});
		common.sort(Comparator.comparingInt(CommonColumn::fileCount).reversed()
				.thenComparing(CommonColumn::columnName));
		return common;
	}

	/**
	 * File pairs whose column-name sets have a Jaccard similarity strictly above {@code threshold}.
	 */
	public List<SchemaSimilarity> findSimilarSchemas(SchemaSnapshot snapshot, double threshold) {
		List<String> files = snapshot.fileNames();
		List<SchemaSimilarity> similar = new ArrayList<>();
		for (int i = 0; i < files.size(); i++) {
			Set<String> first = snapshot.columnNames(files.get(i));
			for (int j = i + 1; j < files.size(); j++) {
				Set<String> second = snapshot.columnNames(files.get(j));
				double similarity = jaccard(first, second);
				if (similarity > threshold) {
					List<String> shared = first.stream().filter(second::contains).sorted().toList();
					similar.add(new SchemaSimilarity(files.get(i), files.get(j), similarity, shared));
				}
			}
		}
		similar.sort(Comparator.comparingDouble(SchemaSimilarity::similarity).reversed());
		return similar;
	}

	static double jaccard(Set<String> first, Set<String> second) {
		Set<String> union = new HashSet<>(first);
		union.addAll(second);
		if (union.isEmpty()) {
			return 0.0;
		}
		long intersection = first.stream().filter(second::contains).count();
		return (double) intersection / union.size();
	}

	/**
	 * Compares two files. Columns unique to one side are matched against the other side's unique
	 * columns semantically before being reported as missing; each column takes part in at most one
	 * equivalence.
	 *
	 * @return empty when either file is not in the snapshot
	 */
	public Optional<SchemaDiff> diffSchemas(SchemaSnapshot snapshot, String file1, String file2, double semanticThreshold) {
		List<ColumnDescriptor> left = snapshot.schemaOf(file1);
		List<ColumnDescriptor> right = snapshot.schemaOf(file2);
		if (left.isEmpty() || right.isEmpty()) {
			return Optional.empty();
		}
		Map<String, DataType> rightTypes = new LinkedHashMap<>();
		right.forEach(c -> rightTypes.put(c.columnName(), c.dataType()));
		Set<String> leftNames = snapshot.columnNames(file1);

		List<SchemaDiff.ColumnComparison> common = new ArrayList<>();
		List<String> onlyLeft = new ArrayList<>();
		for (ColumnDescriptor column : left) {
			DataType other = rightTypes.get(column.columnName());
			if (other != null) {
				common.add(new SchemaDiff.ColumnComparison(column.columnName(), column.dataType(), other));
			}
			else {
				onlyLeft.add(column.columnName());
			}
		}
		List<String> onlyRight = right.stream()
				.map(ColumnDescriptor::columnName)
				.filter(name -> !leftNames.contains(name))
				.toList();

		List<SchemaDiff.SemanticEquivalent> equivalents = new ArrayList<>();
		boolean semanticChecked = false;
		if (matcher.isAvailable() && !onlyLeft.isEmpty() && !onlyRight.isEmpty()) {
			try {
				equivalents = matchEquivalents(file2, onlyLeft, onlyRight, semanticThreshold);
				semanticChecked = true;
			}
			catch (EmbeddingUnavailableException e) {
				logger.warn("Semantic comparison skipped for {} vs {}: {}", file1, file2, e.getMessage());
			}
		}
		else {
			semanticChecked = matcher.isAvailable();
		}

		List<String> matchedLeft = equivalents.stream().map(SchemaDiff.SemanticEquivalent::firstColumn).toList();
		List<String> matchedRight = equivalents.stream().map(SchemaDiff.SemanticEquivalent::secondColumn).toList();
		List<String> missingLeft = onlyLeft.stream().filter(n -> !matchedLeft.contains(n)).toList();
		List<String> missingRight = onlyRight.stream().filter(n -> !matchedRight.contains(n)).toList();

		Set<String> union = new HashSet<>(leftNames);
		union.addAll(rightTypes.keySet());
		double similarity = union.isEmpty() ? 0.0 : Math.min(1.0, (double) (common.size() + equivalents.size()) / union.size());
		return Optional.of(new SchemaDiff(file1, file2, common, missingLeft, missingRight, equivalents, similarity,
				semanticChecked));
	}

	private List<SchemaDiff.SemanticEquivalent> matchEquivalents(String file2, List<String> onlyLeft,
			List<String> onlyRight, double threshold) {
		List<SchemaDiff.SemanticEquivalent> equivalents = new ArrayList<>();
		Set<String> taken = new HashSet<>();
		for (String name : onlyLeft) {
			List<ColumnRef> candidates = onlyRight.stream()
					.filter(n -> !taken.contains(n))
					.map(n -> new ColumnRef(file2, n))
					.toList();
			if (candidates.isEmpty()) {
				break;
			}
			List<SemanticMatch> matches = matcher.findSimilar(name, candidates, threshold);
			if (!matches.isEmpty()) {
				SemanticMatch best = matches.get(0);
				taken.add(best.columnName());
				equivalents.add(new SchemaDiff.SemanticEquivalent(name, best.columnName(), best.similarity()));
			}
		}
		return equivalents;
	}

	/**
	 * The {@code limit} largest files by size, largest first.
	 */
	public List<FileSummary> largestFiles(SchemaSnapshot snapshot, int limit) {
		return snapshot.files().stream()
				.sorted(Comparator.comparingDouble(FileSummary::fileSizeMb).reversed()
						.thenComparing(FileSummary::fileName))
				.limit(Math.max(0, limit))
				.toList();
	}

	/**
	 * Columns grouped by concept through embedding similarity.
	 *
	 * @throws EmbeddingUnavailableException when semantic matching is unavailable
	 */
	public Map<Concept, List<SemanticMatch>> conceptGroups(SchemaSnapshot snapshot, double threshold) {
		if (snapshot.isEmpty()) {
			return Map.of();
		}
		return matcher.conceptGroups(snapshot.columnRefs(), threshold);
	}

	/**
	 * Concepts that go by more than one column name, with the files using each name.
	 *
	 * @throws EmbeddingUnavailableException when semantic matching is unavailable
	 */
	public List<ConceptVariants> conceptEvolution(SchemaSnapshot snapshot, double threshold) {
		List<ConceptVariants> variants = new ArrayList<>();
		conceptGroups(snapshot, threshold).forEach((concept, matches) -> {
			Map<String, List<String>> filesByName = new LinkedHashMap<>();
			for (SemanticMatch match : matches) {
				filesByName.computeIfAbsent(match.columnName(), n -> new ArrayList<>()).add(match.fileName());
			}
			if (filesByName.size() > 1) {
				filesByName.values().forEach(files -> files.sort(Comparator.naturalOrder()));
				variants.add(new ConceptVariants(concept, filesByName));
			}
		});
		return variants;
	}
}
