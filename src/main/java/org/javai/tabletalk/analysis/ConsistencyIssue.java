package org.javai.tabletalk.analysis;

import java.util.List;
import java.util.Objects;
import org.javai.tabletalk.schema.ColumnDescriptor;

/**
 * One finding of the consistency checks.
 *
 * @param kind       what was found
 * @param subject    the column name or concept label the finding is about
 * @param columns    affected columns with their files and types
 * @param similarity average name similarity for semantic findings, {@code null} otherwise
 * @param suggestion how to make the schemas consistent
 */
public record ConsistencyIssue(
		IssueKind kind,
		String subject,
		List<ColumnDescriptor> columns,
		Double similarity,
		String suggestion
) {

	public ConsistencyIssue {
		Objects.requireNonNull(kind, "kind must not be null");
		Objects.requireNonNull(subject, "subject must not be null");
		columns = List.copyOf(columns);
	}

	public List<String> distinctNames() {
		return columns.stream().map(ColumnDescriptor::columnName).distinct().toList();
	}
}
