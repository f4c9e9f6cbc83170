package org.javai.tabletalk.resolve;

import java.util.List;
import org.javai.tabletalk.schema.DuckDbSchemaStore;
import org.javai.tabletalk.tools.ToolDescriptor;

/**
 * System prompts of the model-backed strategies.
 */
final class StrategyPrompts {

	static final String SCHEMA_INFO_COLUMNS = "file_name TEXT, file_path TEXT, column_name TEXT, data_type TEXT "
			+ "(one of integer, float, boolean, datetime, string), null_count BIGINT, unique_count BIGINT, "
			+ "total_rows BIGINT, file_size_mb DOUBLE, last_scanned TIMESTAMP";

	private StrategyPrompts() {
	}

	static String functionCalling(List<String> availableFiles) {
		return """
				You help users explore the schemas of scanned data files.
				Answer every request by calling exactly one of the provided tools.
				Use file names exactly as listed, including the extension.
				%s""".formatted(filesLine(availableFiles));
	}

	static String structuredOutput(List<ToolDescriptor> tools, List<String> availableFiles) {
		StringBuilder catalog = new StringBuilder();
		for (ToolDescriptor tool : tools) {
			catalog.append("- ").append(tool.toPromptLine()).append('\n');
		}
		return """
				You help users explore the schemas of scanned data files.
				Pick exactly one tool for the request and reply with a single JSON object and nothing else:
				{"tool": "<tool name>", "parameters": {<name>: <value>}, "intent": "<short description>", "confidence": <0..1>}

				Tools:
				%s
				Use file names exactly as listed, including the extension.
				%s""".formatted(catalog, filesLine(availableFiles));
	}

	static String sqlGeneration() {
		return """
				You write DuckDB SQL over a single table:
				%s(%s)
				One row describes one column of one scanned file.
				Reply with one SELECT (or WITH ... SELECT) statement and nothing else.
				Never modify data.""".formatted(DuckDbSchemaStore.TABLE, SCHEMA_INFO_COLUMNS);
	}

	static String simplifiedSqlGeneration(String previousSql, String failure) {
		return """
				You write DuckDB SQL over the table %s(%s).
				This query failed:
				%s
				Error: %s
				Write a simpler single SELECT statement answering the same question. Reply with SQL only.""".formatted(
				DuckDbSchemaStore.TABLE, SCHEMA_INFO_COLUMNS, previousSql, failure);
	}

	private static String filesLine(List<String> availableFiles) {
		if (availableFiles.isEmpty()) {
			return "No files have been scanned yet.";
		}
		return "Available files: " + String.join(", ", availableFiles);
	}
}
