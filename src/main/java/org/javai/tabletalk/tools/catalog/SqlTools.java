package org.javai.tabletalk.tools.catalog;

import java.util.Objects;
import org.javai.tabletalk.schema.QueryableSchemaStore;
import org.javai.tabletalk.schema.SqlResult;
import org.javai.tabletalk.sql.ReadOnlySql;
import org.javai.tabletalk.tools.api.AnalysisTool;
import org.javai.tabletalk.tools.api.ToolParameter;

/**
 * Read-only SQL over the {@code schema_info} table. Registered only for stores that support it.
 */
public class SqlTools {

	private final QueryableSchemaStore store;

	public SqlTools(QueryableSchemaStore store) {
		this.store = Objects.requireNonNull(store, "store must not be null");
	}

	@AnalysisTool(name = "execute_sql",
			description = "Run one read-only SELECT over schema_info(file_name, file_path, column_name, data_type, null_count, unique_count, total_rows, file_size_mb, last_scanned)")
	public String executeSql(
			@ToolParameter(name = "sql", description = "A single SELECT or WITH query") String sql) {
		ReadOnlySql query = ReadOnlySql.fromSql(sql);
		SqlResult result = store.executeReadOnly(query.sql());
		return ReportFormatter.sqlResult(query.sql(), result);
	}
}
