package org.javai.tabletalk.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows returned by a read-only SQL statement, values kept as fetched from JDBC.
 */
public record SqlResult(List<String> columns, List<List<Object>> rows) {

	public SqlResult {
		columns = List.copyOf(columns);
		List<List<Object>> copies = new ArrayList<>(rows.size());
		for (List<Object> row : rows) {
			// rows may hold SQL NULLs, which List.copyOf rejects
			copies.add(Collections.unmodifiableList(new ArrayList<>(row)));
		}
		rows = Collections.unmodifiableList(copies);
	}

	public boolean isEmpty() {
		return rows.isEmpty();
	}
}
