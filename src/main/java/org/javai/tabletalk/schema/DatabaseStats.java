package org.javai.tabletalk.schema;

import java.time.Instant;

/**
 * Whole-store summary used by the statistics tool.
 *
 * @param totalFiles        distinct files scanned
 * @param totalColumns      column rows across all files
 * @param uniqueColumnNames distinct column names across all files
 * @param avgFileSizeMb     average file size, 0 when nothing is scanned
 * @param lastScan          most recent scan time, {@code null} when nothing is scanned
 */
public record DatabaseStats(
		int totalFiles,
		int totalColumns,
		int uniqueColumnNames,
		double avgFileSizeMb,
		Instant lastScan
) {

	public static DatabaseStats empty() {
		return new DatabaseStats(0, 0, 0, 0.0, null);
	}

	public boolean isEmpty() {
		return totalFiles == 0;
	}
}
