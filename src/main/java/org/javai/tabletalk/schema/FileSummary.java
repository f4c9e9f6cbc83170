package org.javai.tabletalk.schema;

import java.time.Instant;

/**
 * Per-file aggregate returned by {@link SchemaStore#listAllFiles()}.
 */
public record FileSummary(
		String fileName,
		String filePath,
		int columnCount,
		long totalRows,
		double fileSizeMb,
		Instant lastScanned
) {

	public FileSummary {
		if (fileName == null || fileName.isBlank()) {
			throw new IllegalArgumentException("fileName must not be blank");
		}
		if (columnCount < 0) {
			throw new IllegalArgumentException("columnCount must not be negative");
		}
	}
}
