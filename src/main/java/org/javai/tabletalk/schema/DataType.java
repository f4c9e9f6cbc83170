package org.javai.tabletalk.schema;

import java.util.Locale;
import java.util.Optional;

/**
 * Normalized column data type recorded by the scanner.
 */
public enum DataType {

	INTEGER,
	FLOAT,
	BOOLEAN,
	DATETIME,
	STRING;

	/**
	 * Lower-case form used in stored rows and in tool output.
	 */
	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Maps a stored or engine-native type name onto the normalized set. Unrecognized names map to
	 * {@link #STRING}.
	 */
	public static DataType fromRaw(String raw) {
		return lookup(raw).orElse(STRING);
	}

	/**
	 * Like {@link #fromRaw(String)} but empty for names that are not a recognized type, such as
	 * {@code "customer"}.
	 */
	public static Optional<DataType> lookup(String raw) {
		if (raw == null || raw.isBlank()) {
			return Optional.empty();
		}
		String normalized = raw.trim().toUpperCase(Locale.ROOT);
		return Optional.ofNullable(switch (normalized) {
			case "INTEGER", "INT", "INT64", "INT32", "BIGINT", "SMALLINT", "TINYINT", "HUGEINT", "LONG" -> INTEGER;
			case "FLOAT", "FLOAT64", "DOUBLE", "REAL", "DECIMAL", "NUMERIC" -> FLOAT;
			case "BOOLEAN", "BOOL" -> BOOLEAN;
			case "DATETIME", "DATETIME64", "TIMESTAMP", "DATE", "TIME" -> DATETIME;
			case "STRING", "TEXT", "VARCHAR", "OBJECT", "CHAR" -> STRING;
			default -> normalized.startsWith("DECIMAL") ? FLOAT
					: normalized.startsWith("TIMESTAMP") || normalized.startsWith("DATETIME") ? DATETIME
					: normalized.startsWith("VARCHAR") ? STRING
					: null;
		});
	}

	@Override
	public String toString() {
		return label();
	}
}
