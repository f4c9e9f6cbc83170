package org.javai.tabletalk.schema;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import org.javai.tabletalk.error.SchemaStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schema store backed by a DuckDB file holding the flat {@code schema_info} table.
 * <p>
 * Each operation opens and closes its own connection, so no read path stays open between calls.
 * Free-form SQL only ever runs on a connection opened read-only.
 */
public final class DuckDbSchemaStore implements QueryableSchemaStore {

	private static final Logger logger = LoggerFactory.getLogger(DuckDbSchemaStore.class);

	public static final String TABLE = "schema_info";

	private static final String CREATE_TABLE = """
			CREATE TABLE IF NOT EXISTS schema_info (
				file_name TEXT NOT NULL,
				file_path TEXT NOT NULL,
				column_name TEXT NOT NULL,
				data_type TEXT NOT NULL,
				null_count BIGINT,
				unique_count BIGINT,
				total_rows BIGINT,
				file_size_mb DOUBLE,
				last_scanned TIMESTAMP,
				PRIMARY KEY (file_name, column_name)
			)""";

	private static final String SELECT_FILES = """
			SELECT file_name, MIN(file_path), COUNT(column_name), MAX(total_rows), MAX(file_size_mb), MAX(last_scanned)
			FROM schema_info
			GROUP BY file_name
			ORDER BY file_name""";

	private static final String SELECT_FILE_SCHEMA = """
			SELECT file_name, file_path, column_name, data_type, null_count, unique_count, total_rows,
				file_size_mb, last_scanned
			FROM schema_info
			WHERE file_name = ?
			ORDER BY column_name""";

	private static final String SELECT_STATS = """
			SELECT COUNT(DISTINCT file_name), COUNT(*), COUNT(DISTINCT column_name), MAX(last_scanned)
			FROM schema_info""";

	private static final String SELECT_AVG_SIZE = """
			SELECT AVG(size) FROM (SELECT MAX(file_size_mb) AS size FROM schema_info GROUP BY file_name)""";

	private static final String INSERT = """
			INSERT INTO schema_info (file_name, file_path, column_name, data_type, null_count, unique_count,
				total_rows, file_size_mb, last_scanned)
			VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)""";

	private final String url;

	public DuckDbSchemaStore(Path databaseFile) {
		this.url = "jdbc:duckdb:" + databaseFile.toAbsolutePath();
	}

	/**
	 * Creates the {@code schema_info} table and its indexes when missing.
	 */
	public DuckDbSchemaStore initialize() {
		try (Connection connection = open(false); Statement statement = connection.createStatement()) {
			statement.execute(CREATE_TABLE);
			statement.execute("CREATE INDEX IF NOT EXISTS idx_file_name ON schema_info(file_name)");
			statement.execute("CREATE INDEX IF NOT EXISTS idx_column_name ON schema_info(column_name)");
			logger.info("Schema store initialized at {}", url);
			return this;
		}
		catch (SQLException e) {
			throw new SchemaStoreException("Failed to initialize schema store at " + url, e);
		}
	}

	/**
	 * Replaces every stored column of {@code fileName} in one transaction. This is the write path the
	 * scanner uses; the analyses never call it.
	 */
	public void storeFileSchema(String fileName, List<ColumnDescriptor> columns) {
		try (Connection connection = open(false)) {
			connection.setAutoCommit(false);
			try (PreparedStatement delete = connection.prepareStatement("DELETE FROM schema_info WHERE file_name = ?");
				 PreparedStatement insert = connection.prepareStatement(INSERT)) {
				delete.setString(1, fileName);
				delete.executeUpdate();
				for (ColumnDescriptor column : columns) {
					if (!column.fileName().equals(fileName)) {
						throw new IllegalArgumentException("Column " + column.columnName() + " belongs to "
								+ column.fileName() + ", not " + fileName);
					}
					insert.setString(1, column.fileName());
					insert.setString(2, column.filePath());
					insert.setString(3, column.columnName());
					insert.setString(4, column.dataType().label());
					insert.setLong(5, column.nullCount());
					insert.setLong(6, column.uniqueCount());
					insert.setLong(7, column.totalRows());
					insert.setDouble(8, column.fileSizeMb());
					insert.setTimestamp(9, column.lastScanned() != null ? Timestamp.from(column.lastScanned()) : null);
					insert.addBatch();
				}
				insert.executeBatch();
				connection.commit();
			}
			catch (SQLException | RuntimeException e) {
				connection.rollback();
				throw e;
			}
			logger.debug("Stored {} column(s) for {}", columns.size(), fileName);
		}
		catch (SQLException e) {
			throw new SchemaStoreException("Failed to store schema for " + fileName, e);
		}
	}

	@Override
	public List<FileSummary> listAllFiles() {
		try (Connection connection = open(true);
			 Statement statement = connection.createStatement();
			 ResultSet rs = statement.executeQuery(SELECT_FILES)) {
			List<FileSummary> files = new ArrayList<>();
			while (rs.next()) {
				files.add(new FileSummary(rs.getString(1), rs.getString(2), rs.getInt(3), rs.getLong(4),
						rs.getDouble(5), toInstant(rs.getTimestamp(6))));
			}
			return files;
		}
		catch (SQLException e) {
			throw new SchemaStoreException("Failed to list files", e);
		}
	}

	@Override
	public List<ColumnDescriptor> getFileSchema(String fileName) {
		try (Connection connection = open(true);
			 PreparedStatement statement = connection.prepareStatement(SELECT_FILE_SCHEMA)) {
			statement.setString(1, fileName);
			try (ResultSet rs = statement.executeQuery()) {
				List<ColumnDescriptor> columns = new ArrayList<>();
				while (rs.next()) {
					columns.add(new ColumnDescriptor(
							rs.getString(1),
							rs.getString(2),
							rs.getString(3),
							DataType.fromRaw(rs.getString(4)),
							rs.getLong(5),
							rs.getLong(6),
							rs.getLong(7),
							rs.getDouble(8),
							toInstant(rs.getTimestamp(9))));
				}
				return columns;
			}
		}
		catch (SQLException e) {
			throw new SchemaStoreException("Failed to read schema of " + fileName, e);
		}
	}

	@Override
	public DatabaseStats databaseStats() {
		try (Connection connection = open(true); Statement statement = connection.createStatement()) {
			int files;
			int columns;
			int unique;
			Instant lastScan;
			try (ResultSet rs = statement.executeQuery(SELECT_STATS)) {
				rs.next();
				files = rs.getInt(1);
				columns = rs.getInt(2);
				unique = rs.getInt(3);
				lastScan = toInstant(rs.getTimestamp(4));
			}
			if (files == 0) {
				return DatabaseStats.empty();
			}
			try (ResultSet rs = statement.executeQuery(SELECT_AVG_SIZE)) {
				rs.next();
				return new DatabaseStats(files, columns, unique, rs.getDouble(1), lastScan);
			}
		}
		catch (SQLException e) {
			throw new SchemaStoreException("Failed to compute database statistics", e);
		}
	}

	@Override
	public SqlResult executeReadOnly(String sql) {
		try (Connection connection = open(true);
			 Statement statement = connection.createStatement();
			 ResultSet rs = statement.executeQuery(sql)) {
			ResultSetMetaData meta = rs.getMetaData();
			List<String> columns = new ArrayList<>();
			for (int i = 1; i <= meta.getColumnCount(); i++) {
				columns.add(meta.getColumnLabel(i));
			}
			List<List<Object>> rows = new ArrayList<>();
			while (rs.next()) {
				List<Object> row = new ArrayList<>(columns.size());
				for (int i = 1; i <= columns.size(); i++) {
					row.add(rs.getObject(i));
				}
				rows.add(row);
			}
			logger.debug("Read-only query returned {} row(s)", rows.size());
			return new SqlResult(columns, rows);
		}
		catch (SQLException e) {
			throw new SchemaStoreException("SQL execution failed: " + e.getMessage(), e);
		}
	}

	private Connection open(boolean readOnly) throws SQLException {
		Properties properties = new Properties();
		if (readOnly) {
			properties.setProperty("duckdb.read_only", "true");
		}
		return DriverManager.getConnection(url, properties);
	}

	private static Instant toInstant(Timestamp timestamp) {
		return timestamp != null ? timestamp.toInstant() : null;
	}
}
