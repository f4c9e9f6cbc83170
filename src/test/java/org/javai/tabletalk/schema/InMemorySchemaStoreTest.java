package org.javai.tabletalk.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemorySchemaStoreTest {

	@Nested
	@DisplayName("reading")
	class Reading {

		@Test
		void listsFilesInNameOrderWithColumnCounts() {
			InMemorySchemaStore store = new InMemorySchemaStore()
					.addColumn("orders.csv", "order_id", DataType.INTEGER)
					.addColumn("orders.csv", "price", DataType.FLOAT)
					.addColumn("customers.csv", "customer_id", DataType.INTEGER);

			assertThat(store.listAllFiles())
					.extracting(FileSummary::fileName, FileSummary::columnCount)
					.containsExactly(
							tuple("customers.csv", 1),
							tuple("orders.csv", 2));
		}

		@Test
		void fileSchemaIsOrderedByColumnName() {
			InMemorySchemaStore store = new InMemorySchemaStore()
					.addColumn("orders.csv", "price", DataType.FLOAT)
					.addColumn("orders.csv", "customer_id", DataType.INTEGER);

			assertThat(store.getFileSchema("orders.csv"))
					.extracting(ColumnDescriptor::columnName)
					.containsExactly("customer_id", "price");
		}

		@Test
		void unknownFileHasNoColumns() {
			assertThat(new InMemorySchemaStore().getFileSchema("missing.csv")).isEmpty();
			assertThat(new InMemorySchemaStore().getFileSchema(null)).isEmpty();
		}

		@Test
		void databaseStatsAggregateEveryFile() {
			Instant scanned = Instant.parse("2024-05-01T10:00:00Z");
			InMemorySchemaStore store = new InMemorySchemaStore()
					.addColumn(new ColumnDescriptor("a.csv", "/data/a.csv", "id", DataType.INTEGER, 0, 10, 10, 2.0, scanned))
					.addColumn(new ColumnDescriptor("a.csv", "/data/a.csv", "name", DataType.STRING, 1, 9, 10, 2.0, scanned))
					.addColumn(new ColumnDescriptor("b.csv", "/data/b.csv", "id", DataType.INTEGER, 0, 5, 5, 4.0, null));

			DatabaseStats stats = store.databaseStats();

			assertThat(stats.totalFiles()).isEqualTo(2);
			assertThat(stats.totalColumns()).isEqualTo(3);
			assertThat(stats.uniqueColumnNames()).isEqualTo(2);
			assertThat(stats.avgFileSizeMb()).isEqualTo(3.0);
			assertThat(stats.lastScan()).isEqualTo(scanned);
		}

		@Test
		void emptyStoreHasEmptyStats() {
			assertThat(new InMemorySchemaStore().databaseStats().isEmpty()).isTrue();
		}
	}

	@Nested
	@DisplayName("writing")
	class Writing {

		@Test
		void rejectsDuplicateColumnInOneFile() {
			InMemorySchemaStore store = new InMemorySchemaStore().addColumn("a.csv", "id", DataType.INTEGER);

			assertThatThrownBy(() -> store.addColumn("a.csv", "id", DataType.STRING))
					.isInstanceOf(IllegalStateException.class)
					.hasMessageContaining("id");
		}

		@Test
		void sameColumnNameInDifferentFilesIsFine() {
			InMemorySchemaStore store = new InMemorySchemaStore()
					.addColumn("a.csv", "id", DataType.INTEGER)
					.addColumn("b.csv", "id", DataType.STRING);

			assertThat(store.allColumns()).hasSize(2);
		}

		@Test
		void replaceFileSwapsEveryColumn() {
			InMemorySchemaStore store = new InMemorySchemaStore()
					.addColumn("a.csv", "old_column", DataType.STRING);

			store.replaceFile("a.csv", List.of(ColumnDescriptor.of("a.csv", "new_column", DataType.INTEGER)));

			assertThat(store.getFileSchema("a.csv"))
					.extracting(ColumnDescriptor::columnName)
					.containsExactly("new_column");
		}

		@Test
		void replaceWithNothingRemovesTheFile() {
			InMemorySchemaStore store = new InMemorySchemaStore().addColumn("a.csv", "id", DataType.INTEGER);

			store.replaceFile("a.csv", List.of());

			assertThat(store.listAllFiles()).isEmpty();
		}

		@Test
		void replaceRejectsColumnsOfAnotherFile() {
			InMemorySchemaStore store = new InMemorySchemaStore();

			assertThatThrownBy(() -> store.replaceFile("a.csv", List.of(ColumnDescriptor.of("b.csv", "id", DataType.INTEGER))))
					.isInstanceOf(IllegalArgumentException.class);
		}
	}
}
