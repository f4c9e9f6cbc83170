package org.javai.tabletalk.testsupport;

import org.javai.tabletalk.schema.DataType;
import org.javai.tabletalk.schema.InMemorySchemaStore;

/**
 * Small stores shared by the analysis, tool and resolver tests.
 */
public final class SchemaFixtures {

	private SchemaFixtures() {
	}

	/**
	 * {@code orders.csv{order_id:integer, customer_id:integer, price:float}} and
	 * {@code legacy_users.csv{customer_id:string}}.
	 */
	public static InMemorySchemaStore ordersAndLegacyUsers() {
		return new InMemorySchemaStore()
				.addColumn("orders.csv", "order_id", DataType.INTEGER)
				.addColumn("orders.csv", "customer_id", DataType.INTEGER)
				.addColumn("orders.csv", "price", DataType.FLOAT)
				.addColumn("legacy_users.csv", "customer_id", DataType.STRING);
	}

	/**
	 * Four files: {@code is_active} is boolean in a.csv and string in b.csv, {@code region} appears
	 * in exactly two files, {@code notes} in one, {@code id} in all four.
	 */
	public static InMemorySchemaStore fourFiles() {
		return new InMemorySchemaStore()
				.addColumn("a.csv", "id", DataType.INTEGER)
				.addColumn("a.csv", "is_active", DataType.BOOLEAN)
				.addColumn("a.csv", "region", DataType.STRING)
				.addColumn("b.csv", "id", DataType.INTEGER)
				.addColumn("b.csv", "is_active", DataType.STRING)
				.addColumn("b.csv", "region", DataType.STRING)
				.addColumn("c.csv", "id", DataType.INTEGER)
				.addColumn("c.csv", "notes", DataType.STRING)
				.addColumn("d.csv", "id", DataType.INTEGER);
	}

	/**
	 * Customer identifiers spelled three ways, plus an abbreviated quantity column.
	 */
	public static InMemorySchemaStore customerNaming() {
		return new InMemorySchemaStore()
				.addColumn("orders.csv", "customer_id", DataType.INTEGER)
				.addColumn("orders.csv", "quantity", DataType.INTEGER)
				.addColumn("payments.csv", "cust_id", DataType.INTEGER)
				.addColumn("payments.csv", "qty", DataType.INTEGER)
				.addColumn("crm.csv", "customerId", DataType.STRING);
	}
}
