package org.javai.tabletalk.schema;

/**
 * A schema store that can also answer read-only SQL over its {@code schema_info} table.
 */
public interface QueryableSchemaStore extends SchemaStore {

	/**
	 * Runs a statement that the caller has already checked to be read-only.
	 *
	 * @throws org.javai.tabletalk.error.SchemaStoreException if the statement fails
	 */
	SqlResult executeReadOnly(String sql);
}
