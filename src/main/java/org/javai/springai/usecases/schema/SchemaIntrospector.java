package org.javai.springai.usecases.schema;

/**
 * Describes the schema of the active database as text for a statement generator.
 */
@FunctionalInterface
public interface SchemaIntrospector {

	/**
	 * @return tables, columns with type and nullability, and foreign keys
	 * @throws SchemaIntrospectionException if the schema cannot be read
	 */
	String getSchema();
}
