package org.javai.springai.usecases.schema;

public class SchemaIntrospectionException extends RuntimeException {

	public SchemaIntrospectionException(String message, Throwable cause) {
		super(message, cause);
	}
}
