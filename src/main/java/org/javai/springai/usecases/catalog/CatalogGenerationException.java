package org.javai.springai.usecases.catalog;

/**
 * Exception thrown when a catalog cannot be produced from a schema.
 */
public class CatalogGenerationException extends RuntimeException {

	public CatalogGenerationException(String message) {
		super(message);
	}

	public CatalogGenerationException(String message, Throwable cause) {
		super(message, cause);
	}
}
