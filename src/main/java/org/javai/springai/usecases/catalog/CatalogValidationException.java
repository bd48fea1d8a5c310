package org.javai.springai.usecases.catalog;

/**
 * Exception thrown when a use case violates the structural invariants of the catalog.
 *
 * <p>This exception is thrown when:</p>
 * <ul>
 *   <li>The template has no recognizable leading statement keyword</li>
 *   <li>A placeholder in the template has no declared input parameter</li>
 * </ul>
 */
public class CatalogValidationException extends RuntimeException {

	public CatalogValidationException(String message) {
		super(message);
	}
}
