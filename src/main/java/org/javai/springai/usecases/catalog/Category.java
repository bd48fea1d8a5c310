package org.javai.springai.usecases.catalog;

import java.util.Optional;
import org.javai.springai.usecases.sql.StatementKind;

/**
 * CRUD category of a use case, inferred from its statement's leading keyword.
 */
public enum Category {
	CREATE("Create"),
	READ("Read"),
	UPDATE("Update"),
	DELETE("Delete");

	private final String displayName;

	Category(String displayName) {
		this.displayName = displayName;
	}

	public String displayName() {
		return displayName;
	}

	/**
	 * INSERT maps to Create, SELECT to Read, UPDATE to Update and DELETE to Delete.
	 *
	 * @return the category, or empty for an unrecognized statement
	 */
	public static Optional<Category> of(StatementKind kind) {
		return switch (kind) {
			case INSERT -> Optional.of(CREATE);
			case SELECT -> Optional.of(READ);
			case UPDATE -> Optional.of(UPDATE);
			case DELETE -> Optional.of(DELETE);
			case UNKNOWN -> Optional.empty();
		};
	}
}
