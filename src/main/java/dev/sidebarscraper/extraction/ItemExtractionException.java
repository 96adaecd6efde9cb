package dev.sidebarscraper.extraction;

import dev.sidebarscraper.model.TaskStatus;

/** Base class for failures that are confined to a single item */
public abstract class ItemExtractionException extends Exception {

	protected ItemExtractionException(String message) {
		super(message);
	}

	protected ItemExtractionException(String message, Throwable cause) {
		super(message, cause);
	}

	/** Status recorded in the item's result */
	public abstract TaskStatus status();
}
