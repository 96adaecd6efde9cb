package dev.sidebarscraper.extraction;

import dev.sidebarscraper.model.TaskStatus;

/** Thrown when the page or an item's target cannot be reached */
public class NavigationException extends ItemExtractionException {

	public NavigationException(String message) {
		super(message);
	}

	public NavigationException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public TaskStatus status() {
		return TaskStatus.NAVIGATION_ERROR;
	}
}
