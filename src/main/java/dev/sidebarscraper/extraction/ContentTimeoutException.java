package dev.sidebarscraper.extraction;

import dev.sidebarscraper.model.TaskStatus;

/** Thrown when the content region does not stabilize in time */
public class ContentTimeoutException extends ItemExtractionException {

	public ContentTimeoutException(String message) {
		super(message);
	}

	public ContentTimeoutException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public TaskStatus status() {
		return TaskStatus.TIMEOUT;
	}
}
