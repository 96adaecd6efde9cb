package dev.sidebarscraper.extraction;

import dev.sidebarscraper.model.TaskStatus;

/** Thrown when the rendered content cannot be turned into a document */
public class ExtractionException extends ItemExtractionException {

	public ExtractionException(String message) {
		super(message);
	}

	public ExtractionException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public TaskStatus status() {
		return TaskStatus.EXTRACTION_ERROR;
	}
}
