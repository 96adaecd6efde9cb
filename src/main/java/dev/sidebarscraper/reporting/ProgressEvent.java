package dev.sidebarscraper.reporting;

import java.time.Instant;

/** Represents a progress event from an extraction task */
public record ProgressEvent(String itemId, EventType eventType, String message, Instant timestamp) {
	public enum EventType {
		STARTED,
		COMPLETED,
		SKIPPED,
		FAILED
	}

	public static ProgressEvent started(String itemId, String title) {
		return new ProgressEvent(itemId, EventType.STARTED, title, Instant.now());
	}

	public static ProgressEvent completed(String itemId, String title) {
		return new ProgressEvent(itemId, EventType.COMPLETED, title, Instant.now());
	}

	public static ProgressEvent skipped(String itemId, String reason) {
		return new ProgressEvent(itemId, EventType.SKIPPED, reason, Instant.now());
	}

	public static ProgressEvent failed(String itemId, String message) {
		return new ProgressEvent(itemId, EventType.FAILED, message, Instant.now());
	}

	@Override
	public String toString() {
		return "[%s] %s: %s - %s".formatted(timestamp, itemId, eventType, message);
	}
}
