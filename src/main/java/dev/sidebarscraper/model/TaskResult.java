package dev.sidebarscraper.model;

import java.nio.file.Path;
import java.time.Duration;

/** Result of extracting one sidebar item */
public record TaskResult(
		String itemId, String title, TaskStatus status, String error, Path outputRef, Duration elapsed) {

	public static TaskResult success(SidebarItem item, Path outputRef, Duration elapsed) {
		return new TaskResult(item.id(), item.title(), TaskStatus.SUCCESS, null, outputRef, elapsed);
	}

	public static TaskResult failure(SidebarItem item, TaskStatus status, String error, Duration elapsed) {
		return new TaskResult(item.id(), item.title(), status, error, null, elapsed);
	}

	public static TaskResult skipped(SidebarItem item, String reason) {
		return new TaskResult(item.id(), item.title(), TaskStatus.SKIPPED, reason, null, Duration.ZERO);
	}

	public boolean success() {
		return status == TaskStatus.SUCCESS;
	}

	@Override
	public String toString() {
		return switch (status) {
			case SUCCESS -> "SUCCESS %s (%s) -> %s".formatted(title, itemId, outputRef);
			case SKIPPED -> "SKIPPED %s (%s): %s".formatted(title, itemId, error);
			default -> "%s %s (%s): %s".formatted(status, title, itemId, error != null ? error : "Unknown error");
		};
	}
}
