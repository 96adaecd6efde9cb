package dev.sidebarscraper.extraction;

import dev.sidebarscraper.model.PageDocument;
import dev.sidebarscraper.model.SidebarItem;
import dev.sidebarscraper.model.TaskResult;
import dev.sidebarscraper.model.TaskStatus;
import dev.sidebarscraper.reporting.ProgressEvent;
import dev.sidebarscraper.reporting.ProgressReporter;
import dev.sidebarscraper.resume.ResumeTracker;
import dev.sidebarscraper.session.AutomationSession;
import dev.sidebarscraper.session.RenderedContent;
import dev.sidebarscraper.session.SessionFactory;
import dev.sidebarscraper.session.SessionRetry;
import dev.sidebarscraper.session.SessionStartException;
import dev.sidebarscraper.util.JsonUtils;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Semaphore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts a single page: navigate, wait, extract, persist. Every call opens its own session and
 * holds one permit of the shared semaphore for as long as that session is alive.
 */
public class ExtractionWorker {
	private static final Logger logger = LoggerFactory.getLogger(ExtractionWorker.class);

	private final SessionFactory sessionFactory;
	private final Semaphore permits;
	private final PageContentExtractor extractor;
	private final ExtractionConfig config;
	private final ProgressReporter reporter;
	private final Clock clock;

	public ExtractionWorker(
			SessionFactory sessionFactory,
			Semaphore permits,
			PageContentExtractor extractor,
			ExtractionConfig config,
			ProgressReporter reporter) {
		this(sessionFactory, permits, extractor, config, reporter, Clock.systemUTC());
	}

	public ExtractionWorker(
			SessionFactory sessionFactory,
			Semaphore permits,
			PageContentExtractor extractor,
			ExtractionConfig config,
			ProgressReporter reporter,
			Clock clock) {
		this.sessionFactory = sessionFactory;
		this.permits = permits;
		this.extractor = extractor;
		this.config = config;
		this.reporter = reporter;
		this.clock = clock;
	}

	public TaskResult extract(ExtractionTask task) {
		SidebarItem item = task.item();
		if (!config.force() && ResumeTracker.isMaterialized(task.outputPath())) {
			reporter.report(ProgressEvent.skipped(item.id(), "output already exists"));
			return TaskResult.skipped(item, "output already exists");
		}

		try {
			permits.acquire();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return TaskResult.skipped(item, "interrupted before start");
		}

		Instant start = clock.instant();
		reporter.report(ProgressEvent.started(item.id(), item.title()));
		try {
			try (AutomationSession session = SessionRetry.open(
					sessionFactory, config.sessionStartAttempts(), config.sessionStartBackoff(), "'" + item.title() + "'")) {
				PageDocument document = extractWith(session, task);
				JsonUtils.saveDocument(task.outputPath(), document);
			}
			reporter.report(ProgressEvent.completed(item.id(), item.title()));
			return TaskResult.success(item, task.outputPath(), elapsedSince(start));
		} catch (SessionStartException e) {
			return failed(item, TaskStatus.RESOURCE_ERROR, e.getMessage(), start);
		} catch (ItemExtractionException e) {
			return failed(item, e.status(), e.getMessage(), start);
		} catch (IOException e) {
			return failed(item, TaskStatus.EXTRACTION_ERROR, "Failed to write output: " + e.getMessage(), start);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return failed(item, TaskStatus.TIMEOUT, "Interrupted while extracting", start);
		} catch (RuntimeException e) {
			logger.debug("Unexpected failure extracting {}", item.id(), e);
			return failed(item, TaskStatus.EXTRACTION_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage(), start);
		} finally {
			permits.release();
		}
	}

	private PageDocument extractWith(AutomationSession session, ExtractionTask task)
			throws ItemExtractionException, InterruptedException {
		SidebarItem item = task.item();
		session.navigate(config.sourceUrl(), config.navigationTimeout());
		if (!session.waitForSidebar(config.sidebarTimeout())) {
			throw new NavigationException("Sidebar did not appear within " + config.sidebarTimeout());
		}
		for (SidebarItem ancestor : task.ancestors()) {
			if (ancestor.expandable() && ancestor.hasTarget() && !session.revealChildren(ancestor.targetRef())) {
				logger.debug("Could not reveal children of '{}' for '{}'", ancestor.title(), item.title());
			}
			checkInterrupted();
		}
		session.click(item.targetRef(), config.navigationTimeout());
		if (!session.waitForContent(config.contentTimeout())) {
			throw new ContentTimeoutException("Content did not load within " + config.contentTimeout());
		}
		checkInterrupted();
		RenderedContent content = session.readContent();
		return extractor.extract(task, content, clock.instant());
	}

	private TaskResult failed(SidebarItem item, TaskStatus status, String error, Instant start) {
		logger.error("Failed to extract '{}' ({}): {}", item.title(), status, error);
		reporter.report(ProgressEvent.failed(item.id(), error));
		return TaskResult.failure(item, status, error, elapsedSince(start));
	}

	private Duration elapsedSince(Instant start) {
		return Duration.between(start, clock.instant());
	}

	private static void checkInterrupted() throws InterruptedException {
		if (Thread.currentThread().isInterrupted()) {
			throw new InterruptedException("Extraction interrupted");
		}
	}
}
