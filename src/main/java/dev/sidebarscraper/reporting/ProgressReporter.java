package dev.sidebarscraper.reporting;

import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Central reporting thread that receives progress events from all extraction workers. Keeps track
 * of the items currently in flight and logs running totals.
 */
public class ProgressReporter implements Runnable, AutoCloseable {
	private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);
	private static final ProgressEvent POISON_PILL = ProgressEvent.skipped("SHUTDOWN", "");

	private final BlockingQueue<ProgressEvent> eventQueue;
	private final Set<String> runningItems;
	private final AtomicBoolean running;
	private final AtomicInteger completed;
	private final AtomicInteger failed;
	private final int expectedTotal;
	private Thread reporterThread;

	public ProgressReporter(int expectedTotal) {
		this.eventQueue = new LinkedBlockingQueue<>();
		this.runningItems = ConcurrentHashMap.newKeySet();
		this.running = new AtomicBoolean(false);
		this.completed = new AtomicInteger();
		this.failed = new AtomicInteger();
		this.expectedTotal = expectedTotal;
	}

	/** Start the reporter thread */
	public void start() {
		if (running.compareAndSet(false, true)) {
			reporterThread = new Thread(this, "ProgressReporter");
			reporterThread.setDaemon(true);
			reporterThread.start();
		}
	}

	/** Submit a progress event; events reported before {@link #start()} are handled inline */
	public void report(ProgressEvent event) {
		if (!running.get()) {
			processEvent(event);
			return;
		}
		try {
			eventQueue.put(event);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.error("Interrupted while submitting event", e);
		}
	}

	@Override
	public void run() {
		while (running.get() || !eventQueue.isEmpty()) {
			try {
				ProgressEvent event = eventQueue.take();
				if (event == POISON_PILL) {
					break;
				}
				processEvent(event);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.warn("Reporter thread interrupted");
				break;
			} catch (RuntimeException e) {
				logger.error("Error processing event", e);
			}
		}
	}

	private void processEvent(ProgressEvent event) {
		switch (event.eventType()) {
			case STARTED -> {
				runningItems.add(event.itemId());
				logger.debug("STARTED: {} | In flight: {}", event.message(), runningItems.size());
			}
			case COMPLETED -> {
				runningItems.remove(event.itemId());
				int done = completed.incrementAndGet();
				logger.info("COMPLETED: {} | {}/{} done, {} failed", event.message(), done, expectedTotal, failed.get());
			}
			case SKIPPED -> {
				runningItems.remove(event.itemId());
				logger.debug("SKIPPED: {} - {}", event.itemId(), event.message());
			}
			case FAILED -> {
				runningItems.remove(event.itemId());
				int failures = failed.incrementAndGet();
				logger.warn("FAILED: {} - {} | {} failures so far", event.itemId(), event.message(), failures);
			}
		}
	}

	/** Get the current count of items in flight */
	public int getRunningCount() {
		return runningItems.size();
	}

	public int getCompletedCount() {
		return completed.get();
	}

	public int getFailedCount() {
		return failed.get();
	}

	/** Shutdown the reporter and wait for pending events to be processed */
	@Override
	public void close() {
		if (running.compareAndSet(true, false)) {
			try {
				eventQueue.put(POISON_PILL);
				if (reporterThread != null) {
					reporterThread.join(5000);
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.error("Interrupted while shutting down reporter", e);
			}
		}
	}
}
