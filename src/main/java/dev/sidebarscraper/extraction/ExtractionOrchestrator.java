package dev.sidebarscraper.extraction;

import dev.sidebarscraper.model.SidebarStructure;
import dev.sidebarscraper.model.TaskResult;
import dev.sidebarscraper.model.TaskStatus;
import dev.sidebarscraper.reporting.ProgressReporter;
import dev.sidebarscraper.resume.ResumeState;
import dev.sidebarscraper.session.SessionFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans pending items out to {@link ExtractionWorker}s. A semaphore caps the number of live sessions
 * at {@code maxConcurrentTasks}; results are collected on the calling thread only.
 */
public class ExtractionOrchestrator {
	private static final Logger logger = LoggerFactory.getLogger(ExtractionOrchestrator.class);
	private static final long POLL_MILLIS = 200;

	private final SessionFactory sessionFactory;
	private final PageContentExtractor extractor;
	private final ProgressReporter reporter;
	private final Clock clock;

	private volatile String abortReason;
	private volatile CountDownLatch finished = new CountDownLatch(0);

	public ExtractionOrchestrator(
			SessionFactory sessionFactory, PageContentExtractor extractor, ProgressReporter reporter) {
		this(sessionFactory, extractor, reporter, Clock.systemUTC());
	}

	public ExtractionOrchestrator(
			SessionFactory sessionFactory, PageContentExtractor extractor, ProgressReporter reporter, Clock clock) {
		this.sessionFactory = sessionFactory;
		this.extractor = extractor;
		this.reporter = reporter;
		this.clock = clock;
	}

	public ExecutionMode selectMode(int pending, ExtractionConfig config) {
		if (!config.concurrencyEnabled() || pending < config.minItemsForParallel()) {
			return ExecutionMode.SEQUENTIAL;
		}
		if (!TimeEstimate.of(pending, config).isParallelWorthwhile()) {
			return ExecutionMode.SEQUENTIAL;
		}
		return ExecutionMode.PARALLEL;
	}

	/**
	 * Extract every pending item. Per-item failures end up in the results; the run itself only stops
	 * early on a deadline, an abort request or repeated session start failures.
	 */
	public RunSummary run(SidebarStructure structure, ResumeState resume, ExtractionConfig config) {
		finished = new CountDownLatch(1);
		abortReason = null;
		try {
			Instant start = clock.instant();
			List<ExtractionTask> tasks = resume.pending().stream()
					.map(id -> ExtractionTask.of(structure, id, config.outputRoot()))
					.toList();
			ExecutionMode mode = selectMode(tasks.size(), config);
			logger.info(
					"Extracting {} items in {} mode (max {} concurrent sessions)",
					tasks.size(),
					mode,
					config.maxConcurrentTasks());

			Semaphore permits = new Semaphore(config.maxConcurrentTasks(), true);
			ExtractionWorker worker = new ExtractionWorker(sessionFactory, permits, extractor, config, reporter, clock);
			Instant deadline = config.runTimeout() == null ? null : start.plus(config.runTimeout());
			Run run = new Run(worker, config, deadline);
			ExecutionMode used = run.execute(tasks, mode);

			String reason = abortReason;
			return new RunSummary(used, run.results, Duration.between(start, clock.instant()), reason != null, reason);
		} finally {
			finished.countDown();
		}
	}

	/** Ask a running extraction to stop; in-flight tasks get the configured grace period */
	public synchronized void requestAbort(String reason) {
		if (abortReason == null) {
			logger.warn("Aborting extraction: {}", reason);
			abortReason = reason;
		}
	}

	/** Wait for the current run, if any, to return */
	public boolean awaitCompletion(Duration timeout) throws InterruptedException {
		return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
	}

	private boolean aborted() {
		return abortReason != null;
	}

	/** State of one run. Only the thread calling {@link #run} touches it. */
	private final class Run {
		private final ExtractionWorker worker;
		private final ExtractionConfig config;
		private final Instant deadline;
		private final FailureRateWindow window;
		private final List<TaskResult> results = new ArrayList<>();
		private int consecutiveResourceErrors;

		Run(ExtractionWorker worker, ExtractionConfig config, Instant deadline) {
			this.worker = worker;
			this.config = config;
			this.deadline = deadline;
			this.window = new FailureRateWindow(config.failureWindow(), config.failureThreshold());
		}

		ExecutionMode execute(List<ExtractionTask> tasks, ExecutionMode mode) {
			int next = 0;
			ExecutionMode used = mode;
			if (mode == ExecutionMode.PARALLEL) {
				int batchSize = config.effectiveBatchSize();
				ExecutorService executor =
						Executors.newFixedThreadPool(Math.min(batchSize, tasks.size()), threadFactory("extract-worker"));
				try {
					while (next < tasks.size() && !aborted()) {
						if (window.exceeded()) {
							logger.warn(
									"Failure rate {}% over the last {} tasks, processing the remaining {} items sequentially",
									Math.round(window.rate() * 100),
									config.failureWindow(),
									tasks.size() - next);
							used = ExecutionMode.HYBRID;
							break;
						}
						List<ExtractionTask> batch = tasks.subList(next, Math.min(next + batchSize, tasks.size()));
						runBatch(executor, batch, config.taskStartDelay());
						next += batch.size();
					}
				} finally {
					shutdown(executor);
				}
			}
			if (mode == ExecutionMode.SEQUENTIAL || used == ExecutionMode.HYBRID) {
				ExecutorService executor = Executors.newSingleThreadExecutor(threadFactory("extract-sequential"));
				try {
					while (next < tasks.size() && !aborted()) {
						runBatch(executor, tasks.subList(next, next + 1), Duration.ZERO);
						next++;
					}
				} finally {
					shutdown(executor);
				}
			}
			for (int i = next; i < tasks.size(); i++) {
				results.add(TaskResult.skipped(tasks.get(i).item(), "run aborted: " + abortReason));
			}
			return used;
		}

		private void runBatch(ExecutorService executor, List<ExtractionTask> batch, Duration stagger) {
			Set<String> started = ConcurrentHashMap.newKeySet();
			List<Future<TaskResult>> futures = new ArrayList<>();
			for (int i = 0; i < batch.size(); i++) {
				ExtractionTask task = batch.get(i);
				long delay = stagger.toMillis() * i;
				futures.add(executor.submit(() -> {
					if (delay > 0) {
						Thread.sleep(delay);
					}
					started.add(task.item().id());
					return worker.extract(task);
				}));
			}

			for (int i = 0; i < batch.size(); i++) {
				TaskResult result = await(futures.get(i), batch.get(i));
				if (result == null) {
					abandon(executor, batch, futures, i, started);
					return;
				}
				record(result);
			}
		}

		/** @return the task's result, or null once the run has to stop */
		private TaskResult await(Future<TaskResult> future, ExtractionTask task) {
			while (true) {
				if (aborted()) {
					return null;
				}
				long wait = POLL_MILLIS;
				if (deadline != null) {
					long remaining = Duration.between(clock.instant(), deadline).toMillis();
					if (remaining <= 0) {
						requestAbort("run deadline of " + config.runTimeout() + " exceeded");
						return null;
					}
					wait = Math.min(wait, remaining);
				}
				try {
					return future.get(wait, TimeUnit.MILLISECONDS);
				} catch (TimeoutException e) {
					// still running, poll again
					continue;
				} catch (CancellationException e) {
					return TaskResult.skipped(task.item(), "cancelled");
				} catch (ExecutionException e) {
					return unexpected(task, e.getCause());
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					requestAbort("interrupted");
					return null;
				}
			}
		}

		// Cancel what has not started, give the rest the grace period, then interrupt
		private void abandon(
				ExecutorService executor,
				List<ExtractionTask> batch,
				List<Future<TaskResult>> futures,
				int from,
				Set<String> started) {
			for (int j = from; j < batch.size(); j++) {
				if (!started.contains(batch.get(j).item().id())) {
					futures.get(j).cancel(true);
				}
			}
			shutdown(executor);
			for (int j = from; j < batch.size(); j++) {
				ExtractionTask task = batch.get(j);
				Future<TaskResult> future = futures.get(j);
				TaskResult result = null;
				if (future.isDone() && !future.isCancelled()) {
					try {
						result = future.get();
					} catch (ExecutionException e) {
						result = unexpected(task, e.getCause());
					} catch (InterruptedException e) {
						Thread.currentThread().interrupt();
					}
				}
				if (result == null) {
					future.cancel(true);
					result = started.contains(task.item().id())
							? TaskResult.failure(task.item(), TaskStatus.TIMEOUT, "aborted: " + abortReason, Duration.ZERO)
							: TaskResult.skipped(task.item(), "run aborted: " + abortReason);
				}
				record(result);
			}
		}

		private TaskResult unexpected(ExtractionTask task, Throwable cause) {
			if (cause instanceof InterruptedException) {
				return TaskResult.skipped(task.item(), "interrupted before start");
			}
			logger.error("Extraction task for {} failed unexpectedly", task.item().id(), cause);
			return TaskResult.failure(task.item(), TaskStatus.EXTRACTION_ERROR, String.valueOf(cause), Duration.ZERO);
		}

		private void record(TaskResult result) {
			results.add(result);
			window.record(result);
			if (result.status() == TaskStatus.RESOURCE_ERROR) {
				consecutiveResourceErrors++;
				if (consecutiveResourceErrors >= config.maxConsecutiveResourceErrors()) {
					requestAbort(consecutiveResourceErrors + " consecutive session start failures");
				}
			} else if (result.status() != TaskStatus.SKIPPED) {
				consecutiveResourceErrors = 0;
			}
		}

		private void shutdown(ExecutorService executor) {
			executor.shutdown();
			try {
				if (!executor.awaitTermination(config.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
					logger.warn("Extraction tasks still running after {}, interrupting them", config.shutdownGrace());
					executor.shutdownNow();
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				executor.shutdownNow();
			}
		}
	}

	private static ThreadFactory threadFactory(String prefix) {
		AtomicInteger counter = new AtomicInteger();
		return runnable -> {
			Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		};
	}
}
