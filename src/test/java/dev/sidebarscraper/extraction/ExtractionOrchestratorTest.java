package dev.sidebarscraper.extraction;

import static org.assertj.core.api.Assertions.*;

import dev.sidebarscraper.model.SidebarStructure;
import dev.sidebarscraper.model.Structures;
import dev.sidebarscraper.model.TaskResult;
import dev.sidebarscraper.model.TaskStatus;
import dev.sidebarscraper.reporting.ProgressReporter;
import dev.sidebarscraper.resume.ResumeState;
import dev.sidebarscraper.resume.ResumeTracker;
import dev.sidebarscraper.session.FakeSessionFactory;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExtractionOrchestratorTest {

	@TempDir
	Path tempDir;

	private FakeSessionFactory factory;
	private ExtractionConfig config;

	@BeforeEach
	void setUp() {
		factory = new FakeSessionFactory();
		config = ExtractionConfig.defaults(Structures.SOURCE_URL, tempDir)
				.withTiming(Duration.ZERO, Duration.ofMillis(1), null, Duration.ofSeconds(5));
	}

	@Test
	void testRun_FailureIsIsolated() {
		// Given
		SidebarStructure structure = Structures.flat(10);
		factory.withFailingTarget("id:item-4");

		// When
		RunSummary summary = run(structure);

		// Then
		assertThat(summary.mode()).isEqualTo(ExecutionMode.PARALLEL);
		assertThat(summary.results()).hasSize(10);
		assertThat(summary.successful()).isEqualTo(9);
		assertThat(summary.count(TaskStatus.NAVIGATION_ERROR)).isEqualTo(1);
		assertThat(summary.results().get(3).itemId()).isEqualTo("item-4");
		assertThat(summary.results().get(3).status()).isEqualTo(TaskStatus.NAVIGATION_ERROR);
		assertThat(summary.results()).extracting(TaskResult::itemId).startsWith("item-1", "item-2", "item-3");
		assertThat(summary.aborted()).isFalse();
		assertThat(summary.exitCode()).isEqualTo(1);
	}

	@Test
	void testRun_ConcurrencyIsBounded() {
		// Given
		SidebarStructure structure = Structures.flat(12);
		factory.withClickDelay(Duration.ofMillis(100));

		// When
		RunSummary summary = run(structure);

		// Then
		assertThat(summary.mode()).isEqualTo(ExecutionMode.PARALLEL);
		assertThat(summary.successful()).isEqualTo(12);
		assertThat(factory.getMaxOpenCount()).isBetween(1, config.maxConcurrentTasks());
		assertThat(factory.getOpenedCount()).isEqualTo(12);
		assertThat(factory.getOpenCount()).isZero();
		assertThat(summary.exitCode()).isZero();
	}

	@Test
	void testRun_SingleSessionLimit() {
		// Given
		SidebarStructure structure = Structures.flat(6);
		config = config.withConcurrency(true, 1);

		// When
		RunSummary summary = run(structure);

		// Then
		assertThat(summary.mode()).isEqualTo(ExecutionMode.SEQUENTIAL);
		assertThat(summary.successful()).isEqualTo(6);
		assertThat(factory.getMaxOpenCount()).isEqualTo(1);
	}

	@Test
	void testRun_SequentialBelowMinimum() {
		// Given
		SidebarStructure structure = Structures.flat(4);

		// When
		RunSummary summary = run(structure);

		// Then
		assertThat(summary.mode()).isEqualTo(ExecutionMode.SEQUENTIAL);
		assertThat(summary.successful()).isEqualTo(4);
		assertThat(factory.getMaxOpenCount()).isEqualTo(1);
	}

	@Test
	void testRun_ConcurrencyDisabled() {
		// Given
		SidebarStructure structure = Structures.flat(8);
		config = config.withConcurrency(false, 3);

		// When
		RunSummary summary = run(structure);

		// Then
		assertThat(summary.mode()).isEqualTo(ExecutionMode.SEQUENTIAL);
		assertThat(summary.successful()).isEqualTo(8);
	}

	@Test
	void testRun_FallsBackToSequentialOnHighFailureRate() {
		// Given
		SidebarStructure structure = Structures.flat(12);
		config = config.withConcurrency(true, 2).withFailurePolicy(4, 0.5, 4);
		for (int i = 1; i <= 4; i++) {
			factory.withFailingTarget("id:item-" + i);
		}

		// When
		RunSummary summary = run(structure);

		// Then
		assertThat(summary.mode()).isEqualTo(ExecutionMode.HYBRID);
		assertThat(summary.results()).hasSize(12);
		assertThat(summary.count(TaskStatus.NAVIGATION_ERROR)).isEqualTo(4);
		assertThat(summary.successful()).isEqualTo(8);
		assertThat(summary.aborted()).isFalse();
	}

	@Test
	void testRun_AbortsAfterRepeatedSessionStartFailures() {
		// Given
		SidebarStructure structure = Structures.flat(10);
		config = config.withConcurrency(false, 1);
		factory.withStartFailures(-1);

		// When
		RunSummary summary = run(structure);

		// Then
		assertThat(summary.aborted()).isTrue();
		assertThat(summary.abortReason()).contains("session start");
		assertThat(summary.count(TaskStatus.RESOURCE_ERROR)).isEqualTo(config.maxConsecutiveResourceErrors());
		assertThat(summary.count(TaskStatus.SKIPPED)).isEqualTo(10 - config.maxConsecutiveResourceErrors());
		assertThat(summary.results()).hasSize(10);
		assertThat(summary.exitCode()).isEqualTo(1);
	}

	@Test
	void testRun_DeadlineStopsTheRun() {
		// Given
		SidebarStructure structure = Structures.flat(6);
		config = config.withConcurrency(false, 1)
				.withTiming(Duration.ZERO, Duration.ofMillis(1), Duration.ofMillis(450), Duration.ofMillis(50));
		factory.withClickDelay(Duration.ofMillis(300));

		// When
		RunSummary summary = run(structure);

		// Then
		assertThat(summary.aborted()).isTrue();
		assertThat(summary.abortReason()).contains("deadline");
		assertThat(summary.results()).hasSize(6);
		assertThat(summary.results().get(0).status()).isEqualTo(TaskStatus.SUCCESS);
		assertThat(summary.results().get(1).status()).isEqualTo(TaskStatus.TIMEOUT);
		assertThat(summary.results().subList(2, 6)).allMatch(r -> r.status() == TaskStatus.SKIPPED);
	}

	@Test
	void testRun_AbortRequestFromAnotherThread() throws Exception {
		// Given
		SidebarStructure structure = Structures.flat(6);
		config = config.withConcurrency(false, 1)
				.withTiming(Duration.ZERO, Duration.ofMillis(1), null, Duration.ofMillis(50));
		factory.withClickDelay(Duration.ofMillis(200));
		ExtractionOrchestrator orchestrator = orchestrator(structure);
		ResumeState resume = new ResumeTracker().partition(structure, tempDir, false);

		// When
		CompletableFuture<RunSummary> running =
				CompletableFuture.supplyAsync(() -> orchestrator.run(structure, resume, config));
		Thread.sleep(300);
		orchestrator.requestAbort("shutdown requested");
		boolean finished = orchestrator.awaitCompletion(Duration.ofSeconds(5));
		RunSummary summary = running.get();

		// Then
		assertThat(finished).isTrue();
		assertThat(summary.aborted()).isTrue();
		assertThat(summary.abortReason()).isEqualTo("shutdown requested");
		assertThat(summary.results()).hasSize(6);
		assertThat(summary.successful()).isLessThan(6);
		assertThat(factory.getOpenCount()).isZero();
	}

	@Test
	void testRun_SkipsMaterializedItems() {
		// Given
		SidebarStructure structure = Structures.flat(5);
		run(structure);
		int opened = factory.getOpenedCount();

		// When
		ResumeState resume = new ResumeTracker().partition(structure, tempDir, false);

		// Then
		assertThat(opened).isEqualTo(5);
		assertThat(resume.isComplete()).isTrue();
		assertThat(resume.done()).hasSize(5);
	}

	@Test
	void testSelectMode() {
		// Given
		ExtractionOrchestrator orchestrator = orchestrator(Structures.flat(1));

		// When/Then
		assertThat(orchestrator.selectMode(4, config)).isEqualTo(ExecutionMode.SEQUENTIAL);
		assertThat(orchestrator.selectMode(5, config)).isEqualTo(ExecutionMode.PARALLEL);
		assertThat(orchestrator.selectMode(50, config.withConcurrency(false, 3))).isEqualTo(ExecutionMode.SEQUENTIAL);
		assertThat(orchestrator.selectMode(50, config.withConcurrency(true, 1))).isEqualTo(ExecutionMode.SEQUENTIAL);
	}

	private RunSummary run(SidebarStructure structure) {
		ResumeState resume = new ResumeTracker().partition(structure, tempDir, false);
		return orchestrator(structure).run(structure, resume, config);
	}

	private ExtractionOrchestrator orchestrator(SidebarStructure structure) {
		return new ExtractionOrchestrator(
				factory,
				new PageContentExtractor(ContentSelectors.defaults()),
				new ProgressReporter(structure.leaves().size()));
	}
}
