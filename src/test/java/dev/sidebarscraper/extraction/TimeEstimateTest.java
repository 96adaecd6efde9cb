package dev.sidebarscraper.extraction;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class TimeEstimateTest {
	private final ExtractionConfig config = ExtractionConfig.defaults("https://docs.example.com/", Path.of("out"));

	@Test
	void testEstimate() {
		// When
		TimeEstimate estimate = TimeEstimate.of(10, config);

		// Then
		assertThat(estimate.sequential()).isEqualTo(Duration.ofSeconds(180));
		assertThat(estimate.parallel()).isEqualTo(Duration.ofSeconds(80));
		assertThat(estimate.speedup()).isCloseTo(2.25, within(0.01));
		assertThat(estimate.isParallelWorthwhile()).isTrue();
	}

	@Test
	void testSingleSessionNeverWorthwhile() {
		// When
		TimeEstimate estimate = TimeEstimate.of(10, config.withConcurrency(true, 1));

		// Then
		assertThat(estimate.isParallelWorthwhile()).isFalse();
	}

	@Test
	void testNoItems() {
		// When
		TimeEstimate estimate = TimeEstimate.of(0, config);

		// Then
		assertThat(estimate.sequential()).isZero();
		assertThat(estimate.isParallelWorthwhile()).isFalse();
	}

	@Test
	void testFormat() {
		// When/Then
		assertThat(TimeEstimate.format(Duration.ofSeconds(42))).isEqualTo("42s");
		assertThat(TimeEstimate.format(Duration.ofSeconds(125))).isEqualTo("2m 5s");
		assertThat(TimeEstimate.format(Duration.ofMinutes(135))).isEqualTo("2h 15m");
	}
}
