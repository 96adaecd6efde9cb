package dev.sidebarscraper.discovery;

import static org.assertj.core.api.Assertions.*;

import dev.sidebarscraper.session.FakeSession;
import dev.sidebarscraper.session.FakeSessionFactory;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class MenuExpanderTest {
	private final MenuExpander expander = new MenuExpander(5, Duration.ZERO, Duration.ZERO);

	@Test
	void testExpandAll_Converges() {
		// Given
		FakeSession session = new FakeSessionFactory()
				.withToggles("users", "orders")
				.withReveal("orders", "order-items")
				.openFake();

		// When
		ExpansionOutcome outcome = expander.expandAll(session);

		// Then
		assertThat(outcome.converged()).isTrue();
		assertThat(outcome.partial()).isEmpty();
		assertThat(outcome.expanded()).isEqualTo(3);
		assertThat(outcome.rounds()).isEqualTo(2);
		assertThat(session.getExpanded()).containsExactly("users", "orders", "order-items");
	}

	@Test
	void testExpandAll_NothingCollapsed() {
		// Given
		FakeSession session = new FakeSessionFactory().openFake();

		// When
		ExpansionOutcome outcome = expander.expandAll(session);

		// Then
		assertThat(outcome.converged()).isTrue();
		assertThat(outcome.rounds()).isZero();
		assertThat(outcome.expanded()).isZero();
	}

	@Test
	void testExpandAll_TerminatesOnEndlessTree() {
		// Given
		FakeSessionFactory factory = new FakeSessionFactory().withToggles("root").withEndlessToggles();
		FakeSession session = factory.openFake();

		// When
		ExpansionOutcome outcome = expander.expandAll(session);

		// Then
		assertThat(outcome.converged()).isFalse();
		assertThat(outcome.rounds()).isEqualTo(5);
		assertThat(factory.getExpansionCount()).isEqualTo(5);
		assertThat(outcome.partial()).hasValueSatisfying(warning -> {
			assertThat(warning.rounds()).isEqualTo(5);
			assertThat(warning.remainingCollapsed()).isEqualTo(1);
			assertThat(warning.toString()).contains("may be incomplete");
		});
	}

	@Test
	void testExpandAll_StallsWhenNothingCanBeClicked() {
		// Given
		FakeSession session = new FakeSessionFactory()
				.withToggles("a", "b")
				.withUnclickableToggles()
				.openFake();

		// When
		ExpansionOutcome outcome = expander.expandAll(session);

		// Then
		assertThat(outcome.converged()).isFalse();
		assertThat(outcome.rounds()).isEqualTo(1);
		assertThat(outcome.warning()).isNotNull();
		assertThat(outcome.warning().remainingCollapsed()).isEqualTo(2);
	}

	@Test
	void testRejectsZeroAttempts() {
		// When/Then
		assertThatThrownBy(() -> new MenuExpander(0, Duration.ZERO, Duration.ZERO))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
