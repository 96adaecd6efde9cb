package dev.sidebarscraper.discovery;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ExpansionGateTest {

	@Test
	void testLiveParseAlwaysExpands() {
		// When
		ExpansionGate.Decision pending = ExpansionGate.evaluate(false, ExpansionOverrides.none(), ExpansionState.PENDING);
		ExpansionGate.Decision done = ExpansionGate.evaluate(false, ExpansionOverrides.none(), ExpansionState.DONE);

		// Then
		assertThat(pending.expand()).isTrue();
		assertThat(pending.next()).isEqualTo(ExpansionState.DONE);
		assertThat(done.expand()).isTrue();
		assertThat(done.next()).isEqualTo(ExpansionState.DONE);
	}

	@Test
	void testCachedWithoutOverrideSkips() {
		// When
		ExpansionGate.Decision decision =
				ExpansionGate.evaluate(true, ExpansionOverrides.none(), ExpansionState.PENDING);

		// Then
		assertThat(decision.expand()).isFalse();
		assertThat(decision.next()).isEqualTo(ExpansionState.PENDING);
	}

	@Test
	void testCachedWithOverrideExpandsOnce() {
		// Given
		ExpansionOverrides overrides = new ExpansionOverrides(false, true, false);

		// When
		ExpansionGate.Decision first = ExpansionGate.evaluate(true, overrides, ExpansionState.PENDING);
		ExpansionGate.Decision second = ExpansionGate.evaluate(true, overrides, first.next());

		// Then
		assertThat(first.expand()).isTrue();
		assertThat(first.next()).isEqualTo(ExpansionState.DONE);
		assertThat(second.expand()).isFalse();
		assertThat(second.next()).isEqualTo(ExpansionState.DONE);
	}

	@Test
	void testEveryOverrideCounts() {
		// When/Then
		assertThat(ExpansionGate.evaluate(true, new ExpansionOverrides(true, false, false), ExpansionState.PENDING)
						.expand())
				.isTrue();
		assertThat(ExpansionGate.evaluate(true, new ExpansionOverrides(false, false, true), ExpansionState.PENDING)
						.expand())
				.isTrue();
	}

	@Test
	void testDoneStateSuppressesExpansionOfLaterCachedStructures() {
		// Given a session that already expanded a live page
		ExpansionState state = ExpansionGate.evaluate(false, ExpansionOverrides.none(), ExpansionState.PENDING)
				.next();

		// When a different cached structure is requested with an override
		ExpansionGate.Decision decision =
				ExpansionGate.evaluate(true, new ExpansionOverrides(false, true, false), state);

		// Then the stale DONE flag wins and the cached menu is not expanded
		assertThat(decision.expand()).isFalse();
	}
}
