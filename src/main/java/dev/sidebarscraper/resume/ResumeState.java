package dev.sidebarscraper.resume;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Leaf items split into already materialized and still to do, both in structure order */
public record ResumeState(Set<String> done, List<String> pending) {

	public ResumeState {
		done = Collections.unmodifiableSet(new LinkedHashSet<>(done));
		pending = List.copyOf(pending);
	}

	public int total() {
		return done.size() + pending.size();
	}

	public boolean isComplete() {
		return pending.isEmpty();
	}
}
