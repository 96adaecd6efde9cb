package dev.sidebarscraper.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The discovered navigation tree. Items are kept in discovery order, roots and children lists keep
 * the order declared by the page.
 */
@JsonPropertyOrder({"source_url", "captured_at", "roots", "items"})
public record SidebarStructure(
		@JsonProperty("source_url") String sourceUrl,
		@JsonProperty("captured_at") Instant capturedAt,
		@JsonProperty("roots") List<String> roots,
		@JsonProperty("items") Map<String, SidebarItem> items) {

	public SidebarStructure {
		roots = roots == null ? List.of() : List.copyOf(roots);
		items = items == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(items));
	}

	@JsonIgnore
	public int totalItemCount() {
		return items.size();
	}

	@JsonIgnore
	public int validItemCount() {
		return (int) items.values().stream().filter(SidebarItem::isValid).count();
	}

	public Optional<SidebarItem> item(String id) {
		return Optional.ofNullable(items.get(id));
	}

	/** Ancestors of the given item, outermost first, not including the item itself */
	public List<SidebarItem> ancestors(String id) {
		List<SidebarItem> trail = new ArrayList<>();
		SidebarItem current = items.get(id);
		Set<String> seen = new HashSet<>();
		while (current != null && current.parentId() != null && seen.add(current.id())) {
			current = items.get(current.parentId());
			if (current != null) {
				trail.add(0, current);
			}
		}
		return trail;
	}

	/** Leaf items in depth-first, declared order */
	public List<SidebarItem> leaves() {
		List<SidebarItem> result = new ArrayList<>();
		Set<String> visited = new HashSet<>();
		Deque<String> stack = new ArrayDeque<>();
		for (int i = roots.size() - 1; i >= 0; i--) {
			stack.push(roots.get(i));
		}
		while (!stack.isEmpty()) {
			SidebarItem item = items.get(stack.pop());
			if (item == null || !visited.add(item.id())) {
				continue;
			}
			if (item.isLeaf()) {
				result.add(item);
			}
			List<String> children = item.children();
			for (int i = children.size() - 1; i >= 0; i--) {
				stack.push(children.get(i));
			}
		}
		return result;
	}

	/**
	 * Check the forest invariants: every reference resolves, parent and child links agree, roots
	 * have no parent and no item is reachable twice.
	 *
	 * @return list of problems, empty when the structure is well-formed
	 */
	public List<String> validate() {
		List<String> problems = new ArrayList<>();
		for (Map.Entry<String, SidebarItem> entry : items.entrySet()) {
			SidebarItem item = entry.getValue();
			if (item == null || !entry.getKey().equals(item.id())) {
				problems.add("Item key " + entry.getKey() + " does not match its id");
				continue;
			}
			if (item.parentId() != null) {
				SidebarItem parent = items.get(item.parentId());
				if (parent == null) {
					problems.add("Item " + item.id() + " references missing parent " + item.parentId());
				} else if (!parent.children().contains(item.id())) {
					problems.add("Parent " + parent.id() + " does not list child " + item.id());
				}
			}
			for (String childId : item.children()) {
				SidebarItem child = items.get(childId);
				if (child == null) {
					problems.add("Item " + item.id() + " references missing child " + childId);
				} else if (!item.id().equals(child.parentId())) {
					problems.add("Child " + childId + " does not point back to " + item.id());
				}
			}
		}
		for (String rootId : roots) {
			SidebarItem root = items.get(rootId);
			if (root == null) {
				problems.add("Root " + rootId + " does not exist");
			} else if (!root.isRoot()) {
				problems.add("Root " + rootId + " has a parent");
			}
		}
		if (problems.isEmpty()) {
			checkReachability(problems);
		}
		return problems;
	}

	@JsonIgnore
	public boolean isWellFormed() {
		return validate().isEmpty();
	}

	private void checkReachability(List<String> problems) {
		Set<String> visited = new HashSet<>();
		Deque<String> stack = new ArrayDeque<>(roots);
		while (!stack.isEmpty()) {
			String id = stack.pop();
			if (!visited.add(id)) {
				problems.add("Item " + id + " is reachable more than once");
				return;
			}
			stack.addAll(items.get(id).children());
		}
		if (visited.size() != items.size()) {
			problems.add((items.size() - visited.size()) + " items are not reachable from any root");
		}
	}

	@Override
	public String toString() {
		return "SidebarStructure[%s: %d items, %d valid, %d roots]"
				.formatted(sourceUrl, totalItemCount(), validItemCount(), roots.size());
	}
}
