package dev.sidebarscraper.discovery;

import dev.sidebarscraper.model.SidebarItem;
import dev.sidebarscraper.model.SidebarStructure;
import dev.sidebarscraper.model.TargetRef;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Accumulates parsed entries and assigns their ids */
final class StructureBuilder {
	private final Map<String, Node> nodes = new LinkedHashMap<>();
	private final List<String> roots = new ArrayList<>();
	private final Set<String> declaredIds = new HashSet<>();

	String addHeader(String title) {
		return add(null, title, false, null);
	}

	String addItem(String parentId, String title, boolean expandable, String declaredId) {
		return add(parentId, title, expandable, declaredId);
	}

	int size() {
		return nodes.size();
	}

	SidebarStructure build(String sourceUrl, Instant capturedAt) {
		Map<String, SidebarItem> items = new LinkedHashMap<>();
		for (Node node : nodes.values()) {
			items.put(
					node.id,
					new SidebarItem(
							node.id, node.title, node.level, node.parentId, node.children, node.expandable, node.targetRef));
		}
		return new SidebarStructure(sourceUrl, capturedAt, roots, items);
	}

	private String add(String parentId, String title, boolean expandable, String declaredId) {
		Node parent = parentId == null ? null : nodes.get(parentId);
		if (parentId != null && parent == null) {
			throw new IllegalArgumentException("Unknown parent " + parentId);
		}
		List<String> titlePath = new ArrayList<>();
		if (parent != null) {
			titlePath.addAll(parent.titlePath);
			titlePath.add(parent.title);
		}
		int level = parent == null ? 0 : parent.level + 1;

		String id;
		boolean useDeclared = declaredId != null && !declaredId.isBlank() && !nodes.containsKey(declaredId);
		if (useDeclared) {
			id = declaredId;
			declaredIds.add(declaredId);
		} else {
			id = unique(SyntheticIds.of(titlePath, title, level));
		}

		Node node = new Node();
		node.id = id;
		node.title = title;
		node.level = level;
		node.parentId = parentId;
		node.expandable = expandable;
		node.titlePath = titlePath;
		if (parent != null) {
			// a repeated DOM id would resolve to its first element, so fall back to the title path
			node.targetRef =
					useDeclared ? TargetRef.ofId(declaredId) : TargetRef.ofText(fullPath(titlePath, title));
			parent.children.add(id);
		} else {
			roots.add(id);
		}
		nodes.put(id, node);
		return id;
	}

	private static List<String> fullPath(List<String> titlePath, String title) {
		List<String> path = new ArrayList<>(titlePath);
		path.add(title);
		return path;
	}

	// Identical siblings get a positional suffix, still stable across runs
	private String unique(String candidate) {
		String id = candidate;
		int suffix = 2;
		while (nodes.containsKey(id) || declaredIds.contains(id)) {
			id = candidate + "-" + suffix++;
		}
		return id;
	}

	private static final class Node {
		String id;
		String title;
		int level;
		String parentId;
		boolean expandable;
		String targetRef;
		List<String> titlePath;
		final List<String> children = new ArrayList<>();
	}
}
