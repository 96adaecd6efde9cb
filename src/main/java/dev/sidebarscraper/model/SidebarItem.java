package dev.sidebarscraper.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * One entry of the navigation sidebar. Headers are roots without a target, menus are expandable
 * containers and everything else is a content page.
 */
@JsonPropertyOrder({"id", "title", "level", "parent_id", "children", "is_expandable", "target_ref"})
public record SidebarItem(
		@JsonProperty("id") String id,
		@JsonProperty("title") String title,
		@JsonProperty("level") int level,
		@JsonProperty("parent_id") String parentId,
		@JsonProperty("children") List<String> children,
		@JsonProperty("is_expandable") boolean expandable,
		@JsonProperty("target_ref") String targetRef) {

	public SidebarItem {
		children = children == null ? List.of() : List.copyOf(children);
	}

	/** Content page: nothing below it, not a collapsible container and something to click */
	@JsonIgnore
	public boolean isLeaf() {
		return children.isEmpty() && !expandable && hasTarget();
	}

	@JsonIgnore
	public boolean isRoot() {
		return parentId == null;
	}

	@JsonIgnore
	public boolean hasTarget() {
		return targetRef != null && !targetRef.isBlank();
	}

	/** Counts towards the valid item ratio of a structure */
	@JsonIgnore
	public boolean isValid() {
		return title != null && !title.isBlank() && hasTarget();
	}
}
