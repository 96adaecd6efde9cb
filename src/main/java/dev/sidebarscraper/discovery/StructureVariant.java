package dev.sidebarscraper.discovery;

/** Layouts a sidebar can come in */
public enum StructureVariant {
	/** Items grouped under a leading header, menu children nested in their own list */
	HIERARCHICAL,
	/** A flat run of items followed by the header they belong to */
	FLAT_WITH_TRAILING_HEADER
}
