package dev.sidebarscraper.discovery;

/** The sidebar snapshot matches none of the known layouts */
public class StructureParseException extends DiscoveryException {

	public StructureParseException(String message) {
		super(message);
	}
}
