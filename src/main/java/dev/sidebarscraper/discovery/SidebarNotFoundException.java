package dev.sidebarscraper.discovery;

/** The navigation container never became observable */
public class SidebarNotFoundException extends DiscoveryException {

	public SidebarNotFoundException(String message) {
		super(message);
	}

	public SidebarNotFoundException(String message, Throwable cause) {
		super(message, cause);
	}
}
