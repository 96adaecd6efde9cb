package dev.sidebarscraper.discovery;

/** A discovery attempt failed and produced no structure */
public class DiscoveryException extends Exception {

	public DiscoveryException(String message) {
		super(message);
	}

	public DiscoveryException(String message, Throwable cause) {
		super(message, cause);
	}
}
