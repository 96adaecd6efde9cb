package dev.sidebarscraper.session;

/** Thrown when an automation session cannot be started */
public class SessionStartException extends Exception {

	public SessionStartException(String message) {
		super(message);
	}

	public SessionStartException(String message, Throwable cause) {
		super(message, cause);
	}
}
