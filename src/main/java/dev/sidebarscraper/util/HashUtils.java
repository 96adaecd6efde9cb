package dev.sidebarscraper.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/** Utility class for computing SHA-256 hashes */
public class HashUtils {

	private HashUtils() {}

	public static String sha256(String text) {
		return sha256(text.getBytes(StandardCharsets.UTF_8));
	}

	public static String sha256(byte[] bytes) {
		MessageDigest digest = newDigest();
		return bytesToHex(digest.digest(bytes));
	}

	/** Compute the hash of a file */
	public static String sha256(Path file) throws IOException {
		MessageDigest digest = newDigest();
		try (InputStream is = Files.newInputStream(file)) {
			byte[] buffer = new byte[8192];
			int read;
			while ((read = is.read(buffer)) > 0) {
				digest.update(buffer, 0, read);
			}
		}
		return bytesToHex(digest.digest());
	}

	private static MessageDigest newDigest() {
		try {
			return MessageDigest.getInstance("SHA-256");
		} catch (NoSuchAlgorithmException e) {
			// every JDK ships SHA-256
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}

	/** Convert byte array to hex string */
	private static String bytesToHex(byte[] bytes) {
		StringBuilder result = new StringBuilder();
		for (byte b : bytes) {
			result.append(String.format("%02x", b));
		}
		return result.toString();
	}
}
