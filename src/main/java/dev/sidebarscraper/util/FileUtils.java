package dev.sidebarscraper.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utility class for file operations */
public class FileUtils {
	private static final Logger logger = LoggerFactory.getLogger(FileUtils.class);

	private FileUtils() {}

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/**
	 * Write content next to the target first and move it into place, so readers never observe a
	 * half-written file. The temp file is verified against the SHA-256 of the content before the move.
	 */
	public static void writeAtomically(Path target, String content) throws IOException {
		Path parent = target.toAbsolutePath().getParent();
		ensureDirectory(parent);
		byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
		Path temp = Files.createTempFile(parent, "." + target.getFileName(), ".tmp");
		try {
			Files.write(temp, bytes);
			String expected = HashUtils.sha256(bytes);
			String written = HashUtils.sha256(temp);
			if (!expected.equals(written)) {
				throw new IOException("Checksum mismatch while writing " + target);
			}
			try {
				Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			} catch (AtomicMoveNotSupportedException e) {
				logger.debug("Atomic move not supported for {}, falling back to replace", target);
				Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
			}
		} finally {
			Files.deleteIfExists(temp);
		}
	}
}
