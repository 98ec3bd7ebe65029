package dev.ytarchiver.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Utility class for file operations */
public class FileUtils {

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/** Strip everything from the first dot onwards: "abc.info.json" becomes "abc" */
	public static String baseName(String filename) {
		int dot = filename.indexOf('.');
		return dot == -1 ? filename : filename.substring(0, dot);
	}

	/**
	 * Write and flush a marker file to prove the directory is writable.
	 *
	 * @param directory The directory to probe, created if missing
	 * @param markerName The name of the marker file
	 */
	public static void probeWritable(Path directory, String markerName) throws IOException {
		ensureDirectory(directory);
		Path marker = directory.resolve(markerName);
		Files.writeString(marker, "");
	}
}
