package dev.ytarchiver.archiver;

/** Base class for failures of the archiver that are not tied to a single video */
public class ArchiverException extends Exception {

	public ArchiverException(String message) {
		super(message);
	}

	public ArchiverException(String message, Throwable cause) {
		super(message, cause);
	}
}
