package dev.ytarchiver.archiver;

/** Building the channel cache failed; the archiver must not start */
public class CacheBuildException extends ArchiverException {

	public CacheBuildException(String message, Throwable cause) {
		super(message, cause);
	}
}
