package dev.ytarchiver.archiver;

/** A channel identity that has no identifier at all, or that matches more than one channel */
public class AmbiguousIdentityException extends ArchiverException {

	public AmbiguousIdentityException(String message) {
		super(message);
	}
}
