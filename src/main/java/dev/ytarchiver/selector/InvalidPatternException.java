package dev.ytarchiver.selector;

import dev.ytarchiver.archiver.ArchiverException;

/** A regex selector was configured with a pattern that does not compile */
public class InvalidPatternException extends ArchiverException {

	public InvalidPatternException(String pattern, Throwable cause) {
		super("invalid regex pattern '" + pattern + "': " + cause.getMessage(), cause);
	}
}
