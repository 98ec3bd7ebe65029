package dev.ytarchiver.archiver;

/** The first page of an uploads feed came back without any items */
public class EmptyFeedException extends ArchiverException {

	public EmptyFeedException(String feedId) {
		super("no results returned for feed " + feedId);
	}
}
