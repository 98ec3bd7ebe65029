package dev.ytarchiver.archiver;

/** A configured channel has no entry in the channel cache */
public class CacheMissException extends ArchiverException {

	public CacheMissException(String channel) {
		super("channel not in cache: " + channel);
	}
}
