package dev.ytarchiver.archiver;

/** The remote API returned no channel for a configured identity */
public class ChannelNotFoundException extends ArchiverException {

	public ChannelNotFoundException(String message) {
		super(message);
	}
}
