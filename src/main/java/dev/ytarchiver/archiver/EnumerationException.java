package dev.ytarchiver.archiver;

/** Walking a channel's uploads feed stopped early */
public class EnumerationException extends ArchiverException {
	private final String channelId;
	private final int page;

	public EnumerationException(String channelId, int page, Throwable cause) {
		super("foreach video on " + channelId + " (page " + page + "): " + cause.getMessage(), cause);
		this.channelId = channelId;
		this.page = page;
	}

	public String channelId() {
		return channelId;
	}

	public int page() {
		return page;
	}
}
