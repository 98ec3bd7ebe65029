package dev.ytarchiver.archiver;

/** Downloading a single video failed, possibly after several attempts */
public class DownloadException extends Exception {
	private final String videoId;

	public DownloadException(String videoId, String message) {
		super("archive video " + videoId + ": " + message);
		this.videoId = videoId;
	}

	public DownloadException(String videoId, String message, Throwable cause) {
		super("archive video " + videoId + ": " + message, cause);
		this.videoId = videoId;
	}

	public String videoId() {
		return videoId;
	}
}
