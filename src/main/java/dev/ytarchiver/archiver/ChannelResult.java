package dev.ytarchiver.archiver;

import java.util.List;

/** Outcome of archiving a single channel during one run */
public record ChannelResult(
		String channelId, String channelName, int videosSubmitted, int videosSkipped, List<Exception> errors) {

	public ChannelResult {
		errors = List.copyOf(errors);
	}

	public static ChannelResult cacheMiss(String channel, CacheMissException error) {
		return new ChannelResult(channel, null, 0, 0, List.of(error));
	}

	public boolean success() {
		return errors.isEmpty();
	}

	/** Number of videos that were submitted and downloaded without error */
	public int videosDownloaded() {
		long failed = errors.stream().filter(e -> e instanceof DownloadException).count();
		return videosSubmitted - (int) failed;
	}

	/** IDs of the videos whose download failed this run */
	public List<String> failedVideoIds() {
		return errors.stream()
				.filter(e -> e instanceof DownloadException)
				.map(e -> ((DownloadException) e).videoId())
				.toList();
	}

	@Override
	public String toString() {
		if (success()) {
			return "channel %s: SUCCESS (%d videos submitted, %d videos skipped)"
					.formatted(channelId, videosSubmitted, videosSkipped);
		}
		StringBuilder sb = new StringBuilder();
		sb.append("channel %s: %d archiving errors:".formatted(channelId, errors.size()));
		for (Exception e : errors) {
			sb.append("\n\t- ").append(e.getMessage());
		}
		return sb.toString();
	}
}
