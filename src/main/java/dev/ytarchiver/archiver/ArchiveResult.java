package dev.ytarchiver.archiver;

import java.util.List;

/**
 * Result of one archive run over all channels. A run never stops on the first error: each channel
 * reports its own failures, and the run succeeded only if none of them did.
 */
public record ArchiveResult(List<ChannelResult> channels) {

	public ArchiveResult {
		channels = List.copyOf(channels);
	}

	public boolean success() {
		return channels.stream().allMatch(ChannelResult::success);
	}

	/** Only the channels that reported errors */
	public List<ChannelResult> failures() {
		return channels.stream().filter(c -> !c.success()).toList();
	}

	public int videosSubmitted() {
		return channels.stream().mapToInt(ChannelResult::videosSubmitted).sum();
	}

	@Override
	public String toString() {
		if (success()) {
			return "SUCCESS (%d channels, %d videos submitted)".formatted(channels.size(), videosSubmitted());
		}
		List<ChannelResult> failures = failures();
		StringBuilder sb = new StringBuilder();
		sb.append("%d channel errors during archiving:".formatted(failures.size()));
		for (ChannelResult failure : failures) {
			sb.append("\n\t").append(failure.toString().replace("\n", "\n\t"));
		}
		return sb.toString();
	}
}
