package dev.ytarchiver.archiver;

import dev.ytarchiver.model.ChannelIdentity;
import dev.ytarchiver.selector.VideoSelector;
import java.util.List;

/** A channel to archive, with the selectors that apply to it only */
public record ChannelTarget(ChannelIdentity identity, List<VideoSelector> selectors) {

	public ChannelTarget {
		selectors = List.copyOf(selectors);
	}

	public static ChannelTarget of(ChannelIdentity identity) {
		return new ChannelTarget(identity, List.of());
	}
}
