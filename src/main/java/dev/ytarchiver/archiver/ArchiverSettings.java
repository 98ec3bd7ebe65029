package dev.ytarchiver.archiver;

import dev.ytarchiver.selector.VideoSelector;
import java.nio.file.Path;
import java.util.List;

/**
 * Runtime settings of the archiver.
 *
 * @param root Archive root, one sub-directory per channel ID
 * @param maxParallel Number of concurrent downloads per channel run
 * @param dumpChannelInfo Write a {@code channel.json} file into each channel directory
 * @param channels The channels to archive
 * @param selectors Selectors applied to the videos of every channel
 */
public record ArchiverSettings(
		Path root, int maxParallel, boolean dumpChannelInfo, List<ChannelTarget> channels, List<VideoSelector> selectors) {

	public ArchiverSettings {
		if (maxParallel < 1) {
			throw new IllegalArgumentException("maxParallel must be at least 1: " + maxParallel);
		}
		channels = List.copyOf(channels);
		selectors = List.copyOf(selectors);
	}
}
