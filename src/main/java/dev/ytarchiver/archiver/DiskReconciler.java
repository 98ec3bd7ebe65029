package dev.ytarchiver.archiver;

import dev.ytarchiver.util.FileUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Marks videos that are already present in the archive root as seen, so that a restarted process
 * does not download them again. The files on disk are the only persisted state.
 */
public class DiskReconciler {
	private static final Logger logger = LoggerFactory.getLogger(DiskReconciler.class);

	/** Sidecars written next to the videos: {@code <id>.info.json} and {@code channel.json} */
	static final String METADATA_SUFFIX = ".json";

	/** Leftovers of an interrupted download, the video is not complete */
	private static final List<String> TEMPORARY_SUFFIXES = List.of(".part", ".ytdl", ".temp");

	private final Path root;

	public DiskReconciler(Path root) {
		this.root = root;
	}

	/**
	 * Scan the directory of every cached channel. A channel without a directory has never been
	 * archived and keeps an unknown history.
	 *
	 * @return The number of videos found across all channels
	 * @throws IOException if a channel directory exists but cannot be read
	 */
	public int reconcile(ChannelCache cache) throws IOException {
		int total = 0;
		for (CachedChannel channel : cache.channels()) {
			total += reconcile(channel);
		}
		return total;
	}

	int reconcile(CachedChannel channel) throws IOException {
		Path channelDir = root.resolve(channel.id());
		if (!Files.isDirectory(channelDir)) {
			logger.debug("[{}] No archive directory yet", channel.id());
			return 0;
		}

		int found = 0;
		try (Stream<Path> files = Files.list(channelDir)) {
			for (Path file : (Iterable<Path>) files::iterator) {
				String filename = file.getFileName().toString();
				if (!Files.isRegularFile(file) || !isVideoFile(filename)) {
					continue;
				}
				String videoId = FileUtils.baseName(filename);
				if (videoId.isEmpty()) {
					continue;
				}
				if (!channel.hasSeen(videoId)) {
					found++;
				}
				channel.markSeen(videoId);
			}
		}
		logger.info("[{}] Found {} archived video(s) on disk", channel.id(), found);
		return found;
	}

	static boolean isVideoFile(String filename) {
		if (filename.endsWith(METADATA_SUFFIX)) {
			return false;
		}
		for (String suffix : TEMPORARY_SUFFIXES) {
			if (filename.endsWith(suffix)) {
				return false;
			}
		}
		return true;
	}
}
