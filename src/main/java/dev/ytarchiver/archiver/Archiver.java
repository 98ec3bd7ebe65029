package dev.ytarchiver.archiver;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.ytarchiver.api.YouTubeApi;
import dev.ytarchiver.model.Video;
import dev.ytarchiver.selector.VideoSelector;
import dev.ytarchiver.util.FileUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Archives the uploads of the configured channels. Channels are processed one after the other; the
 * videos of each channel are downloaded by a fresh {@link DownloadManager}.
 *
 * <p>A video is marked seen as soon as it is submitted, and unmarked again if its download fails,
 * so it is retried on the next run.
 */
public class Archiver {
	private static final Logger logger = LoggerFactory.getLogger(Archiver.class);

	static final String MARKER_FILE = ".ytarchiver";
	static final String CHANNEL_INFO_FILE = "channel.json";

	private final ArchiverSettings settings;
	private final YouTubeApi api;
	private final Downloader downloader;
	private final ChannelCache cache;
	private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

	private volatile boolean cancelled;
	private volatile DownloadManager currentDownloads;

	Archiver(ArchiverSettings settings, YouTubeApi api, Downloader downloader, ChannelCache cache) {
		this.settings = settings;
		this.api = api;
		this.downloader = downloader;
		this.cache = cache;
	}

	/**
	 * Create an archiver ready to run. Checks the downloader and the archive root, resolves every
	 * channel and picks up the videos already on disk.
	 *
	 * @throws ArchiverException if any of the startup steps fails
	 */
	public static Archiver create(ArchiverSettings settings, YouTubeApi api, Downloader downloader)
			throws ArchiverException, InterruptedException {
		downloader.verify();

		try {
			FileUtils.probeWritable(settings.root(), MARKER_FILE);
		} catch (IOException e) {
			throw new ArchiverException("bad download directory " + settings.root() + ": " + e.getMessage(), e);
		}

		ChannelCache cache = ChannelCache.build(
				api, settings.channels().stream().map(ChannelTarget::identity).toList());

		try {
			int found = new DiskReconciler(settings.root()).reconcile(cache);
			logger.info("Archiver ready: {} channel(s), {} video(s) already archived", cache.size(), found);
		} catch (IOException e) {
			throw new ArchiverException("scan archive root " + settings.root() + ": " + e.getMessage(), e);
		}

		return new Archiver(settings, api, downloader, cache);
	}

	/**
	 * Run one archive pass over every channel. Failures of one channel or video never stop the
	 * others; they are collected in the returned result.
	 */
	public ArchiveResult archive() throws InterruptedException {
		cancelled = false;
		List<ChannelResult> results = new ArrayList<>();
		for (ChannelTarget target : settings.channels()) {
			if (cancelled) {
				logger.info("Archive run cancelled, skipping remaining channels");
				break;
			}
			ChannelResult result = archiveChannel(target);
			if (result.success()) {
				logger.info("[{}] {}", result.channelId(), result);
			} else {
				logger.warn("[{}] {}", result.channelId(), result);
			}
			results.add(result);
		}
		return new ArchiveResult(results);
	}

	ChannelResult archiveChannel(ChannelTarget target) throws InterruptedException {
		Optional<CachedChannel> cached = cache.get(target.identity());
		if (cached.isEmpty()) {
			String channel = target.identity().toString();
			return ChannelResult.cacheMiss(channel, new CacheMissException(channel));
		}
		CachedChannel channel = cached.get();
		logger.info("[{}] Archiving {}", channel.id(), channel.name());

		List<Exception> errors = new ArrayList<>();
		if (settings.dumpChannelInfo()) {
			try {
				writeChannelInfo(channel);
			} catch (IOException e) {
				errors.add(new ArchiverException("write channel info for " + channel.id() + ": " + e.getMessage(), e));
			}
		}

		int[] counts = new int[2]; // submitted, skipped
		DownloadManager downloads = new DefaultDownloadManager(settings.maxParallel(), downloader);
		currentDownloads = downloads;
		downloads.start();
		try {
			channel.forEach(api, (c, video) -> {
				c.markHistoryKnown();
				if (c.hasSeen(video.videoId())) {
					return;
				}
				if (!selected(target, video)) {
					counts[1]++;
					return;
				}
				downloads.submit(new DownloadJob(video.videoId(), c.id(), outputPath(c, video)));
				c.markSeen(video.videoId());
				counts[0]++;
			});
		} catch (EnumerationException e) {
			errors.add(e);
		} catch (InterruptedException e) {
			// Workers stop after their current download and the pool is released
			downloads.cancel();
			throw e;
		} finally {
			downloads.shutdown();
		}

		for (DownloadException failure : downloads.awaitCompletion()) {
			// Try again next run
			channel.unmarkSeen(failure.videoId());
			errors.add(failure);
		}
		currentDownloads = null;

		return new ChannelResult(channel.id(), channel.name(), counts[0], counts[1], errors);
	}

	/** Channel selectors first, then the global ones */
	private boolean selected(ChannelTarget target, Video video) {
		return VideoSelector.allSelect(target.selectors(), video)
				&& VideoSelector.allSelect(settings.selectors(), video);
	}

	private Path outputPath(CachedChannel channel, Video video) {
		return settings.root().resolve(channel.id()).resolve(video.videoId() + ".%(ext)s");
	}

	private void writeChannelInfo(CachedChannel channel) throws IOException {
		Path channelDir = settings.root().resolve(channel.id());
		FileUtils.ensureDirectory(channelDir);
		Map<String, Object> info = new LinkedHashMap<>();
		info.put("id", channel.id());
		info.put("name", channel.name());
		info.put("uploads_playlist", channel.uploadsFeedId());
		info.put("identity", channel.identity().toString());
		objectMapper.writeValue(channelDir.resolve(CHANNEL_INFO_FILE).toFile(), info);
	}

	/**
	 * Stop the current run: downloads already running finish, queued ones are dropped and reported
	 * as failures, remaining channels are skipped.
	 */
	public void cancel() {
		cancelled = true;
		DownloadManager downloads = currentDownloads;
		if (downloads != null) {
			downloads.cancel();
		}
	}

	public ChannelCache cache() {
		return cache;
	}

	public ArchiverSettings settings() {
		return settings;
	}
}
