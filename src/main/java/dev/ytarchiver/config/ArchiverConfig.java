package dev.ytarchiver.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.ytarchiver.api.YouTubeApi;
import dev.ytarchiver.archiver.ArchiverSettings;
import dev.ytarchiver.archiver.ChannelTarget;
import dev.ytarchiver.selector.InvalidPatternException;
import dev.ytarchiver.selector.VideoSelector;
import dev.ytarchiver.util.DurationUtils;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Contents of the {@code ytarchive.json} configuration file. Missing optional values are replaced
 * by their defaults.
 */
public record ArchiverConfig(
		@JsonProperty("root") String root,
		@JsonProperty("apiKey") String apiKey,
		@JsonProperty("maxParallel") Integer maxParallel,
		@JsonProperty("downloader") String downloader,
		@JsonProperty("maxRetries") Integer maxRetries,
		@JsonProperty("retryDelay") String retryDelay,
		@JsonProperty("dumpVideoInfo") boolean dumpVideoInfo,
		@JsonProperty("dumpChannelInfo") boolean dumpChannelInfo,
		@JsonProperty("interval") String interval,
		@JsonProperty("channels") List<ChannelConfig> channels,
		@JsonProperty("selectors") List<SelectorConfig> selectors) {

	public static final String DEFAULT_DOWNLOADER = "/usr/bin/yt-dlp";
	public static final int DEFAULT_MAX_RETRIES = 2;
	public static final String DEFAULT_RETRY_DELAY = "5s";
	public static final String DEFAULT_INTERVAL = "6h";

	public ArchiverConfig {
		if (maxParallel == null || maxParallel <= 0) {
			maxParallel = Runtime.getRuntime().availableProcessors();
		}
		if (downloader == null || downloader.isBlank()) {
			downloader = DEFAULT_DOWNLOADER;
		}
		if (maxRetries == null) {
			maxRetries = DEFAULT_MAX_RETRIES;
		}
		if (retryDelay == null || retryDelay.isBlank()) {
			retryDelay = DEFAULT_RETRY_DELAY;
		}
		if (interval == null || interval.isBlank()) {
			interval = DEFAULT_INTERVAL;
		}
		channels = channels == null ? List.of() : List.copyOf(channels);
		selectors = selectors == null ? List.of() : List.copyOf(selectors);
	}

	@JsonIgnore
	public Path rootPath() {
		return Path.of(root);
	}

	@JsonIgnore
	public Duration intervalDuration() {
		return DurationUtils.parse(interval);
	}

	@JsonIgnore
	public Duration retryDelayDuration() {
		return DurationUtils.parse(retryDelay);
	}

	/**
	 * Build the archiver settings, turning every selector entry into a selector.
	 *
	 * @throws ConfigException if a selector entry is invalid
	 */
	public ArchiverSettings toSettings(YouTubeApi api) throws ConfigException {
		try {
			List<ChannelTarget> targets = new ArrayList<>();
			for (ChannelConfig channel : channels) {
				targets.add(new ChannelTarget(channel.identity(), toSelectors(channel.selectors(), api)));
			}
			return new ArchiverSettings(rootPath(), maxParallel, dumpChannelInfo, targets, toSelectors(selectors, api));
		} catch (InvalidPatternException e) {
			throw new ConfigException(e.getMessage(), e);
		}
	}

	private static List<VideoSelector> toSelectors(List<SelectorConfig> configs, YouTubeApi api)
			throws ConfigException, InvalidPatternException {
		List<VideoSelector> result = new ArrayList<>();
		for (SelectorConfig config : configs) {
			VideoSelector selector = config.toSelector(api);
			if (selector != null) {
				result.add(selector);
			}
		}
		return result;
	}
}
