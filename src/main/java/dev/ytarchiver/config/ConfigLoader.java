package dev.ytarchiver.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ytarchiver.archiver.ExternalDownloader;
import dev.ytarchiver.model.ChannelIdentity;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Locates, parses and validates the configuration file */
public class ConfigLoader {
	private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

	public static final List<Path> SEARCH_PATHS = List.of(
			Path.of("ytarchive.json"), Path.of("/etc/ytarchive.json"), Path.of("/usr/share/ytarchive/ytarchive.json"));

	/** Shorter intervals would spam the API */
	public static final Duration MIN_INTERVAL = Duration.ofSeconds(30);

	private static final String PLACEHOLDER_KEY = "YOUR_KEY_HERE";

	private final List<Path> searchPaths;
	private final ObjectMapper objectMapper =
			new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

	public ConfigLoader() {
		this(SEARCH_PATHS);
	}

	public ConfigLoader(List<Path> searchPaths) {
		this.searchPaths = searchPaths;
	}

	/**
	 * Load the configuration from the given file, or from the first file of the search path that
	 * exists when none is given.
	 */
	public ArchiverConfig load(Path explicitFile) throws ConfigException {
		Path file = explicitFile != null ? explicitFile : find().orElseThrow(() -> new ConfigException(
				"no configuration file found, looked in " + searchPaths));
		logger.info("Loading configuration from {}", file.toAbsolutePath());
		ArchiverConfig config = parse(file);
		validate(config);
		return config;
	}

	Optional<Path> find() {
		return searchPaths.stream().filter(Files::isRegularFile).findFirst();
	}

	ArchiverConfig parse(Path file) throws ConfigException {
		try {
			return objectMapper.readValue(Files.readString(file), ArchiverConfig.class);
		} catch (JsonProcessingException e) {
			throw new ConfigException("parsing config " + file + ": " + e.getOriginalMessage(), e);
		} catch (IOException e) {
			throw new ConfigException("reading config " + file + ": " + e.getMessage(), e);
		}
	}

	/** Check the values the archiver cannot start without */
	public static void validate(ArchiverConfig config) throws ConfigException {
		if (config.root() == null || config.root().isBlank()) {
			throw new ConfigException("invalid config: root is required");
		}
		if (config.apiKey() == null || config.apiKey().isBlank() || PLACEHOLDER_KEY.equals(config.apiKey())) {
			throw new ConfigException(
					"invalid config: blank API key supplied, an API key is required: go to https://console.cloud.google.com");
		}
		if (config.maxRetries() < ExternalDownloader.RETRY_FOREVER) {
			throw new ConfigException("invalid config: maxRetries must be >= 0, or -1 to retry forever");
		}
		try {
			if (config.intervalDuration().compareTo(MIN_INTERVAL) < 0) {
				throw new ConfigException("invalid config: interval must be at least 30s");
			}
			if (config.retryDelayDuration().isNegative()) {
				throw new ConfigException("invalid config: retryDelay must not be negative");
			}
		} catch (IllegalArgumentException e) {
			throw new ConfigException("invalid config: " + e.getMessage(), e);
		}
		if (config.channels().isEmpty()) {
			logger.warn("No channels configured, nothing will be archived");
		}
		for (ChannelConfig channel : config.channels()) {
			ChannelIdentity identity = channel.identity();
			if (identity.isEmpty()) {
				throw new ConfigException("invalid config: channel entry without id, handle or username");
			}
		}
	}
}
