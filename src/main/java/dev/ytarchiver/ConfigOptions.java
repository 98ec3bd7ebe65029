package dev.ytarchiver;

import dev.ytarchiver.config.ArchiverConfig;
import dev.ytarchiver.config.ConfigException;
import dev.ytarchiver.config.ConfigLoader;
import java.nio.file.Path;
import picocli.CommandLine.Option;

/** Options shared by all commands that read the configuration file */
public class ConfigOptions {

	@Option(
			names = {"-c", "--config"},
			description = "Configuration file (default: first of ./ytarchive.json, /etc/ytarchive.json, "
					+ "/usr/share/ytarchive/ytarchive.json)")
	Path configFile;

	@Option(
			names = {"-r", "--root"},
			description = "Override the archive root of the configuration file")
	Path root;

	@Option(
			names = {"-t", "--threads"},
			description = "Override the number of parallel downloads of the configuration file")
	Integer maxParallel;

	ArchiverConfig load() throws ConfigException {
		ArchiverConfig config = new ConfigLoader().load(configFile);
		if (root != null || maxParallel != null) {
			config = new ArchiverConfig(
					root != null ? root.toString() : config.root(),
					config.apiKey(),
					maxParallel != null ? maxParallel : config.maxParallel(),
					config.downloader(),
					config.maxRetries(),
					config.retryDelay(),
					config.dumpVideoInfo(),
					config.dumpChannelInfo(),
					config.interval(),
					config.channels(),
					config.selectors());
		}
		return config;
	}
}
