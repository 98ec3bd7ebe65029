package dev.ytarchiver;

import dev.ytarchiver.api.YouTubeDataApi;
import dev.ytarchiver.archiver.ArchiveResult;
import dev.ytarchiver.archiver.Archiver;
import dev.ytarchiver.archiver.ArchiverException;
import dev.ytarchiver.archiver.ExternalDownloader;
import dev.ytarchiver.config.ArchiverConfig;
import dev.ytarchiver.config.ConfigException;
import dev.ytarchiver.config.ConfigLoader;
import dev.ytarchiver.util.DurationUtils;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/** Archive command that runs the archiver once or on a fixed interval */
@Command(
		name = "archive",
		description = "Archive the configured channels, once or every configured interval",
		mixinStandardHelpOptions = true)
public class ArchiveCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Mixin
	private ConfigOptions configOptions;

	@Option(
			names = {"--once"},
			description = "Run a single archive pass and exit instead of running every interval")
	private boolean once;

	@Option(
			names = {"-i", "--interval"},
			description = "Override the interval between archive runs of the configuration file (e.g. 30m, 6h)")
	private String interval;

	@Override
	public Integer call() throws Exception {
		ArchiverConfig config;
		Duration runInterval;
		Archiver archiver;
		try {
			config = configOptions.load();
			runInterval = interval != null ? DurationUtils.parse(interval) : config.intervalDuration();
			if (runInterval.compareTo(ConfigLoader.MIN_INTERVAL) < 0) {
				throw new ConfigException("interval must be at least 30s: " + interval);
			}
			archiver = createArchiver(config);
		} catch (ArchiverException | IllegalArgumentException e) {
			logger.error("Failed to start archiver: {}", e.getMessage());
			return 2;
		}

		if (once) {
			ArchiveResult result = runOnce(archiver, config);
			return result.success() ? 0 : 1;
		}

		logger.info(
				"Archiver ready on {} worker(s), {} channel(s) and archiving approx. every {}",
				config.maxParallel(),
				config.channels().size(),
				runInterval);

		ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
		CountDownLatch stopped = new CountDownLatch(1);
		Runtime.getRuntime().addShutdownHook(new Thread(() -> {
			logger.info("Caught shutdown signal, exiting gracefully...");
			archiver.cancel();
			scheduler.shutdown();
			try {
				scheduler.awaitTermination(1, TimeUnit.MINUTES);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			stopped.countDown();
		}));

		scheduler.scheduleWithFixedDelay(
				() -> {
					try {
						runOnce(archiver, config);
					} catch (InterruptedException e) {
						Thread.currentThread().interrupt();
					} catch (RuntimeException e) {
						// Keep the schedule alive, the next run may succeed
						logger.error("Archive run failed", e);
					}
				},
				0,
				runInterval.toMillis(),
				TimeUnit.MILLISECONDS);

		stopped.await();
		return 0;
	}

	private Archiver createArchiver(ArchiverConfig config) throws ArchiverException, InterruptedException {
		YouTubeDataApi api = new YouTubeDataApi(config.apiKey());
		ExternalDownloader downloader = new ExternalDownloader(
				config.downloader(), config.maxRetries(), config.retryDelayDuration(), config.dumpVideoInfo());
		return Archiver.create(config.toSettings(api), api, downloader);
	}

	private ArchiveResult runOnce(Archiver archiver, ArchiverConfig config) throws InterruptedException {
		long startTime = System.currentTimeMillis();
		logger.info("Starting archive run on {} channel(s)", config.channels().size());
		ArchiveResult result = archiver.archive();
		double duration = (System.currentTimeMillis() - startTime) / 1000.0;
		if (result.success()) {
			logger.info("Archive OK; {} video(s) submitted, time elapsed {}s", result.videosSubmitted(), duration);
		} else {
			logger.warn("Archive finished with errors after {}s:\n{}", duration, result);
		}
		return result;
	}
}
