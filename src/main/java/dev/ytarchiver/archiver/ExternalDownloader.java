package dev.ytarchiver.archiver;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external youtube-dl compatible executable (yt-dlp, youtube-dl) once per video. The
 * process is a black box: a zero exit code is success, anything else is retried.
 */
public class ExternalDownloader implements Downloader {
	public static final String WATCH_URL = "https://youtube.com/watch?v=";

	/** Retry count that never gives up */
	public static final int RETRY_FOREVER = -1;

	private static final Logger logger = LoggerFactory.getLogger(ExternalDownloader.class);

	private final String executable;
	private final int maxRetries;
	private final Duration retryDelay;
	private final boolean writeInfoJson;

	/**
	 * Create a new ExternalDownloader.
	 *
	 * @param executable Path to the downloader executable
	 * @param maxRetries Retries after the first attempt; 0 for a single attempt, {@link
	 *     #RETRY_FOREVER} to retry until success
	 * @param retryDelay Pause between attempts
	 * @param writeInfoJson Ask the downloader for a {@code <id>.info.json} sidecar
	 */
	public ExternalDownloader(String executable, int maxRetries, Duration retryDelay, boolean writeInfoJson) {
		if (maxRetries < RETRY_FOREVER) {
			throw new IllegalArgumentException("maxRetries must be >= 0 or " + RETRY_FOREVER + ": " + maxRetries);
		}
		this.executable = executable;
		this.maxRetries = maxRetries;
		this.retryDelay = retryDelay;
		this.writeInfoJson = writeInfoJson;
	}

	@Override
	public void download(DownloadJob job) throws DownloadException, InterruptedException {
		List<String> command = command(job);
		DownloadException lastFailure = null;
		for (int attempt = 1; maxRetries == RETRY_FOREVER || attempt <= maxRetries + 1; attempt++) {
			if (attempt > 1 && !retryDelay.isZero()) {
				Thread.sleep(retryDelay.toMillis());
			}
			try {
				logger.info("[{}] Downloading {} (attempt {})", job.channelId(), job.videoId(), attempt);
				int exitCode = run(command, job.videoId());
				if (exitCode == 0) {
					logger.info("[{}] Downloaded {}", job.channelId(), job.videoId());
					return;
				}
				lastFailure = new DownloadException(job.videoId(), executable + " exited with code " + exitCode);
			} catch (IOException e) {
				lastFailure = new DownloadException(job.videoId(), "start " + executable + ": " + e.getMessage(), e);
			}
			logger.warn("[{}] {}", job.channelId(), lastFailure.getMessage());
		}
		throw lastFailure;
	}

	/** Build the argument list for a job; the executable comes first */
	List<String> command(DownloadJob job) {
		List<String> command = new ArrayList<>();
		command.add(executable);
		command.add("-o");
		command.add(job.outputPath().toString());
		command.add("--merge-output-format");
		command.add("mp4");
		if (writeInfoJson) {
			command.add("--write-info-json");
		}
		command.add(WATCH_URL + job.videoId());
		return command;
	}

	@Override
	public void verify() throws ArchiverException, InterruptedException {
		try {
			int exitCode = run(List.of(executable, "--version"), "version");
			if (exitCode != 0) {
				throw new ArchiverException(
						"downloader " + executable + ": abnormal termination (exit code " + exitCode + ")");
			}
		} catch (IOException e) {
			throw new ArchiverException("downloader " + executable + ": start process: " + e.getMessage(), e);
		}
	}

	private int run(List<String> command, String tag) throws IOException, InterruptedException {
		ProcessBuilder processBuilder = new ProcessBuilder(command);
		processBuilder.redirectErrorStream(true);
		Process process = processBuilder.start();

		try (BufferedReader reader =
				new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				logger.debug("[{}] {}", tag, line);
			}
		}
		return process.waitFor();
	}
}
