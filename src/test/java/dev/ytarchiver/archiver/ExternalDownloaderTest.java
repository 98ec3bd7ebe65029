package dev.ytarchiver.archiver;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class ExternalDownloaderTest {

	@TempDir
	Path tempDir;

	private final DownloadJob job = new DownloadJob("abc123", "UC1", Path.of("/archive/UC1/abc123.%(ext)s"));

	@Test
	void testCommand() {
		// Given
		ExternalDownloader downloader = new ExternalDownloader("/usr/bin/yt-dlp", 2, Duration.ZERO, false);

		// When / Then
		assertThat(downloader.command(job))
				.containsExactly(
						"/usr/bin/yt-dlp",
						"-o",
						"/archive/UC1/abc123.%(ext)s",
						"--merge-output-format",
						"mp4",
						"https://youtube.com/watch?v=abc123");
	}

	@Test
	void testCommandWithInfoJson() {
		ExternalDownloader downloader = new ExternalDownloader("yt-dlp", 0, Duration.ZERO, true);

		assertThat(downloader.command(job))
				.contains("--write-info-json")
				.endsWith("https://youtube.com/watch?v=abc123");
	}

	@Test
	void testInvalidRetries() {
		assertThatThrownBy(() -> new ExternalDownloader("yt-dlp", -2, Duration.ZERO, false))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@EnabledOnOs({OS.LINUX, OS.MAC})
	void testSuccessfulDownload() throws Exception {
		// Given
		Path counter = tempDir.resolve("count");
		ExternalDownloader downloader = new ExternalDownloader(script(counter, 0).toString(), 2, Duration.ZERO, false);

		// When
		downloader.download(job);

		// Then
		assertThat(Files.readAllLines(counter)).hasSize(1);
	}

	@Test
	@EnabledOnOs({OS.LINUX, OS.MAC})
	void testFailedDownloadIsRetried() throws Exception {
		// Given
		Path counter = tempDir.resolve("count");
		ExternalDownloader downloader = new ExternalDownloader(script(counter, 3).toString(), 2, Duration.ofMillis(10), false);

		// When / Then
		assertThatThrownBy(() -> downloader.download(job))
				.isInstanceOfSatisfying(DownloadException.class, e -> assertThat(e.videoId()).isEqualTo("abc123"))
				.hasMessageContaining("exited with code 3");
		assertThat(Files.readAllLines(counter)).hasSize(3);
	}

	@Test
	@EnabledOnOs({OS.LINUX, OS.MAC})
	void testZeroRetriesMeansSingleAttempt() throws Exception {
		// Given
		Path counter = tempDir.resolve("count");
		ExternalDownloader downloader = new ExternalDownloader(script(counter, 1).toString(), 0, Duration.ZERO, false);

		// When / Then
		assertThatThrownBy(() -> downloader.download(job)).isInstanceOf(DownloadException.class);
		assertThat(Files.readAllLines(counter)).hasSize(1);
	}

	@Test
	@EnabledOnOs({OS.LINUX, OS.MAC})
	void testVerify() throws Exception {
		ExternalDownloader downloader =
				new ExternalDownloader(script(tempDir.resolve("count"), 0).toString(), 0, Duration.ZERO, false);

		assertThatCode(downloader::verify).doesNotThrowAnyException();
	}

	@Test
	@EnabledOnOs({OS.LINUX, OS.MAC})
	void testVerifyFailsOnNonZeroExit() throws Exception {
		ExternalDownloader downloader =
				new ExternalDownloader(script(tempDir.resolve("count"), 1).toString(), 0, Duration.ZERO, false);

		assertThatThrownBy(downloader::verify)
				.isInstanceOf(ArchiverException.class)
				.hasMessageContaining("abnormal termination");
	}

	@Test
	void testVerifyFailsOnMissingExecutable() {
		ExternalDownloader downloader = new ExternalDownloader(
				tempDir.resolve("does-not-exist").toString(), 0, Duration.ZERO, false);

		assertThatThrownBy(downloader::verify)
				.isInstanceOf(ArchiverException.class)
				.hasMessageContaining("start process");
	}

	/** Shell script that appends its arguments to the counter file and exits with the given code */
	private Path script(Path counter, int exitCode) throws Exception {
		Path script = tempDir.resolve("fake-dl-" + exitCode + ".sh");
		Files.writeString(
				script,
				"#!/bin/sh\n" + "echo \"$@\" >> '" + counter + "'\n" + "echo downloading\n" + "exit " + exitCode + "\n");
		Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwxr-xr-x"));
		return script;
	}
}
