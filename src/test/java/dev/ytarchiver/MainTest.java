package dev.ytarchiver;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class MainTest {

	@TempDir
	Path tempDir;

	@Test
	void testArchiveWithMissingConfigFailsToStart() {
		int exitCode = new CommandLine(new Main())
				.execute("archive", "--once", "--config", tempDir.resolve("missing.json").toString());

		assertThat(exitCode).isEqualTo(2);
	}

	@Test
	void testArchiveWithInvalidConfigFailsToStart() throws Exception {
		Path config = Files.writeString(tempDir.resolve("ytarchive.json"), "{ \"root\": \"/srv\", \"apiKey\": \"\" }");

		int exitCode = new CommandLine(new Main()).execute("archive", "--once", "-c", config.toString());

		assertThat(exitCode).isEqualTo(2);
	}

	@Test
	void testArchiveWithInvalidIntervalOverrideFailsToStart() throws Exception {
		Path config = Files.writeString(tempDir.resolve("ytarchive.json"), "{ \"root\": \"/srv\", \"apiKey\": \"k\" }");

		int exitCode = new CommandLine(new Main()).execute("archive", "-c", config.toString(), "--interval", "soon");

		assertThat(exitCode).isEqualTo(2);
	}

	@Test
	void testChannelsWithMissingConfig() {
		int exitCode = new CommandLine(new Main())
				.execute("channels", "--config", tempDir.resolve("missing.json").toString());

		assertThat(exitCode).isEqualTo(1);
	}

	@Test
	void testUnknownOption() {
		int exitCode = new CommandLine(new Main()).execute("archive", "--bogus");

		assertThat(exitCode).isEqualTo(2);
	}

	@Test
	void testNoSubcommandPrintsUsage() {
		assertThat(new CommandLine(new Main()).execute()).isZero();
	}

	@Test
	void testArchiveWithTooShortIntervalOverrideFailsToStart() throws Exception {
		Path config = Files.writeString(tempDir.resolve("ytarchive.json"), "{ \"root\": \"/srv\", \"apiKey\": \"k\" }");

		assertThat(new CommandLine(new Main()).execute("archive", "-c", config.toString(), "-i", "1s")).isEqualTo(2);
		assertThat(new CommandLine(new Main()).execute("archive", "-c", config.toString(), "-i", "0s")).isEqualTo(2);
	}
}
