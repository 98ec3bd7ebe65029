package dev.ytarchiver;

import dev.ytarchiver.api.YouTubeDataApi;
import dev.ytarchiver.archiver.ArchiverException;
import dev.ytarchiver.archiver.CachedChannel;
import dev.ytarchiver.archiver.ChannelCache;
import dev.ytarchiver.archiver.DiskReconciler;
import dev.ytarchiver.config.ArchiverConfig;
import dev.ytarchiver.config.ChannelConfig;
import java.io.IOException;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/** Resolves the configured channels and shows what is already archived, without downloading */
@Command(
		name = "channels",
		description = "Resolve the configured channels and show how many videos are already archived",
		mixinStandardHelpOptions = true)
public class ChannelsCommand implements Callable<Integer> {

	@Mixin
	private ConfigOptions configOptions;

	@Override
	public Integer call() throws Exception {
		ChannelCache cache;
		try {
			ArchiverConfig config = configOptions.load();
			YouTubeDataApi api = new YouTubeDataApi(config.apiKey());
			cache = ChannelCache.build(
					api, config.channels().stream().map(ChannelConfig::identity).toList());
			new DiskReconciler(config.rootPath()).reconcile(cache);
		} catch (ArchiverException | IOException e) {
			System.err.println("Error: " + e.getMessage());
			return 1;
		}

		System.out.println("Configured Channels");
		System.out.println("===================");
		for (CachedChannel channel : cache.channels()) {
			System.out.printf("  %s%n", channel.identity());
			System.out.printf("    ID: %s%n", channel.id());
			System.out.printf("    Name: %s%n", channel.name());
			System.out.printf("    Uploads: %s%n", channel.uploadsFeedId());
			System.out.printf(
					"    Archived: %s%n",
					channel.isHistoryKnown() ? channel.seen().size() + " videos" : "nothing yet");
		}
		System.out.println();
		System.out.println("Total: " + cache.size() + " channels");
		return 0;
	}
}
