package dev.ytarchiver.archiver;

import dev.ytarchiver.api.YouTubeApi;
import dev.ytarchiver.model.ChannelIdentity;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Cache of resolved channels, owned by the archiver for the lifetime of the process */
public class ChannelCache {
	private static final Logger logger = LoggerFactory.getLogger(ChannelCache.class);

	private final Map<ChannelIdentity, CachedChannel> channels = new LinkedHashMap<>();

	/**
	 * Resolve every identity. A single failure fails the whole build, the archiver must not start
	 * with a partial cache.
	 */
	public static ChannelCache build(YouTubeApi api, List<ChannelIdentity> identities)
			throws CacheBuildException, InterruptedException {
		ChannelCache cache = new ChannelCache();
		for (ChannelIdentity identity : identities) {
			try {
				CachedChannel channel = CachedChannel.resolve(api, identity);
				cache.put(channel);
				logger.info("Resolved channel {} to {} ({})", identity, channel.id(), channel.name());
			} catch (ArchiverException e) {
				throw new CacheBuildException("build channel cache: " + e.getMessage(), e);
			}
		}
		return cache;
	}

	public void put(CachedChannel channel) {
		channels.put(channel.identity(), channel);
	}

	public Optional<CachedChannel> get(ChannelIdentity identity) {
		return Optional.ofNullable(channels.get(identity));
	}

	public Collection<CachedChannel> channels() {
		return Collections.unmodifiableCollection(channels.values());
	}

	public int size() {
		return channels.size();
	}
}
