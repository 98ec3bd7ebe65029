package dev.ytarchiver.archiver;

import dev.ytarchiver.api.YouTubeApi;
import dev.ytarchiver.model.ChannelIdentity;
import dev.ytarchiver.model.ChannelInfo;
import dev.ytarchiver.model.LiveStatus;
import dev.ytarchiver.model.PlaylistPage;
import dev.ytarchiver.model.Video;
import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Details of a channel pertinent to archiving. Resolved once per process to preserve quota.
 *
 * <p>The seen set is null until the channel's history is known. While it is null, enumeration
 * walks every page of the uploads feed; once set (even when empty) only the newest page is checked.
 * It is never reset to null.
 */
public class CachedChannel {
	private static final Logger logger = LoggerFactory.getLogger(CachedChannel.class);

	/** Callback for each video of the uploads feed; throwing stops the enumeration */
	@FunctionalInterface
	public interface VideoVisitor {
		void visit(CachedChannel channel, Video video) throws Exception;
	}

	private final ChannelIdentity identity;
	private final String id;
	private final String name;
	private final String uploadsFeedId;
	private Set<String> seen;

	public CachedChannel(ChannelIdentity identity, String id, String name, String uploadsFeedId) {
		this.identity = identity;
		this.id = id;
		this.name = name;
		this.uploadsFeedId = uploadsFeedId;
	}

	/**
	 * Resolve a channel identity against the remote API.
	 *
	 * @throws AmbiguousIdentityException if the identity is empty or matches several channels
	 * @throws ChannelNotFoundException if no channel matches
	 * @throws ArchiverException if the API call fails
	 */
	public static CachedChannel resolve(YouTubeApi api, ChannelIdentity identity)
			throws ArchiverException, InterruptedException {
		if (identity.isEmpty()) {
			throw new AmbiguousIdentityException("caching channel: no identifying information for channel");
		}
		if (identity.identifierCount() > 1) {
			logger.warn(
					"Channel {} has more than one identifier, using the {} only", identity, identity.kind());
		}

		List<ChannelInfo> channels;
		try {
			channels = api.findChannels(identity);
		} catch (IOException e) {
			throw new ArchiverException("caching " + identity + ": list channel: " + e.getMessage(), e);
		}
		if (channels.isEmpty()) {
			throw new ChannelNotFoundException("caching " + identity + ": list channel: channel not found");
		}
		if (channels.size() > 1) {
			throw new AmbiguousIdentityException(
					"caching " + identity + ": list channel: " + channels.size() + " channels match");
		}

		ChannelInfo info = channels.get(0);
		return new CachedChannel(identity, info.id(), info.name(), info.uploadsFeedId());
	}

	/**
	 * Run the visitor on each archivable video of the uploads feed, in feed order. Upcoming and live
	 * videos are left out and will be looked at again on the next run.
	 *
	 * @throws EnumerationException if a page cannot be fetched, the first page is empty or the
	 *     visitor fails
	 */
	public void forEach(YouTubeApi api, VideoVisitor visitor) throws EnumerationException, InterruptedException {
		boolean fullHistory = seen == null;
		String pageToken = null;
		int page = 0;
		do {
			page++;
			try {
				PlaylistPage result = api.listPlaylistItems(uploadsFeedId, pageToken);
				if (result.items().isEmpty()) {
					if (page == 1) {
						throw new EmptyFeedException(uploadsFeedId);
					}
					break;
				}
				visitPage(api, result, visitor);
				pageToken = fullHistory && result.hasNextPage() ? result.nextPageToken() : null;
			} catch (InterruptedException e) {
				throw e;
			} catch (Exception e) {
				throw new EnumerationException(id, page, e);
			}
		} while (pageToken != null);
		logger.debug("[{}] Enumerated {} page(s) of {}", id, page, uploadsFeedId);
	}

	private void visitPage(YouTubeApi api, PlaylistPage page, VideoVisitor visitor) throws Exception {
		List<String> ids = page.items().stream().map(Video::videoId).toList();
		Map<String, LiveStatus> statuses;
		try {
			statuses = api.liveStatuses(ids);
		} catch (IOException e) {
			throw new IOException("check upcoming: " + e.getMessage(), e);
		}

		for (Video video : page.items()) {
			LiveStatus status = statuses.get(video.videoId());
			if (status != null && !status.isArchivable()) {
				logger.debug("[{}] Skipping {} video {}", id, status.name().toLowerCase(), video.videoId());
				continue;
			}
			visitor.visit(this, video);
		}
	}

	/** Whether the full history of this channel has been seen at least once */
	public boolean isHistoryKnown() {
		return seen != null;
	}

	public boolean hasSeen(String videoId) {
		return seen != null && seen.contains(videoId);
	}

	/**
	 * Mark the history as known, so that later enumerations only check the newest page. Called once
	 * the full history has been visited, whether or not anything was archived.
	 */
	public void markHistoryKnown() {
		if (seen == null) {
			seen = new HashSet<>();
		}
	}

	/** Record a video as archived or in flight; also marks the history as known */
	public void markSeen(String videoId) {
		markHistoryKnown();
		seen.add(videoId);
	}

	/** Forget a video so it is retried next run; does nothing if it is not in the seen set */
	public void unmarkSeen(String videoId) {
		if (seen != null) {
			seen.remove(videoId);
		}
	}

	/** Snapshot of the seen set, or null if the history is unknown */
	public Set<String> seen() {
		return seen == null ? null : Set.copyOf(seen);
	}

	public ChannelIdentity identity() {
		return identity;
	}

	public String id() {
		return id;
	}

	public String name() {
		return name;
	}

	public String uploadsFeedId() {
		return uploadsFeedId;
	}

	@Override
	public String toString() {
		return name;
	}
}
