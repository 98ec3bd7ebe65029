package dev.ytarchiver.selector;

import dev.ytarchiver.api.YouTubeApi;
import dev.ytarchiver.model.PlaylistPage;
import dev.ytarchiver.model.Video;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects only videos that are members of a playlist. The membership list is fetched on first use
 * and re-fetched once it is older than {@link #STALE_AFTER}, so the API is hit at most once a day
 * per selector.
 */
public class PlaylistSelector implements VideoSelector {
	public static final Duration STALE_AFTER = Duration.ofHours(24);

	private static final Logger logger = LoggerFactory.getLogger(PlaylistSelector.class);

	private final YouTubeApi api;
	private final String playlistId;
	private final Clock clock;

	private Set<String> members;
	private Instant loadedAt;

	public PlaylistSelector(YouTubeApi api, String playlistId) {
		this(api, playlistId, Clock.systemUTC());
	}

	public PlaylistSelector(YouTubeApi api, String playlistId, Clock clock) {
		this.api = api;
		this.playlistId = playlistId;
		this.clock = clock;
	}

	@Override
	public boolean shouldSelect(Video video) {
		if (needsLoad()) {
			try {
				members = loadMembers();
				loadedAt = clock.instant();
			} catch (IOException e) {
				logger.warn("Failed to load playlist {}, not selecting {}: {}", playlistId, video.videoId(), e.getMessage());
				return false;
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return false;
			}
		}
		return members.contains(video.videoId());
	}

	private boolean needsLoad() {
		return members == null || loadedAt == null || Duration.between(loadedAt, clock.instant()).compareTo(STALE_AFTER) > 0;
	}

	private Set<String> loadMembers() throws IOException, InterruptedException {
		Set<String> ids = new HashSet<>();
		String pageToken = null;
		do {
			PlaylistPage page = api.listPlaylistItems(playlistId, pageToken);
			for (Video item : page.items()) {
				ids.add(item.videoId());
			}
			pageToken = page.hasNextPage() ? page.nextPageToken() : null;
		} while (pageToken != null);
		logger.debug("Loaded {} members of playlist {}", ids.size(), playlistId);
		return ids;
	}

	public String playlistId() {
		return playlistId;
	}

	@Override
	public String toString() {
		return "playlist(" + playlistId + ")";
	}
}
