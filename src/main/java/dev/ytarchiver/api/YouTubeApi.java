package dev.ytarchiver.api;

import dev.ytarchiver.model.ChannelIdentity;
import dev.ytarchiver.model.ChannelInfo;
import dev.ytarchiver.model.LiveStatus;
import dev.ytarchiver.model.PlaylistPage;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * The subset of the remote metadata API used by the archiver. Every call costs quota, so callers
 * are expected to batch and cache where they can.
 */
public interface YouTubeApi {

	/** Maximum number of items the API returns per page and accepts per batched lookup */
	int MAX_RESULTS = 50;

	/**
	 * Look up the channels matching an identity. Only the highest priority identifier is sent.
	 *
	 * @return The matching channels, empty when there is no such channel
	 */
	List<ChannelInfo> findChannels(ChannelIdentity identity) throws IOException, InterruptedException;

	/**
	 * Fetch a page of a playlist.
	 *
	 * @param playlistId The playlist, e.g. a channel's uploads feed
	 * @param pageToken The token of the page to fetch, null for the first page
	 */
	PlaylistPage listPlaylistItems(String playlistId, String pageToken) throws IOException, InterruptedException;

	/**
	 * Fetch the broadcast state of a batch of videos in a single call. Videos unknown to the API
	 * (deleted, private) are absent from the result.
	 */
	Map<String, LiveStatus> liveStatuses(List<String> videoIds) throws IOException, InterruptedException;
}
