package dev.ytarchiver.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.ytarchiver.model.ChannelIdentity;
import dev.ytarchiver.model.ChannelInfo;
import dev.ytarchiver.model.LiveStatus;
import dev.ytarchiver.model.PlaylistPage;
import dev.ytarchiver.model.Video;
import dev.ytarchiver.util.HttpUtils;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link YouTubeApi} backed by the public YouTube Data API v3, authenticated with an API key */
public class YouTubeDataApi implements YouTubeApi {
	public static final String DEFAULT_BASE_URL = "https://www.googleapis.com/youtube/v3";

	private static final Logger logger = LoggerFactory.getLogger(YouTubeDataApi.class);

	private final String baseUrl;
	private final String apiKey;
	private final HttpUtils httpUtils;
	private final ObjectMapper objectMapper = new ObjectMapper();

	public YouTubeDataApi(String apiKey) {
		this(DEFAULT_BASE_URL, apiKey, new HttpUtils());
	}

	public YouTubeDataApi(String baseUrl, String apiKey, HttpUtils httpUtils) {
		this.baseUrl = baseUrl;
		this.apiKey = apiKey;
		this.httpUtils = httpUtils;
	}

	@Override
	public List<ChannelInfo> findChannels(ChannelIdentity identity) throws IOException, InterruptedException {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("part", "id,snippet,contentDetails");
		switch (identity.kind()) {
			case ID -> params.put("id", identity.id());
			case HANDLE -> params.put("forHandle", identity.handle());
			case USERNAME -> params.put("forUsername", identity.username());
		}
		JsonNode root = get("channels", params);

		List<ChannelInfo> channels = new ArrayList<>();
		for (JsonNode item : items(root)) {
			channels.add(new ChannelInfo(
					text(item, "id"),
					text(item.path("snippet"), "title"),
					text(item.path("contentDetails").path("relatedPlaylists"), "uploads")));
		}
		return channels;
	}

	@Override
	public PlaylistPage listPlaylistItems(String playlistId, String pageToken)
			throws IOException, InterruptedException {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("part", "contentDetails,snippet");
		params.put("playlistId", playlistId);
		params.put("maxResults", String.valueOf(MAX_RESULTS));
		params.put("pageToken", pageToken);
		JsonNode root = get("playlistItems", params);

		List<Video> videos = new ArrayList<>();
		for (JsonNode item : items(root)) {
			JsonNode snippet = item.path("snippet");
			String videoId = text(item.path("contentDetails"), "videoId");
			if (videoId == null) {
				videoId = text(snippet.path("resourceId"), "videoId");
			}
			if (videoId == null) {
				logger.debug("Ignoring playlist item without video ID in {}", playlistId);
				continue;
			}
			videos.add(new Video(
					videoId, text(snippet, "channelId"), text(snippet, "title"), text(snippet, "description")));
		}
		return new PlaylistPage(videos, text(root, "nextPageToken"));
	}

	@Override
	public Map<String, LiveStatus> liveStatuses(List<String> videoIds) throws IOException, InterruptedException {
		Map<String, LiveStatus> statuses = new LinkedHashMap<>();
		if (videoIds.isEmpty()) {
			return statuses;
		}
		Map<String, String> params = new LinkedHashMap<>();
		params.put("part", "snippet");
		params.put("id", String.join(",", videoIds));
		params.put("maxResults", String.valueOf(MAX_RESULTS));
		JsonNode root = get("videos", params);

		for (JsonNode item : items(root)) {
			String id = text(item, "id");
			if (id != null) {
				statuses.put(id, LiveStatus.parse(text(item.path("snippet"), "liveBroadcastContent")));
			}
		}
		return statuses;
	}

	private JsonNode get(String resource, Map<String, String> params) throws IOException, InterruptedException {
		params.put("key", apiKey);
		String url = HttpUtils.url(baseUrl + "/" + resource, params);
		logger.trace("GET {}", resource);
		return objectMapper.readTree(httpUtils.downloadString(url));
	}

	private static Iterable<JsonNode> items(JsonNode root) {
		JsonNode items = root.path("items");
		return items.isArray() ? items : List.<JsonNode>of();
	}

	private static String text(JsonNode node, String field) {
		JsonNode value = node.get(field);
		return value == null || value.isNull() ? null : value.asText();
	}
}
