package dev.ytarchiver.archiver;

import static dev.ytarchiver.api.FakeYouTubeApi.video;
import static org.assertj.core.api.Assertions.*;

import dev.ytarchiver.api.FakeYouTubeApi;
import dev.ytarchiver.model.ChannelIdentity;
import dev.ytarchiver.model.ChannelInfo;
import dev.ytarchiver.model.LiveStatus;
import dev.ytarchiver.model.Video;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CachedChannelTest {

	private static final String CHANNEL = "UC123";
	private static final String FEED = "UU123";

	private FakeYouTubeApi api;
	private CachedChannel channel;
	private List<String> visited;

	@BeforeEach
	void setUp() {
		api = new FakeYouTubeApi();
		channel = new CachedChannel(ChannelIdentity.ofId(CHANNEL), CHANNEL, "Test Channel", FEED);
		visited = new ArrayList<>();
	}

	@Test
	void testUnknownHistoryWalksEveryPage() throws Exception {
		// Given
		api.addPlaylist(
				FEED,
				List.of(video("v1", CHANNEL), video("v2", CHANNEL)),
				List.of(video("v3", CHANNEL)),
				List.of(video("v4", CHANNEL)));

		// When
		channel.forEach(api, (c, v) -> visited.add(v.videoId()));

		// Then
		assertThat(visited).containsExactly("v1", "v2", "v3", "v4");
		assertThat(api.playlistRequests()).containsExactly(FEED + "#1", FEED + "#2", FEED + "#3");
		assertThat(api.statusRequests()).isEqualTo(3);
	}

	@Test
	void testKnownHistoryOnlyChecksFirstPage() throws Exception {
		// Given
		api.addPlaylist(FEED, List.of(video("v1", CHANNEL)), List.of(video("v2", CHANNEL)));
		channel.markSeen("v0");

		// When
		channel.forEach(api, (c, v) -> visited.add(v.videoId()));

		// Then
		assertThat(visited).containsExactly("v1");
		assertThat(api.playlistRequests()).containsExactly(FEED + "#1");
	}

	@Test
	void testEmptySeenSetStillCountsAsKnownHistory() throws Exception {
		// Given
		api.addPlaylist(FEED, List.of(video("v1", CHANNEL)), List.of(video("v2", CHANNEL)));
		channel.markSeen("v1");
		channel.unmarkSeen("v1");

		// When
		channel.forEach(api, (c, v) -> visited.add(v.videoId()));

		// Then
		assertThat(channel.isHistoryKnown()).isTrue();
		assertThat(channel.seen()).isEmpty();
		assertThat(visited).containsExactly("v1");
	}

	@Test
	void testUpcomingAndLiveVideosAreLeftOut() throws Exception {
		// Given
		api.addPlaylist(
				FEED,
				List.of(
						video("upcoming", CHANNEL),
						video("live", CHANNEL),
						video("done", CHANNEL),
						video("vod", CHANNEL),
						video("odd", CHANNEL)));
		api.setStatus("upcoming", LiveStatus.UPCOMING)
				.setStatus("live", LiveStatus.LIVE)
				.setStatus("done", LiveStatus.COMPLETED)
				.setStatus("odd", LiveStatus.UNKNOWN);

		// When
		channel.forEach(api, (c, v) -> visited.add(v.videoId()));

		// Then
		assertThat(visited).containsExactly("done", "vod");
		assertThat(api.statusRequests()).isEqualTo(1);
	}

	@Test
	void testVideoMissingFromStatusResponseIsVisited() throws Exception {
		// Given
		api.addPlaylist(FEED, List.of(video("gone", CHANNEL)));
		api.setUnknown("gone");

		// When
		channel.forEach(api, (c, v) -> visited.add(v.videoId()));

		// Then
		assertThat(visited).containsExactly("gone");
	}

	@Test
	void testEmptyFirstPageFails() {
		// Given
		api.addPlaylist(FEED, List.of());

		// When / Then
		assertThatThrownBy(() -> channel.forEach(api, (c, v) -> visited.add(v.videoId())))
				.isInstanceOf(EnumerationException.class)
				.hasCauseInstanceOf(EmptyFeedException.class)
				.hasMessageContaining("no results returned for feed " + FEED);
		assertThat(visited).isEmpty();
	}

	@Test
	void testEmptyLaterPageEndsEnumeration() throws Exception {
		// Given
		api.addPlaylist(FEED, List.of(video("v1", CHANNEL)), List.of(), List.of(video("v3", CHANNEL)));

		// When
		channel.forEach(api, (c, v) -> visited.add(v.videoId()));

		// Then
		assertThat(visited).containsExactly("v1");
		assertThat(api.playlistRequests()).containsExactly(FEED + "#1", FEED + "#2");
	}

	@Test
	void testVisitorErrorStopsEnumeration() {
		// Given
		api.addPlaylist(FEED, List.of(video("v1", CHANNEL), video("v2", CHANNEL)), List.of(video("v3", CHANNEL)));

		// When / Then
		assertThatThrownBy(() -> channel.forEach(api, (c, v) -> {
					visited.add(v.videoId());
					throw new IllegalStateException("boom");
				}))
				.isInstanceOf(EnumerationException.class)
				.hasMessageContaining("boom");
		assertThat(visited).containsExactly("v1");
		assertThat(api.playlistRequests()).containsExactly(FEED + "#1");
	}

	@Test
	void testPageFailureReportsPageNumber() {
		// Given
		api.addPlaylist(FEED, List.of(video("v1", CHANNEL)), List.of(video("v2", CHANNEL)));
		api.failPage(FEED, 2, new IOException("quota exceeded"));

		// When / Then
		assertThatThrownBy(() -> channel.forEach(api, (c, v) -> visited.add(v.videoId())))
				.isInstanceOfSatisfying(EnumerationException.class, e -> {
					assertThat(e.page()).isEqualTo(2);
					assertThat(e.channelId()).isEqualTo(CHANNEL);
				})
				.hasMessageContaining("quota exceeded");
		assertThat(visited).containsExactly("v1");
	}

	@Test
	void testStatusFailureIsReportedAsUpcomingCheck() {
		// Given
		api.addPlaylist(FEED, List.of(video("v1", CHANNEL)));
		api.failStatuses(new IOException("backend error"));

		// When / Then
		assertThatThrownBy(() -> channel.forEach(api, (c, v) -> visited.add(v.videoId())))
				.isInstanceOf(EnumerationException.class)
				.hasMessageContaining("check upcoming: backend error");
		assertThat(visited).isEmpty();
	}

	@Test
	void testSeenSetLifecycle() {
		// Given
		assertThat(channel.isHistoryKnown()).isFalse();
		assertThat(channel.seen()).isNull();

		// When
		channel.unmarkSeen("v1");
		channel.markSeen("v1");
		channel.markSeen("v2");
		channel.unmarkSeen("v2");

		// Then
		assertThat(channel.isHistoryKnown()).isTrue();
		assertThat(channel.hasSeen("v1")).isTrue();
		assertThat(channel.hasSeen("v2")).isFalse();
		assertThat(channel.seen()).containsExactly("v1");
	}

	@Test
	void testMarkHistoryKnownWithoutVideos() {
		// When
		channel.markHistoryKnown();
		channel.markHistoryKnown();

		// Then
		assertThat(channel.isHistoryKnown()).isTrue();
		assertThat(channel.seen()).isEmpty();
	}

	@Test
	void testResolve() throws Exception {
		// Given
		api.addChannel("@someone", new ChannelInfo(CHANNEL, "Someone", FEED));

		// When
		CachedChannel resolved = CachedChannel.resolve(api, ChannelIdentity.ofHandle("@someone"));

		// Then
		assertThat(resolved.id()).isEqualTo(CHANNEL);
		assertThat(resolved.name()).isEqualTo("Someone");
		assertThat(resolved.uploadsFeedId()).isEqualTo(FEED);
		assertThat(resolved.identity()).isEqualTo(ChannelIdentity.ofHandle("@someone"));
		assertThat(resolved.isHistoryKnown()).isFalse();
	}

	@Test
	void testResolveUsesHighestPriorityIdentifier() throws Exception {
		// Given
		api.addChannel(CHANNEL, "By ID", FEED);
		api.addChannel("@someone", new ChannelInfo("UCother", "By handle", "UUother"));

		// When
		CachedChannel resolved = CachedChannel.resolve(api, new ChannelIdentity(CHANNEL, "@someone", null));

		// Then
		assertThat(resolved.name()).isEqualTo("By ID");
	}

	@Test
	void testResolveEmptyIdentity() {
		assertThatThrownBy(() -> CachedChannel.resolve(api, new ChannelIdentity(null, " ", null)))
				.isInstanceOf(AmbiguousIdentityException.class);
		assertThat(api.channelRequests()).isZero();
	}

	@Test
	void testResolveNotFound() {
		assertThatThrownBy(() -> CachedChannel.resolve(api, ChannelIdentity.ofUsername("nobody")))
				.isInstanceOf(ChannelNotFoundException.class)
				.hasMessageContaining("nobody");
	}

	@Test
	void testResolveSeveralMatches() {
		// Given
		api.addChannel(CHANNEL, "First", FEED);
		api.addChannel(CHANNEL, "Second", "UU456");

		// When / Then
		assertThatThrownBy(() -> CachedChannel.resolve(api, ChannelIdentity.ofId(CHANNEL)))
				.isInstanceOf(AmbiguousIdentityException.class);
	}

	@Test
	void testVisitorSeesChannel() throws Exception {
		// Given
		api.addPlaylist(FEED, List.of(video("v1", CHANNEL)));
		List<Video> videos = new ArrayList<>();

		// When
		channel.forEach(api, (c, v) -> {
			assertThat(c).isSameAs(channel);
			videos.add(v);
		});

		// Then
		assertThat(videos).extracting(Video::title).containsExactly("Video v1");
	}
}
