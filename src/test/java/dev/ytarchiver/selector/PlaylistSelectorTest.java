package dev.ytarchiver.selector;

import static dev.ytarchiver.api.FakeYouTubeApi.video;
import static org.assertj.core.api.Assertions.*;

import dev.ytarchiver.api.FakeYouTubeApi;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PlaylistSelectorTest {

	private FakeYouTubeApi api;
	private MutableClock clock;

	@BeforeEach
	void setUp() {
		api = new FakeYouTubeApi();
		clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
	}

	@Test
	void testSelectsPlaylistMembersAcrossPages() {
		// Given
		api.addPlaylist("PL1", List.of(video("v1", "UC1")), List.of(video("v2", "UC1")));
		PlaylistSelector selector = new PlaylistSelector(api, "PL1", clock);

		// When / Then
		assertThat(selector.shouldSelect(video("v2", "UC1"))).isTrue();
		assertThat(selector.shouldSelect(video("v1", "UC1"))).isTrue();
		assertThat(selector.shouldSelect(video("v3", "UC1"))).isFalse();
		assertThat(api.playlistRequests()).containsExactly("PL1#1", "PL1#2");
	}

	@Test
	void testMembersAreReloadedWhenStale() {
		// Given
		api.addPlaylist("PL1", List.of(video("v1", "UC1")));
		PlaylistSelector selector = new PlaylistSelector(api, "PL1", clock);
		selector.shouldSelect(video("v1", "UC1"));

		// When
		clock.advance(Duration.ofHours(23));
		selector.shouldSelect(video("v1", "UC1"));

		// Then
		assertThat(api.playlistRequests()).hasSize(1);

		// When
		api.addPlaylist("PL1", List.of(video("v1", "UC1"), video("v2", "UC1")));
		clock.advance(Duration.ofHours(2));

		// Then
		assertThat(selector.shouldSelect(video("v2", "UC1"))).isTrue();
		assertThat(api.playlistRequests()).hasSize(2);
	}

	@Test
	void testLoadFailureSelectsNothing() {
		// Given
		api.addPlaylist("PL1", List.of(video("v1", "UC1")));
		api.failPage("PL1", 1, new IOException("forbidden"));
		PlaylistSelector selector = new PlaylistSelector(api, "PL1", clock);

		// When / Then
		assertThat(selector.shouldSelect(video("v1", "UC1"))).isFalse();
	}

	/** Clock that only moves when told to */
	private static class MutableClock extends Clock {
		private Instant now;

		MutableClock(Instant now) {
			this.now = now;
		}

		void advance(Duration duration) {
			now = now.plus(duration);
		}

		@Override
		public ZoneId getZone() {
			return ZoneOffset.UTC;
		}

		@Override
		public Clock withZone(ZoneId zone) {
			return this;
		}

		@Override
		public Instant instant() {
			return now;
		}
	}
}
