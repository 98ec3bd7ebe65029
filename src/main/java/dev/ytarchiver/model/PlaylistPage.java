package dev.ytarchiver.model;

import java.util.List;

/** One page of playlist items; nextPageToken is null on the last page */
public record PlaylistPage(List<Video> items, String nextPageToken) {

	public boolean hasNextPage() {
		return nextPageToken != null && !nextPageToken.isEmpty();
	}
}
