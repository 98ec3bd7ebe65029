package dev.ytarchiver.selector;

import dev.ytarchiver.model.Video;
import java.util.Collection;
import java.util.Set;

/** Selects only videos with one of a fixed set of IDs */
public class IdSelector implements VideoSelector {
	private final Set<String> ids;

	public IdSelector(Collection<String> ids) {
		this.ids = Set.copyOf(ids);
	}

	@Override
	public boolean shouldSelect(Video video) {
		return video != null && video.videoId() != null && ids.contains(video.videoId());
	}

	@Override
	public String toString() {
		return "ids(" + ids.size() + ")";
	}
}
