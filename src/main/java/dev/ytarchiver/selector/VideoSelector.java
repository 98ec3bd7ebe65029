package dev.ytarchiver.selector;

import dev.ytarchiver.model.Video;
import java.util.List;

/**
 * A criterion for deciding if a given video should be archived. All configured selectors must
 * select a video before it is downloaded.
 */
public interface VideoSelector {

	/** Whether this selector selects the given video */
	boolean shouldSelect(Video video);

	/** Conjunction of all selectors; an empty list selects everything */
	static boolean allSelect(List<? extends VideoSelector> selectors, Video video) {
		for (VideoSelector selector : selectors) {
			if (!selector.shouldSelect(video)) {
				return false;
			}
		}
		return true;
	}
}
