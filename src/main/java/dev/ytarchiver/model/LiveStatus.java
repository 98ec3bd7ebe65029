package dev.ytarchiver.model;

import java.util.Locale;

/** Broadcast state of a video, as reported by the remote API */
public enum LiveStatus {
	NONE,
	UPCOMING,
	LIVE,
	COMPLETED,
	UNKNOWN;

	/** Only finished or never-live videos can be downloaded */
	public boolean isArchivable() {
		return this == NONE || this == COMPLETED;
	}

	public static LiveStatus parse(String value) {
		if (value == null) {
			return UNKNOWN;
		}
		return switch (value.toLowerCase(Locale.ROOT)) {
			case "none" -> NONE;
			case "upcoming" -> UPCOMING;
			case "live" -> LIVE;
			case "completed" -> COMPLETED;
			default -> UNKNOWN;
		};
	}
}
