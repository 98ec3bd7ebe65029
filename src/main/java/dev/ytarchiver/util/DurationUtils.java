package dev.ytarchiver.util;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parsing of human friendly durations such as {@code 90s}, {@code 15m}, {@code 6h} or {@code 1d} */
public class DurationUtils {
	private static final Pattern DURATION_PATTERN = Pattern.compile("^(\\d+)(ms|s|m|h|d)$");

	/**
	 * Parse a duration. Accepts a number followed by a unit (ms, s, m, h, d) or an ISO-8601 duration
	 * like {@code PT6H}.
	 *
	 * @throws IllegalArgumentException if the value is not a valid duration
	 */
	public static Duration parse(String value) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("Empty duration");
		}
		String trimmed = value.trim().toLowerCase(Locale.ROOT);
		Matcher matcher = DURATION_PATTERN.matcher(trimmed);
		if (matcher.matches()) {
			long amount = Long.parseLong(matcher.group(1));
			return switch (matcher.group(2)) {
				case "ms" -> Duration.ofMillis(amount);
				case "s" -> Duration.ofSeconds(amount);
				case "m" -> Duration.ofMinutes(amount);
				case "h" -> Duration.ofHours(amount);
				case "d" -> Duration.ofDays(amount);
				default -> throw new IllegalArgumentException("Invalid duration unit: " + value);
			};
		}
		try {
			return Duration.parse(value.trim().toUpperCase(Locale.ROOT));
		} catch (DateTimeParseException e) {
			throw new IllegalArgumentException("Invalid duration: " + value, e);
		}
	}
}
