package dev.ytarchiver.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.ytarchiver.api.YouTubeApi;
import dev.ytarchiver.selector.IdSelector;
import dev.ytarchiver.selector.InvalidPatternException;
import dev.ytarchiver.selector.PlaylistSelector;
import dev.ytarchiver.selector.RegexSelector;
import dev.ytarchiver.selector.VideoSelector;
import java.util.List;
import java.util.Locale;

/**
 * A selector entry of the configuration file. Exactly one of the fields is expected to be set; the
 * first one set wins, and an entry without any is ignored.
 */
public record SelectorConfig(
		@JsonProperty("regex") RegexConfig regex,
		@JsonProperty("playlist") String playlist,
		@JsonProperty("videos") List<String> videos) {

	/** Regex selector entry; type is "title" or "description" */
	public record RegexConfig(@JsonProperty("type") String type, @JsonProperty("pattern") String pattern) {}

	/**
	 * Convert to a selector.
	 *
	 * @return The selector, or null if the entry is empty
	 * @throws ConfigException if the regex type is unknown
	 * @throws InvalidPatternException if the regex does not compile
	 */
	public VideoSelector toSelector(YouTubeApi api) throws ConfigException, InvalidPatternException {
		if (regex != null && regex.pattern() != null && !regex.pattern().isEmpty()) {
			return new RegexSelector(field(regex.type()), regex.pattern());
		}
		if (playlist != null && !playlist.isBlank()) {
			return new PlaylistSelector(api, playlist);
		}
		if (videos != null && !videos.isEmpty()) {
			return new IdSelector(videos);
		}
		return null;
	}

	private static RegexSelector.Field field(String type) throws ConfigException {
		if (type != null) {
			switch (type.toLowerCase(Locale.ROOT)) {
				case "title":
					return RegexSelector.Field.TITLE;
				case "description":
					return RegexSelector.Field.DESCRIPTION;
				default:
					break;
			}
		}
		throw new ConfigException(
				"regex selector: invalid match type '" + type + "' (want 'title' or 'description')");
	}
}
