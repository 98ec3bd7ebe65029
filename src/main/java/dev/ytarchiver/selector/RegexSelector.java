package dev.ytarchiver.selector;

import dev.ytarchiver.model.Video;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Selects videos whose title or description contains a match for a regular expression */
public class RegexSelector implements VideoSelector {

	public enum Field {
		TITLE,
		DESCRIPTION
	}

	private final Field field;
	private final Pattern pattern;

	public RegexSelector(Field field, String regex) throws InvalidPatternException {
		this.field = field;
		try {
			this.pattern = Pattern.compile(regex);
		} catch (PatternSyntaxException e) {
			throw new InvalidPatternException(regex, e);
		}
	}

	@Override
	public boolean shouldSelect(Video video) {
		String value = switch (field) {
			case TITLE -> video.title();
			case DESCRIPTION -> video.description();
		};
		return pattern.matcher(value != null ? value : "").find();
	}

	public Field field() {
		return field;
	}

	public String pattern() {
		return pattern.pattern();
	}

	@Override
	public String toString() {
		return "regex(" + field.name().toLowerCase() + " ~ " + pattern.pattern() + ")";
	}
}
