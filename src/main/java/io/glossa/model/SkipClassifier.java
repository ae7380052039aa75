package io.glossa.model;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Decides whether a text segment needs translation at all.
 *
 * A segment is skipped only when its whole trimmed content matches one of the patterns; a pattern matching
 * part of a sentence does not count. The list is a heuristic allow-list and can be replaced through
 * {@link #SkipClassifier(List)}.
 */
public final class SkipClassifier {

	/**
	 * Patterns applied to the trimmed text.
	 */
	public static final List<Pattern> DEFAULT_PATTERNS = List.of(
		// digits and punctuation only
		Pattern.compile("^[0-9\\s\\u00A0\\u2007\\u202F\\-.,/:;()]*$"),
		// character references only, such as &nbsp;
		Pattern.compile("^(?:&(?:#[0-9]+|#[xX][0-9a-fA-F]+|[a-zA-Z][a-zA-Z0-9]*);|\\s)+$"),
		// bare URL
		Pattern.compile("^https?://\\S+$"),
		// JSON-like content
		Pattern.compile("^\\s*[{\\[].+[}\\]]\\s*$"),
		// constants such as API_KEY
		Pattern.compile("^[A-Z_][A-Z0-9_]*$"),
		// bare function call
		Pattern.compile("^[a-z_][a-z0-9_]*\\([^)]*\\)$"),
		// positional placeholder such as $1
		Pattern.compile("^\\$[0-9]+$"),
		// fenced code block
		Pattern.compile("^```[\\s\\S]*```$")
	);

	private final List<Pattern> patterns;

	public SkipClassifier() {
		this(DEFAULT_PATTERNS);
	}

	/**
	 * Creates a classifier with a custom pattern list.
	 *
	 * @param patterns patterns that must match the whole trimmed text
	 */
	public SkipClassifier(@Nonnull List<Pattern> patterns) {
		this.patterns = List.copyOf(Objects.requireNonNull(patterns, "patterns must not be null"));
	}

	/**
	 * Returns true when the text must be passed through untranslated.
	 *
	 * @param text raw text segment content
	 * @return true for blank or technical content
	 */
	public boolean shouldSkip(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		final String trimmed = TextNormalizer.strip(text);
		if (trimmed.isEmpty()) {
			return true;
		}
		for (final Pattern pattern : this.patterns) {
			if (pattern.matcher(trimmed).matches()) {
				return true;
			}
		}
		return false;
	}
}
