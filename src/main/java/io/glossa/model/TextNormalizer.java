package io.glossa.model;

import javax.annotation.Nonnull;

/**
 * Whitespace handling shared by segment classification, the segment cache and whitespace re-application.
 *
 * Besides what {@link Character#isWhitespace(char)} accepts, the no-break spaces (U+00A0, U+2007, U+202F) and the
 * byte order mark (U+FEFF) count as whitespace, since HTML text uses them as padding.
 */
public final class TextNormalizer {

	private TextNormalizer() {
		// utility class
	}

	/**
	 * Returns true for characters treated as whitespace around text.
	 *
	 * @param c character to test
	 * @return true for Java whitespace, no-break spaces and the byte order mark
	 */
	public static boolean isSpace(char c) {
		return Character.isWhitespace(c) || c == '\u00A0' || c == '\u2007' || c == '\u202F' || c == '\uFEFF';
	}

	/**
	 * Index of the first non-whitespace character, or the text length when there is none.
	 */
	public static int contentStart(@Nonnull String text) {
		int start = 0;
		while (start < text.length() && isSpace(text.charAt(start))) {
			start++;
		}
		return start;
	}

	/**
	 * Index just after the last non-whitespace character at or after `from`.
	 */
	public static int contentEnd(@Nonnull String text, int from) {
		int end = text.length();
		while (end > from && isSpace(text.charAt(end - 1))) {
			end--;
		}
		return end;
	}

	/**
	 * Removes leading and trailing whitespace.
	 *
	 * @param text text to strip
	 * @return stripped text, empty when the text holds only whitespace
	 */
	@Nonnull
	public static String strip(@Nonnull String text) {
		final int start = contentStart(text);
		return text.substring(start, contentEnd(text, start));
	}

	public static boolean isBlank(@Nonnull String text) {
		return contentStart(text) == text.length();
	}
}
