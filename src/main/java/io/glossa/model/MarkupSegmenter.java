package io.glossa.model;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits an HTML fragment into an ordered list of {@link Segment segments}.
 *
 * The scanner looks for, in priority order:
 * 1. complete `<script>` elements, which become {@link Segment.StructuredDataBlock}
 * 2. complete `<style>` elements and comments, kept whole as {@link Segment.Tag} so their content is never read as text
 * 3. any other tag, which becomes a {@link Segment.Tag}
 *
 * Everything between two matches becomes exactly one {@link Segment.Text}. Text is not split into sentences.
 * No characters are dropped: joining the raw segments gives back the input.
 */
public final class MarkupSegmenter {

	private static final Pattern MARKUP_PATTERN = Pattern.compile(
		"(<script\\b[^>]*>[\\s\\S]*?</script\\s*>)" +
			"|(<style\\b[^>]*>[\\s\\S]*?</style\\s*>|<!--[\\s\\S]*?-->|<[^>]*>)",
		Pattern.CASE_INSENSITIVE
	);

	/**
	 * Parses the markup into segments.
	 *
	 * @param markup the HTML fragment
	 * @return segments in document order, empty for empty input
	 */
	@Nonnull
	public List<Segment> segment(@Nonnull String markup) {
		Objects.requireNonNull(markup, "markup must not be null");

		final List<Segment> segments = new ArrayList<>();
		final Matcher matcher = MARKUP_PATTERN.matcher(markup);
		int lastEnd = 0;

		while (matcher.find()) {
			if (matcher.start() > lastEnd) {
				segments.add(new Segment.Text(segments.size(), markup.substring(lastEnd, matcher.start())));
			}
			if (matcher.group(1) != null) {
				segments.add(new Segment.StructuredDataBlock(segments.size(), matcher.group(1)));
			} else {
				segments.add(new Segment.Tag(segments.size(), matcher.group(2)));
			}
			lastEnd = matcher.end();
		}

		if (lastEnd < markup.length()) {
			segments.add(new Segment.Text(segments.size(), markup.substring(lastEnd)));
		}
		return segments;
	}

	/**
	 * Joins segment contents back into a document. The values must be given in segment order.
	 *
	 * @param parts final content of each segment
	 * @return the reassembled document
	 */
	@Nonnull
	public static String join(@Nonnull List<String> parts) {
		final StringBuilder sb = new StringBuilder();
		for (final String part : parts) {
			sb.append(part);
		}
		return sb.toString();
	}
}
