package io.glossa.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MarkupSegmenter should split HTML into ordered segments")
public class MarkupSegmenterTest {

	private final MarkupSegmenter segmenter = new MarkupSegmenter();

	private static String rejoin(List<Segment> segments) {
		final List<String> raw = new ArrayList<>();
		for (final Segment segment : segments) {
			raw.add(segment.raw());
		}
		return MarkupSegmenter.join(raw);
	}

	@Test
	@DisplayName("shouldSplitTagsAndText")
	void shouldSplitTagsAndText() {
		final List<Segment> segments = segmenter.segment("<p class=\"x\">Hello <b>world</b></p>");

		assertEquals(
			List.of(
				new Segment.Tag(0, "<p class=\"x\">"),
				new Segment.Text(1, "Hello "),
				new Segment.Tag(2, "<b>"),
				new Segment.Text(3, "world"),
				new Segment.Tag(4, "</b>"),
				new Segment.Tag(5, "</p>")
			),
			segments
		);
	}

	@Test
	@DisplayName("shouldKeepScriptBlockWhole")
	void shouldKeepScriptBlockWhole() {
		final String script = "<script type=\"application/ld+json\">{\"name\": \"<b>x</b>\"}</script>";
		final List<Segment> segments = segmenter.segment("<p>A</p>" + script);

		assertEquals(4, segments.size());
		assertEquals(new Segment.StructuredDataBlock(3, script), segments.get(3));
	}

	@Test
	@DisplayName("shouldKeepStyleAndCommentsAsTags")
	void shouldKeepStyleAndCommentsAsTags() {
		final List<Segment> segments = segmenter.segment("<style>p > a { color: red }</style><!-- a > b -->Text");

		assertEquals(
			List.of(
				new Segment.Tag(0, "<style>p > a { color: red }</style>"),
				new Segment.Tag(1, "<!-- a > b -->"),
				new Segment.Text(2, "Text")
			),
			segments
		);
	}

	@Test
	@DisplayName("shouldMatchScriptCaseInsensitively")
	void shouldMatchScriptCaseInsensitively() {
		final List<Segment> segments = segmenter.segment("<SCRIPT>var a = 1 < 2;</SCRIPT>");

		assertEquals(1, segments.size());
		assertInstanceOf(Segment.StructuredDataBlock.class, segments.get(0));
	}

	@Test
	@DisplayName("shouldNotSplitTextIntoSentences")
	void shouldNotSplitTextIntoSentences() {
		final List<Segment> segments = segmenter.segment("<p>One sentence. Another one! A third?</p>");

		assertEquals(new Segment.Text(1, "One sentence. Another one! A third?"), segments.get(1));
	}

	@Test
	@DisplayName("shouldKeepWhitespaceOnlyText")
	void shouldKeepWhitespaceOnlyText() {
		final List<Segment> segments = segmenter.segment("<ul>\n  <li>x</li>\n</ul>");

		assertEquals(new Segment.Text(1, "\n  "), segments.get(1));
		assertEquals("x", ((Segment.Text) segments.get(3)).normalized());
	}

	@Test
	@DisplayName("shouldReproduceInputWhenJoined")
	void shouldReproduceInputWhenJoined() {
		final String markup = "  lead <div id=a>x<br/>y<script>{}</script><!--c--></div> tail <unclosed";

		assertEquals(markup, rejoin(segmenter.segment(markup)));
	}

	@Test
	@DisplayName("shouldReturnEmptyListForEmptyInput")
	void shouldReturnEmptyListForEmptyInput() {
		assertTrue(segmenter.segment("").isEmpty());
	}
}
