package io.glossa.model;

import javax.annotation.Nonnull;

/**
 * One ordered unit of a parsed markup document. Concatenating the {@link #raw()} values of all segments of a
 * document in index order reproduces the document exactly.
 */
public sealed interface Segment permits Segment.Text, Segment.Tag, Segment.StructuredDataBlock {

	/**
	 * Zero-based position of the segment in its document.
	 */
	int index();

	/**
	 * Exact source characters covered by the segment.
	 */
	@Nonnull
	String raw();

	/**
	 * A run of text between two tags. Never split further, so the translator sees whole paragraphs.
	 *
	 * @param index   position in the document
	 * @param content the text including its surrounding whitespace
	 */
	record Text(int index, @Nonnull String content) implements Segment {

		@Nonnull
		@Override
		public String raw() {
			return this.content;
		}

		/**
		 * Returns the text with surrounding whitespace removed, used as the cache key.
		 *
		 * @return trimmed content
		 */
		@Nonnull
		public String normalized() {
			return TextNormalizer.strip(this.content);
		}
	}

	/**
	 * Any markup tag (or style block). Always emitted verbatim.
	 *
	 * @param index  position in the document
	 * @param markup the raw tag
	 */
	record Tag(int index, @Nonnull String markup) implements Segment {

		@Nonnull
		@Override
		public String raw() {
			return this.markup;
		}
	}

	/**
	 * A complete `<script>...</script>` element, handled as one opaque unit whose JSON payload may be translated.
	 *
	 * @param index  position in the document
	 * @param markup the raw script element including its wrapper tags
	 */
	record StructuredDataBlock(int index, @Nonnull String markup) implements Segment {

		@Nonnull
		@Override
		public String raw() {
			return this.markup;
		}
	}
}
