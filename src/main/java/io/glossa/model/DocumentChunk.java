package io.glossa.model;

import javax.annotation.Nonnull;

/**
 * A contiguous slice of a document produced by {@link ChunkSplitter}.
 *
 * @param index       zero-based index of this chunk in the document
 * @param startOffset character offset where this chunk starts in the original content
 * @param endOffset   character offset where this chunk ends in the original content (exclusive)
 * @param content     the slice itself
 */
public record DocumentChunk(
	int index,
	int startOffset,
	int endOffset,
	@Nonnull String content
) {

	public DocumentChunk {
		if (index < 0) {
			throw new IllegalArgumentException("index must be non-negative");
		}
		if (startOffset < 0) {
			throw new IllegalArgumentException("startOffset must be non-negative");
		}
		if (endOffset < startOffset) {
			throw new IllegalArgumentException("endOffset must be >= startOffset");
		}
		if (content == null) {
			throw new IllegalArgumentException("content must not be null");
		}
		if (content.length() != endOffset - startOffset) {
			throw new IllegalArgumentException("content length must match the offsets");
		}
	}

	/**
	 * Returns whether the chunk holds nothing but whitespace.
	 *
	 * @return true for empty or whitespace-only chunks
	 */
	public boolean isBlank() {
		return this.content.isBlank();
	}
}
