package io.glossa.model;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Cuts a markup string into a fixed number of contiguous pieces for separate translation.
 *
 * The algorithm:
 * 1. compute evenly spaced target offsets (`i * length / pieceCount`)
 * 2. move each target forward to just after the next `>` so no piece starts or ends inside a tag
 * 3. if no `>` follows, cut at the target offset itself
 *
 * Cut points never move backwards, so the pieces always concatenate to the input. When cut points collapse on
 * short input, some pieces are empty; the number of pieces is always exactly the requested count.
 */
public class ChunkSplitter {

	/**
	 * Largest supported piece count.
	 */
	public static final int MAX_PIECES = 10;

	/**
	 * Splits the content into exactly {@code pieceCount} chunks.
	 *
	 * @param content    the markup to split
	 * @param pieceCount number of pieces, 1 to {@link #MAX_PIECES}
	 * @return ordered chunks whose contents concatenate to {@code content}
	 */
	@Nonnull
	public List<DocumentChunk> split(@Nonnull String content, int pieceCount) {
		Objects.requireNonNull(content, "content must not be null");
		if (pieceCount < 1 || pieceCount > MAX_PIECES) {
			throw new IllegalArgumentException("pieceCount must be between 1 and " + MAX_PIECES + ": " + pieceCount);
		}

		final int length = content.length();
		final List<DocumentChunk> chunks = new ArrayList<>(pieceCount);
		int start = 0;

		for (int i = 1; i < pieceCount; i++) {
			final int target = (int) ((long) i * length / pieceCount);
			final int cut = Math.max(start, findSafeCut(content, target));
			chunks.add(new DocumentChunk(i - 1, start, cut, content.substring(start, cut)));
			start = cut;
		}
		chunks.add(new DocumentChunk(pieceCount - 1, start, length, content.substring(start)));
		return chunks;
	}

	/**
	 * Splits the content into chunk texts only.
	 *
	 * @param content    the markup to split
	 * @param pieceCount number of pieces
	 * @return ordered piece texts
	 */
	@Nonnull
	public List<String> splitToStrings(@Nonnull String content, int pieceCount) {
		final List<DocumentChunk> chunks = split(content, pieceCount);
		final List<String> result = new ArrayList<>(chunks.size());
		for (final DocumentChunk chunk : chunks) {
			result.add(chunk.content());
		}
		return result;
	}

	/**
	 * Finds the first offset at or after {@code target} that directly follows a `>`.
	 *
	 * @param content the markup
	 * @param target  preferred cut offset
	 * @return safe cut offset, or {@code target} when no tag end follows
	 */
	private static int findSafeCut(@Nonnull String content, int target) {
		if (target <= 0 || target >= content.length()) {
			return target;
		}
		if (content.charAt(target - 1) == '>') {
			return target;
		}
		final int tagEnd = content.indexOf('>', target);
		return tagEnd < 0 ? target : tagEnd + 1;
	}
}
