package io.glossa.model;

import javax.annotation.Nonnull;

/**
 * Per-request translation options.
 *
 * @param maxChunks          0 for automatic strategy selection, 1 to 10 to force that many whole-document pieces
 * @param fallbackToGranular when true, a failed whole-document strategy is retried once segment by segment;
 *                           when false the failure is propagated to the caller
 */
public record TranslationOptions(int maxChunks, boolean fallbackToGranular) {

	/**
	 * Value of {@link #maxChunks()} meaning automatic selection.
	 */
	public static final int AUTOMATIC = 0;

	private static final TranslationOptions DEFAULTS = new TranslationOptions(AUTOMATIC, false);

	public TranslationOptions {
		if (maxChunks < AUTOMATIC || maxChunks > ChunkSplitter.MAX_PIECES) {
			throw new IllegalArgumentException(
				"maxChunks must be between 0 and " + ChunkSplitter.MAX_PIECES + ": " + maxChunks
			);
		}
	}

	/**
	 * Automatic strategy, failures propagated.
	 *
	 * @return default options
	 */
	@Nonnull
	public static TranslationOptions automatic() {
		return DEFAULTS;
	}

	/**
	 * Fixed number of whole-document pieces, failures propagated.
	 *
	 * @param maxChunks piece count (0 means automatic)
	 * @return options
	 */
	@Nonnull
	public static TranslationOptions withMaxChunks(int maxChunks) {
		return new TranslationOptions(maxChunks, false);
	}

	public boolean isAutomatic() {
		return this.maxChunks == AUTOMATIC;
	}
}
