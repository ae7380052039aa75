package io.glossa.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Outcome of one {@link TranslationJob}.
 *
 * @param job               the original job
 * @param translatedContent the translated markup (null if failed)
 * @param success           whether the translation succeeded
 * @param errorMessage      error message if translation failed (null if successful)
 * @param usage             tokens spent on this job
 * @param failedSegments    segments that kept their original text
 */
public record TranslationResult(
	@Nonnull TranslationJob job,
	@Nullable String translatedContent,
	boolean success,
	@Nullable String errorMessage,
	@Nonnull Usage usage,
	int failedSegments
) {

	/**
	 * Creates a successful translation result.
	 *
	 * @param job               the original job
	 * @param translatedContent the translated markup
	 * @param usage             tokens spent
	 * @param failedSegments    segments that kept their original text
	 * @return a successful TranslationResult
	 */
	@Nonnull
	public static TranslationResult success(
		@Nonnull TranslationJob job,
		@Nonnull String translatedContent,
		@Nonnull Usage usage,
		int failedSegments
	) {
		return new TranslationResult(job, translatedContent, true, null, usage, failedSegments);
	}

	/**
	 * Creates a failed translation result.
	 *
	 * @param job          the original job
	 * @param errorMessage the error message describing the failure
	 * @param usage        tokens spent before the failure
	 * @return a failed TranslationResult
	 */
	@Nonnull
	public static TranslationResult failure(
		@Nonnull TranslationJob job,
		@Nonnull String errorMessage,
		@Nonnull Usage usage
	) {
		return new TranslationResult(job, null, false, errorMessage, usage, 0);
	}

	/**
	 * Returns true when the translation succeeded but some segments kept their original text.
	 *
	 * @return true for a partially translated document
	 */
	public boolean isDegraded() {
		return this.success && this.failedSegments > 0;
	}
}
