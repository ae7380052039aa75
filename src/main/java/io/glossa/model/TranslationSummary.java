package io.glossa.model;

import javax.annotation.Nonnull;

/**
 * Summary statistics for a translation batch.
 *
 * @param successCount  number of translated files, degraded ones included
 * @param failedCount   number of files that failed to translate
 * @param skippedCount  number of files skipped
 * @param degradedCount number of translated files with untranslated segments
 * @param inputTokens   total number of input tokens
 * @param outputTokens  total number of output tokens
 */
public record TranslationSummary(
	int successCount,
	int failedCount,
	int skippedCount,
	int degradedCount,
	long inputTokens,
	long outputTokens
) {

	@Nonnull
	public static TranslationSummary empty() {
		return new TranslationSummary(0, 0, 0, 0, 0, 0);
	}

	public int getTotalCount() {
		return this.successCount + this.failedCount + this.skippedCount;
	}

	public boolean hasFailures() {
		return this.failedCount > 0;
	}

	/**
	 * Creates a new summary with an incremented success count.
	 *
	 * @param usage    tokens spent on the translation
	 * @param degraded whether some segments kept their original text
	 * @return a new TranslationSummary with updated counts
	 */
	@Nonnull
	public TranslationSummary withSuccess(@Nonnull Usage usage, boolean degraded) {
		return new TranslationSummary(
			this.successCount + 1,
			this.failedCount,
			this.skippedCount,
			this.degradedCount + (degraded ? 1 : 0),
			this.inputTokens + usage.input(),
			this.outputTokens + usage.output()
		);
	}

	/**
	 * Creates a new summary with an incremented failure count. Tokens spent before the failure still count.
	 *
	 * @param usage tokens spent before the failure
	 * @return a new TranslationSummary with updated counts
	 */
	@Nonnull
	public TranslationSummary withFailure(@Nonnull Usage usage) {
		return new TranslationSummary(
			this.successCount,
			this.failedCount + 1,
			this.skippedCount,
			this.degradedCount,
			this.inputTokens + usage.input(),
			this.outputTokens + usage.output()
		);
	}

	@Nonnull
	public TranslationSummary withSkipped() {
		return new TranslationSummary(
			this.successCount,
			this.failedCount,
			this.skippedCount + 1,
			this.degradedCount,
			this.inputTokens,
			this.outputTokens
		);
	}

	@Override
	public String toString() {
		return String.format(
			"TranslationSummary[success=%d, failed=%d, skipped=%d, degraded=%d, tokens=%d/%d]",
			this.successCount, this.failedCount, this.skippedCount, this.degradedCount,
			this.inputTokens, this.outputTokens
		);
	}
}
