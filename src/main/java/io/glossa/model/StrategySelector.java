package io.glossa.model;

import io.glossa.jsonld.StructuredDataWalker;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Chooses how a document is translated, based on its estimated token size and the caller's chunk override.
 *
 * With a manual override of 1 the document always goes out in one call; with n &gt; 1 it is cut into n pieces.
 * Without override, documents up to the single-call threshold T go out in one call, documents up to 2T in two
 * pieces, and anything larger is translated segment by segment so no single oversized call is ever issued.
 */
public class StrategySelector {

	/**
	 * Default single-call threshold in estimated tokens.
	 */
	public static final int DEFAULT_SINGLE_CALL_THRESHOLD = 15_000;

	private final long singleCallThreshold;
	@Nonnull
	private final MarkupSegmenter segmenter;
	@Nonnull
	private final SkipClassifier skipClassifier;
	@Nonnull
	private final StructuredDataWalker structuredDataWalker = new StructuredDataWalker();

	public StrategySelector() {
		this(DEFAULT_SINGLE_CALL_THRESHOLD);
	}

	/**
	 * Creates a selector with a custom threshold.
	 *
	 * @param singleCallThreshold largest estimated token count sent in a single call
	 */
	public StrategySelector(long singleCallThreshold) {
		this(singleCallThreshold, new MarkupSegmenter(), new SkipClassifier());
	}

	/**
	 * Creates a selector sharing the translator's segmenter and skip rules.
	 *
	 * @param singleCallThreshold largest estimated token count sent in a single call
	 * @param segmenter           segmenter used to look for translatable content
	 * @param skipClassifier      skip rules used to look for translatable content
	 */
	public StrategySelector(
		long singleCallThreshold,
		@Nonnull MarkupSegmenter segmenter,
		@Nonnull SkipClassifier skipClassifier
	) {
		if (singleCallThreshold <= 0) {
			throw new IllegalArgumentException("singleCallThreshold must be positive");
		}
		this.singleCallThreshold = singleCallThreshold;
		this.segmenter = Objects.requireNonNull(segmenter, "segmenter must not be null");
		this.skipClassifier = Objects.requireNonNull(skipClassifier, "skipClassifier must not be null");
	}

	/**
	 * Selects the strategy for the markup.
	 *
	 * @param markup  the document
	 * @param options caller options
	 * @return the decision
	 */
	@Nonnull
	public StrategyDecision select(@Nonnull String markup, @Nonnull TranslationOptions options) {
		Objects.requireNonNull(markup, "markup must not be null");
		Objects.requireNonNull(options, "options must not be null");

		final long estimated = TokenEstimator.estimate(markup);
		if (markup.isBlank()) {
			return new StrategyDecision(TranslationStrategy.EMPTY, 0, estimated);
		}
		if (!hasTranslatableContent(markup)) {
			return new StrategyDecision(TranslationStrategy.UNTRANSLATABLE, 0, estimated);
		}

		final int maxChunks = options.maxChunks();
		if (maxChunks == 1) {
			return new StrategyDecision(TranslationStrategy.SINGLE_SHOT, 1, estimated);
		}
		if (maxChunks > 1) {
			return new StrategyDecision(TranslationStrategy.FIXED_CHUNKS, maxChunks, estimated);
		}

		if (estimated <= this.singleCallThreshold) {
			return new StrategyDecision(TranslationStrategy.SINGLE_SHOT, 1, estimated);
		}
		if (estimated <= 2 * this.singleCallThreshold) {
			return new StrategyDecision(TranslationStrategy.TWO_PART, 2, estimated);
		}
		return new StrategyDecision(TranslationStrategy.GRANULAR, 0, estimated);
	}

	public long getSingleCallThreshold() {
		return this.singleCallThreshold;
	}

	/**
	 * Checks whether the markup holds a text run the skip classifier lets through or a JSON-LD block with
	 * translatable strings.
	 *
	 * @param markup document or piece of a document
	 * @return false for blank, markup-only and purely technical content
	 */
	public boolean hasTranslatableContent(@Nonnull String markup) {
		Objects.requireNonNull(markup, "markup must not be null");
		if (TextNormalizer.isBlank(markup)) {
			return false;
		}
		for (final Segment segment : this.segmenter.segment(markup)) {
			if (segment instanceof Segment.StructuredDataBlock block &&
				this.structuredDataWalker.hasTranslatableStrings(block.markup())) {
				return true;
			}
			if (segment instanceof Segment.Text text && !this.skipClassifier.shouldSkip(text.content())) {
				return true;
			}
		}
		return false;
	}
}
