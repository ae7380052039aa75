package io.glossa.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Outcome of {@link StrategySelector#select(String, TranslationOptions)}.
 *
 * @param strategy        the chosen strategy
 * @param pieceCount      number of whole-document pieces, 0 for strategies that do not cut the document
 * @param estimatedTokens approximate token size of the document
 */
public record StrategyDecision(
	@Nonnull TranslationStrategy strategy,
	int pieceCount,
	long estimatedTokens
) {

	public StrategyDecision {
		Objects.requireNonNull(strategy, "strategy must not be null");
		if (pieceCount < 0) {
			throw new IllegalArgumentException("pieceCount must be non-negative");
		}
	}

	@Override
	public String toString() {
		return this.strategy + (this.pieceCount > 0 ? " (" + this.pieceCount + " piece(s))" : "") +
			", ~" + this.estimatedTokens + " tokens";
	}
}
