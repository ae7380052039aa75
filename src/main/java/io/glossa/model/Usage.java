package io.glossa.model;

import dev.langchain4j.model.output.TokenUsage;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Token usage of one backend call or the running total of a session.
 *
 * @param input  number of prompt (input) tokens
 * @param output number of completion (output) tokens
 */
public record Usage(long input, long output) {

	private static final Usage ZERO = new Usage(0, 0);

	public Usage {
		if (input < 0 || output < 0) {
			throw new IllegalArgumentException("token counts must be non-negative");
		}
	}

	/**
	 * Returns usage with both counts at zero.
	 *
	 * @return zero usage
	 */
	@Nonnull
	public static Usage zero() {
		return ZERO;
	}

	/**
	 * Converts LangChain4j token usage; a missing usage record or missing counts are treated as zero.
	 *
	 * @param tokenUsage usage reported by the chat model, may be null
	 * @return converted usage
	 */
	@Nonnull
	public static Usage from(@Nullable TokenUsage tokenUsage) {
		if (tokenUsage == null) {
			return ZERO;
		}
		final Integer in = tokenUsage.inputTokenCount();
		final Integer out = tokenUsage.outputTokenCount();
		return new Usage(in != null ? in : 0, out != null ? out : 0);
	}
}
