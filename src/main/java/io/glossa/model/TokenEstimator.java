package io.glossa.model;

import javax.annotation.Nonnull;

/**
 * Cheap, approximate token estimate based on character count. It is not a tokenizer and only serves to choose a
 * translation strategy; real usage comes from the backend.
 */
public final class TokenEstimator {

	/**
	 * Assumed average number of characters per token.
	 */
	public static final int CHARS_PER_TOKEN = 4;

	private TokenEstimator() {
		// utility class
	}

	/**
	 * Estimates the number of tokens for the text, rounding up.
	 *
	 * @param text the text
	 * @return approximate token count
	 */
	public static long estimate(@Nonnull String text) {
		return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
	}
}
