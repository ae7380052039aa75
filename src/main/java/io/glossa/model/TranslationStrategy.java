package io.glossa.model;

/**
 * How a document is sent to the backend.
 */
public enum TranslationStrategy {

	/** Blank input, returned as-is. */
	EMPTY(false),
	/** Nothing translatable in the document, returned as-is. */
	UNTRANSLATABLE(false),
	/** The whole document in one call. */
	SINGLE_SHOT(true),
	/** Two pieces cut at the first tag boundary after the midpoint. */
	TWO_PART(true),
	/** A caller-chosen number of pieces. */
	FIXED_CHUNKS(true),
	/** Text segments and JSON-LD strings translated one by one. */
	GRANULAR(false);

	private final boolean wholeDocument;

	TranslationStrategy(boolean wholeDocument) {
		this.wholeDocument = wholeDocument;
	}

	/**
	 * Returns true when the strategy sends the markup itself (or slices of it) to the backend.
	 *
	 * @return true for single-shot, two-part and fixed-chunk translation
	 */
	public boolean isWholeDocument() {
		return this.wholeDocument;
	}
}
