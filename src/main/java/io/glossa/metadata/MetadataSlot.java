package io.glossa.metadata;

/**
 * Places in an assembled document where a translated metadata string is written.
 */
public enum MetadataSlot {

	/**
	 * Inner text of an `<h1>` element.
	 */
	HEADING,
	/**
	 * `content` attribute of `<meta name="description">`.
	 */
	META_DESCRIPTION,
	/**
	 * `headline` values inside JSON-LD script blocks.
	 */
	STRUCTURED_DATA_HEADLINE

}
