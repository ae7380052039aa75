package io.glossa.metadata;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One metadata string together with its translation and the slot it is written to.
 *
 * @param slot       where the translation goes
 * @param original   the string as it was before translation
 * @param translated the translation
 */
public record MetadataField(
	@Nonnull MetadataSlot slot,
	@Nonnull String original,
	@Nonnull String translated
) {

	public MetadataField {
		Objects.requireNonNull(slot, "slot must not be null");
		Objects.requireNonNull(original, "original must not be null");
		Objects.requireNonNull(translated, "translated must not be null");
		if (original.isBlank()) {
			throw new IllegalArgumentException("original must not be blank");
		}
	}

	/**
	 * Returns true when applying the field would not change anything.
	 *
	 * @return true when the translation equals the original
	 */
	public boolean isUnchanged() {
		return this.original.equals(this.translated);
	}
}
