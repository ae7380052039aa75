package io.glossa;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Failure of a whole-document translation call. Segment-level failures never raise it; they fall back to the
 * original text instead.
 */
public final class TranslationException extends RuntimeException {

	@Nonnull
	private final String phase;

	/**
	 * Creates a new TranslationException.
	 *
	 * @param phase   the failing step, e.g. `SINGLE_SHOT` or `PIECE_2_OF_3`
	 * @param message description of the failure
	 * @param cause   the backend error
	 */
	public TranslationException(@Nonnull String phase, @Nonnull String message, @Nonnull Throwable cause) {
		super(phase + ": " + message, cause);
		this.phase = Objects.requireNonNull(phase, "phase must not be null");
	}

	/**
	 * Returns the step that failed.
	 *
	 * @return phase name
	 */
	@Nonnull
	public String getPhase() {
		return this.phase;
	}
}
