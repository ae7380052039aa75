package io.glossa.llm;

import io.glossa.model.Usage;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Answer of one completion call.
 *
 * @param text  the text returned by the model
 * @param usage tokens consumed by the call
 */
public record Completion(@Nonnull String text, @Nonnull Usage usage) {

	public Completion {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(usage, "usage must not be null");
	}
}
