package io.glossa;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;

/**
 * Receives the files found by {@link Traverser}.
 */
public interface Visitor {
	/**
	 * Called for each file that matches the configured pattern.
	 *
	 * @param file         path to the file that matched
	 * @param content      full textual contents of the file
	 * @param instructions accumulated instructions from `.glossa-instructions` files (may be null)
	 */
	void visit(@Nonnull Path file, @Nonnull String content, @Nullable String instructions);
}
