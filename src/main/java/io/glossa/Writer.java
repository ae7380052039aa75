package io.glossa;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes translated markup to its target file in UTF-8.
 */
public final class Writer {

	/**
	 * Writes the markup to the target file, creating missing parent directories. An existing file is replaced.
	 *
	 * @param markup     the content to write
	 * @param targetFile the target file
	 * @throws IOException if an I/O error occurs while creating directories or writing the file
	 */
	public void write(
		@Nonnull final String markup,
		@Nonnull final Path targetFile
	) throws IOException {
		Objects.requireNonNull(markup, "markup must not be null");
		Objects.requireNonNull(targetFile, "targetFile must not be null");

		final Path absolute = targetFile.toAbsolutePath().normalize();
		final Path parent = absolute.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.writeString(absolute, markup, StandardCharsets.UTF_8);
	}
}
