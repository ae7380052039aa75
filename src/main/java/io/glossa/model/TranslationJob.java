package io.glossa.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * One file to translate into one target language.
 *
 * @param sourceFile   the source file
 * @param targetFile   where the translation is written
 * @param locale       target language
 * @param content      source markup
 * @param instructions accumulated custom instructions, may be null
 */
public record TranslationJob(
	@Nonnull Path sourceFile,
	@Nonnull Path targetFile,
	@Nonnull Locale locale,
	@Nonnull String content,
	@Nullable String instructions
) {

	public TranslationJob {
		Objects.requireNonNull(sourceFile, "sourceFile must not be null");
		Objects.requireNonNull(targetFile, "targetFile must not be null");
		Objects.requireNonNull(locale, "locale must not be null");
		Objects.requireNonNull(content, "content must not be null");
	}

	/**
	 * Opens a fresh session for this job.
	 *
	 * @param options strategy options
	 * @return new session bound to the job's locale and instructions
	 */
	@Nonnull
	public TranslationSession openSession(@Nonnull TranslationOptions options) {
		return new TranslationSession(this.locale, options, this.instructions);
	}
}
