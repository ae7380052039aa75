package io.glossa;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Walks a source directory and hands every file matching a regex to a {@link Visitor}, in lexicographic path
 * order, together with the custom instructions that apply to it.
 *
 * Instructions come from `.glossa-instructions` files in the directories between the source root and the file's
 * parent. They are concatenated root first, separated by a blank line.
 */
public final class Traverser {

	/**
	 * Name of the per-directory custom instruction file.
	 */
	public static final String INSTRUCTIONS_FILE = ".glossa-instructions";

	@Nonnull
	private final Path sourceDir;
	@Nonnull
	private final Pattern filePattern;
	@Nonnull
	private final Visitor visitor;

	/**
	 * Create a traverser.
	 *
	 * @param sourceDir   root directory to traverse
	 * @param filePattern regex matched against the whole path string
	 * @param visitor     callback to process file contents
	 */
	public Traverser(
		@Nonnull final Path sourceDir,
		@Nonnull final Pattern filePattern,
		@Nonnull final Visitor visitor
	) {
		this.sourceDir = Objects.requireNonNull(sourceDir, "sourceDir must not be null").toAbsolutePath().normalize();
		this.filePattern = Objects.requireNonNull(filePattern, "filePattern must not be null");
		this.visitor = Objects.requireNonNull(visitor, "visitor must not be null");
	}

	/**
	 * Perform recursive traversal and notify visitor for each matched file.
	 *
	 * @throws IOException when the directory is missing or cannot be read
	 */
	public void traverse() throws IOException {
		if (!Files.isDirectory(this.sourceDir)) {
			throw new IOException("Source directory does not exist or is not a directory: " + this.sourceDir);
		}

		final List<Path> files;
		try (Stream<Path> stream = Files.walk(this.sourceDir)) {
			files = stream
				.filter(Files::isRegularFile)
				.filter(file -> !INSTRUCTIONS_FILE.equals(String.valueOf(file.getFileName())))
				.filter(file -> this.filePattern.matcher(file.toString()).matches())
				.sorted(Comparator.comparing(Path::toString))
				.collect(Collectors.toList());
		}

		final Map<Path, String> instructionsByDir = new HashMap<>();
		for (final Path file : files) {
			final String content = Files.readString(file, StandardCharsets.UTF_8);
			final Path parent = file.getParent();
			final String instructions = parent == null ? null : instructionsFor(parent, instructionsByDir);
			this.visitor.visit(file, content, instructions);
		}
	}

	@Nullable
	private String instructionsFor(@Nonnull final Path dir, @Nonnull final Map<Path, String> cache) throws IOException {
		if (cache.containsKey(dir)) {
			return cache.get(dir);
		}

		final StringBuilder result = new StringBuilder();
		final Path parent = dir.getParent();
		if (!dir.equals(this.sourceDir) && parent != null && parent.startsWith(this.sourceDir)) {
			final String inherited = instructionsFor(parent, cache);
			if (inherited != null) {
				result.append(inherited);
			}
		}

		final Path instructionFile = dir.resolve(INSTRUCTIONS_FILE);
		if (Files.isRegularFile(instructionFile)) {
			final String own = Files.readString(instructionFile, StandardCharsets.UTF_8).strip();
			if (!own.isEmpty()) {
				if (result.length() > 0) {
					result.append("\n\n");
				}
				result.append(own);
			}
		}

		final String instructions = result.length() > 0 ? result.toString() : null;
		cache.put(dir, instructions);
		return instructions;
	}
}
