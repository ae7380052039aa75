package io.glossa;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Writer should store markup as UTF-8")
public class WriterTest {

	@Test
	@DisplayName("shouldWriteToFileAndCreateParents")
	public void shouldWriteToFileAndCreateParents() throws IOException {
		final Path tempDir = Files.createTempDirectory("writer-out-");
		final Path target = tempDir.resolve("a/b/c.html");
		final String markup = "<h1>Übersicht</h1>\n<p>Größe: 10&nbsp;m²</p>";

		new Writer().write(markup, target);

		assertEquals(markup, Files.readString(target, StandardCharsets.UTF_8));
	}

	@Test
	@DisplayName("shouldOverwriteExistingFileWhenPresent")
	public void shouldOverwriteExistingFileWhenPresent() throws IOException {
		final Path tempDir = Files.createTempDirectory("writer-over-");
		final Path target = tempDir.resolve("x/y.html");
		Files.createDirectories(target.getParent());
		Files.writeString(target, "<p>OLD and much longer than the new content</p>", StandardCharsets.UTF_8);

		new Writer().write("<p>New</p>", target);

		assertEquals("<p>New</p>", Files.readString(target, StandardCharsets.UTF_8));
	}

	@Test
	@DisplayName("shouldRejectNullArguments")
	public void shouldRejectNullArguments() throws IOException {
		final Path target = Files.createTempDirectory("writer-null-").resolve("z.html");

		assertThrows(NullPointerException.class, () -> new Writer().write(null, target));
		assertThrows(NullPointerException.class, () -> new Writer().write("<p>x</p>", null));
	}
}
