package io.glossa;

import dev.langchain4j.exception.AuthenticationException;
import io.glossa.llm.LlmClient;
import io.glossa.llm.PromptLoader;
import io.glossa.model.TranslationJob;
import io.glossa.model.TranslationOptions;
import io.glossa.model.TranslationSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TranslationExecutor should translate files in parallel")
public class TranslationExecutorTest {

	private Path tempDir;
	private Path sourceDir;
	private CapturingLog testLog;
	private StubChatModel model;
	private Writer writer;
	private TranslationExecutor executor;

	@BeforeEach
	void setUp() throws Exception {
		tempDir = Files.createTempDirectory("executor-test-");
		sourceDir = tempDir.resolve("source");
		Files.createDirectories(sourceDir);

		testLog = new CapturingLog();
		model = new StubChatModel();
		writer = new Writer();
		executor = createExecutor(4, 15_000, TranslationOptions.automatic());
	}

	@AfterEach
	void tearDown() throws Exception {
		executor.shutdown();
		deleteRecursively(tempDir);
	}

	private TranslationExecutor createExecutor(int parallelism, long threshold, TranslationOptions options) {
		final MarkupTranslator translator = new MarkupTranslator(
			new LlmClient(model), new PromptLoader(), null, testLog, threshold
		);
		return new TranslationExecutor(parallelism, translator, writer, testLog, sourceDir, options);
	}

	private TranslationExecutor replaceExecutor(int parallelism, long threshold, TranslationOptions options) {
		executor.shutdown();
		executor = createExecutor(parallelism, threshold, options);
		return executor;
	}

	@Test
	@DisplayName("shouldTranslateAndWriteAllJobs")
	void shouldTranslateAndWriteAllJobs() throws Exception {
		final List<TranslationJob> jobs = createJobs(5);

		final TranslationSummary summary = executor.executeAll(jobs);

		assertEquals(5, summary.successCount());
		assertEquals(0, summary.failedCount());
		assertEquals(0, summary.degradedCount());
		assertEquals(80, summary.inputTokens());
		assertEquals(80, summary.outputTokens());
		for (int i = 0; i < 5; i++) {
			assertEquals("<p>CONTENT " + i + "</p>", Files.readString(jobs.get(i).targetFile()));
		}
		assertTrue(testLog.hasInfo("Translated: doc0.html"));
	}

	@Test
	@DisplayName("shouldContinueOnIndividualFailure")
	void shouldContinueOnIndividualFailure() throws Exception {
		model.failOn("Content 1");
		final List<TranslationJob> jobs = createJobs(3);

		final TranslationSummary summary = executor.executeAll(jobs);

		assertEquals(2, summary.successCount());
		assertEquals(1, summary.failedCount());
		assertFalse(Files.exists(jobs.get(1).targetFile()));
		assertTrue(testLog.hasError("Translation failed for doc1.html"));
		assertTrue(testLog.hasError("SINGLE_SHOT"));
	}

	@Test
	@DisplayName("shouldCountDegradedTranslations")
	void shouldCountDegradedTranslations() throws Exception {
		replaceExecutor(2, 1, TranslationOptions.automatic());
		model.failOn("Bad");
		final TranslationJob job = job("mixed.html", "<p>Good text</p><p>Bad text</p>");

		final TranslationSummary summary = executor.executeAll(List.of(job));

		assertEquals(1, summary.successCount());
		assertEquals(1, summary.degradedCount());
		assertEquals("<p>GOOD TEXT</p><p>Bad text</p>", Files.readString(job.targetFile()));
		assertTrue(testLog.hasWarn("1 untranslated segment"));
	}

	@Test
	@DisplayName("shouldFailRemainingJobsAfterPermanentFailure")
	void shouldFailRemainingJobsAfterPermanentFailure() throws Exception {
		replaceExecutor(1, 15_000, TranslationOptions.automatic());
		model.setException(new AuthenticationException("Invalid API key"));

		final TranslationSummary summary = executor.executeAll(createJobs(3));

		assertEquals(0, summary.successCount());
		assertEquals(3, summary.failedCount());
		assertEquals(1, model.getCallCount());
		assertTrue(testLog.hasError("permanent LLM failure"));
	}

	@Test
	@DisplayName("shouldApplyOptionsToEveryJob")
	void shouldApplyOptionsToEveryJob() throws Exception {
		replaceExecutor(2, 15_000, TranslationOptions.withMaxChunks(2));
		final TranslationJob job = job("two.html", "<p>One</p><p>Two</p>");

		executor.executeAll(List.of(job));

		assertEquals(List.of("<p>One</p>", "<p>Two</p>"), model.getUserTexts());
		assertEquals("<p>ONE</p><p>TWO</p>", Files.readString(job.targetFile()));
	}

	@Test
	@DisplayName("shouldPassInstructionsToPrompt")
	void shouldPassInstructionsToPrompt() throws Exception {
		final TranslationJob job = new TranslationJob(
			sourceDir.resolve("a.html"), tempDir.resolve("target/a.html"), Locale.GERMAN, "<p>Hello</p>", "Use Sie."
		);

		executor.executeAll(List.of(job));

		assertTrue(model.getSystemTexts().get(0).contains("Use Sie."));
	}

	@Test
	@DisplayName("shouldHandleEmptyJobList")
	void shouldHandleEmptyJobList() {
		final TranslationSummary summary = executor.executeAll(List.of());

		assertEquals(0, summary.getTotalCount());
		assertEquals(0, model.getCallCount());
	}

	@Test
	@DisplayName("shouldRejectInvalidArguments")
	void shouldRejectInvalidArguments() {
		final MarkupTranslator translator = new MarkupTranslator(model, testLog);

		assertThrows(IllegalArgumentException.class, () ->
			new TranslationExecutor(0, translator, writer, testLog, sourceDir)
		);
		assertThrows(NullPointerException.class, () ->
			new TranslationExecutor(4, null, writer, testLog, sourceDir)
		);
		assertThrows(NullPointerException.class, () ->
			new TranslationExecutor(4, translator, null, testLog, sourceDir)
		);
		assertThrows(NullPointerException.class, () ->
			new TranslationExecutor(4, translator, writer, testLog, sourceDir, null)
		);
	}

	private TranslationJob job(String name, String content) throws IOException {
		final Path sourceFile = sourceDir.resolve(name);
		Files.writeString(sourceFile, content);
		return new TranslationJob(sourceFile, tempDir.resolve("target/nested/" + name), Locale.GERMAN, content, null);
	}

	private List<TranslationJob> createJobs(int count) throws IOException {
		final List<TranslationJob> jobs = new ArrayList<>();
		for (int i = 0; i < count; i++) {
			jobs.add(job("doc" + i + ".html", "<p>Content " + i + "</p>"));
		}
		return jobs;
	}

	private static void deleteRecursively(Path path) throws IOException {
		if (Files.exists(path)) {
			try (Stream<Path> walk = Files.walk(path)) {
				walk.sorted(Comparator.reverseOrder()).forEach(p -> p.toFile().delete());
			}
		}
	}
}
