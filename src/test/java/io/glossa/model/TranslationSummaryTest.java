package io.glossa.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TranslationSummary and TranslationResult should report batch outcomes")
public class TranslationSummaryTest {

	private static final TranslationJob JOB = new TranslationJob(
		Path.of("/source/a.html"), Path.of("/target/a.html"), Locale.GERMAN, "<p>Hi there</p>", null
	);

	@Test
	@DisplayName("counts successes, degraded results, failures and skips")
	void shouldCountOutcomes() {
		final TranslationSummary summary = TranslationSummary.empty()
			.withSuccess(new Usage(10, 5), false)
			.withSuccess(new Usage(1, 1), true)
			.withFailure(new Usage(3, 0))
			.withSkipped();

		assertEquals(2, summary.successCount());
		assertEquals(1, summary.degradedCount());
		assertEquals(1, summary.failedCount());
		assertEquals(1, summary.skippedCount());
		assertEquals(4, summary.getTotalCount());
		assertEquals(14, summary.inputTokens());
		assertEquals(6, summary.outputTokens());
		assertTrue(summary.hasFailures());
		assertTrue(summary.toString().contains("degraded=1"));
	}

	@Test
	@DisplayName("marks a success with failed segments as degraded")
	void shouldMarkDegradedResult() {
		assertTrue(TranslationResult.success(JOB, "<p>x</p>", Usage.zero(), 2).isDegraded());
		assertFalse(TranslationResult.success(JOB, "<p>x</p>", Usage.zero(), 0).isDegraded());

		final TranslationResult failure = TranslationResult.failure(JOB, "boom", new Usage(1, 0));
		assertFalse(failure.success());
		assertFalse(failure.isDegraded());
		assertNull(failure.translatedContent());
	}

	@Test
	@DisplayName("opens a session with the job's language and instructions")
	void shouldOpenSessionForJob() {
		final TranslationJob job = new TranslationJob(
			Path.of("/s/a.html"), Path.of("/t/a.html"), Locale.ITALIAN, "<p>x</p>", "Be brief."
		);

		final TranslationSession session = job.openSession(TranslationOptions.withMaxChunks(2));

		assertEquals(Locale.ITALIAN, session.getTargetLocale());
		assertEquals("Be brief.", session.getInstructions());
		assertEquals(2, session.getOptions().maxChunks());
	}
}
