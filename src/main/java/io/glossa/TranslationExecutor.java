package io.glossa;

import io.glossa.model.TranslationJob;
import io.glossa.model.TranslationOptions;
import io.glossa.model.TranslationResult;
import io.glossa.model.TranslationSession;
import io.glossa.model.TranslationSummary;
import io.glossa.model.Usage;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Translates a batch of files on a fixed thread pool and writes the results.
 *
 * Each job gets its own {@link TranslationSession}, so cache and token counters never mix between files. At most
 * `parallelism` documents are in flight at once; the segments of one document are translated on the translator's
 * own executor. One job's failure never stops the others, except that after a permanent backend failure
 * (authentication, invalid model) the remaining jobs fail without calling the backend.
 */
public final class TranslationExecutor {

	private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

	private final ExecutorService executor;
	private final MarkupTranslator translator;
	private final Writer writer;
	private final Log log;
	private final Path sourceDir;
	private final TranslationOptions options;

	/**
	 * Creates a translation executor.
	 *
	 * @param parallelism number of documents translated concurrently
	 * @param translator  the translator to use for LLM calls
	 * @param writer      the writer for output files
	 * @param log         Maven log for output
	 * @param sourceDir   the source root directory for relative path calculation
	 * @param options     strategy options applied to every job
	 */
	public TranslationExecutor(
		int parallelism,
		@Nonnull MarkupTranslator translator,
		@Nonnull Writer writer,
		@Nonnull Log log,
		@Nonnull Path sourceDir,
		@Nonnull TranslationOptions options
	) {
		if (parallelism < 1) {
			throw new IllegalArgumentException("parallelism must be at least 1");
		}
		this.translator = Objects.requireNonNull(translator, "translator must not be null");
		this.writer = Objects.requireNonNull(writer, "writer must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
		this.sourceDir = Objects.requireNonNull(sourceDir, "sourceDir must not be null").toAbsolutePath().normalize();
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.executor = Executors.newFixedThreadPool(parallelism);
	}

	public TranslationExecutor(
		int parallelism,
		@Nonnull MarkupTranslator translator,
		@Nonnull Writer writer,
		@Nonnull Log log,
		@Nonnull Path sourceDir
	) {
		this(parallelism, translator, writer, log, sourceDir, TranslationOptions.automatic());
	}

	/**
	 * Executes all jobs and returns a summary of results.
	 *
	 * @param jobs the jobs to execute
	 * @return summary with success/failure counts and token usage
	 */
	@Nonnull
	public TranslationSummary executeAll(@Nonnull List<TranslationJob> jobs) {
		Objects.requireNonNull(jobs, "jobs must not be null");

		if (jobs.isEmpty()) {
			return TranslationSummary.empty();
		}

		final List<CompletableFuture<TranslationResult>> futures = new ArrayList<>(jobs.size());
		for (final TranslationJob job : jobs) {
			futures.add(CompletableFuture.supplyAsync(() -> translate(job), this.executor));
		}

		TranslationSummary summary = TranslationSummary.empty();
		for (int i = 0; i < futures.size(); i++) {
			try {
				summary = processResult(futures.get(i).join(), summary);
			} catch (CompletionException e) {
				this.log.error("Failed to get translation result for " + jobs.get(i).sourceFile() + ": " + e.getMessage());
				summary = summary.withFailure(Usage.zero());
			}
		}
		return summary;
	}

	/**
	 * Translates one job synchronously on a pool thread.
	 */
	@Nonnull
	private TranslationResult translate(@Nonnull TranslationJob job) {
		if (this.translator.getLlmClient().hasPermanentFailure()) {
			final Throwable cause = this.translator.getLlmClient().getFailureCause();
			return TranslationResult.failure(
				job,
				"skipped after permanent LLM failure" + (cause == null ? "" : ": " + cause.getMessage()),
				Usage.zero()
			);
		}

		final TranslationSession session = job.openSession(this.options);
		try {
			final String translated = this.translator.translate(job.content(), session).toCompletableFuture().join();
			return TranslationResult.success(job, translated, session.getUsage(), session.getFailedSegmentCount());
		} catch (CompletionException e) {
			final Throwable cause = e.getCause() != null ? e.getCause() : e;
			return TranslationResult.failure(job, String.valueOf(cause.getMessage()), session.getUsage());
		}
	}

	@Nonnull
	private TranslationSummary processResult(
		@Nonnull TranslationResult result,
		@Nonnull TranslationSummary summary
	) {
		final TranslationJob job = result.job();
		final Path relativePath = this.sourceDir.relativize(job.sourceFile().toAbsolutePath().normalize());
		final String prefix = "[" + job.locale().toLanguageTag() + "] ";

		if (!result.success()) {
			this.log.error(prefix + "Translation failed for " + relativePath + ": " + result.errorMessage());
			return summary.withFailure(result.usage());
		}

		try {
			this.writer.write(result.translatedContent(), job.targetFile());
		} catch (IOException e) {
			this.log.error(prefix + "Failed to write " + relativePath + ": " + e.getMessage());
			return summary.withFailure(result.usage());
		}

		if (result.isDegraded()) {
			this.log.warn(
				prefix + "Translated with " + result.failedSegments() + " untranslated segment(s): " +
					relativePath + " -> " + job.targetFile()
			);
		} else {
			this.log.info(prefix + "Translated: " + relativePath + " -> " + job.targetFile());
		}
		return summary.withSuccess(result.usage(), result.isDegraded());
	}

	/**
	 * Shuts down the executor gracefully, waiting for pending tasks to complete.
	 */
	public void shutdown() {
		this.executor.shutdown();
		try {
			if (!this.executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
				this.log.warn("Executor did not terminate in time, forcing shutdown");
				this.executor.shutdownNow();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.executor.shutdownNow();
		}
	}
}
