package io.glossa;

import dev.langchain4j.model.chat.ChatModel;
import io.glossa.llm.ChatModelFactory;
import io.glossa.llm.LlmClient;
import io.glossa.llm.PromptLoader;
import io.glossa.model.StrategyDecision;
import io.glossa.model.StrategySelector;
import io.glossa.model.TranslationJob;
import io.glossa.model.TranslationOptions;
import io.glossa.model.TranslationSummary;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Main Mojo for the Glossa plugin providing actions:
 * - show-config: prints current configuration
 * - translate: finds HTML files, translates them into every target language and writes the results
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class GlossaMojo extends AbstractMojo {

	/** Which action to perform: "show-config" or "translate". */
	@Parameter(property = "glossa.action", defaultValue = "show-config")
	private String action;

	/** LLM provider: "openai" or "anthropic". */
	@Parameter(property = "glossa.llmProvider", defaultValue = "openai")
	private String llmProvider = "openai";

	/** LLM URL (no default). */
	@Parameter(property = "glossa.llmUrl")
	private String llmUrl;

	/** LLM token (no default). */
	@Parameter(property = "glossa.llmToken")
	private String llmToken;

	/** LLM model name; the provider default is used when not set. */
	@Parameter(property = "glossa.llmModel")
	private String llmModel;

	/** Source directory path (no default). */
	@Parameter(property = "glossa.sourceDir")
	private String sourceDir;

	/** Regex to match all files to translate - default (?i).*\.html? (ignore case). */
	@Parameter(property = "glossa.fileRegex", defaultValue = "(?i).*\\.html?")
	private String fileRegex = "(?i).*\\.html?";

	/** Collection of target languages (no default). */
	@Parameter(property = "glossa.targets")
	private List<Target> targets;

	/** Maximum number of files to be translated per target (default Integer.MAX_VALUE). */
	@Parameter(property = "glossa.limit", defaultValue = "2147483647")
	private int limit = Integer.MAX_VALUE;

	/** When true, do not call the LLM or write anything, only report what would be done. */
	@Parameter(property = "glossa.dryRun", defaultValue = "true")
	private boolean dryRun = true;

	/** Number of documents translated concurrently (default 4). */
	@Parameter(property = "glossa.parallelism", defaultValue = "4")
	private int parallelism = 4;

	/** Fixed number of pieces per document (1-10), 0 picks the strategy from the document size. */
	@Parameter(property = "glossa.maxChunks", defaultValue = "0")
	private int maxChunks = TranslationOptions.AUTOMATIC;

	/** Largest estimated token count translated in a single call. */
	@Parameter(property = "glossa.singleCallTokenThreshold", defaultValue = "15000")
	private long singleCallTokenThreshold = StrategySelector.DEFAULT_SINGLE_CALL_THRESHOLD;

	/** When true, a failed whole-document translation is retried segment by segment. */
	@Parameter(property = "glossa.fallbackToGranular", defaultValue = "false")
	private boolean fallbackToGranular;

	/** When true, existing target files are translated again. */
	@Parameter(property = "glossa.overwrite", defaultValue = "false")
	private boolean overwrite;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config":
				showConfig(getLog());
				break;
			case "translate":
				translate(getLog());
				break;
			default:
				throw new MojoExecutionException("Unknown action: " + this.action + ". Supported actions: show-config, translate");
		}
	}

	private void showConfig(@Nonnull final Log log) {
		log.info("Glossa Plugin Configuration:");
		log.info(" - llmProvider: " + this.llmProvider);
		log.info(" - llmUrl: " + orNotSet(this.llmUrl));
		if (isBlank(this.llmUrl)) {
			log.warn("LLM url is not set");
		}
		log.info(" - llmToken: " + (isBlank(this.llmToken) ? "<not set>" : mask(this.llmToken)));
		if (isBlank(this.llmToken)) {
			log.warn("LLM token is not set");
		}
		log.info(" - llmModel: " + (isBlank(this.llmModel) ? "<provider default>" : this.llmModel));
		log.info(" - sourceDir: " + orNotSet(this.sourceDir));
		if (isBlank(this.sourceDir)) {
			log.warn("Source directory is not set");
		}
		log.info(" - fileRegex: " + this.fileRegex);
		if (this.targets == null || this.targets.isEmpty()) {
			log.info(" - targets: <none>");
			log.warn("No target languages configured");
		} else {
			log.info(" - targets:");
			for (final Target t : this.targets) {
				final String locale = t == null ? null : t.getLocale();
				final String tDir = t == null ? null : t.getTargetDir();
				log.info("   - locale: " + orNotSet(locale) + ", targetDir: " + orNotSet(tDir));
				if (isBlank(locale)) {
					log.warn("Target locale is not set");
				}
				if (isBlank(tDir)) {
					log.warn("Target directory is not set for locale " + (locale == null ? "<unknown>" : locale));
				}
			}
		}
		log.info(" - limit: " + this.limit);
		log.info(" - dryRun: " + this.dryRun);
		log.info(" - parallelism: " + this.parallelism);
		log.info(" - maxChunks: " + (this.maxChunks == TranslationOptions.AUTOMATIC ? "automatic" : this.maxChunks));
		log.info(" - singleCallTokenThreshold: " + this.singleCallTokenThreshold);
		log.info(" - fallbackToGranular: " + this.fallbackToGranular);
		log.info(" - overwrite: " + this.overwrite);
	}

	private void translate(@Nonnull final Log log) throws MojoExecutionException {
		if (isBlank(this.sourceDir)) {
			log.error("Source directory must be specified for translate action");
			return;
		}
		if (!this.dryRun && isBlank(this.llmUrl)) {
			log.error("LLM URL must be specified for non-dry-run translate action");
			return;
		}
		if (this.targets == null || this.targets.isEmpty()) {
			log.error("At least one target must be specified for translate action");
			return;
		}

		final TranslationOptions options;
		final StrategySelector selector;
		final Pattern pattern;
		try {
			options = new TranslationOptions(this.maxChunks, this.fallbackToGranular);
			selector = new StrategySelector(this.singleCallTokenThreshold);
			pattern = Pattern.compile(this.fileRegex);
		} catch (IllegalArgumentException e) {
			// PatternSyntaxException is an IllegalArgumentException too
			throw new MojoExecutionException("Invalid configuration: " + e.getMessage(), e);
		}

		final Path root = Path.of(this.sourceDir).toAbsolutePath().normalize();
		if (!Files.isDirectory(root)) {
			log.error("Source directory does not exist or is not a directory: " + root);
			return;
		}

		TranslationExecutor executor = null;
		try {
			if (!this.dryRun) {
				final ChatModel chatModel = ChatModelFactory.create(
					this.llmProvider, this.llmUrl, this.llmToken, this.llmModel
				);
				final MarkupTranslator translator = new MarkupTranslator(
					new LlmClient(chatModel), new PromptLoader(), null, log, this.singleCallTokenThreshold
				);
				executor = new TranslationExecutor(this.parallelism, translator, new Writer(), log, root, options);
			}

			for (final Target target : this.targets) {
				if (target == null || isBlank(target.getLocale()) || isBlank(target.getTargetDir())) {
					log.warn("Skipping incomplete target configuration");
					continue;
				}
				processTarget(log, root, pattern, target, options, selector, executor);
			}
		} catch (IOException | RuntimeException ex) {
			log.error("Failed to execute translate action: " + ex.getMessage(), ex);
		} finally {
			if (executor != null) {
				executor.shutdown();
			}
		}
	}

	private void processTarget(
		@Nonnull final Log log,
		@Nonnull final Path root,
		@Nonnull final Pattern pattern,
		@Nonnull final Target target,
		@Nonnull final TranslationOptions options,
		@Nonnull final StrategySelector selector,
		@Nullable final TranslationExecutor executor
	) throws IOException {
		final Locale locale = Locale.forLanguageTag(target.getLocale());
		final Path targetDir = Path.of(target.getTargetDir()).toAbsolutePath().normalize();
		log.info("=== Processing target: " + locale.getDisplayName(Locale.ENGLISH) + " (" + locale.toLanguageTag() + ") -> " + targetDir + " ===");

		final List<TranslationJob> jobs = new ArrayList<>();
		final AtomicInteger skippedCount = new AtomicInteger(0);
		final Visitor collectingVisitor = (file, content, instructions) -> {
			if (jobs.size() >= this.limit) {
				return;
			}
			final Path relativePath = root.relativize(file.toAbsolutePath().normalize());
			final Path targetFile = targetDir.resolve(relativePath.toString());
			if (!this.overwrite && Files.exists(targetFile)) {
				skippedCount.incrementAndGet();
				if (this.dryRun) {
					log.info("[SKIP] " + relativePath + " (target exists)");
				}
				return;
			}
			final TranslationJob job = new TranslationJob(file, targetFile, locale, content, instructions);
			jobs.add(job);
			if (this.dryRun) {
				final StrategyDecision decision = selector.select(content, options);
				log.info("[" + decision.strategy() + "] " + relativePath + " -> " + targetFile +
					" (~" + decision.estimatedTokens() + " tokens, " + decision.pieceCount() + " piece(s))");
			}
		};

		new Traverser(root, pattern, collectingVisitor).traverse();

		if (this.dryRun || executor == null) {
			log.info("--- Dry-run Summary ---");
			log.info("Files to translate: " + jobs.size());
			log.info("Skipped (target exists): " + skippedCount.get());
			return;
		}

		log.info("Executing " + jobs.size() + " translations with parallelism " + this.parallelism + "...");
		final TranslationSummary summary = executor.executeAll(jobs);
		log.info("--- Translation Summary ---");
		log.info("Successful: " + summary.successCount());
		log.info("Partially translated: " + summary.degradedCount());
		log.info("Failed: " + summary.failedCount());
		log.info("Skipped: " + skippedCount.get());
		log.info("Input tokens: " + summary.inputTokens());
		log.info("Output tokens: " + summary.outputTokens());
	}

	private static boolean isBlank(@Nullable final String value) {
		return value == null || value.isBlank();
	}

	@Nonnull
	private static String orNotSet(@Nullable final String value) {
		return isBlank(value) ? "<not set>" : value;
	}

	@Nonnull
	static String mask(@Nullable final String value) {
		if (value == null || value.length() <= 4) {
			return "****";
		}
		return "****" + value.substring(value.length() - 4);
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setLlmProvider(@Nullable final String llmProvider) { this.llmProvider = llmProvider; }
	void setLlmUrl(@Nullable final String llmUrl) { this.llmUrl = llmUrl; }
	void setLlmToken(@Nullable final String llmToken) { this.llmToken = llmToken; }
	void setLlmModel(@Nullable final String llmModel) { this.llmModel = llmModel; }
	void setSourceDir(@Nullable final String sourceDir) { this.sourceDir = sourceDir; }
	void setFileRegex(@Nonnull final String fileRegex) { this.fileRegex = fileRegex; }
	void setTargets(@Nullable final List<Target> targets) { this.targets = targets; }
	void setLimit(final int limit) { this.limit = limit; }
	void setDryRun(final boolean dryRun) { this.dryRun = dryRun; }
	void setParallelism(final int parallelism) { this.parallelism = parallelism; }
	void setMaxChunks(final int maxChunks) { this.maxChunks = maxChunks; }
	void setSingleCallTokenThreshold(final long threshold) { this.singleCallTokenThreshold = threshold; }
	void setFallbackToGranular(final boolean fallbackToGranular) { this.fallbackToGranular = fallbackToGranular; }
	void setOverwrite(final boolean overwrite) { this.overwrite = overwrite; }

	/** Target language configuration. */
	public static class Target {
		@Parameter
		private String locale;
		@Parameter
		private String targetDir;

		public Target() {}

		public Target(@Nullable final String locale, @Nullable final String targetDir) {
			this.locale = locale;
			this.targetDir = targetDir;
		}

		@Nullable
		public String getLocale() { return this.locale; }

		@Nullable
		public String getTargetDir() { return this.targetDir; }

		public void setLocale(@Nullable final String locale) { this.locale = locale; }

		public void setTargetDir(@Nullable final String targetDir) { this.targetDir = targetDir; }
	}
}
