package io.glossa;

import dev.langchain4j.model.chat.ChatModel;
import io.glossa.jsonld.StructuredDataWalker;
import io.glossa.llm.Completion;
import io.glossa.llm.LlmClient;
import io.glossa.llm.PromptLoader;
import io.glossa.metadata.MetadataPatcher;
import io.glossa.model.ChunkSplitter;
import io.glossa.model.MarkupSegmenter;
import io.glossa.model.Segment;
import io.glossa.model.SkipClassifier;
import io.glossa.model.StrategyDecision;
import io.glossa.model.StrategySelector;
import io.glossa.model.TextNormalizer;
import io.glossa.model.TranslationOptions;
import io.glossa.model.TranslationSession;
import io.glossa.model.TranslationStrategy;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates HTML fragments through an LLM while keeping the markup byte-identical.
 *
 * The strategy depends on document size and the session's chunk override (see {@link StrategySelector}):
 * - whole-document strategies send the markup (or tag-safe slices of it) to the model, one slice after another
 * - the granular strategy translates each text run and each JSON-LD text field separately and concurrently,
 *   reusing the session cache, and joins the results back in document order
 *
 * Whole-document failures complete the returned stage with a {@link TranslationException}. Granular failures
 * never do: a segment that cannot be translated keeps its original text and a warning is logged.
 *
 * All request state (cache, token counters) lives in the {@link TranslationSession} passed by the caller, so a
 * single translator can serve any number of independent requests.
 */
public class MarkupTranslator {

	private static final Pattern CODE_FENCE_PATTERN = Pattern.compile("^```[\\w-]*[ \\t]*\\R([\\s\\S]*?)\\R?```$");
	private static final int LOG_ABBREVIATION_LENGTH = 60;

	@Nonnull
	private final LlmClient llmClient;
	@Nonnull
	private final PromptLoader promptLoader;
	@Nullable
	private final Executor executor;
	@Nonnull
	private final Log log;
	@Nonnull
	private final MarkupSegmenter segmenter = new MarkupSegmenter();
	@Nonnull
	private final SkipClassifier skipClassifier;
	@Nonnull
	private final ChunkSplitter chunkSplitter = new ChunkSplitter();
	@Nonnull
	private final StrategySelector strategySelector;
	@Nonnull
	private final StructuredDataWalker structuredDataWalker = new StructuredDataWalker();
	@Nonnull
	private final MetadataPatcher metadataPatcher = new MetadataPatcher();

	/**
	 * Creates a translator.
	 *
	 * @param llmClient           completion backend
	 * @param promptLoader        prompt template loader
	 * @param executor            executor for backend calls; null for {@link ForkJoinPool#commonPool()}
	 * @param log                 log receiving segment failures and strategy decisions; null for stdout
	 * @param singleCallThreshold largest estimated token count translated in a single call
	 */
	public MarkupTranslator(
		@Nonnull LlmClient llmClient,
		@Nonnull PromptLoader promptLoader,
		@Nullable Executor executor,
		@Nullable Log log,
		long singleCallThreshold
	) {
		this.llmClient = Objects.requireNonNull(llmClient, "llmClient must not be null");
		this.promptLoader = Objects.requireNonNull(promptLoader, "promptLoader must not be null");
		this.executor = executor;
		this.log = log != null ? log : new SystemStreamLog();
		this.skipClassifier = new SkipClassifier();
		this.strategySelector = new StrategySelector(singleCallThreshold, this.segmenter, this.skipClassifier);
	}

	/**
	 * Creates a translator with the default single-call threshold.
	 *
	 * @param llmClient    completion backend
	 * @param promptLoader prompt template loader
	 * @param log          log for segment failures; null for stdout
	 */
	public MarkupTranslator(@Nonnull LlmClient llmClient, @Nonnull PromptLoader promptLoader, @Nullable Log log) {
		this(llmClient, promptLoader, null, log, StrategySelector.DEFAULT_SINGLE_CALL_THRESHOLD);
	}

	/**
	 * Creates a translator on top of a chat model with default settings.
	 *
	 * @param model chat model to use
	 * @param log   log for segment failures; null for stdout
	 */
	public MarkupTranslator(@Nonnull ChatModel model, @Nullable Log log) {
		this(new LlmClient(model), new PromptLoader(), log);
	}

	/**
	 * Returns the LlmClient used by this translator.
	 * Useful for checking permanent failure status.
	 *
	 * @return the LLM client
	 */
	@Nonnull
	public LlmClient getLlmClient() {
		return this.llmClient;
	}

	/**
	 * Returns the strategy {@link #translate(String, TranslationSession)} would use, without calling the backend.
	 *
	 * @param markup  the document
	 * @param options caller options
	 * @return strategy decision
	 */
	@Nonnull
	public StrategyDecision plan(@Nonnull String markup, @Nonnull TranslationOptions options) {
		return this.strategySelector.select(markup, options);
	}

	/**
	 * Translates the markup into the session's target language.
	 *
	 * @param markup  HTML fragment
	 * @param session caller-owned session holding language, options, cache and counters
	 * @return stage with the translated markup; fails with {@link TranslationException} only for
	 *         whole-document strategies
	 */
	@Nonnull
	public CompletionStage<String> translate(@Nonnull String markup, @Nonnull TranslationSession session) {
		Objects.requireNonNull(markup, "markup must not be null");
		Objects.requireNonNull(session, "session must not be null");

		final StrategyDecision decision = this.strategySelector.select(markup, session.getOptions());
		if (this.log.isDebugEnabled()) {
			this.log.debug("Translating to " + session.getTargetLanguageName() + " using " + decision);
		}

		switch (decision.strategy()) {
			case EMPTY:
			case UNTRANSLATABLE:
				return CompletableFuture.completedFuture(markup);
			case GRANULAR:
				return translateGranular(markup, session);
			default:
				final CompletionStage<String> whole = translateWholeDocument(markup, decision, session);
				if (!session.getOptions().fallbackToGranular()) {
					return whole;
				}
				return whole
					.handle((translated, error) -> {
						if (error == null) {
							return CompletableFuture.completedFuture(translated);
						}
						if (this.llmClient.hasPermanentFailure()) {
							return CompletableFuture.<String>failedFuture(unwrap(error));
						}
						this.log.warn(
							decision.strategy() + " translation failed (" + unwrap(error).getMessage() +
								"), retrying segment by segment"
						);
						return translateGranular(markup, session);
					})
					.thenCompose(Function.identity());
		}
	}

	/**
	 * Translates the title and meta description of an already assembled document and patches them in at their
	 * known locations: the `<h1>` heading, the description meta tag and JSON-LD `headline` values.
	 *
	 * @param markup              assembled document
	 * @param originalTitle       title before translation, may be null
	 * @param originalDescription meta description before translation, may be null
	 * @param session             caller-owned session
	 * @return stage with the patched markup; unchanged when neither string is given
	 */
	@Nonnull
	public CompletionStage<String> translateMetadata(
		@Nonnull String markup,
		@Nullable String originalTitle,
		@Nullable String originalDescription,
		@Nonnull TranslationSession session
	) {
		Objects.requireNonNull(markup, "markup must not be null");
		Objects.requireNonNull(session, "session must not be null");
		return this.metadataPatcher.patch(
			markup, originalTitle, originalDescription, text -> translateText(text, session)
		);
	}

	/**
	 * Translates one piece of text through the session cache.
	 *
	 * Surrounding whitespace is kept as in the input. Blank text is returned as-is. When the backend fails, the
	 * original text is returned and the failure is logged.
	 *
	 * @param text    text to translate
	 * @param session caller-owned session
	 * @return stage that never fails
	 */
	@Nonnull
	public CompletionStage<String> translateText(@Nonnull String text, @Nonnull TranslationSession session) {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(session, "session must not be null");

		final String normalized = TextNormalizer.strip(text);
		if (normalized.isEmpty()) {
			return CompletableFuture.completedFuture(text);
		}

		return session.cached(
				normalized,
				key -> CompletableFuture.supplyAsync(() -> callSegment(key, session), effectiveExecutor())
			)
			.handle((translated, error) -> {
				if (error == null) {
					return reapplyWhitespace(text, translated);
				}
				session.recordFailedSegment();
				this.log.warn(
					"Translation to " + session.getTargetLanguageName() + " failed for segment \"" +
						abbreviate(normalized) + "\", keeping original text: " + unwrap(error).getMessage()
				);
				return text;
			});
	}

	/**
	 * Sends the document in one or more contiguous pieces, one after another, and concatenates the answers.
	 */
	@Nonnull
	private CompletionStage<String> translateWholeDocument(
		@Nonnull String markup,
		@Nonnull StrategyDecision decision,
		@Nonnull TranslationSession session
	) {
		final List<String> pieces = decision.pieceCount() == 1 ?
			List.of(markup) : this.chunkSplitter.splitToStrings(markup, decision.pieceCount());

		CompletionStage<StringBuilder> stage = CompletableFuture.completedFuture(new StringBuilder(markup.length()));
		for (int i = 0; i < pieces.size(); i++) {
			final String piece = pieces.get(i);
			final String phase = pieces.size() == 1 ?
				decision.strategy().name() : "PIECE_" + (i + 1) + "_OF_" + pieces.size();
			final int part = i + 1;
			stage = stage.thenCompose(
				translated -> translatePiece(piece, part, pieces.size(), phase, session).thenApply(translated::append)
			);
		}
		return stage.thenApply(StringBuilder::toString);
	}

	@Nonnull
	private CompletionStage<String> translatePiece(
		@Nonnull String piece,
		int part,
		int partCount,
		@Nonnull String phase,
		@Nonnull TranslationSession session
	) {
		if (!this.strategySelector.hasTranslatableContent(piece)) {
			return CompletableFuture.completedFuture(piece);
		}

		final String systemPrompt = buildSystemPrompt(PromptLoader.DOCUMENT_SYSTEM_TEMPLATE, session, part, partCount);
		return CompletableFuture.supplyAsync(() -> {
			try {
				final Completion completion = this.llmClient.complete(systemPrompt, TextNormalizer.strip(piece));
				session.recordUsage(completion.usage());
				final String translated = unwrapCodeFence(completion.text().strip(), piece);
				if (translated.isEmpty()) {
					throw new IllegalStateException("backend returned an empty translation");
				}
				return reapplyWhitespace(piece, translated);
			} catch (RuntimeException e) {
				throw new TranslationException(phase, String.valueOf(e.getMessage()), e);
			}
		}, effectiveExecutor());
	}

	/**
	 * Translates segment by segment. Every text run and JSON-LD block is dispatched at once; results are joined
	 * by segment index, not by completion order.
	 */
	@Nonnull
	private CompletionStage<String> translateGranular(@Nonnull String markup, @Nonnull TranslationSession session) {
		final List<Segment> segments = this.segmenter.segment(markup);
		final List<CompletableFuture<String>> parts = new ArrayList<>(segments.size());

		for (final Segment segment : segments) {
			if (segment instanceof Segment.Text text) {
				parts.add(
					this.skipClassifier.shouldSkip(text.content()) ?
						CompletableFuture.completedFuture(text.content()) :
						translateText(text.content(), session).toCompletableFuture()
				);
			} else if (segment instanceof Segment.StructuredDataBlock block) {
				parts.add(translateStructuredData(block, session));
			} else {
				parts.add(CompletableFuture.completedFuture(segment.raw()));
			}
		}

		return CompletableFuture.allOf(parts.toArray(new CompletableFuture[0]))
			.thenApply(ignored -> {
				final List<String> translated = new ArrayList<>(parts.size());
				for (final CompletableFuture<String> part : parts) {
					translated.add(part.join());
				}
				return MarkupSegmenter.join(translated);
			});
	}

	@Nonnull
	private CompletableFuture<String> translateStructuredData(
		@Nonnull Segment.StructuredDataBlock block,
		@Nonnull TranslationSession session
	) {
		return this.structuredDataWalker.translate(block.markup(), text -> translateText(text, session))
			.toCompletableFuture()
			.exceptionally(error -> {
				this.log.warn("Structured data block #" + block.index() + " kept untranslated: " + unwrap(error).getMessage());
				return block.markup();
			});
	}

	@Nonnull
	private String callSegment(@Nonnull String normalized, @Nonnull TranslationSession session) {
		final String systemPrompt = buildSystemPrompt(PromptLoader.SEGMENT_SYSTEM_TEMPLATE, session, 1, 1);
		final Completion completion = this.llmClient.complete(systemPrompt, normalized);
		session.recordUsage(completion.usage());
		final String translated = completion.text().strip();
		if (translated.isEmpty()) {
			throw new IllegalStateException("backend returned an empty translation");
		}
		return translated;
	}

	@Nonnull
	private String buildSystemPrompt(
		@Nonnull String template,
		@Nonnull TranslationSession session,
		int part,
		int partCount
	) {
		final Map<String, String> placeholders = new HashMap<>(4);
		placeholders.put("targetLanguage", session.getTargetLanguageName());
		placeholders.put("customInstructions", session.getInstructions() == null ? "" : "\n" + session.getInstructions());
		placeholders.put(
			"partInfo",
			partCount > 1 ?
				"The input is part " + part + " of " + partCount + " of a longer document and may start or end " +
					"in the middle of an element; translate it as it is.\n" :
				""
		);
		return this.promptLoader.loadAndInterpolate(template, placeholders).strip();
	}

	@Nonnull
	private Executor effectiveExecutor() {
		return this.executor != null ? this.executor : ForkJoinPool.commonPool();
	}

	/**
	 * Puts the leading and trailing whitespace of the source around the translated text.
	 *
	 * @param source     original text
	 * @param translated trimmed translation
	 * @return translation with the source's surrounding whitespace
	 */
	@Nonnull
	static String reapplyWhitespace(@Nonnull String source, @Nonnull String translated) {
		final int start = TextNormalizer.contentStart(source);
		final int end = TextNormalizer.contentEnd(source, start);
		return source.substring(0, start) + translated + source.substring(end);
	}

	/**
	 * Removes a Markdown code fence the model wrapped around its answer, unless the source itself was fenced.
	 */
	@Nonnull
	static String unwrapCodeFence(@Nonnull String response, @Nonnull String source) {
		if (!response.startsWith("```") || source.strip().startsWith("```")) {
			return response;
		}
		final Matcher matcher = CODE_FENCE_PATTERN.matcher(response);
		return matcher.matches() ? matcher.group(1).strip() : response;
	}

	@Nonnull
	private static Throwable unwrap(@Nonnull Throwable error) {
		Throwable current = error;
		while (current instanceof CompletionException && current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}

	@Nonnull
	private static String abbreviate(@Nonnull String text) {
		return text.length() <= LOG_ABBREVIATION_LENGTH ? text : text.substring(0, LOG_ABBREVIATION_LENGTH) + "...";
	}
}
