package io.glossa.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * State of a single translation request: target language, options, the segment cache and the token counters.
 *
 * A session is created by the caller for one request and dropped afterwards. It is safe to use from the threads
 * of one request's fan-out but is never shared between requests, so nothing leaks from one document to another.
 * Counters only grow; start a new session for a fresh count.
 */
public final class TranslationSession {

	@Nonnull
	private final Locale targetLocale;
	@Nonnull
	private final TranslationOptions options;
	@Nullable
	private final String instructions;
	@Nonnull
	private final Map<String, CompletableFuture<String>> cache = new ConcurrentHashMap<>();
	private final AtomicLong promptTokens = new AtomicLong(0);
	private final AtomicLong completionTokens = new AtomicLong(0);
	private final AtomicInteger backendCalls = new AtomicInteger(0);
	private final AtomicInteger failedSegments = new AtomicInteger(0);

	/**
	 * Creates a session.
	 *
	 * @param targetLocale target language
	 * @param options      strategy options
	 * @param instructions extra instructions appended to every system prompt, may be null
	 */
	public TranslationSession(
		@Nonnull Locale targetLocale,
		@Nonnull TranslationOptions options,
		@Nullable String instructions
	) {
		this.targetLocale = Objects.requireNonNull(targetLocale, "targetLocale must not be null");
		this.options = Objects.requireNonNull(options, "options must not be null");
		this.instructions = instructions == null || instructions.isBlank() ? null : instructions.strip();
	}

	public TranslationSession(@Nonnull Locale targetLocale, @Nonnull TranslationOptions options) {
		this(targetLocale, options, null);
	}

	public TranslationSession(@Nonnull Locale targetLocale) {
		this(targetLocale, TranslationOptions.automatic(), null);
	}

	@Nonnull
	public Locale getTargetLocale() {
		return this.targetLocale;
	}

	/**
	 * Returns the language name used in prompts, e.g. `German (de)`.
	 *
	 * @return human-readable target language with its tag
	 */
	@Nonnull
	public String getTargetLanguageName() {
		final String tag = this.targetLocale.toLanguageTag();
		final String name = this.targetLocale.getDisplayName(Locale.ENGLISH);
		return name.isBlank() || name.equals(tag) ? tag : name + " (" + tag + ")";
	}

	@Nonnull
	public TranslationOptions getOptions() {
		return this.options;
	}

	@Nullable
	public String getInstructions() {
		return this.instructions;
	}

	/**
	 * Returns the translation of a normalized text, loading it at most once per session.
	 *
	 * Concurrent requests for the same text share one pending future. A failed load is evicted, so a later
	 * request for the same text tries again.
	 *
	 * @param normalized trimmed source text
	 * @param loader     issues the backend call for a text that is not cached yet
	 * @return future with the trimmed translation
	 */
	@Nonnull
	public CompletableFuture<String> cached(
		@Nonnull String normalized,
		@Nonnull Function<String, ? extends CompletableFuture<String>> loader
	) {
		Objects.requireNonNull(normalized, "normalized must not be null");
		Objects.requireNonNull(loader, "loader must not be null");

		final CompletableFuture<String> created = new CompletableFuture<>();
		final CompletableFuture<String> existing = this.cache.putIfAbsent(normalized, created);
		if (existing != null) {
			return existing;
		}

		final CompletableFuture<String> loaded;
		try {
			loaded = loader.apply(normalized);
		} catch (RuntimeException e) {
			this.cache.remove(normalized, created);
			created.completeExceptionally(e);
			return created;
		}
		loaded.whenComplete((value, error) -> {
			if (error != null) {
				this.cache.remove(normalized, created);
				created.completeExceptionally(error);
			} else {
				created.complete(value);
			}
		});
		return created;
	}

	/**
	 * Returns a finished cached translation.
	 *
	 * @param normalized trimmed source text
	 * @return the translation if it has been loaded successfully
	 */
	@Nonnull
	public Optional<String> getCachedTranslation(@Nonnull String normalized) {
		final CompletableFuture<String> future = this.cache.get(normalized);
		if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
			return Optional.empty();
		}
		return Optional.ofNullable(future.join());
	}

	public int getCacheSize() {
		return this.cache.size();
	}

	/**
	 * Adds the usage of one backend call to the running totals.
	 *
	 * @param usage usage reported for the call
	 */
	public void recordUsage(@Nonnull Usage usage) {
		this.backendCalls.incrementAndGet();
		this.promptTokens.addAndGet(usage.input());
		this.completionTokens.addAndGet(usage.output());
	}

	/**
	 * Notes a segment whose translation failed and whose original text was kept.
	 */
	public void recordFailedSegment() {
		this.failedSegments.incrementAndGet();
	}

	/**
	 * Returns the token totals of every backend call made in this session so far.
	 *
	 * @return input and output token totals
	 */
	@Nonnull
	public Usage getUsage() {
		return new Usage(this.promptTokens.get(), this.completionTokens.get());
	}

	public int getBackendCallCount() {
		return this.backendCalls.get();
	}

	public int getFailedSegmentCount() {
		return this.failedSegments.get();
	}
}
