package io.glossa.llm;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Creates the LangChain4j {@link ChatModel} behind {@link LlmClient}.
 * Supports OpenAI-compatible endpoints (OpenAI, Groq, Ollama, DeepSeek, etc.) and Anthropic.
 */
public final class ChatModelFactory {

	public static final String PROVIDER_OPENAI = "openai";
	public static final String PROVIDER_ANTHROPIC = "anthropic";

	private static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);
	// translation should stay close to the source
	private static final double DEFAULT_TEMPERATURE = 0.2;
	private static final int DEFAULT_MAX_RETRIES = 3;
	private static final String DEFAULT_OPENAI_MODEL = "gpt-4o-mini";
	private static final String DEFAULT_ANTHROPIC_MODEL = "claude-sonnet-4-5-20250929";

	private ChatModelFactory() {
		// utility class
	}

	/**
	 * Creates a chat model for the given provider.
	 *
	 * @param provider  "openai" or "anthropic" (case-insensitive)
	 * @param llmUrl    base URL of the endpoint, e.g. "https://api.openai.com/v1"
	 * @param llmToken  API key, may be null for local endpoints
	 * @param modelName model name, null or blank for the provider default
	 * @return configured chat model
	 * @throws IllegalArgumentException if the provider is unknown or the URL is blank
	 */
	@Nonnull
	public static ChatModel create(
		@Nonnull String provider,
		@Nonnull String llmUrl,
		@Nullable String llmToken,
		@Nullable String modelName
	) {
		Objects.requireNonNull(provider, "provider must not be null");
		Objects.requireNonNull(llmUrl, "llmUrl must not be null");
		if (llmUrl.isBlank()) {
			throw new IllegalArgumentException("llmUrl must not be blank");
		}

		final String baseUrl = stripTrailingSlashes(llmUrl.trim());
		return switch (provider.trim().toLowerCase(Locale.ROOT)) {
			case PROVIDER_OPENAI -> OpenAiChatModel.builder()
				.baseUrl(baseUrl)
				// some OpenAI-compatible servers reject a missing key
				.apiKey(isBlank(llmToken) ? "none" : llmToken)
				.modelName(isBlank(modelName) ? DEFAULT_OPENAI_MODEL : modelName)
				.timeout(DEFAULT_TIMEOUT)
				.temperature(DEFAULT_TEMPERATURE)
				.maxRetries(DEFAULT_MAX_RETRIES)
				.logRequests(false)
				.logResponses(false)
				.build();
			case PROVIDER_ANTHROPIC -> {
				final AnthropicChatModel.AnthropicChatModelBuilder builder = AnthropicChatModel.builder()
					.baseUrl(baseUrl)
					.modelName(isBlank(modelName) ? DEFAULT_ANTHROPIC_MODEL : modelName)
					.timeout(DEFAULT_TIMEOUT)
					.temperature(DEFAULT_TEMPERATURE)
					.maxRetries(DEFAULT_MAX_RETRIES)
					.logRequests(false)
					.logResponses(false);
				if (!isBlank(llmToken)) {
					builder.apiKey(llmToken);
				}
				yield builder.build();
			}
			default -> throw new IllegalArgumentException(
				"Unknown provider: " + provider + ". Supported providers: " + PROVIDER_OPENAI + ", " + PROVIDER_ANTHROPIC
			);
		};
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.isBlank();
	}

	@Nonnull
	private static String stripTrailingSlashes(@Nonnull String url) {
		int end = url.length();
		while (end > 0 && url.charAt(end - 1) == '/') {
			end--;
		}
		return url.substring(0, end);
	}
}
