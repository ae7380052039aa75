package io.glossa.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.glossa.model.Usage;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Completion backend: sends a system instruction and a user text to a {@link ChatModel} and returns the answer
 * together with its token usage.
 *
 * LangChain4j already retries transient errors with backoff. This client adds:
 * - detection of permanent failures (authentication, invalid request, etc.)
 * - fast-fail for every later call once a permanent failure was seen, so a batch stops burning requests
 *
 * Exception handling:
 * - {@link NonRetriableException}: latches the client and propagates
 * - other exceptions: propagated as-is
 */
public final class LlmClient {

	@Nonnull
	private final ChatModel model;
	@Nonnull
	private final AtomicBoolean permanentFailure = new AtomicBoolean(false);
	@Nonnull
	private final AtomicReference<NonRetriableException> failureCause = new AtomicReference<>();

	/**
	 * Creates an LLM client wrapping the given ChatModel.
	 *
	 * @param model the underlying chat model
	 */
	public LlmClient(@Nonnull ChatModel model) {
		this.model = Objects.requireNonNull(model, "model must not be null");
	}

	/**
	 * Runs one completion.
	 *
	 * @param systemInstruction instruction sent as the system message
	 * @param userText          text sent as the user message
	 * @return the model's answer and usage
	 * @throws NonRetriableException if a permanent failure occurs
	 * @throws LangChain4jException  for other LLM errors or when the client is latched
	 */
	@Nonnull
	public Completion complete(@Nonnull String systemInstruction, @Nonnull String userText) {
		Objects.requireNonNull(systemInstruction, "systemInstruction must not be null");
		Objects.requireNonNull(userText, "userText must not be null");

		final List<ChatMessage> messages = List.of(
			SystemMessage.from(systemInstruction),
			UserMessage.from(userText)
		);
		final ChatResponse response = chat(messages);
		final AiMessage aiMessage = response.aiMessage();
		final String text = aiMessage == null || aiMessage.text() == null ? "" : aiMessage.text();
		return new Completion(text, Usage.from(response.tokenUsage()));
	}

	/**
	 * Sends raw messages to the model.
	 *
	 * @param messages the messages to send
	 * @return the chat response
	 */
	@Nonnull
	public ChatResponse chat(@Nonnull List<ChatMessage> messages) {
		Objects.requireNonNull(messages, "messages must not be null");

		if (this.permanentFailure.get()) {
			final NonRetriableException cause = this.failureCause.get();
			throw new LangChain4jException(
				"LLM client shut down after a permanent failure" +
					(cause != null ? ": " + cause.getMessage() : ""),
				cause
			);
		}

		try {
			return this.model.chat(messages);
		} catch (NonRetriableException e) {
			this.failureCause.set(e);
			this.permanentFailure.set(true);
			throw e;
		}
	}

	/**
	 * Checks if a permanent failure has occurred.
	 * When true, all subsequent calls fail immediately.
	 *
	 * @return true if permanent failure, false otherwise
	 */
	public boolean hasPermanentFailure() {
		return this.permanentFailure.get();
	}

	/**
	 * Returns the cause of the permanent failure, if any.
	 *
	 * @return the permanent failure exception or null
	 */
	@Nullable
	public NonRetriableException getFailureCause() {
		return this.failureCause.get();
	}
}
