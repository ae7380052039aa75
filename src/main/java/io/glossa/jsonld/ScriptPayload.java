package io.glossa.jsonld;

import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * The payload of a `<script>` element split from its wrapper, so the payload can be replaced while the opening
 * tag, the closing tag and the whitespace around the payload stay as they were.
 *
 * @param openTag   the opening `<script ...>` tag
 * @param leading   whitespace between the opening tag and the payload
 * @param body      the trimmed payload
 * @param trailing  whitespace between the payload and the closing tag
 * @param closeTag  the closing `</script>` tag
 */
public record ScriptPayload(
	@Nonnull String openTag,
	@Nonnull String leading,
	@Nonnull String body,
	@Nonnull String trailing,
	@Nonnull String closeTag
) {

	/**
	 * Mapper shared by the JSON-LD code. Trailing garbage after the JSON value counts as malformed. Written
	 * strings escape `<`, so no value can close the script element or open an HTML comment.
	 */
	public static final ObjectMapper MAPPER = JsonMapper.builder(
			new JsonFactoryBuilder().characterEscapes(new ScriptSafeEscapes()).build()
		)
		.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
		.build();

	/**
	 * Splits a complete script element.
	 *
	 * @param scriptMarkup the raw `<script>...</script>` element
	 * @return the parts, or empty when the markup is not a complete script element
	 */
	@Nonnull
	public static Optional<ScriptPayload> of(@Nonnull String scriptMarkup) {
		Objects.requireNonNull(scriptMarkup, "scriptMarkup must not be null");

		final int openEnd = scriptMarkup.indexOf('>');
		final int closeStart = scriptMarkup.toLowerCase(Locale.ROOT).lastIndexOf("</script");
		if (openEnd < 0 || closeStart <= openEnd) {
			return Optional.empty();
		}

		final String inner = scriptMarkup.substring(openEnd + 1, closeStart);
		final String body = inner.strip();
		final int bodyStart = body.isEmpty() ? inner.length() : inner.indexOf(body);
		return Optional.of(new ScriptPayload(
			scriptMarkup.substring(0, openEnd + 1),
			inner.substring(0, bodyStart),
			body,
			inner.substring(bodyStart + body.length()),
			scriptMarkup.substring(closeStart)
		));
	}

	/**
	 * Parses the payload as JSON.
	 *
	 * @return the JSON tree, or empty when the payload is blank or not valid JSON
	 */
	@Nonnull
	public Optional<JsonNode> parseJson() {
		if (this.body.isEmpty()) {
			return Optional.empty();
		}
		try {
			return Optional.of(MAPPER.readTree(this.body));
		} catch (JsonProcessingException e) {
			return Optional.empty();
		}
	}

	/**
	 * Serializes the tree compactly and puts it back into the original wrapper.
	 *
	 * @param root the (modified) JSON tree
	 * @return the full script element
	 */
	@Nonnull
	public String wrap(@Nonnull JsonNode root) {
		try {
			return wrap(MAPPER.writeValueAsString(root));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Cannot serialize JSON-LD tree", e);
		}
	}

	/**
	 * Puts a new payload into the original wrapper.
	 *
	 * @param newBody the payload
	 * @return the full script element
	 */
	@Nonnull
	public String wrap(@Nonnull String newBody) {
		return this.openTag + this.leading + newBody + this.trailing + this.closeTag;
	}

	/**
	 * Standard JSON escaping plus `<` written as a unicode escape.
	 */
	private static final class ScriptSafeEscapes extends CharacterEscapes {

		private static final long serialVersionUID = 1L;

		private final int[] asciiEscapes;

		ScriptSafeEscapes() {
			final int[] escapes = CharacterEscapes.standardAsciiEscapesForJSON();
			escapes['<'] = CharacterEscapes.ESCAPE_STANDARD;
			this.asciiEscapes = escapes;
		}

		@Override
		public int[] getEscapeCodesForAscii() {
			return this.asciiEscapes;
		}

		@Override
		public SerializableString getEscapeSequence(int ch) {
			return null;
		}
	}
}
