package io.glossa.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.glossa.jsonld.ScriptPayload;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes translated title and description strings into an already assembled document.
 *
 * Each string is translated once and written only at its {@link MetadataSlot}: the text of `<h1>` elements, the
 * description meta tag and JSON-LD `headline` values. Text that merely happens to contain the same words elsewhere
 * in the document is never touched.
 */
public final class MetadataPatcher {

	private static final Pattern HEADING_PATTERN = Pattern.compile(
		"(<h1\\b[^>]*>)(\\s*)([\\s\\S]*?)(\\s*)(</h1\\s*>)", Pattern.CASE_INSENSITIVE
	);
	private static final Pattern META_TAG_PATTERN = Pattern.compile("<meta\\b[^>]*>", Pattern.CASE_INSENSITIVE);
	private static final Pattern DESCRIPTION_NAME_PATTERN = Pattern.compile(
		"\\bname\\s*=\\s*([\"'])description\\1", Pattern.CASE_INSENSITIVE
	);
	private static final Pattern CONTENT_ATTRIBUTE_PATTERN = Pattern.compile(
		"(\\bcontent\\s*=\\s*)([\"'])([\\s\\S]*?)\\2", Pattern.CASE_INSENSITIVE
	);
	private static final Pattern SCRIPT_PATTERN = Pattern.compile(
		"<script\\b[^>]*>[\\s\\S]*?</script\\s*>", Pattern.CASE_INSENSITIVE
	);
	private static final String HEADLINE_KEY = "headline";

	/**
	 * Translates the given strings and patches them into the markup.
	 *
	 * @param markup              assembled document
	 * @param originalTitle       title before translation, null or blank to skip the title slots
	 * @param originalDescription description before translation, null or blank to skip the description slot
	 * @param translator          translates one string; a failed stage keeps the original
	 * @return stage with the patched markup
	 */
	@Nonnull
	public CompletionStage<String> patch(
		@Nonnull String markup,
		@Nullable String originalTitle,
		@Nullable String originalDescription,
		@Nonnull Function<String, ? extends CompletionStage<String>> translator
	) {
		Objects.requireNonNull(markup, "markup must not be null");
		Objects.requireNonNull(translator, "translator must not be null");

		final boolean hasTitle = originalTitle != null && !originalTitle.isBlank();
		final boolean hasDescription = originalDescription != null && !originalDescription.isBlank();
		if (!hasTitle && !hasDescription) {
			return CompletableFuture.completedFuture(markup);
		}

		final CompletableFuture<String> title = hasTitle ?
			translateOrKeep(originalTitle.strip(), translator) : CompletableFuture.completedFuture(null);
		final CompletableFuture<String> description = hasDescription ?
			translateOrKeep(originalDescription.strip(), translator) : CompletableFuture.completedFuture(null);

		return title.thenCombine(description, (translatedTitle, translatedDescription) -> {
			final List<MetadataField> fields = new ArrayList<>(3);
			if (hasTitle) {
				fields.add(new MetadataField(MetadataSlot.HEADING, originalTitle.strip(), translatedTitle));
				fields.add(new MetadataField(MetadataSlot.STRUCTURED_DATA_HEADLINE, originalTitle.strip(), translatedTitle));
			}
			if (hasDescription) {
				fields.add(new MetadataField(MetadataSlot.META_DESCRIPTION, originalDescription.strip(), translatedDescription));
			}
			return apply(markup, fields);
		});
	}

	/**
	 * Writes every field into its slot.
	 *
	 * @param markup assembled document
	 * @param fields fields to apply
	 * @return patched markup
	 */
	@Nonnull
	public String apply(@Nonnull String markup, @Nonnull List<MetadataField> fields) {
		Objects.requireNonNull(markup, "markup must not be null");
		Objects.requireNonNull(fields, "fields must not be null");

		String result = markup;
		for (final MetadataField field : fields) {
			if (field.isUnchanged()) {
				continue;
			}
			result = switch (field.slot()) {
				case HEADING -> applyHeading(result, field);
				case META_DESCRIPTION -> applyMetaDescription(result, field);
				case STRUCTURED_DATA_HEADLINE -> applyStructuredDataHeadline(result, field);
			};
		}
		return result;
	}

	@Nonnull
	private static String applyHeading(@Nonnull String markup, @Nonnull MetadataField field) {
		final Matcher matcher = HEADING_PATTERN.matcher(markup);
		final StringBuilder sb = new StringBuilder(markup.length());
		while (matcher.find()) {
			final Optional<String> replacement = replacementFor(matcher.group(3), field, '"');
			final String text = replacement.orElse(matcher.group(3));
			matcher.appendReplacement(
				sb,
				Matcher.quoteReplacement(matcher.group(1) + matcher.group(2) + text + matcher.group(4) + matcher.group(5))
			);
		}
		matcher.appendTail(sb);
		return sb.toString();
	}

	@Nonnull
	private static String applyMetaDescription(@Nonnull String markup, @Nonnull MetadataField field) {
		final Matcher metaMatcher = META_TAG_PATTERN.matcher(markup);
		final StringBuilder sb = new StringBuilder(markup.length());
		while (metaMatcher.find()) {
			final String tag = metaMatcher.group();
			String patched = tag;
			if (DESCRIPTION_NAME_PATTERN.matcher(tag).find()) {
				final Matcher content = CONTENT_ATTRIBUTE_PATTERN.matcher(tag);
				if (content.find()) {
					final char quote = content.group(2).charAt(0);
					final Optional<String> replacement = replacementFor(content.group(3), field, quote);
					if (replacement.isPresent()) {
						patched = tag.substring(0, content.start(3)) + replacement.get() + tag.substring(content.end(3));
					}
				}
			}
			metaMatcher.appendReplacement(sb, Matcher.quoteReplacement(patched));
		}
		metaMatcher.appendTail(sb);
		return sb.toString();
	}

	@Nonnull
	private static String applyStructuredDataHeadline(@Nonnull String markup, @Nonnull MetadataField field) {
		final Matcher matcher = SCRIPT_PATTERN.matcher(markup);
		final StringBuilder sb = new StringBuilder(markup.length());
		while (matcher.find()) {
			final String script = matcher.group();
			final String patched = ScriptPayload.of(script)
				.flatMap(payload -> payload.parseJson()
					.filter(root -> replaceHeadlines(root, field) > 0)
					.map(payload::wrap))
				.orElse(script);
			matcher.appendReplacement(sb, Matcher.quoteReplacement(patched));
		}
		matcher.appendTail(sb);
		return sb.toString();
	}

	private static int replaceHeadlines(@Nonnull JsonNode node, @Nonnull MetadataField field) {
		int replaced = 0;
		if (node.isObject()) {
			final ObjectNode object = (ObjectNode) node;
			final JsonNode headline = object.get(HEADLINE_KEY);
			if (headline != null && headline.isTextual() && headline.asText().strip().equals(field.original())) {
				object.put(HEADLINE_KEY, field.translated());
				replaced++;
			}
			final Iterator<Map.Entry<String, JsonNode>> it = object.fields();
			while (it.hasNext()) {
				final Map.Entry<String, JsonNode> entry = it.next();
				if (entry.getValue().isContainerNode()) {
					replaced += replaceHeadlines(entry.getValue(), field);
				}
			}
		} else if (node.isArray()) {
			for (final JsonNode element : node) {
				replaced += replaceHeadlines(element, field);
			}
		}
		return replaced;
	}

	/**
	 * Returns the text to write when the slot currently holds the field's original, either as-is or HTML escaped.
	 * The translation is escaped the same way the original was; the enclosing quote character is always escaped.
	 */
	@Nonnull
	private static Optional<String> replacementFor(@Nonnull String current, @Nonnull MetadataField field, char quote) {
		if (current.equals(escapeHtml(field.original(), quote))) {
			return Optional.of(escapeHtml(field.translated(), quote));
		}
		if (current.equals(field.original())) {
			return Optional.of(field.translated().replace(String.valueOf(quote), quoteEntity(quote)));
		}
		return Optional.empty();
	}

	/**
	 * Escapes markup characters and the given quote character.
	 *
	 * @param text  text to escape
	 * @param quote `"` or `'`
	 * @return escaped text
	 */
	@Nonnull
	static String escapeHtml(@Nonnull String text, char quote) {
		return text
			.replace("&", "&amp;")
			.replace("<", "&lt;")
			.replace(">", "&gt;")
			.replace(String.valueOf(quote), quoteEntity(quote));
	}

	@Nonnull
	private static String quoteEntity(char quote) {
		return quote == '\'' ? "&#39;" : "&quot;";
	}

	@Nonnull
	private static CompletableFuture<String> translateOrKeep(
		@Nonnull String original,
		@Nonnull Function<String, ? extends CompletionStage<String>> translator
	) {
		final CompletableFuture<String> translated;
		try {
			translated = translator.apply(original).toCompletableFuture();
		} catch (RuntimeException e) {
			return CompletableFuture.completedFuture(original);
		}
		return translated.handle((value, error) ->
			error != null || value == null || value.isBlank() ? original : value.strip()
		);
	}
}
