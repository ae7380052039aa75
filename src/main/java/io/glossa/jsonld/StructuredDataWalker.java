package io.glossa.jsonld;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

/**
 * Translates the human-readable fields of a JSON-LD `<script>` block.
 *
 * Only strings held under a whitelisted key (directly, or as elements of an array under that key) are
 * translated, and only when they are not URLs, not `@` identifiers and longer than two characters. Everything
 * else, including `@type`, `@context` and all other keys, is kept. A payload that does not parse is returned
 * untouched; a payload without translatable strings is returned byte-identical.
 */
public final class StructuredDataWalker {

	/**
	 * Keys whose string values are translated.
	 */
	public static final Set<String> TRANSLATABLE_KEYS = Set.of(
		"headline", "description", "text", "name", "articleSection", "keywords"
	);

	/**
	 * Strings of this length or shorter are kept.
	 */
	private static final int MAX_IGNORED_LENGTH = 2;

	/**
	 * Translates the script element.
	 *
	 * @param scriptMarkup complete `<script>...</script>` element
	 * @param translator   translates one string; expected to fall back to its input rather than fail
	 * @return stage with the element carrying translated fields
	 */
	@Nonnull
	public CompletionStage<String> translate(
		@Nonnull String scriptMarkup,
		@Nonnull Function<String, ? extends CompletionStage<String>> translator
	) {
		Objects.requireNonNull(scriptMarkup, "scriptMarkup must not be null");
		Objects.requireNonNull(translator, "translator must not be null");

		final Optional<ScriptPayload> payload = ScriptPayload.of(scriptMarkup);
		if (payload.isEmpty()) {
			return CompletableFuture.completedFuture(scriptMarkup);
		}
		final Optional<JsonNode> parsed = payload.get().parseJson();
		if (parsed.isEmpty()) {
			return CompletableFuture.completedFuture(scriptMarkup);
		}

		final JsonNode root = parsed.get();
		final List<StringSlot> slots = collectTranslatableStrings(root);
		if (slots.isEmpty()) {
			return CompletableFuture.completedFuture(scriptMarkup);
		}

		final List<CompletableFuture<String>> translations = new ArrayList<>(slots.size());
		for (final StringSlot slot : slots) {
			translations.add(translator.apply(slot.value()).toCompletableFuture());
		}

		return CompletableFuture.allOf(translations.toArray(new CompletableFuture[0]))
			.thenApply(ignored -> {
				for (int i = 0; i < slots.size(); i++) {
					slots.get(i).write(translations.get(i).join());
				}
				return payload.get().wrap(root);
			});
	}

	/**
	 * Checks whether the script element holds at least one string that {@link #translate} would send out.
	 *
	 * @param scriptMarkup complete `<script>...</script>` element
	 * @return false for unparseable payloads and payloads without translatable strings
	 */
	public boolean hasTranslatableStrings(@Nonnull String scriptMarkup) {
		Objects.requireNonNull(scriptMarkup, "scriptMarkup must not be null");
		return ScriptPayload.of(scriptMarkup)
			.flatMap(ScriptPayload::parseJson)
			.map(root -> !collectTranslatableStrings(root).isEmpty())
			.orElse(false);
	}

	/**
	 * Lists the strings that would be translated, in document order.
	 *
	 * @param root parsed JSON-LD tree
	 * @return translatable string slots
	 */
	@Nonnull
	public List<StringSlot> collectTranslatableStrings(@Nonnull JsonNode root) {
		final List<StringSlot> slots = new ArrayList<>();
		if (root.isObject()) {
			collectFromObject((ObjectNode) root, slots);
		} else if (root.isArray()) {
			collectFromArray((ArrayNode) root, false, slots);
		}
		return slots;
	}

	/**
	 * Returns true for values that may be translated when found under a whitelisted key.
	 *
	 * @param value string value
	 * @return false for URLs, `@` identifiers and very short values
	 */
	public static boolean isTranslatableValue(@Nonnull String value) {
		return !value.startsWith("http") && !value.startsWith("@") && value.length() > MAX_IGNORED_LENGTH;
	}

	private void collectFromObject(@Nonnull ObjectNode node, @Nonnull List<StringSlot> slots) {
		final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
		while (fields.hasNext()) {
			final Map.Entry<String, JsonNode> field = fields.next();
			final String key = field.getKey();
			final JsonNode value = field.getValue();
			final boolean translatableKey = TRANSLATABLE_KEYS.contains(key);

			if (value.isTextual()) {
				if (translatableKey && isTranslatableValue(value.textValue())) {
					slots.add(new ObjectSlot(node, key, value.textValue()));
				}
			} else if (value.isArray()) {
				collectFromArray((ArrayNode) value, translatableKey, slots);
			} else if (value.isObject()) {
				collectFromObject((ObjectNode) value, slots);
			}
		}
	}

	private void collectFromArray(@Nonnull ArrayNode array, boolean translatableKey, @Nonnull List<StringSlot> slots) {
		for (int i = 0; i < array.size(); i++) {
			final JsonNode element = array.get(i);
			if (element.isTextual()) {
				if (translatableKey && isTranslatableValue(element.textValue())) {
					slots.add(new ArraySlot(array, i, element.textValue()));
				}
			} else if (element.isArray()) {
				collectFromArray((ArrayNode) element, translatableKey, slots);
			} else if (element.isObject()) {
				collectFromObject((ObjectNode) element, slots);
			}
		}
	}

	/**
	 * A string value inside the tree that can be replaced in place.
	 */
	public sealed interface StringSlot permits ObjectSlot, ArraySlot {

		@Nonnull
		String value();

		void write(@Nonnull String translated);
	}

	/**
	 * String held under an object key.
	 */
	record ObjectSlot(@Nonnull ObjectNode parent, @Nonnull String key, @Nonnull String value) implements StringSlot {

		@Override
		public void write(@Nonnull String translated) {
			this.parent.set(this.key, TextNode.valueOf(translated));
		}
	}

	/**
	 * String held as an array element.
	 */
	record ArraySlot(@Nonnull ArrayNode parent, int index, @Nonnull String value) implements StringSlot {

		@Override
		public void write(@Nonnull String translated) {
			this.parent.set(this.index, TextNode.valueOf(translated));
		}
	}
}
