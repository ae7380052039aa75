package io.glossa.llm;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads prompt templates from `META-INF/glossa/prompts/` on the classpath and fills in `{{name}}` placeholders.
 * Loaded templates are cached.
 */
public final class PromptLoader {

	/**
	 * System prompt for single text segments and JSON-LD strings.
	 */
	public static final String SEGMENT_SYSTEM_TEMPLATE = "translate-segment-system.txt";
	/**
	 * System prompt for a whole document or one piece of it.
	 */
	public static final String DOCUMENT_SYSTEM_TEMPLATE = "translate-document-system.txt";

	private static final String PROMPTS_PATH = "META-INF/glossa/prompts/";
	private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{(\\w+)}}");

	private final Map<String, String> templateCache = new ConcurrentHashMap<>();

	/**
	 * Loads a prompt template from the classpath.
	 *
	 * @param templateName the template file name
	 * @return the template content with line endings normalized to `\n`
	 * @throws IllegalArgumentException if the template is missing or unreadable
	 */
	@Nonnull
	public String loadTemplate(@Nonnull String templateName) {
		Objects.requireNonNull(templateName, "templateName must not be null");
		return this.templateCache.computeIfAbsent(templateName, this::loadTemplateFromClasspath);
	}

	/**
	 * Loads a template and replaces its placeholders.
	 *
	 * @param templateName the template file name
	 * @param values       placeholder values keyed by name (without braces)
	 * @return the interpolated prompt
	 */
	@Nonnull
	public String loadAndInterpolate(@Nonnull String templateName, @Nonnull Map<String, String> values) {
		Objects.requireNonNull(values, "values must not be null");
		return interpolate(loadTemplate(templateName), values);
	}

	/**
	 * Replaces `{{name}}` placeholders. Unknown placeholders are left untouched, empty values remove them.
	 *
	 * @param template the template string
	 * @param values   placeholder values
	 * @return the interpolated string
	 */
	@Nonnull
	public String interpolate(@Nonnull String template, @Nonnull Map<String, String> values) {
		Objects.requireNonNull(template, "template must not be null");
		Objects.requireNonNull(values, "values must not be null");

		final Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
		final StringBuilder result = new StringBuilder();
		while (matcher.find()) {
			final String value = values.get(matcher.group(1));
			if (value != null) {
				matcher.appendReplacement(result, Matcher.quoteReplacement(value));
			}
		}
		matcher.appendTail(result);
		return result.toString();
	}

	@Nonnull
	private String loadTemplateFromClasspath(@Nonnull String templateName) {
		final String resourcePath = PROMPTS_PATH + templateName;
		try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourcePath)) {
			if (inputStream == null) {
				throw new IllegalArgumentException("Prompt template not found: " + resourcePath);
			}
			final String content = new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
			return content.replace("\r\n", "\n").strip();
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read prompt template: " + resourcePath, e);
		}
	}
}
