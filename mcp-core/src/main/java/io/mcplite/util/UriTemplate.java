/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcplite.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A compiled resource URI template such as {@code user://{userId}/profile}.
 * <p>
 * Each {@code {name}} placeholder matches exactly one non-empty segment that does not
 * contain a {@code /}. All other characters of the template are matched literally, and
 * a URI matches only if the whole string matches the template.
 */
public final class UriTemplate {

	private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{([^{}]*)\\}");

	private static final String SEGMENT_PATTERN = "([^/]+)";

	private final String template;

	private final Pattern pattern;

	private final List<String> variableNames;

	private UriTemplate(String template, Pattern pattern, List<String> variableNames) {
		this.template = template;
		this.pattern = pattern;
		this.variableNames = variableNames;
	}

	/**
	 * Compiles the given template.
	 * @param template the URI template
	 * @return the compiled template
	 * @throws IllegalArgumentException if the template is null or empty, or declares an
	 * empty or duplicate variable name
	 */
	public static UriTemplate compile(String template) {
		Assert.hasText(template, "URI template must not be null or empty");

		List<String> names = new ArrayList<>();
		StringBuilder regex = new StringBuilder("^");
		Matcher matcher = VARIABLE_PATTERN.matcher(template);
		int last = 0;
		while (matcher.find()) {
			String name = matcher.group(1).trim();
			if (name.isEmpty()) {
				throw new IllegalArgumentException("Empty variable name in URI template: " + template);
			}
			if (names.contains(name)) {
				throw new IllegalArgumentException(
						"Duplicate variable name '" + name + "' in URI template: " + template);
			}
			names.add(name);
			appendLiteral(regex, template.substring(last, matcher.start()));
			regex.append(SEGMENT_PATTERN);
			last = matcher.end();
		}
		appendLiteral(regex, template.substring(last));
		regex.append('$');

		return new UriTemplate(template, Pattern.compile(regex.toString()), Collections.unmodifiableList(names));
	}

	private static void appendLiteral(StringBuilder regex, String literal) {
		if (!literal.isEmpty()) {
			regex.append(Pattern.quote(literal));
		}
	}

	/**
	 * Returns the original template string.
	 * @return the template
	 */
	public String getTemplate() {
		return this.template;
	}

	/**
	 * Returns the variable names in declaration order.
	 * @return an unmodifiable list of variable names
	 */
	public List<String> getVariableNames() {
		return this.variableNames;
	}

	/**
	 * Checks whether the URI matches this template.
	 * @param uri the URI to test
	 * @return {@code true} if the whole URI matches
	 */
	public boolean matches(String uri) {
		return uri != null && this.pattern.matcher(uri).matches();
	}

	/**
	 * Matches the URI against this template and extracts the variable values.
	 * @param uri the URI to match
	 * @return the captured values keyed by variable name in declaration order, or empty
	 * if the URI does not match
	 */
	public Optional<Map<String, String>> match(String uri) {
		if (uri == null) {
			return Optional.empty();
		}
		Matcher matcher = this.pattern.matcher(uri);
		if (!matcher.matches()) {
			return Optional.empty();
		}
		Map<String, String> values = new LinkedHashMap<>();
		for (int i = 0; i < this.variableNames.size(); i++) {
			values.put(this.variableNames.get(i), matcher.group(i + 1));
		}
		return Optional.of(Collections.unmodifiableMap(values));
	}

	/**
	 * Extracts the variable values from the URI.
	 * @param uri the URI to match
	 * @return the captured values, or an empty map if the URI does not match
	 */
	public Map<String, String> extractVariableValues(String uri) {
		return match(uri).orElse(Map.of());
	}

	@Override
	public String toString() {
		return this.template;
	}

}
