/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcplite.server;

import java.util.Map;
import java.util.Optional;

import io.mcplite.server.McpServerFeatures.ResourceTemplateSpecification;

/**
 * Resource templates keyed by their literal pattern, with URI matching.
 */
public class ResourceTemplateRegistry extends CapabilityRegistry<ResourceTemplateSpecification> {

	public ResourceTemplateRegistry() {
		super("resource template");
	}

	/**
	 * Finds the template that matches a concrete URI. Templates are tried in
	 * registration order and the first match wins, so when two patterns overlap the one
	 * registered earlier serves the read.
	 * @param uri the concrete resource URI
	 * @return the matching template with the extracted variable values, or empty
	 */
	public Optional<TemplateMatch> matchTemplate(String uri) {
		if (uri == null) {
			return Optional.empty();
		}
		return read(map -> {
			for (ResourceTemplateSpecification specification : map.values()) {
				Optional<Map<String, String>> variables = specification.uriTemplate().match(uri);
				if (variables.isPresent()) {
					return Optional.of(new TemplateMatch(specification, variables.get()));
				}
			}
			return Optional.empty();
		});
	}

	/**
	 * A template that matched a URI.
	 *
	 * @param specification the matching template registration
	 * @param variables the variable values, in declaration order
	 */
	public record TemplateMatch(ResourceTemplateSpecification specification, Map<String, String> variables) {
	}

}
