/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcplite.examples.calculator;

import java.util.List;

import io.mcplite.server.McpServerFeatures;
import io.mcplite.spec.McpSchema;

/**
 * A prompt asking the assistant to greet someone by name.
 */
public final class GreetingPrompt {

	public static final String PROMPT_NAME = "greeting";

	private GreetingPrompt() {
	}

	public static McpServerFeatures.PromptSpecification promptSpecification() {
		McpSchema.Prompt prompt = new McpSchema.Prompt(PROMPT_NAME, "Greets a person by name",
				List.of(new McpSchema.PromptArgument("name", "Who to greet", true)));
		return new McpServerFeatures.PromptSpecification(prompt,
				McpServerFeatures.PromptHandler.fromSync((exchange, request) -> {
					Object name = request.arguments().get("name");
					if (name == null || name.toString().isBlank()) {
						throw new IllegalArgumentException("Missing required argument: name");
					}
					return new McpSchema.GetPromptResult("Greeting for " + name,
							List.of(new McpSchema.PromptMessage(McpSchema.Role.USER,
									new McpSchema.TextContent("Please greet " + name + " warmly."))));
				}));
	}

}
