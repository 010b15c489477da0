/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcplite.server;

import java.util.Map;

import io.mcplite.spec.McpSchema;
import io.mcplite.util.Assert;
import io.mcplite.util.UriTemplate;
import reactor.core.publisher.Mono;

/**
 * MCP server features specification that a particular server can choose to support.
 */
public final class McpServerFeatures {

	private McpServerFeatures() {
	}

	/**
	 * Specification of a resource with its handler function.
	 *
	 * <pre>{@code
	 * new McpServerFeatures.ResourceSpecification(
	 *     McpSchema.Resource.builder().uri("file:///readme.md").name("readme").mimeType("text/markdown").build(),
	 *     ResourceHandler.fromSync((exchange, request) -> new ReadResourceResult(List.of(
	 *         new TextResourceContents(request.uri(), "text/markdown", Files.readString(path))))));
	 * }</pre>
	 *
	 * @param resource The resource definition
	 * @param handler The function that reads the resource
	 */
	public record ResourceSpecification(McpSchema.Resource resource, ResourceHandler handler) {

		public ResourceSpecification {
			Assert.notNull(resource, "resource must not be null");
			Assert.hasText(resource.uri(), "resource uri must not be empty");
			Assert.notNull(handler, "handler must not be null");
		}
	}

	/**
	 * Specification of a resource template with its handler function. The template is
	 * compiled once at registration.
	 *
	 * @param resourceTemplate The template descriptor advertised to clients
	 * @param uriTemplate The compiled matcher for {@code resourceTemplate.uriTemplate()}
	 * @param handler The function that reads a matching resource
	 */
	public record ResourceTemplateSpecification(McpSchema.ResourceTemplate resourceTemplate, UriTemplate uriTemplate,
			ResourceTemplateHandler handler) {

		public ResourceTemplateSpecification {
			Assert.notNull(resourceTemplate, "resourceTemplate must not be null");
			Assert.notNull(uriTemplate, "uriTemplate must not be null");
			Assert.isTrue(uriTemplate.getTemplate().equals(resourceTemplate.uriTemplate()),
					"uriTemplate must be compiled from the descriptor's pattern");
			Assert.notNull(handler, "handler must not be null");
		}

		/**
		 * Compiles the descriptor's pattern.
		 * @param resourceTemplate the template descriptor
		 * @param handler the read handler
		 * @throws IllegalArgumentException if the pattern is not a valid template
		 */
		public ResourceTemplateSpecification(McpSchema.ResourceTemplate resourceTemplate,
				ResourceTemplateHandler handler) {
			this(resourceTemplate, compile(resourceTemplate), handler);
		}

		private static UriTemplate compile(McpSchema.ResourceTemplate resourceTemplate) {
			Assert.notNull(resourceTemplate, "resourceTemplate must not be null");
			return UriTemplate.compile(resourceTemplate.uriTemplate());
		}
	}

	/**
	 * Specification of a tool with its handler function. Tools are the primary way for
	 * MCP servers to expose functionality to AI models. Each tool represents a specific
	 * capability, such as performing calculations or querying a system.
	 *
	 * @param tool The tool definition including name, description, and parameter schema
	 * @param handler The function that implements the tool's logic
	 */
	public record ToolSpecification(McpSchema.Tool tool, ToolHandler handler) {

		public ToolSpecification {
			Assert.notNull(tool, "tool must not be null");
			Assert.hasText(tool.name(), "tool name must not be empty");
			Assert.notNull(handler, "handler must not be null");
		}
	}

	/**
	 * Specification of a prompt template with its handler function.
	 *
	 * @param prompt The prompt definition including name and argument descriptions
	 * @param handler The function that renders the prompt
	 */
	public record PromptSpecification(McpSchema.Prompt prompt, PromptHandler handler) {

		public PromptSpecification {
			Assert.notNull(prompt, "prompt must not be null");
			Assert.notNull(handler, "handler must not be null");
		}
	}

	/**
	 * Reads a static resource.
	 */
	@FunctionalInterface
	public interface ResourceHandler {

		Mono<McpSchema.ReadResourceResult> read(McpServerExchange exchange, McpSchema.ReadResourceRequest request);

		/**
		 * Adapts a blocking function. The function runs on the session's handler
		 * scheduler.
		 */
		static ResourceHandler fromSync(SyncResourceHandler handler) {
			Assert.notNull(handler, "handler must not be null");
			return (exchange, request) -> Mono.fromCallable(() -> handler.read(exchange, request));
		}

	}

	@FunctionalInterface
	public interface SyncResourceHandler {

		McpSchema.ReadResourceResult read(McpServerExchange exchange, McpSchema.ReadResourceRequest request)
				throws Exception;

	}

	/**
	 * Reads a resource addressed through a template.
	 */
	@FunctionalInterface
	public interface ResourceTemplateHandler {

		/**
		 * @param exchange the exchange of the current request
		 * @param request the read request with the concrete URI
		 * @param variables the values extracted from the URI, keyed by variable name
		 * @return the resource contents
		 */
		Mono<McpSchema.ReadResourceResult> read(McpServerExchange exchange, McpSchema.ReadResourceRequest request,
				Map<String, String> variables);

		static ResourceTemplateHandler fromSync(SyncResourceTemplateHandler handler) {
			Assert.notNull(handler, "handler must not be null");
			return (exchange, request, variables) -> Mono
				.fromCallable(() -> handler.read(exchange, request, variables));
		}

	}

	@FunctionalInterface
	public interface SyncResourceTemplateHandler {

		McpSchema.ReadResourceResult read(McpServerExchange exchange, McpSchema.ReadResourceRequest request,
				Map<String, String> variables) throws Exception;

	}

	/**
	 * Executes a tool call. An error signal is reported to the caller as a result
	 * flagged with {@code isError}; an {@link io.mcplite.spec.McpError} is reported as a
	 * JSON-RPC error instead.
	 */
	@FunctionalInterface
	public interface ToolHandler {

		Mono<McpSchema.CallToolResult> call(McpServerExchange exchange, Map<String, Object> arguments);

		static ToolHandler fromSync(SyncToolHandler handler) {
			Assert.notNull(handler, "handler must not be null");
			return (exchange, arguments) -> Mono.fromCallable(() -> handler.call(exchange, arguments));
		}

	}

	@FunctionalInterface
	public interface SyncToolHandler {

		McpSchema.CallToolResult call(McpServerExchange exchange, Map<String, Object> arguments) throws Exception;

	}

	/**
	 * Renders a prompt.
	 */
	@FunctionalInterface
	public interface PromptHandler {

		Mono<McpSchema.GetPromptResult> get(McpServerExchange exchange, McpSchema.GetPromptRequest request);

		static PromptHandler fromSync(SyncPromptHandler handler) {
			Assert.notNull(handler, "handler must not be null");
			return (exchange, request) -> Mono.fromCallable(() -> handler.get(exchange, request));
		}

	}

	@FunctionalInterface
	public interface SyncPromptHandler {

		McpSchema.GetPromptResult get(McpServerExchange exchange, McpSchema.GetPromptRequest request) throws Exception;

	}

}
