/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcplite.server;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

import io.mcplite.json.McpJsonMapper;
import io.mcplite.json.TypeRef;
import io.mcplite.server.McpServerFeatures.PromptSpecification;
import io.mcplite.server.McpServerFeatures.ResourceSpecification;
import io.mcplite.server.McpServerFeatures.ResourceTemplateSpecification;
import io.mcplite.server.McpServerFeatures.ToolSpecification;
import io.mcplite.server.McpServerSession.RequestHandler;
import io.mcplite.server.ResourceTemplateRegistry.TemplateMatch;
import io.mcplite.spec.McpError;
import io.mcplite.spec.McpSchema;
import io.mcplite.spec.McpSchema.CallToolResult;
import io.mcplite.spec.McpSchema.ReadResourceResult;
import io.mcplite.spec.McpSchema.TextResourceContents;
import io.mcplite.spec.McpServerTransport;
import io.mcplite.util.Assert;
import io.mcplite.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * An MCP server that exposes resources, resource templates, tools and prompts to a
 * single connected client.
 *
 * <p>
 * The server owns its identity, its advertised capabilities and the four capability
 * registries. Capabilities may be added or removed at any time, before or after
 * {@link #connect(McpServerTransport)}; a request only ever sees a consistent
 * snapshot of one registry.
 *
 * <pre>{@code
 * McpServer server = McpServer.builder()
 *     .serverInfo("calculator", "1.0.0")
 *     .tools(calculatorTool)
 *     .build();
 * server.connect(new StdioServerTransport(McpJsonMapper.createDefault()));
 * }</pre>
 */
public final class McpServer {

	private static final Logger logger = LoggerFactory.getLogger(McpServer.class);

	private static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 256;

	private static final TypeRef<McpSchema.ReadResourceRequest> READ_RESOURCE_REQUEST = new TypeRef<>() {
	};

	private static final TypeRef<McpSchema.CallToolRequest> CALL_TOOL_REQUEST = new TypeRef<>() {
	};

	private static final TypeRef<McpSchema.GetPromptRequest> GET_PROMPT_REQUEST = new TypeRef<>() {
	};

	private static final TypeRef<McpSchema.SetLevelRequest> SET_LEVEL_REQUEST = new TypeRef<>() {
	};

	private final McpSchema.Implementation serverInfo;

	private final McpSchema.ServerCapabilities capabilities;

	private final String instructions;

	private final McpJsonMapper jsonMapper;

	private final int maxConcurrentRequests;

	private final Scheduler handlerScheduler;

	private final CapabilityRegistry<ResourceSpecification> resources = new CapabilityRegistry<>("resource");

	private final ResourceTemplateRegistry resourceTemplates = new ResourceTemplateRegistry();

	private final CapabilityRegistry<ToolSpecification> tools = new CapabilityRegistry<>("tool");

	private final CapabilityRegistry<PromptSpecification> prompts = new CapabilityRegistry<>("prompt");

	private final McpNotificationEmitter notifications = new McpNotificationEmitter();

	private final AtomicReference<McpServerSession> session = new AtomicReference<>();

	private McpServer(Builder builder) {
		this.serverInfo = builder.serverInfo;
		this.capabilities = builder.capabilities;
		this.instructions = builder.instructions;
		this.jsonMapper = builder.jsonMapper;
		this.maxConcurrentRequests = builder.maxConcurrentRequests;
		this.handlerScheduler = builder.handlerScheduler;

		builder.resources.forEach(this::addResource);
		builder.resourceTemplates.forEach(this::addResourceTemplate);
		builder.tools.forEach(this::addTool);
		builder.prompts.forEach(this::addPrompt);
	}

	public static Builder builder() {
		return new Builder();
	}

	public McpSchema.Implementation getServerInfo() {
		return this.serverInfo;
	}

	public McpSchema.ServerCapabilities getServerCapabilities() {
		return this.capabilities;
	}

	public McpJsonMapper getJsonMapper() {
		return this.jsonMapper;
	}

	// ---------------------------------------
	// Lifecycle
	// ---------------------------------------

	/**
	 * Attaches the transport and starts serving it. A server serves exactly one
	 * transport over its lifetime.
	 * @param transport the channel to the client
	 * @return the started session
	 * @throws IllegalStateException if a transport was already attached
	 */
	public McpServerSession connect(McpServerTransport transport) {
		Assert.notNull(transport, "transport must not be null");

		McpSchema.InitializeResult initializeResult = new McpSchema.InitializeResult(
				McpSchema.LATEST_PROTOCOL_VERSION, this.capabilities, this.serverInfo, this.instructions);
		McpServerSession newSession = new McpServerSession(transport, initializeResult, requestHandlers(),
				this.notifications, this.maxConcurrentRequests, this.handlerScheduler);
		if (!this.session.compareAndSet(null, newSession)) {
			throw new IllegalStateException("Server is already connected to a transport");
		}
		this.notifications.attach(transport);

		logger.info("Connecting server {} {}", this.serverInfo.name(), this.serverInfo.version());
		newSession.start();
		return newSession;
	}

	/**
	 * Returns the emitter for server-initiated notifications.
	 */
	public McpNotificationEmitter notifications() {
		return this.notifications;
	}

	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			McpServerSession current = this.session.get();
			return current != null ? current.closeGracefully() : Mono.empty();
		});
	}

	public void close() {
		McpServerSession current = this.session.get();
		if (current != null) {
			current.close();
		}
	}

	// ---------------------------------------
	// Resource Management
	// ---------------------------------------

	/**
	 * Registers a static resource, replacing any resource with the same URI.
	 * @param resourceSpecification the resource and its read handler
	 */
	public void addResource(ResourceSpecification resourceSpecification) {
		Assert.notNull(resourceSpecification, "Resource must not be null");
		this.resources.register(resourceSpecification.resource().uri(), resourceSpecification);
	}

	public boolean removeResource(String resourceUri) {
		return this.resources.unregister(resourceUri).isPresent();
	}

	/**
	 * Registers a resource template, replacing any template with the same pattern.
	 * @param templateSpecification the template and its read handler
	 */
	public void addResourceTemplate(ResourceTemplateSpecification templateSpecification) {
		Assert.notNull(templateSpecification, "Resource template must not be null");
		this.resourceTemplates.register(templateSpecification.resourceTemplate().uriTemplate(),
				templateSpecification);
	}

	public boolean removeResourceTemplate(String uriTemplate) {
		return this.resourceTemplates.unregister(uriTemplate).isPresent();
	}

	public List<McpSchema.Resource> listResources() {
		return this.resources.list().stream().map(ResourceSpecification::resource).toList();
	}

	public List<McpSchema.ResourceTemplate> listResourceTemplates() {
		return this.resourceTemplates.list().stream().map(ResourceTemplateSpecification::resourceTemplate).toList();
	}

	/**
	 * Registers a text resource whose content is produced by a plain function.
	 * @param uri the resource URI
	 * @param name the display name
	 * @param description the description, may be {@code null}
	 * @param mimeType the MIME type, may be {@code null}
	 * @param content produces the resource text
	 */
	public void textResource(String uri, String name, String description, String mimeType,
			Supplier<String> content) {
		Assert.notNull(content, "content must not be null");
		McpSchema.Resource resource = McpSchema.Resource.builder()
			.uri(uri)
			.name(name)
			.description(description)
			.mimeType(mimeType)
			.build();
		addResource(new ResourceSpecification(resource, McpServerFeatures.ResourceHandler
			.fromSync((exchange, request) -> textResult(request.uri(), mimeType, content.get()))));
	}

	/**
	 * Registers a text resource template whose content is produced from the extracted
	 * variables.
	 * @param uriTemplate the pattern, e.g. {@code user://{userId}}
	 * @param name the display name
	 * @param description the description, may be {@code null}
	 * @param mimeType the MIME type, may be {@code null}
	 * @param content produces the resource text from the variable values
	 */
	public void textResourceTemplate(String uriTemplate, String name, String description, String mimeType,
			Function<Map<String, String>, String> content) {
		Assert.notNull(content, "content must not be null");
		McpSchema.ResourceTemplate template = new McpSchema.ResourceTemplate(uriTemplate, name, description,
				mimeType);
		addResourceTemplate(new ResourceTemplateSpecification(template, McpServerFeatures.ResourceTemplateHandler
			.fromSync((exchange, request, variables) -> textResult(request.uri(), mimeType, content.apply(variables)))));
	}

	private static ReadResourceResult textResult(String uri, String mimeType, String text) {
		return new ReadResourceResult(List.of(new TextResourceContents(uri, mimeType, text)));
	}

	// ---------------------------------------
	// Tool Management
	// ---------------------------------------

	/**
	 * Registers a tool, replacing any tool with the same name.
	 * @param toolSpecification the tool and its handler
	 */
	public void addTool(ToolSpecification toolSpecification) {
		Assert.notNull(toolSpecification, "Tool specification must not be null");
		this.tools.register(toolSpecification.tool().name(), toolSpecification);
	}

	public boolean removeTool(String toolName) {
		return this.tools.unregister(toolName).isPresent();
	}

	public List<McpSchema.Tool> listTools() {
		return this.tools.list().stream().map(ToolSpecification::tool).toList();
	}

	/**
	 * Registers a tool whose output is a single text block produced by a plain
	 * function. An exception thrown by the function is reported as a failed tool
	 * result.
	 * @param name the tool name
	 * @param description the description
	 * @param inputSchema the JSON schema of the arguments, may be {@code null}
	 * @param function computes the text output from the arguments
	 */
	public void textTool(String name, String description, Map<String, Object> inputSchema,
			Function<Map<String, Object>, String> function) {
		Assert.notNull(function, "function must not be null");
		McpSchema.Tool tool = McpSchema.Tool.builder()
			.name(name)
			.description(description)
			.inputSchema(inputSchema)
			.build();
		addTool(new ToolSpecification(tool, McpServerFeatures.ToolHandler
			.fromSync((exchange, arguments) -> CallToolResult.text(function.apply(arguments)))));
	}

	// ---------------------------------------
	// Prompt Management
	// ---------------------------------------

	/**
	 * Registers a prompt, replacing any prompt with the same name.
	 * @param promptSpecification the prompt and its handler
	 */
	public void addPrompt(PromptSpecification promptSpecification) {
		Assert.notNull(promptSpecification, "Prompt specification must not be null");
		this.prompts.register(promptSpecification.prompt().name(), promptSpecification);
	}

	public boolean removePrompt(String promptName) {
		return this.prompts.unregister(promptName).isPresent();
	}

	public List<McpSchema.Prompt> listPrompts() {
		return this.prompts.list().stream().map(PromptSpecification::prompt).toList();
	}

	// ---------------------------------------
	// Request handlers
	// ---------------------------------------

	private Map<String, RequestHandler<?>> requestHandlers() {
		Map<String, RequestHandler<?>> handlers = new HashMap<>();
		handlers.put(McpSchema.METHOD_PING, (exchange, params) -> Mono.just(Map.of()));
		handlers.put(McpSchema.METHOD_RESOURCES_LIST, resourcesListRequestHandler());
		handlers.put(McpSchema.METHOD_RESOURCES_TEMPLATES_LIST, resourceTemplateListRequestHandler());
		handlers.put(McpSchema.METHOD_RESOURCES_READ, resourcesReadRequestHandler());
		handlers.put(McpSchema.METHOD_TOOLS_LIST, toolsListRequestHandler());
		handlers.put(McpSchema.METHOD_TOOLS_CALL, toolsCallRequestHandler());
		handlers.put(McpSchema.METHOD_PROMPT_LIST, promptsListRequestHandler());
		handlers.put(McpSchema.METHOD_PROMPT_GET, promptsGetRequestHandler());
		handlers.put(McpSchema.METHOD_LOGGING_SET_LEVEL, setLoggerRequestHandler());
		return Map.copyOf(handlers);
	}

	private RequestHandler<McpSchema.ListResourcesResult> resourcesListRequestHandler() {
		return (exchange, params) -> Mono.fromSupplier(() -> {
			List<McpSchema.Resource> all = new ArrayList<>(listResources());
			// templates are listed as resources whose uri is the pattern
			for (McpSchema.ResourceTemplate template : listResourceTemplates()) {
				all.add(new McpSchema.Resource(template.uriTemplate(), template.name(), template.description(),
						template.mimeType()));
			}
			return new McpSchema.ListResourcesResult(all, null);
		});
	}

	private RequestHandler<McpSchema.ListResourceTemplatesResult> resourceTemplateListRequestHandler() {
		return (exchange, params) -> Mono
			.fromSupplier(() -> new McpSchema.ListResourceTemplatesResult(listResourceTemplates(), null));
	}

	private RequestHandler<ReadResourceResult> resourcesReadRequestHandler() {
		return (exchange, params) -> {
			McpSchema.ReadResourceRequest request = unmarshal(params, READ_RESOURCE_REQUEST);
			if (!Utils.hasText(request.uri())) {
				return Mono.error(McpError.invalidParams("uri is required"));
			}
			String uri = request.uri();

			Mono<ReadResourceResult> result = this.resources.lookup(uri)
				.map(specification -> Mono.defer(() -> specification.handler().read(exchange, request)))
				.orElseGet(() -> {
					TemplateMatch match = this.resourceTemplates.matchTemplate(uri).orElse(null);
					if (match == null) {
						return Mono.error(McpError.RESOURCE_NOT_FOUND.apply(uri));
					}
					return Mono
						.defer(() -> match.specification().handler().read(exchange, request, match.variables()));
				});
			return result.onErrorMap(error -> !(error instanceof McpError), McpServer::readFailure)
				.switchIfEmpty(Mono.error(() -> McpError.internalError("Error reading resource: no contents")));
		};
	}

	private static McpError readFailure(Throwable error) {
		logger.warn("Resource handler failed", error);
		return McpError.internalError("Error reading resource: " + Utils.describe(error));
	}

	private RequestHandler<McpSchema.ListToolsResult> toolsListRequestHandler() {
		return (exchange, params) -> Mono.fromSupplier(() -> new McpSchema.ListToolsResult(listTools(), null));
	}

	private RequestHandler<CallToolResult> toolsCallRequestHandler() {
		return (exchange, params) -> {
			McpSchema.CallToolRequest request = unmarshal(params, CALL_TOOL_REQUEST);
			if (!Utils.hasText(request.name())) {
				return Mono.error(McpError.invalidParams("name is required"));
			}
			ToolSpecification specification = this.tools.lookup(request.name()).orElse(null);
			if (specification == null) {
				return Mono.error(McpError.TOOL_NOT_FOUND.apply(request.name()));
			}
			return Mono.defer(() -> specification.handler().call(exchange, request.arguments()))
				.switchIfEmpty(Mono.error(() -> new IllegalStateException("Tool returned no result")))
				.onErrorResume(error -> !(error instanceof McpError), error -> {
					logger.debug("Tool {} failed", request.name(), error);
					return Mono.just(CallToolResult.error("Error: " + Utils.describe(error)));
				});
		};
	}

	private RequestHandler<McpSchema.ListPromptsResult> promptsListRequestHandler() {
		return (exchange, params) -> Mono.fromSupplier(() -> new McpSchema.ListPromptsResult(listPrompts(), null));
	}

	private RequestHandler<McpSchema.GetPromptResult> promptsGetRequestHandler() {
		return (exchange, params) -> {
			McpSchema.GetPromptRequest request = unmarshal(params, GET_PROMPT_REQUEST);
			if (!Utils.hasText(request.name())) {
				return Mono.error(McpError.invalidParams("name is required"));
			}
			PromptSpecification specification = this.prompts.lookup(request.name()).orElse(null);
			if (specification == null) {
				return Mono.error(McpError.PROMPT_NOT_FOUND.apply(request.name()));
			}
			return Mono.defer(() -> specification.handler().get(exchange, request))
				.switchIfEmpty(Mono.error(() -> new IllegalStateException("Prompt returned no result")))
				.onErrorMap(error -> !(error instanceof McpError),
						error -> McpError.internalError(Utils.describe(error)));
		};
	}

	private RequestHandler<Map<String, Object>> setLoggerRequestHandler() {
		return (exchange, params) -> {
			McpSchema.SetLevelRequest request = unmarshal(params, SET_LEVEL_REQUEST);
			if (request.level() == null) {
				return Mono.error(McpError.invalidParams("level is required"));
			}
			this.notifications.setMinLoggingLevel(request.level());
			return Mono.just(Map.of());
		};
	}

	private <T> T unmarshal(Object params, TypeRef<T> type) {
		if (params == null) {
			throw McpError.invalidParams("params are required");
		}
		try {
			return this.jsonMapper.convertValue(params, type);
		}
		catch (IllegalArgumentException e) {
			throw McpError.invalidParams(Utils.describe(e));
		}
	}

	/**
	 * Builder for {@link McpServer}.
	 */
	public static final class Builder {

		private McpSchema.Implementation serverInfo = new McpSchema.Implementation("mcp-server", "1.0.0");

		private McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.defaults();

		private String instructions;

		private McpJsonMapper jsonMapper;

		private int maxConcurrentRequests = DEFAULT_MAX_CONCURRENT_REQUESTS;

		private Scheduler handlerScheduler = Schedulers.boundedElastic();

		private final List<ResourceSpecification> resources = new ArrayList<>();

		private final List<ResourceTemplateSpecification> resourceTemplates = new ArrayList<>();

		private final List<ToolSpecification> tools = new ArrayList<>();

		private final List<PromptSpecification> prompts = new ArrayList<>();

		private Builder() {
		}

		public Builder serverInfo(McpSchema.Implementation serverInfo) {
			Assert.notNull(serverInfo, "Server info must not be null");
			this.serverInfo = serverInfo;
			return this;
		}

		public Builder serverInfo(String name, String version) {
			Assert.hasText(name, "Name must not be empty");
			Assert.hasText(version, "Version must not be empty");
			this.serverInfo = new McpSchema.Implementation(name, version);
			return this;
		}

		/**
		 * Sets the capabilities advertised in the {@code initialize} result. They are
		 * sent as given.
		 */
		public Builder capabilities(McpSchema.ServerCapabilities capabilities) {
			Assert.notNull(capabilities, "Server capabilities must not be null");
			this.capabilities = capabilities;
			return this;
		}

		public Builder instructions(String instructions) {
			this.instructions = instructions;
			return this;
		}

		public Builder jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "JsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		/**
		 * Sets how many inbound messages may be handled at once. When the bound is
		 * reached no further frames are read until a handler completes.
		 */
		public Builder maxConcurrentRequests(int maxConcurrentRequests) {
			Assert.isTrue(maxConcurrentRequests > 0, "maxConcurrentRequests must be positive");
			this.maxConcurrentRequests = maxConcurrentRequests;
			return this;
		}

		public Builder handlerScheduler(Scheduler handlerScheduler) {
			Assert.notNull(handlerScheduler, "handlerScheduler must not be null");
			this.handlerScheduler = handlerScheduler;
			return this;
		}

		public Builder resources(ResourceSpecification... resources) {
			Assert.notNull(resources, "Resources must not be null");
			this.resources.addAll(List.of(resources));
			return this;
		}

		public Builder resourceTemplates(ResourceTemplateSpecification... resourceTemplates) {
			Assert.notNull(resourceTemplates, "Resource templates must not be null");
			this.resourceTemplates.addAll(List.of(resourceTemplates));
			return this;
		}

		public Builder tools(ToolSpecification... tools) {
			Assert.notNull(tools, "Tools must not be null");
			this.tools.addAll(List.of(tools));
			return this;
		}

		public Builder prompts(PromptSpecification... prompts) {
			Assert.notNull(prompts, "Prompts must not be null");
			this.prompts.addAll(List.of(prompts));
			return this;
		}

		public McpServer build() {
			if (this.jsonMapper == null) {
				this.jsonMapper = McpJsonMapper.createDefault();
			}
			return new McpServer(this);
		}

	}

}
