/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcplite.server;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.mcplite.MockMcpServerTransport;
import io.mcplite.server.McpServerFeatures.PromptHandler;
import io.mcplite.server.McpServerFeatures.PromptSpecification;
import io.mcplite.server.McpServerFeatures.ResourceHandler;
import io.mcplite.server.McpServerFeatures.ResourceSpecification;
import io.mcplite.server.McpServerFeatures.ResourceTemplateHandler;
import io.mcplite.server.McpServerFeatures.ResourceTemplateSpecification;
import io.mcplite.server.McpServerFeatures.ToolHandler;
import io.mcplite.server.McpServerFeatures.ToolSpecification;
import io.mcplite.spec.McpError;
import io.mcplite.spec.McpSchema;
import io.mcplite.spec.McpSchema.CallToolResult;
import io.mcplite.spec.McpSchema.JSONRPCRequest;
import io.mcplite.spec.McpSchema.JSONRPCResponse;
import io.mcplite.spec.McpSchema.ReadResourceResult;
import io.mcplite.spec.McpSchema.TextContent;
import io.mcplite.spec.McpSchema.TextResourceContents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static net.javacrumbs.jsonunit.assertj.JsonAssertions.assertThatJson;
import static net.javacrumbs.jsonunit.assertj.JsonAssertions.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Tests for {@link McpServerSession} driven through {@link McpServer} and an in-memory
 * transport.
 */
class McpServerSessionTests {

	private static final Map<String, Object> INITIALIZE_PARAMS = Map.of("protocolVersion", "2024-11-05",
			"capabilities", Map.of(), "clientInfo", Map.of("name", "test-client", "version", "1.0.0"));

	private MockMcpServerTransport transport;

	private McpServerSession session;

	private ListAppender<ILoggingEvent> logAppender;

	private Logger sessionLogger;

	@BeforeEach
	void setUp() {
		this.transport = new MockMcpServerTransport();

		this.sessionLogger = (Logger) LoggerFactory.getLogger(McpServerSession.class);
		this.logAppender = new ListAppender<>();
		this.logAppender.start();
		this.sessionLogger.addAppender(this.logAppender);
	}

	@AfterEach
	void tearDown() {
		this.transport.simulateEndOfStream();
		this.sessionLogger.detachAppender(this.logAppender);
	}

	private McpServer.Builder serverBuilder() {
		return McpServer.builder().serverInfo("test-server", "1.0.0");
	}

	private void connect(McpServer server) {
		this.session = server.connect(this.transport);
	}

	private JSONRPCResponse request(Object id, String method, Object params) {
		this.transport.simulateIncomingMessage(new JSONRPCRequest(McpSchema.JSONRPC_VERSION, method, id, params));
		return this.transport.awaitResponse(id);
	}

	private void initialize() {
		JSONRPCResponse response = request("init", McpSchema.METHOD_INITIALIZE, INITIALIZE_PARAMS);
		assertThat(response.error()).isNull();
	}

	private String toJson(Object value) {
		return this.transport.toJson(value);
	}

	private static String text(CallToolResult result) {
		return ((TextContent) result.content().get(0)).text();
	}

	// Handshake

	@Test
	void requestBeforeInitializeIsRejected() {
		connect(serverBuilder().build());

		JSONRPCResponse response = request(1, McpSchema.METHOD_TOOLS_LIST, Map.of());

		assertThat(response.id()).isEqualTo(1);
		assertThat(response.result()).isNull();
		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.NOT_INITIALIZED);
		assertThat(response.error().message()).isEqualTo("Server not initialized");
		assertThat(this.session.isInitialized()).isFalse();
	}

	@Test
	void pingIsAllowedBeforeInitialize() {
		connect(serverBuilder().build());

		JSONRPCResponse response = request("p1", McpSchema.METHOD_PING, null);

		assertThat(response.error()).isNull();
		assertThatJson(toJson(response.result())).isEqualTo(json("{}"));
	}

	@Test
	void notificationsBeforeInitializeAreDropped() {
		connect(serverBuilder().build());

		this.transport.simulateIncomingMessage(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION,
				McpSchema.METHOD_NOTIFICATION_CANCELLED, Map.of("requestId", 1)));
		request("after", McpSchema.METHOD_PING, null);

		assertThat(this.transport.getSentMessages()).hasSize(1);
	}

	@Test
	void initializeReturnsIdentityAndCapabilities() {
		connect(serverBuilder().instructions("Be nice").build());

		JSONRPCResponse response = request(1, McpSchema.METHOD_INITIALIZE, INITIALIZE_PARAMS);

		assertThatJson(toJson(response)).isEqualTo(json("""
				{
					"jsonrpc":"2.0",
					"id":1,
					"result":{
						"protocolVersion":"2024-11-05",
						"capabilities":{
							"logging":{},
							"prompts":{"listChanged":true},
							"resources":{"subscribe":false,"listChanged":true},
							"tools":{"listChanged":true}
						},
						"serverInfo":{"name":"test-server","version":"1.0.0"},
						"instructions":"Be nice"
					}
				}"""));
		assertThat(this.session.isInitialized()).isTrue();
		assertThat(this.session.getClientInfo()).isEqualTo(new McpSchema.Implementation("test-client", "1.0.0"));
	}

	@Test
	void capabilitiesAreAdvertisedVerbatim() {
		McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder().tools(false).build();
		connect(serverBuilder().capabilities(capabilities).build());

		JSONRPCResponse response = request(1, McpSchema.METHOD_INITIALIZE, INITIALIZE_PARAMS);

		assertThatJson(toJson(response.result())).node("capabilities").isEqualTo(json("""
				{"tools":{"listChanged":false}}"""));
	}

	@Test
	void concurrentInitializeRequestsGetTheSameResult() {
		connect(serverBuilder().build());

		for (int i = 0; i < 8; i++) {
			this.transport.simulateIncomingMessage(new JSONRPCRequest(McpSchema.JSONRPC_VERSION,
					McpSchema.METHOD_INITIALIZE, "init-" + i,
					Map.of("protocolVersion", "2024-11-05", "clientInfo",
							Map.of("name", "client-" + i, "version", "1"))));
		}
		List<JSONRPCResponse> responses = this.transport.awaitResponses(8);

		Set<String> results = responses.stream()
			.map(response -> toJson(response.result()))
			.collect(Collectors.toSet());
		assertThat(results).hasSize(1);
		assertThat(responses).allSatisfy(response -> assertThat(response.error()).isNull());
		assertThat(this.session.getClientInfo().name()).startsWith("client-");

		List<ILoggingEvent> recorded = this.logAppender.list.stream()
			.filter(event -> event.getMessage().startsWith("Client initialize request"))
			.toList();
		assertThat(recorded).hasSize(1);
	}

	@Test
	void initializeWithInvalidParamsIsRejected() {
		connect(serverBuilder().build());

		JSONRPCResponse response = request(1, McpSchema.METHOD_INITIALIZE, "not an object");

		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.INVALID_PARAMS);
		assertThat(this.session.isInitialized()).isFalse();
	}

	// Routing

	@Test
	void unknownMethodIsReported() {
		connect(serverBuilder().build());
		initialize();

		JSONRPCResponse response = request(2, "foo/bar", Map.of());

		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.METHOD_NOT_FOUND);
		assertThat(response.error().message()).isEqualTo("Method not found: foo/bar");
	}

	@Test
	void stringAndNumericIdsAreEchoedUnchanged() {
		connect(serverBuilder().build());
		initialize();

		assertThat(request("7", McpSchema.METHOD_PING, null).id()).isEqualTo("7");
		assertThat(request(8, McpSchema.METHOD_PING, null).id()).isEqualTo(8);

		this.transport.simulateIncomingJson("""
				{"jsonrpc":"2.0","id":1.50,"method":"ping"}""");
		JSONRPCResponse response = this.transport.awaitResponse(1.5);
		assertThat(toJson(response)).contains("\"id\":1.50");
	}

	@Test
	void inboundResponsesAreIgnored() {
		connect(serverBuilder().build());
		initialize();

		this.transport.simulateIncomingMessage(JSONRPCResponse.success(99, Map.of()));
		request("after", McpSchema.METHOD_PING, null);

		assertThat(this.transport.getSentResponses()).extracting(JSONRPCResponse::id).doesNotContain(99);
	}

	// Decode failures

	@Test
	void undecodableRequestWithIdGetsParseError() {
		connect(serverBuilder().build());

		this.transport.simulateIncomingJson("""
				{"jsonrpc":"2.0","id":9}""");
		JSONRPCResponse response = this.transport.awaitResponse(9);

		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.PARSE_ERROR);
	}

	@Test
	void requestWithoutMethodGetsErrorResponse() {
		connect(serverBuilder().build());
		initialize();

		this.transport.simulateIncomingJson("""
				{"jsonrpc":"2.0","id":7,"method":null}""");
		this.transport.simulateIncomingJson("""
				{"jsonrpc":"2.0","id":8,"method":""}""");

		assertThat(this.transport.awaitResponse(7).error().code()).isEqualTo(McpSchema.ErrorCodes.PARSE_ERROR);
		assertThat(this.transport.awaitResponse(8).error().code()).isEqualTo(McpSchema.ErrorCodes.PARSE_ERROR);
		assertThat(request(9, McpSchema.METHOD_PING, null).error()).isNull();
	}

	@Test
	void undecodableMessageWithoutIdIsDropped() {
		connect(serverBuilder().build());

		this.transport.simulateIncomingJson("{invalid json}");
		request("after", McpSchema.METHOD_PING, null);

		await().atMost(Duration.ofSeconds(5))
			.ignoreExceptions()
			.until(() -> new ArrayList<>(this.logAppender.list).stream()
				.anyMatch(event -> event.getLevel() == Level.WARN
						&& event.getMessage().equals("Dropping undecodable message: {}")));
		assertThat(this.transport.getSentMessages()).hasSize(1);
	}

	// Tools

	@Test
	void toolsListReturnsRegisteredTools() {
		McpServer server = serverBuilder().build();
		server.textTool("echo", "Echoes text", null, arguments -> String.valueOf(arguments.get("text")));
		connect(server);
		initialize();

		JSONRPCResponse response = request(3, McpSchema.METHOD_TOOLS_LIST, null);

		assertThatJson(toJson(response.result())).isEqualTo(json("""
				{"tools":[{"name":"echo","description":"Echoes text","inputSchema":{"type":"object"}}]}"""));
	}

	@Test
	void toolCallReturnsHandlerResult() {
		McpServer server = serverBuilder().build();
		server.textTool("echo", "Echoes text", null, arguments -> String.valueOf(arguments.get("text")));
		connect(server);
		initialize();

		JSONRPCResponse response = request(4, McpSchema.METHOD_TOOLS_CALL,
				Map.of("name", "echo", "arguments", Map.of("text", "hello")));

		CallToolResult result = (CallToolResult) response.result();
		assertThat(result.isError()).isFalse();
		assertThat(text(result)).isEqualTo("hello");
	}

	@Test
	void failingToolReturnsErrorResult() {
		McpServer server = serverBuilder().build();
		server.textTool("divide", "Divides", null, arguments -> {
			throw new ArithmeticException("division by zero");
		});
		connect(server);
		initialize();

		JSONRPCResponse response = request(5, McpSchema.METHOD_TOOLS_CALL,
				Map.of("name", "divide", "arguments", Map.of("a", 1, "b", 0)));

		assertThat(response.error()).isNull();
		assertThatJson(toJson(response.result())).isEqualTo(json("""
				{"content":[{"type":"text","text":"Error: division by zero"}],"isError":true}"""));
	}

	@Test
	void toolErrorSignalReturnsErrorResult() {
		McpServer server = serverBuilder()
			.tools(new ToolSpecification(McpSchema.Tool.builder().name("broken").build(),
					(exchange, arguments) -> Mono.error(new IllegalStateException("backend down"))))
			.build();
		connect(server);
		initialize();

		CallToolResult result = (CallToolResult) request(6, McpSchema.METHOD_TOOLS_CALL, Map.of("name", "broken"))
			.result();

		assertThat(result.isError()).isTrue();
		assertThat(text(result)).isEqualTo("Error: backend down");
	}

	@Test
	void toolRaisingMcpErrorGetsErrorResponse() {
		McpServer server = serverBuilder()
			.tools(new ToolSpecification(McpSchema.Tool.builder().name("strict").build(),
					(exchange, arguments) -> Mono.error(McpError.invalidParams("x is required"))))
			.build();
		connect(server);
		initialize();

		JSONRPCResponse response = request(7, McpSchema.METHOD_TOOLS_CALL, Map.of("name", "strict"));

		assertThat(response.result()).isNull();
		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.INVALID_PARAMS);
		assertThat(response.error().message()).isEqualTo("Invalid params: x is required");
	}

	@Test
	void unknownToolIsReported() {
		connect(serverBuilder().build());
		initialize();

		JSONRPCResponse response = request(8, McpSchema.METHOD_TOOLS_CALL, Map.of("name", "missing"));

		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.INVALID_PARAMS);
		assertThat(response.error().message()).isEqualTo("Tool not found: missing");
	}

	@Test
	void malformedToolCallParamsAreInvalid() {
		connect(serverBuilder().build());
		initialize();

		JSONRPCResponse response = request(9, McpSchema.METHOD_TOOLS_CALL, "abc");

		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.INVALID_PARAMS);
		assertThat(response.error().message()).startsWith("Invalid params");
	}

	@Test
	void concurrentToolCallsAreAllAnswered() {
		int calls = 10;
		CountDownLatch allStarted = new CountDownLatch(calls);
		ToolHandler handler = ToolHandler.fromSync((exchange, arguments) -> {
			allStarted.countDown();
			// every call must be in flight at the same time to get past this point
			if (!allStarted.await(10, TimeUnit.SECONDS)) {
				throw new IllegalStateException("calls were not handled concurrently");
			}
			return CallToolResult.text("done " + exchange.getRequestId());
		});
		connect(serverBuilder().tools(new ToolSpecification(McpSchema.Tool.builder().name("slow").build(), handler))
			.build());
		initialize();

		for (int i = 0; i < calls; i++) {
			this.transport.simulateIncomingMessage(new JSONRPCRequest(McpSchema.JSONRPC_VERSION,
					McpSchema.METHOD_TOOLS_CALL, "call-" + i, Map.of("name", "slow")));
		}

		for (int i = 0; i < calls; i++) {
			JSONRPCResponse response = this.transport.awaitResponse("call-" + i);
			assertThat(text((CallToolResult) response.result())).isEqualTo("done call-" + i);
		}
	}

	@Test
	void concurrencyBoundHoldsBackFurtherMessages() throws Exception {
		CountDownLatch release = new CountDownLatch(1);
		AtomicInteger started = new AtomicInteger();
		ToolHandler handler = ToolHandler.fromSync((exchange, arguments) -> {
			started.incrementAndGet();
			release.await(10, TimeUnit.SECONDS);
			return CallToolResult.text("ok");
		});
		connect(serverBuilder().maxConcurrentRequests(1)
			.tools(new ToolSpecification(McpSchema.Tool.builder().name("gate").build(), handler))
			.build());
		initialize();

		this.transport.simulateIncomingMessage(new JSONRPCRequest(McpSchema.JSONRPC_VERSION,
				McpSchema.METHOD_TOOLS_CALL, "first", Map.of("name", "gate")));
		this.transport.simulateIncomingMessage(new JSONRPCRequest(McpSchema.JSONRPC_VERSION,
				McpSchema.METHOD_TOOLS_CALL, "second", Map.of("name", "gate")));

		await().atMost(Duration.ofSeconds(5)).until(() -> started.get() == 1);
		Thread.sleep(200);
		assertThat(started.get()).isEqualTo(1);

		release.countDown();
		this.transport.awaitResponse("first");
		this.transport.awaitResponse("second");
		assertThat(started.get()).isEqualTo(2);
	}

	// Resources

	private McpServer resourceServer() {
		McpServer server = serverBuilder().build();
		server.textResource("config://app", "app-config", "Application configuration", "application/json",
				() -> "{\"debug\":false}");
		server.textResourceTemplate("user://{userId}", "user", "A user profile", "text/plain",
				variables -> "User " + variables.get("userId"));
		return server;
	}

	@Test
	void resourcesListIncludesTemplateDescriptors() {
		connect(resourceServer());
		initialize();

		JSONRPCResponse response = request(10, McpSchema.METHOD_RESOURCES_LIST, null);

		assertThatJson(toJson(response.result())).isEqualTo(json("""
				{"resources":[
					{"uri":"config://app","name":"app-config","description":"Application configuration","mimeType":"application/json"},
					{"uri":"user://{userId}","name":"user","description":"A user profile","mimeType":"text/plain"}
				]}"""));
	}

	@Test
	void resourceTemplatesList() {
		connect(resourceServer());
		initialize();

		JSONRPCResponse response = request(11, McpSchema.METHOD_RESOURCES_TEMPLATES_LIST, null);

		assertThatJson(toJson(response.result())).isEqualTo(json("""
				{"resourceTemplates":[
					{"uriTemplate":"user://{userId}","name":"user","description":"A user profile","mimeType":"text/plain"}
				]}"""));
	}

	@Test
	void staticResourceIsRead() {
		connect(resourceServer());
		initialize();

		ReadResourceResult result = (ReadResourceResult) request(12, McpSchema.METHOD_RESOURCES_READ,
				Map.of("uri", "config://app"))
			.result();

		assertThat(result.contents()).containsExactly(
				new TextResourceContents("config://app", "application/json", "{\"debug\":false}"));
	}

	@Test
	void templateResourceIsReadWithExtractedVariables() {
		connect(resourceServer());
		initialize();

		ReadResourceResult result = (ReadResourceResult) request(13, McpSchema.METHOD_RESOURCES_READ,
				Map.of("uri", "user://42"))
			.result();

		assertThat(result.contents())
			.containsExactly(new TextResourceContents("user://42", "text/plain", "User 42"));
	}

	@Test
	void exactUriWinsOverTemplate() {
		McpServer server = resourceServer();
		server.textResource("user://admin", "admin", null, "text/plain", () -> "the admin");
		connect(server);
		initialize();

		ReadResourceResult result = (ReadResourceResult) request(14, McpSchema.METHOD_RESOURCES_READ,
				Map.of("uri", "user://admin"))
			.result();

		assertThat(((TextResourceContents) result.contents().get(0)).text()).isEqualTo("the admin");
	}

	@Test
	void unknownResourceIsReported() {
		connect(resourceServer());
		initialize();

		JSONRPCResponse response = request(15, McpSchema.METHOD_RESOURCES_READ, Map.of("uri", "user://42/extra"));

		assertThatJson(toJson(response.error())).isEqualTo(json("""
				{"code":-32602,"message":"Resource not found","data":{"uri":"user://42/extra"}}"""));
	}

	@Test
	void failingResourceHandlerIsInternalError() {
		McpServer server = serverBuilder()
			.resources(new ResourceSpecification(
					McpSchema.Resource.builder().uri("file:///broken").name("broken").build(),
					ResourceHandler.fromSync((exchange, request) -> {
						throw new IllegalStateException("disk on fire");
					})))
			.resourceTemplates(new ResourceTemplateSpecification(
					new McpSchema.ResourceTemplate("db://{table}", "table", null, null),
					(exchange, request, variables) -> Mono.error(new IllegalStateException("no such table"))))
			.build();
		connect(server);
		initialize();

		JSONRPCResponse staticFailure = request(16, McpSchema.METHOD_RESOURCES_READ, Map.of("uri", "file:///broken"));
		JSONRPCResponse templateFailure = request(17, McpSchema.METHOD_RESOURCES_READ, Map.of("uri", "db://users"));

		assertThat(staticFailure.error().code()).isEqualTo(McpSchema.ErrorCodes.INTERNAL_ERROR);
		assertThat(staticFailure.error().message()).isEqualTo("Error reading resource: disk on fire");
		assertThat(templateFailure.error().code()).isEqualTo(McpSchema.ErrorCodes.INTERNAL_ERROR);
		assertThat(templateFailure.error().message()).isEqualTo("Error reading resource: no such table");
	}

	@Test
	void resourceRegisteredAfterConnectIsVisible() {
		McpServer server = serverBuilder().build();
		connect(server);
		initialize();

		server.addResourceTemplate(new ResourceTemplateSpecification(
				new McpSchema.ResourceTemplate("item://{id}", "item", null, "text/plain"),
				ResourceTemplateHandler.fromSync((exchange, request, variables) -> new ReadResourceResult(
						List.of(new TextResourceContents(request.uri(), "text/plain", variables.get("id")))))));

		ReadResourceResult result = (ReadResourceResult) request(18, McpSchema.METHOD_RESOURCES_READ,
				Map.of("uri", "item://abc"))
			.result();
		assertThat(((TextResourceContents) result.contents().get(0)).text()).isEqualTo("abc");
	}

	// Prompts

	private McpServer promptServer() {
		return serverBuilder()
			.prompts(new PromptSpecification(
					new McpSchema.Prompt("greeting", "Greets someone",
							List.of(new McpSchema.PromptArgument("name", "Who to greet", true))),
					PromptHandler.fromSync((exchange, request) -> {
						Object name = request.arguments().get("name");
						if (name == null) {
							throw new IllegalArgumentException("Missing required argument: name");
						}
						return new McpSchema.GetPromptResult("Greeting", List.of(new McpSchema.PromptMessage(
								McpSchema.Role.USER, new TextContent("Say hello to " + name))));
					})))
			.build();
	}

	@Test
	void promptsList() {
		connect(promptServer());
		initialize();

		JSONRPCResponse response = request(20, McpSchema.METHOD_PROMPT_LIST, null);

		assertThatJson(toJson(response.result())).isEqualTo(json("""
				{"prompts":[{"name":"greeting","description":"Greets someone",
					"arguments":[{"name":"name","description":"Who to greet","required":true}]}]}"""));
	}

	@Test
	void promptIsRendered() {
		connect(promptServer());
		initialize();

		JSONRPCResponse response = request(21, McpSchema.METHOD_PROMPT_GET,
				Map.of("name", "greeting", "arguments", Map.of("name", "Ada")));

		assertThatJson(toJson(response.result())).isEqualTo(json("""
				{"description":"Greeting","messages":[{"role":"user","content":{"type":"text","text":"Say hello to Ada"}}]}"""));
	}

	@Test
	void failingPromptIsInternalError() {
		connect(promptServer());
		initialize();

		JSONRPCResponse response = request(22, McpSchema.METHOD_PROMPT_GET, Map.of("name", "greeting"));

		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.INTERNAL_ERROR);
		assertThat(response.error().message()).isEqualTo("Missing required argument: name");
	}

	@Test
	void unknownPromptIsReported() {
		connect(promptServer());
		initialize();

		JSONRPCResponse response = request(23, McpSchema.METHOD_PROMPT_GET, Map.of("name", "farewell"));

		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.INVALID_PARAMS);
		assertThat(response.error().message()).isEqualTo("Prompt not found: farewell");
	}

	// Cancellation

	@Test
	void cancelledNotificationSignalsTheHandler() throws Exception {
		CountDownLatch started = new CountDownLatch(1);
		ToolHandler handler = (exchange, arguments) -> {
			started.countDown();
			return exchange.cancellation().then(Mono.fromSupplier(() -> CallToolResult.text("stopped")));
		};
		connect(serverBuilder().tools(new ToolSpecification(McpSchema.Tool.builder().name("long").build(), handler))
			.build());
		initialize();

		this.transport.simulateIncomingMessage(
				new JSONRPCRequest(McpSchema.JSONRPC_VERSION, McpSchema.METHOD_TOOLS_CALL, 30, Map.of("name", "long")));
		assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

		// numeric ids are matched by value whatever their decoded type
		this.transport.simulateIncomingMessage(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION,
				McpSchema.METHOD_NOTIFICATION_CANCELLED, Map.of("requestId", 30L, "reason", "user aborted")));

		JSONRPCResponse response = this.transport.awaitResponse(30);
		assertThat(text((CallToolResult) response.result())).isEqualTo("stopped");
	}

	@Test
	void closeSignalsInFlightRequests() throws Exception {
		CountDownLatch started = new CountDownLatch(1);
		AtomicReference<McpServerExchange> captured = new AtomicReference<>();
		ToolHandler handler = (exchange, arguments) -> {
			captured.set(exchange);
			started.countDown();
			return exchange.cancellation().then(Mono.fromSupplier(() -> CallToolResult.text("stopped")));
		};
		McpServer server = serverBuilder()
			.tools(new ToolSpecification(McpSchema.Tool.builder().name("long").build(), handler))
			.build();
		connect(server);
		initialize();

		this.transport.simulateIncomingMessage(new JSONRPCRequest(McpSchema.JSONRPC_VERSION,
				McpSchema.METHOD_TOOLS_CALL, "c1", Map.of("name", "long")));
		assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

		server.close();

		await().atMost(Duration.ofSeconds(5)).until(() -> captured.get().isCancelled());
		StepVerifier.create(this.session.onTermination()).expectComplete().verify(Duration.ofSeconds(5));
		assertThat(this.transport.isClosed()).isTrue();
	}

	// Session end

	@Test
	void endOfStreamEndsTheSession() {
		connect(serverBuilder().build());

		this.transport.simulateEndOfStream();

		StepVerifier.create(this.session.onTermination()).expectComplete().verify(Duration.ofSeconds(5));
		assertThat(this.transport.isClosed()).isTrue();
	}

	@Test
	void transportFailureEndsTheSessionAndIsLogged() {
		connect(serverBuilder().build());

		this.transport.simulateTransportFailure("pipe broken");

		StepVerifier.create(this.session.onTermination()).expectComplete().verify(Duration.ofSeconds(5));
		List<ILoggingEvent> errors = this.logAppender.list.stream()
			.filter(event -> event.getLevel() == Level.ERROR)
			.toList();
		assertThat(errors).hasSize(1);
		assertThat(errors.get(0).getMessage()).isEqualTo("Transport failure, ending session");
		assertThat(errors.get(0).getThrowableProxy().getMessage()).isEqualTo("pipe broken");
	}

	@Test
	void sendFailureDoesNotStopTheLoop() {
		connect(serverBuilder().build());

		this.transport.failSends(true);
		this.transport.simulateIncomingMessage(
				new JSONRPCRequest(McpSchema.JSONRPC_VERSION, McpSchema.METHOD_PING, "lost", null));
		await().atMost(Duration.ofSeconds(5))
			.ignoreExceptions()
			.until(() -> new ArrayList<>(this.logAppender.list).stream()
				.anyMatch(event -> event.getMessage().startsWith("Failed to send response")));
		this.transport.failSends(false);

		JSONRPCResponse response = request("kept", McpSchema.METHOD_PING, null);
		assertThat(response.error()).isNull();
	}

	// Logging

	@Test
	void setLevelUpdatesTheEmitter() {
		McpServer server = serverBuilder().build();
		connect(server);
		initialize();

		JSONRPCResponse response = request(40, McpSchema.METHOD_LOGGING_SET_LEVEL, Map.of("level", "warning"));

		assertThat(response.error()).isNull();
		assertThat(server.notifications().getMinLoggingLevel()).isEqualTo(McpSchema.LoggingLevel.WARNING);
	}

	@Test
	void setLevelWithUnknownLevelIsInvalid() {
		connect(serverBuilder().build());
		initialize();

		JSONRPCResponse response = request(41, McpSchema.METHOD_LOGGING_SET_LEVEL, Map.of("level", "loud"));

		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.INVALID_PARAMS);
	}

}
