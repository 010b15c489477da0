/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcplite.server;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import io.mcplite.json.TypeRef;
import io.mcplite.spec.McpDecodeException;
import io.mcplite.spec.McpError;
import io.mcplite.spec.McpSchema;
import io.mcplite.spec.McpSchema.JSONRPCMessage;
import io.mcplite.spec.McpSchema.JSONRPCNotification;
import io.mcplite.spec.McpSchema.JSONRPCRequest;
import io.mcplite.spec.McpSchema.JSONRPCResponse;
import io.mcplite.spec.McpServerTransport;
import io.mcplite.util.Assert;
import io.mcplite.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

/**
 * Drives one client connection: pulls envelopes from the transport, enforces the
 * initialize handshake and dispatches requests to the registered handlers.
 *
 * <p>
 * A single receive loop pulls frames; every frame is then handled as an independent
 * unit of work on the handler scheduler, at most {@code maxConcurrentRequests} at a
 * time. Responses are sent as soon as their handler completes, in no particular order.
 */
public class McpServerSession {

	private static final Logger logger = LoggerFactory.getLogger(McpServerSession.class);

	private static final Object CLOSED = new Object();

	private final McpServerTransport transport;

	private final McpSchema.InitializeResult initializeResult;

	private final Map<String, RequestHandler<?>> requestHandlers;

	private final Map<String, NotificationHandler> notificationHandlers;

	private final McpNotificationEmitter notifications;

	private final int maxConcurrentRequests;

	private final Scheduler handlerScheduler;

	private final AtomicBoolean initialized = new AtomicBoolean(false);

	private final AtomicReference<McpSchema.Implementation> clientInfo = new AtomicReference<>();

	private final AtomicReference<Map<String, Object>> clientCapabilities = new AtomicReference<>();

	private final ConcurrentHashMap<String, McpServerExchange> inFlight = new ConcurrentHashMap<>();

	private final Sinks.Empty<Void> terminated = Sinks.empty();

	private final AtomicBoolean started = new AtomicBoolean(false);

	private volatile Disposable receiveLoop;

	/**
	 * Creates a session over the transport. Call {@link #start()} to begin reading.
	 * @param transport the channel to the client
	 * @param initializeResult the result returned for every {@code initialize} request
	 * @param requestHandlers handlers for every method except {@code initialize}
	 * @param notifications the emitter handed to handlers through the exchange
	 * @param maxConcurrentRequests upper bound of messages handled at once
	 * @param handlerScheduler the scheduler handlers run on
	 */
	public McpServerSession(McpServerTransport transport, McpSchema.InitializeResult initializeResult,
			Map<String, RequestHandler<?>> requestHandlers, McpNotificationEmitter notifications,
			int maxConcurrentRequests, Scheduler handlerScheduler) {
		Assert.notNull(transport, "transport must not be null");
		Assert.notNull(initializeResult, "initializeResult must not be null");
		Assert.notNull(requestHandlers, "requestHandlers must not be null");
		Assert.notNull(notifications, "notifications must not be null");
		Assert.isTrue(maxConcurrentRequests > 0, "maxConcurrentRequests must be positive");
		Assert.notNull(handlerScheduler, "handlerScheduler must not be null");

		this.transport = transport;
		this.initializeResult = initializeResult;
		this.requestHandlers = Map.copyOf(requestHandlers);
		this.notifications = notifications;
		this.maxConcurrentRequests = maxConcurrentRequests;
		this.handlerScheduler = handlerScheduler;
		this.notificationHandlers = Map.of( // @formatter:off
				McpSchema.METHOD_INITIALIZED, params -> handleInitialized(),
				McpSchema.METHOD_NOTIFICATION_INITIALIZED, params -> handleInitialized(),
				McpSchema.METHOD_NOTIFICATION_CANCELLED, this::handleCancelled); // @formatter:on
	}

	/**
	 * Starts the receive loop. The loop runs until the transport reports end of stream,
	 * fails with a transport error, or the session is closed.
	 * @throws IllegalStateException if the session was already started
	 */
	public void start() {
		if (!this.started.compareAndSet(false, true)) {
			throw new IllegalStateException("Session already started");
		}
		logger.info("Starting MCP session, protocol version {}", this.initializeResult.protocolVersion());

		Flux<Object> inbound = Mono.defer(this.transport::receive)
			.<Object>map(message -> message)
			.onErrorResume(McpDecodeException.class, Mono::just)
			.defaultIfEmpty(CLOSED)
			.repeat()
			.takeUntil(item -> item == CLOSED)
			.filter(item -> item != CLOSED);

		this.receiveLoop = inbound
			.flatMap(item -> handleInbound(item).subscribeOn(this.handlerScheduler), this.maxConcurrentRequests)
			.subscribe(null, error -> {
				logger.error("Transport failure, ending session", error);
				terminate();
			}, () -> {
				logger.info("Transport closed, session ended");
				terminate();
			});
	}

	/**
	 * Returns whether an {@code initialize} request has been accepted.
	 */
	public boolean isInitialized() {
		return this.initialized.get();
	}

	/**
	 * Returns the client identity recorded from the first {@code initialize} request.
	 */
	public McpSchema.Implementation getClientInfo() {
		return this.clientInfo.get();
	}

	/**
	 * Returns the capabilities sent with the first {@code initialize} request.
	 */
	public Map<String, Object> getClientCapabilities() {
		return this.clientCapabilities.get();
	}

	/**
	 * Completes once the receive loop has ended.
	 */
	public Mono<Void> onTermination() {
		return this.terminated.asMono();
	}

	/**
	 * Closes the transport. The receive loop ends after the transport reports closure;
	 * requests still being handled complete, but their responses can no longer be sent.
	 */
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			logger.info("Closing MCP session");
			return this.transport.closeGracefully();
		});
	}

	/**
	 * Signals cancellation to every in-flight request and closes the transport without
	 * waiting.
	 */
	public void close() {
		this.inFlight.values().forEach(McpServerExchange::cancel);
		this.transport.close();
	}

	private void terminate() {
		this.inFlight.values().forEach(McpServerExchange::cancel);
		this.transport.closeGracefully()
			.doFinally(signal -> this.terminated.tryEmitEmpty())
			.subscribe(null, error -> logger.warn("Failed to close transport", error));
	}

	Mono<Void> handleInbound(Object item) {
		return Mono.defer(() -> {
			if (item instanceof McpDecodeException decodeError) {
				return handleDecodeError(decodeError);
			}
			if (item instanceof JSONRPCRequest request) {
				logger.debug("Received request: {}", request);
				return handleIncomingRequest(request).flatMap(this::sendResponse);
			}
			if (item instanceof JSONRPCNotification notification) {
				logger.debug("Received notification: {}", notification);
				return handleIncomingNotification(notification);
			}
			if (item instanceof JSONRPCResponse response) {
				logger.warn("Unexpected response for id {}, the server sends no requests", response.id());
				return Mono.empty();
			}
			logger.warn("Received unknown message type: {}", item);
			return Mono.<Void>empty();
		}).onErrorResume(error -> {
			logger.warn("Error handling inbound message", error);
			return Mono.empty();
		});
	}

	private Mono<Void> handleDecodeError(McpDecodeException error) {
		Object id = error.getRequestId();
		if (id == null) {
			logger.warn("Dropping undecodable message: {}", error.getMessage());
			return Mono.empty();
		}
		logger.warn("Undecodable request {}: {}", id, error.getMessage());
		return sendResponse(errorResponse(id, McpError.parseError(error.getMessage())));
	}

	private Mono<Void> sendResponse(JSONRPCResponse response) {
		return this.transport.sendMessage(response).onErrorResume(error -> {
			logger.warn("Failed to send response for id {}: {}", response.id(), error.getMessage());
			return Mono.empty();
		});
	}

	/**
	 * Handles an incoming JSON-RPC request by routing it to the appropriate handler.
	 * @param request The incoming JSON-RPC request
	 * @return A Mono containing the JSON-RPC response
	 */
	private Mono<JSONRPCResponse> handleIncomingRequest(JSONRPCRequest request) {
		return Mono.defer(() -> {
			if (McpSchema.METHOD_INITIALIZE.equals(request.method())) {
				return handleInitialize(request);
			}
			if (!this.initialized.get() && !McpSchema.METHOD_PING.equals(request.method())) {
				logger.debug("Rejecting {} received before initialization", request.method());
				return Mono.just(errorResponse(request.id(), McpError.notInitialized()));
			}

			RequestHandler<?> handler = this.requestHandlers.get(request.method());
			if (handler == null) {
				return Mono.just(errorResponse(request.id(), McpError.METHOD_NOT_FOUND.apply(request.method())));
			}

			String key = McpSchema.correlationKey(request.id());
			McpServerExchange exchange = new McpServerExchange(request.id(), this.clientInfo.get(),
					this.notifications);
			McpServerExchange previous = this.inFlight.put(key, exchange);
			if (previous != null) {
				logger.warn("Request id {} reused while a request with that id is still in flight", key);
			}

			return Mono.defer(() -> handler.handle(exchange, request.params()))
				.map(result -> JSONRPCResponse.success(request.id(), result))
				.defaultIfEmpty(JSONRPCResponse.success(request.id(), null))
				.onErrorResume(error -> {
					logger.debug("Request {} {} failed", key, request.method(), error);
					return Mono.just(errorResponse(request.id(), error));
				})
				.doFinally(signal -> this.inFlight.remove(key, exchange));
		});
	}

	private Mono<JSONRPCResponse> handleInitialize(JSONRPCRequest request) {
		return Mono.fromCallable(() -> {
			McpSchema.InitializeRequest initializeRequest;
			try {
				initializeRequest = this.transport.unmarshalFrom(request.params(),
						new TypeRef<McpSchema.InitializeRequest>() {
						});
			}
			catch (IllegalArgumentException e) {
				return errorResponse(request.id(), McpError.invalidParams(Utils.describe(e)));
			}

			if (this.initialized.compareAndSet(false, true)) {
				if (initializeRequest != null) {
					this.clientInfo.set(initializeRequest.clientInfo());
					this.clientCapabilities.set(initializeRequest.capabilities());
					logger.info("Client initialize request - Protocol: {}, Capabilities: {}, Info: {}",
							initializeRequest.protocolVersion(), initializeRequest.capabilities(),
							initializeRequest.clientInfo());
				}
				else {
					logger.info("Client initialize request without params");
				}
			}
			else {
				logger.debug("Repeated initialize request {}, answering with the same result", request.id());
			}
			return JSONRPCResponse.success(request.id(), this.initializeResult);
		});
	}

	/**
	 * Handles an incoming JSON-RPC notification by routing it to the appropriate handler.
	 * @param notification The incoming JSON-RPC notification
	 * @return A Mono that completes when the notification is processed
	 */
	private Mono<Void> handleIncomingNotification(JSONRPCNotification notification) {
		return Mono.defer(() -> {
			NotificationHandler handler = this.notificationHandlers.get(notification.method());
			boolean initializedNotification = McpSchema.METHOD_INITIALIZED.equals(notification.method())
					|| McpSchema.METHOD_NOTIFICATION_INITIALIZED.equals(notification.method());
			if (!this.initialized.get() && !initializedNotification) {
				logger.debug("Dropping notification {} received before initialization", notification.method());
				return Mono.empty();
			}
			if (handler == null) {
				logger.warn("No handler registered for notification method: {}", notification.method());
				return Mono.empty();
			}
			return handler.handle(notification.params())
				.doOnError(error -> logger.error("Error handling notification: {}", error.getMessage()));
		});
	}

	private Mono<Void> handleInitialized() {
		logger.debug("Client reported initialization complete");
		return Mono.empty();
	}

	private Mono<Void> handleCancelled(Object params) {
		return Mono.fromRunnable(() -> {
			McpSchema.CancelledNotification cancelled = this.transport.unmarshalFrom(params,
					new TypeRef<McpSchema.CancelledNotification>() {
					});
			if (cancelled == null || !McpSchema.isValidId(cancelled.requestId())) {
				logger.warn("Ignoring cancellation without a valid request id: {}", params);
				return;
			}
			String key = McpSchema.correlationKey(cancelled.requestId());
			McpServerExchange exchange = this.inFlight.get(key);
			if (exchange == null) {
				logger.debug("Cancellation for request {} that is not in flight", key);
				return;
			}
			logger.debug("Client cancelled request {}: {}", key, cancelled.reason());
			exchange.cancel();
		});
	}

	private static JSONRPCResponse errorResponse(Object id, Throwable error) {
		if (error instanceof McpError mcpError) {
			return JSONRPCResponse.failure(id, mcpError.getJsonRpcError());
		}
		return JSONRPCResponse.failure(id, McpError.internalError(Utils.describe(error)).getJsonRpcError());
	}

	/**
	 * A handler for client-initiated requests.
	 *
	 * @param <T> the type of the response that is expected as a result of handling the
	 * request.
	 */
	@FunctionalInterface
	public interface RequestHandler<T> {

		/**
		 * Handles a request from the client.
		 * @param exchange the exchange associated with the request
		 * @param params the raw parameters of the request
		 * @return a Mono that will emit the response to the request; an error signal
		 * becomes a JSON-RPC error response
		 */
		Mono<T> handle(McpServerExchange exchange, Object params);

	}

	/**
	 * A handler for client-initiated notifications.
	 */
	@FunctionalInterface
	interface NotificationHandler {

		Mono<Void> handle(Object params);

	}

}
