/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcplite.server;

import java.util.concurrent.atomic.AtomicReference;

import io.mcplite.spec.McpSchema;
import io.mcplite.spec.McpSchema.LoggingLevel;
import io.mcplite.spec.McpSchema.LoggingMessageNotification;
import io.mcplite.spec.McpServerTransport;
import io.mcplite.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Sends server-initiated notifications to the connected client.
 *
 * <p>
 * Notifications may be sent in any handshake state once a transport is attached. Before
 * that every method fails with {@link IllegalStateException}.
 */
public class McpNotificationEmitter {

	private static final Logger logger = LoggerFactory.getLogger(McpNotificationEmitter.class);

	private final AtomicReference<McpServerTransport> transport = new AtomicReference<>();

	private volatile LoggingLevel minLoggingLevel = LoggingLevel.DEBUG;

	void attach(McpServerTransport transport) {
		Assert.notNull(transport, "transport must not be null");
		if (!this.transport.compareAndSet(null, transport)) {
			throw new IllegalStateException("A transport is already attached");
		}
	}

	public Mono<Void> resourcesListChanged() {
		return sendNotification(McpSchema.METHOD_NOTIFICATION_RESOURCES_LIST_CHANGED, null);
	}

	public Mono<Void> toolsListChanged() {
		return sendNotification(McpSchema.METHOD_NOTIFICATION_TOOLS_LIST_CHANGED, null);
	}

	public Mono<Void> promptsListChanged() {
		return sendNotification(McpSchema.METHOD_NOTIFICATION_PROMPTS_LIST_CHANGED, null);
	}

	/**
	 * Tells the client that the contents of a resource changed.
	 * @param uri the resource URI
	 */
	public Mono<Void> resourceUpdated(String uri) {
		if (uri == null || uri.isEmpty()) {
			return Mono.error(new IllegalArgumentException("uri must not be empty"));
		}
		return sendNotification(McpSchema.METHOD_NOTIFICATION_RESOURCES_UPDATED,
				new McpSchema.ResourcesUpdatedNotification(uri));
	}

	/**
	 * Sends a log message to the client. Messages below the level requested by the
	 * client through {@code logging/setLevel} are dropped.
	 * @param message the log message
	 * @return a Mono that completes when the message was sent or dropped
	 */
	public Mono<Void> loggingMessage(LoggingMessageNotification message) {
		if (message == null) {
			return Mono.error(new IllegalArgumentException("Logging message must not be null"));
		}
		if (message.level().level() < this.minLoggingLevel.level()) {
			return Mono.empty();
		}
		return sendNotification(McpSchema.METHOD_NOTIFICATION_MESSAGE, message);
	}

	public Mono<Void> debug(Object data, String loggerName) {
		return loggingMessage(new LoggingMessageNotification(LoggingLevel.DEBUG, loggerName, data));
	}

	public Mono<Void> info(Object data, String loggerName) {
		return loggingMessage(new LoggingMessageNotification(LoggingLevel.INFO, loggerName, data));
	}

	public Mono<Void> warning(Object data, String loggerName) {
		return loggingMessage(new LoggingMessageNotification(LoggingLevel.WARNING, loggerName, data));
	}

	public Mono<Void> error(Object data, String loggerName) {
		return loggingMessage(new LoggingMessageNotification(LoggingLevel.ERROR, loggerName, data));
	}

	/**
	 * Sends a notification with an arbitrary method name.
	 * @param method the notification method
	 * @param params the params, or {@code null} to omit them
	 */
	public Mono<Void> sendNotification(String method, Object params) {
		return Mono.defer(() -> {
			McpServerTransport current = this.transport.get();
			if (current == null) {
				return Mono.error(new IllegalStateException("No transport attached, cannot send " + method));
			}
			logger.debug("Sending notification {}", method);
			return current.sendMessage(new McpSchema.JSONRPCNotification(McpSchema.JSONRPC_VERSION, method, params));
		});
	}

	void setMinLoggingLevel(LoggingLevel level) {
		Assert.notNull(level, "level must not be null");
		logger.info("Client requested minimum logging level {}", level);
		this.minLoggingLevel = level;
	}

	public LoggingLevel getMinLoggingLevel() {
		return this.minLoggingLevel;
	}

}
