/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcplite.server;

import java.util.concurrent.atomic.AtomicBoolean;

import io.mcplite.spec.McpSchema;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.annotation.Nullable;

/**
 * Per-request view of the session handed to capability handlers. Gives access to the
 * request id, the client identity, a cancellation signal and the notification emitter.
 */
public class McpServerExchange {

	private final Object requestId;

	private final McpSchema.Implementation clientInfo;

	private final McpNotificationEmitter notifications;

	private final Sinks.Empty<Void> cancellation = Sinks.empty();

	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	McpServerExchange(Object requestId, @Nullable McpSchema.Implementation clientInfo,
			McpNotificationEmitter notifications) {
		this.requestId = requestId;
		this.clientInfo = clientInfo;
		this.notifications = notifications;
	}

	/**
	 * Returns the id of the request being served, exactly as the client sent it.
	 */
	public Object getRequestId() {
		return this.requestId;
	}

	/**
	 * Returns the client identity sent with {@code initialize}, or {@code null} if the
	 * client did not send one.
	 */
	@Nullable
	public McpSchema.Implementation getClientInfo() {
		return this.clientInfo;
	}

	/**
	 * Completes when the client cancels the request or the session is closed. The
	 * session never interrupts handler work; handlers that support cancellation
	 * subscribe to this signal, e.g. {@code work.takeUntilOther(exchange.cancellation())}.
	 * @return a Mono that completes empty on cancellation
	 */
	public Mono<Void> cancellation() {
		return this.cancellation.asMono();
	}

	public boolean isCancelled() {
		return this.cancelled.get();
	}

	public McpNotificationEmitter notifications() {
		return this.notifications;
	}

	/**
	 * Sends a log message to the client, subject to the client's minimum level.
	 * @param message the log message
	 */
	public Mono<Void> loggingNotification(McpSchema.LoggingMessageNotification message) {
		return this.notifications.loggingMessage(message);
	}

	void cancel() {
		if (this.cancelled.compareAndSet(false, true)) {
			this.cancellation.tryEmitEmpty();
		}
	}

}
