/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcplite.server.transport;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import io.mcplite.json.McpJsonMapper;
import io.mcplite.json.TypeRef;
import io.mcplite.spec.McpDecodeException;
import io.mcplite.spec.McpSchema;
import io.mcplite.spec.McpSchema.JSONRPCMessage;
import io.mcplite.spec.McpServerTransport;
import io.mcplite.spec.McpTransportException;
import io.mcplite.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Implementation of {@link McpServerTransport} for the stdio transport. One JSON-RPC
 * envelope per line, UTF-8 encoded, on standard input and standard output.
 *
 * <p>
 * Records are terminated by {@code \n}; a trailing {@code \r} is stripped and blank
 * lines are skipped. Frames are read by a single dedicated thread. Each outbound frame
 * is written and flushed while holding one lock, so concurrent senders never
 * interleave.
 */
public class StdioServerTransport implements McpServerTransport {

	private static final Logger logger = LoggerFactory.getLogger(StdioServerTransport.class);

	private static final int NEWLINE = '\n';

	private static final int CARRIAGE_RETURN = '\r';

	private final McpJsonMapper jsonMapper;

	private final InputStream inputStream;

	private final OutputStream outputStream;

	private final Scheduler inboundScheduler;

	private final ReentrantLock writeLock = new ReentrantLock();

	private final AtomicBoolean isClosing = new AtomicBoolean(false);

	// Only touched by the inbound thread.
	private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream();

	private volatile boolean endOfStream;

	/**
	 * Creates a new StdioServerTransport with the specified JsonMapper and System
	 * streams.
	 * @param jsonMapper The JsonMapper to use for JSON serialization/deserialization
	 */
	public StdioServerTransport(McpJsonMapper jsonMapper) {
		this(jsonMapper, System.in, System.out);
	}

	/**
	 * Creates a new StdioServerTransport with the specified JsonMapper and streams.
	 * @param jsonMapper The JsonMapper to use for JSON serialization/deserialization
	 * @param inputStream The input stream to read from
	 * @param outputStream The output stream to write to
	 */
	public StdioServerTransport(McpJsonMapper jsonMapper, InputStream inputStream, OutputStream outputStream) {
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		Assert.notNull(inputStream, "The InputStream can not be null");
		Assert.notNull(outputStream, "The OutputStream can not be null");

		this.jsonMapper = jsonMapper;
		this.inputStream = new BufferedInputStream(inputStream);
		this.outputStream = outputStream;
		this.inboundScheduler = Schedulers.newSingle("mcp-stdio-inbound", true);
	}

	@Override
	public Mono<JSONRPCMessage> receive() {
		return Mono.defer(() -> {
			if (this.isClosing.get() || this.endOfStream) {
				return Mono.empty();
			}
			return Mono.fromCallable(this::readNextMessage).subscribeOn(this.inboundScheduler);
		}).onErrorResume(RejectedExecutionException.class, e -> Mono.empty());
	}

	private JSONRPCMessage readNextMessage() {
		while (true) {
			String line = readLine();
			if (line == null) {
				return null;
			}
			if (line.isBlank()) {
				continue;
			}
			return McpSchema.deserializeJsonRpcMessage(this.jsonMapper, line);
		}
	}

	private String readLine() {
		if (this.endOfStream) {
			return null;
		}
		this.lineBuffer.reset();
		try {
			int b;
			while ((b = this.inputStream.read()) != -1) {
				if (b == NEWLINE) {
					return decodeLine();
				}
				this.lineBuffer.write(b);
			}
		}
		catch (IOException e) {
			if (this.isClosing.get()) {
				return null;
			}
			throw new McpTransportException("Error reading from stdin", e);
		}

		this.endOfStream = true;
		if (this.lineBuffer.size() > 0) {
			logger.debug("Input ended with {} unterminated bytes", this.lineBuffer.size());
			throw new McpDecodeException("Unterminated record at end of stream", null);
		}
		logger.debug("Reached end of input stream");
		return null;
	}

	private String decodeLine() {
		byte[] bytes = this.lineBuffer.toByteArray();
		int length = bytes.length;
		if (length > 0 && bytes[length - 1] == CARRIAGE_RETURN) {
			length--;
		}
		return new String(bytes, 0, length, StandardCharsets.UTF_8);
	}

	@Override
	public Mono<Void> sendMessage(JSONRPCMessage message) {
		return Mono.fromRunnable(() -> {
			if (this.isClosing.get()) {
				throw new McpTransportException("Transport is closed");
			}
			String json;
			try {
				json = this.jsonMapper.writeValueAsString(message);
			}
			catch (IOException e) {
				throw new McpTransportException("Failed to serialize message", e);
			}
			byte[] frame = (json + "\n").getBytes(StandardCharsets.UTF_8);

			this.writeLock.lock();
			try {
				this.outputStream.write(frame);
				this.outputStream.flush();
			}
			catch (IOException e) {
				throw new McpTransportException("Error writing message to stdout", e);
			}
			finally {
				this.writeLock.unlock();
			}
			logger.debug("Sent message: {}", json);
		});
	}

	@Override
	public <T> T unmarshalFrom(Object data, TypeRef<T> typeRef) {
		return this.jsonMapper.convertValue(data, typeRef);
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			if (!this.isClosing.compareAndSet(false, true)) {
				return;
			}
			logger.debug("Closing stdio transport");
			closeQuietly(this.inputStream, "input");
			this.writeLock.lock();
			try {
				closeQuietly(this.outputStream, "output");
			}
			finally {
				this.writeLock.unlock();
			}
			this.inboundScheduler.dispose();
		});
	}

	private static void closeQuietly(Closeable closeable, String name) {
		try {
			closeable.close();
		}
		catch (IOException e) {
			logger.warn("Failed to close {} stream", name, e);
		}
	}

}
