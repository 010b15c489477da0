/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcplite.examples.calculator;

import java.util.Map;

import io.mcplite.json.McpJsonMapper;
import io.mcplite.server.McpServer;
import io.mcplite.server.McpServerSession;
import io.mcplite.server.transport.StdioServerTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calculator server on standard input and output. Logs go to standard error.
 *
 * <p>
 * The server name and version are read from the {@code mcp.server.name} and
 * {@code mcp.server.version} system properties.
 */
public final class CalculatorServer {

	private static final Logger logger = LoggerFactory.getLogger(CalculatorServer.class);

	static final String CONSTANTS_TEMPLATE = "calculator://constants/{name}";

	private static final Map<String, Double> CONSTANTS = Map.of("pi", Math.PI, "e", Math.E);

	private CalculatorServer() {
	}

	/**
	 * Builds the server with the calculate tool, the greeting prompt and a template
	 * resource serving mathematical constants.
	 */
	public static McpServer create(String name, String version) {
		McpJsonMapper jsonMapper = McpJsonMapper.createDefault();
		McpServer server = McpServer.builder()
			.serverInfo(name, version)
			.jsonMapper(jsonMapper)
			.instructions("Use the calculate tool for arithmetic on two numbers.")
			.tools(Calculator.toolSpecification(jsonMapper))
			.prompts(GreetingPrompt.promptSpecification())
			.build();

		server.textResourceTemplate(CONSTANTS_TEMPLATE, "constant", "A mathematical constant by name", "text/plain",
				variables -> {
					Double value = CONSTANTS.get(variables.get("name"));
					if (value == null) {
						throw new IllegalArgumentException("unknown constant: " + variables.get("name"));
					}
					return Calculator.format(value);
				});
		return server;
	}

	public static void main(String[] args) {
		String name = System.getProperty("mcp.server.name", "Calculator");
		String version = System.getProperty("mcp.server.version", "1.0.0");

		McpServer server = create(name, version);
		McpServerSession session = server.connect(new StdioServerTransport(server.getJsonMapper()));
		logger.info("{} {} serving on stdio", name, version);

		session.onTermination().block();
	}

}
