/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcplite.examples.calculator;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

import io.mcplite.json.McpJsonMapper;
import io.mcplite.server.McpServerFeatures;
import io.mcplite.spec.McpSchema;

/**
 * The {@code calculate} tool: one binary arithmetic operation on two numbers.
 */
public final class Calculator {

	public static final String TOOL_NAME = "calculate";

	private static final String INPUT_SCHEMA = """
			{
				"type": "object",
				"properties": {
					"operation": {
						"type": "string",
						"enum": ["add", "subtract", "multiply", "divide"],
						"description": "Operation to perform"
					},
					"a": {
						"type": "number",
						"description": "First operand"
					},
					"b": {
						"type": "number",
						"description": "Second operand"
					}
				},
				"required": ["operation", "a", "b"]
			}
			""";

	private Calculator() {
	}

	public static McpServerFeatures.ToolSpecification toolSpecification(McpJsonMapper jsonMapper) {
		McpSchema.Tool tool = McpSchema.Tool.builder()
			.name(TOOL_NAME)
			.description("Perform a calculation")
			.inputSchema(jsonMapper, INPUT_SCHEMA)
			.build();
		return new McpServerFeatures.ToolSpecification(tool, McpServerFeatures.ToolHandler
			.fromSync((exchange, arguments) -> McpSchema.CallToolResult.text("Result: " + calculate(arguments))));
	}

	/**
	 * Applies the operation named in the arguments.
	 * @param arguments the tool arguments: {@code operation}, {@code a} and {@code b}
	 * @return the formatted result
	 * @throws IllegalArgumentException for missing operands or an unknown operation
	 * @throws ArithmeticException when dividing by zero
	 */
	static String calculate(Map<String, Object> arguments) {
		Object operation = arguments.get("operation");
		if (!(operation instanceof String)) {
			throw new IllegalArgumentException("operation must be a string");
		}
		double a = operand(arguments, "a");
		double b = operand(arguments, "b");

		String op = ((String) operation).toLowerCase(Locale.ROOT);
		double result;
		if ("add".equals(op)) {
			result = a + b;
		}
		else if ("subtract".equals(op)) {
			result = a - b;
		}
		else if ("multiply".equals(op)) {
			result = a * b;
		}
		else if ("divide".equals(op)) {
			if (b == 0) {
				throw new ArithmeticException("division by zero");
			}
			result = a / b;
		}
		else {
			throw new IllegalArgumentException("unknown operation: " + operation);
		}
		return format(result);
	}

	private static double operand(Map<String, Object> arguments, String name) {
		Object value = arguments.get(name);
		if (value instanceof Number number) {
			return number.doubleValue();
		}
		throw new IllegalArgumentException(name + " must be a number");
	}

	static String format(double value) {
		if (Double.isNaN(value) || Double.isInfinite(value)) {
			return Double.toString(value);
		}
		return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
	}

}
