/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcplite.json;

import java.io.IOException;

/**
 * Abstraction for JSON serialization/deserialization so the session engine does not
 * depend on a specific JSON library directly. The default implementation is backed by
 * Jackson, see {@link JacksonMcpJsonMapper}.
 */
public interface McpJsonMapper {

	/**
	 * Deserialize JSON string into a target type.
	 * @param content JSON as String
	 * @param type target class
	 * @return deserialized instance
	 * @param <T> generic type
	 * @throws IOException on parse errors
	 */
	<T> T readValue(String content, Class<T> type) throws IOException;

	/**
	 * Deserialize JSON string into a parameterized target type.
	 * @param content JSON as String
	 * @param type parameterized type reference
	 * @return deserialized instance
	 * @param <T> generic type
	 * @throws IOException on parse errors
	 */
	<T> T readValue(String content, TypeRef<T> type) throws IOException;

	/**
	 * Convert a value to a given type, useful for mapping nested JSON structures.
	 * @param fromValue source value
	 * @param type target class
	 * @return converted value
	 * @param <T> generic type
	 */
	<T> T convertValue(Object fromValue, Class<T> type);

	/**
	 * Convert a value to a given parameterized type.
	 * @param fromValue source value
	 * @param type target type reference
	 * @return converted value
	 * @param <T> generic type
	 */
	<T> T convertValue(Object fromValue, TypeRef<T> type);

	/**
	 * Serialize an object to JSON string.
	 * @param value object to serialize
	 * @return JSON as String
	 * @throws IOException on serialization errors
	 */
	String writeValueAsString(Object value) throws IOException;

	/**
	 * Creates the default {@link McpJsonMapper}, backed by a Jackson
	 * {@link com.fasterxml.jackson.databind.ObjectMapper}.
	 * @return a new mapper instance
	 */
	static McpJsonMapper createDefault() {
		return new JacksonMcpJsonMapper(JacksonMcpJsonMapper.defaultObjectMapper());
	}

}
