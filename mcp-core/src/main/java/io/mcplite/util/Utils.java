/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcplite.util;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * <p>
	 * More specifically, this method returns {@code true} if the {@code String} is not
	 * {@code null}, its length is greater than 0, and it contains at least one
	 * non-whitespace character.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Returns the message of the throwable, falling back to its class name when the
	 * throwable carries no message.
	 * @param error the throwable to describe
	 * @return a non-null description of the error
	 */
	public static String describe(Throwable error) {
		String message = error.getMessage();
		return hasText(message) ? message : error.getClass().getSimpleName();
	}

}
