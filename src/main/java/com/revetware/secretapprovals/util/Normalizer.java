/*
 * Copyright 2022-2025 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.revetware.secretapprovals.util;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Utilities for normalizing user-supplied input.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Normalizer {
	@Nonnull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@Nonnull
	private static final Pattern TAIL_WHITESPACE_PATTERN;
	@Nonnull
	private static final Pattern REPEATED_SLASHES_PATTERN;

	static {
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z}|\\s)+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z}|\\s)+$");
		REPEATED_SLASHES_PATTERN = Pattern.compile("/{2,}");
	}

	/**
	 * Turns user input like {@code " app//db/ "} into {@code /app/db}.
	 * <p>
	 * A missing leading slash is added, repeated slashes are collapsed and a trailing slash is dropped (except for the
	 * root path {@code /}). Glob characters are left untouched so policy paths can be normalized the same way.
	 */
	@Nonnull
	public static Optional<String> normalizeSecretPath(@Nullable String secretPath) {
		secretPath = trimAggressivelyToNull(secretPath);

		if (secretPath == null)
			return Optional.empty();

		if (!secretPath.startsWith("/"))
			secretPath = "/" + secretPath;

		secretPath = REPEATED_SLASHES_PATTERN.matcher(secretPath).replaceAll("/");

		if (secretPath.length() > 1 && secretPath.endsWith("/"))
			secretPath = secretPath.substring(0, secretPath.length() - 1);

		return Optional.of(secretPath);
	}

	@Nonnull
	public static Optional<String> normalizeEnvironment(@Nullable String environment) {
		return Optional.ofNullable(trimAggressivelyToNull(environment));
	}

	/**
	 * A "stronger" version of {@link String#trim()} which discards any kind of whitespace or invisible separator.
	 */
	@Nonnull
	public static Optional<String> trimAggressively(@Nullable String string) {
		if (string == null)
			return Optional.empty();

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return Optional.of(string);

		string = TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		return Optional.of(string);
	}

	@Nullable
	public static String trimAggressivelyToNull(@Nullable String string) {
		String trimmed = trimAggressively(string).orElse(null);
		return trimmed == null || trimmed.length() == 0 ? null : trimmed;
	}

	private Normalizer() {
		// Non-instantiable
	}
}
