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

import org.springframework.util.AntPathMatcher;
import org.springframework.util.PathMatcher;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Matches secret paths against glob patterns.
 * <p>
 * Matching is Ant-style:
 * <ul>
 *   <li>{@code *} - any run of characters within a single path segment</li>
 *   <li>{@code **} - any number of whole segments, including none; {@code /a/**} also matches {@code /a}</li>
 *   <li>{@code ?} - a single character within a segment</li>
 *   <li>{@code {a,b}} - alternation, which may nest; expanded before matching</li>
 * </ul>
 * Square brackets count toward {@link #containsGlobPattern(String)} but match literally.
 * Slash strictness is disabled: a trailing slash on the pattern or on the path does not prevent a match.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class GlobMatcher {
	@Nonnull
	private static final PathMatcher PATH_MATCHER;

	static {
		PATH_MATCHER = new AntPathMatcher();
	}

	@Nonnull
	public static Boolean containsGlobPattern(@Nullable String path) {
		if (path == null)
			return false;

		for (int i = 0; i < path.length(); i++) {
			switch (path.charAt(i)) {
				case '*', '?', '[', ']', '{', '}':
					return true;
				default:
					break;
			}
		}

		return false;
	}

	@Nonnull
	public static Boolean matches(@Nonnull String pattern,
																@Nonnull String path) {
		requireNonNull(pattern);
		requireNonNull(path);

		String normalizedPattern = stripTrailingSlash(pattern);
		String normalizedPath = stripTrailingSlash(path);

		if (!containsGlobPattern(normalizedPattern))
			return normalizedPattern.equals(normalizedPath);

		for (String alternative : expandAlternatives(normalizedPattern))
			if (PATH_MATCHER.match(stripTrailingSlash(alternative), normalizedPath))
				return true;

		return false;
	}

	/**
	 * Expands {@code /{prod,staging}/db} into {@code /prod/db} and {@code /staging/db}. Unbalanced braces are kept as-is.
	 */
	@Nonnull
	static List<String> expandAlternatives(@Nonnull String pattern) {
		requireNonNull(pattern);

		int open = pattern.indexOf('{');

		if (open == -1)
			return List.of(pattern);

		int depth = 0;
		int close = -1;
		List<Integer> commas = new ArrayList<>();

		for (int i = open; i < pattern.length() && close == -1; i++) {
			char c = pattern.charAt(i);

			if (c == '{')
				++depth;
			else if (c == '}' && --depth == 0)
				close = i;
			else if (c == ',' && depth == 1)
				commas.add(i);
		}

		if (close == -1)
			return List.of(pattern);

		String prefix = pattern.substring(0, open);
		String suffix = pattern.substring(close + 1);
		List<String> options = new ArrayList<>(commas.size() + 1);
		int start = open + 1;

		for (int comma : commas) {
			options.add(pattern.substring(start, comma));
			start = comma + 1;
		}

		options.add(pattern.substring(start, close));

		List<String> expanded = new ArrayList<>();

		for (String option : options)
			expanded.addAll(expandAlternatives(prefix + option + suffix));

		return expanded;
	}

	@Nonnull
	private static String stripTrailingSlash(@Nonnull String path) {
		requireNonNull(path);

		if (path.length() > 1 && path.endsWith("/"))
			return path.substring(0, path.length() - 1);

		return path;
	}

	private GlobMatcher() {
		// Non-instantiable
	}
}
