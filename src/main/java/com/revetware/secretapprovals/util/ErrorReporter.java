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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Contract for reporting unexpected errors, e.g. to a third-party monitoring service.
 * <p>
 * Context entries identify what was being worked on when the error happened, such as an audit event type or an
 * approval request ID.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface ErrorReporter {
	void reportError(@Nullable String message,
									 @Nullable Throwable throwable,
									 @NonNull Map<@NonNull String, @NonNull Object> context);

	default void reportError(@Nullable String message) {
		reportError(message, null, Map.of());
	}

	default void reportError(@Nullable Throwable throwable) {
		reportError(null, throwable, Map.of());
	}

	default void reportError(@Nullable String message,
													 @Nullable Throwable throwable) {
		reportError(message, throwable, Map.of());
	}

	enum Type {
		MOCK,
		REAL
	}
}
