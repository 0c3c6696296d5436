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

package com.revetware.secretapprovals.exception;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.util.Optional;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when the current actor lacks the standing (role, committer or approver) an operation requires.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@NotThreadSafe
public class AuthorizationException extends RuntimeException {
	@Nonnull
	private final String userMessage;
	@Nullable
	private final UUID actorId;

	public AuthorizationException(@Nonnull String userMessage) {
		this(userMessage, null);
	}

	public AuthorizationException(@Nonnull String userMessage,
																@Nullable UUID actorId) {
		super(format("%s (actor ID %s)", requireNonNull(userMessage), actorId == null ? "unknown" : actorId));
		this.userMessage = userMessage;
		this.actorId = actorId;
	}

	@Nonnull
	public Integer getStatusCode() {
		return 403;
	}

	@Nonnull
	public String getUserMessage() {
		return this.userMessage;
	}

	@Nonnull
	public Optional<UUID> getActorId() {
		return Optional.ofNullable(this.actorId);
	}
}
