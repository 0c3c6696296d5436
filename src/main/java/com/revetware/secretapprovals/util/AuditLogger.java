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

import com.revetware.secretapprovals.model.auth.Actor.ActorType;
import org.jspecify.annotations.NonNull;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Fire-and-forget sink for audit events.
 * <p>
 * Callers record events only after the originating transaction commits. Implementations may fail; callers log and
 * report such failures but never undo committed work because of them.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface AuditLogger {
	void recordEvent(@NonNull AuditEvent auditEvent);

	enum Type {
		MOCK,
		REAL
	}

	enum AuditEventType {
		SECRET_APPROVAL_REQUEST_CREATED,
		SECRET_APPROVAL_MERGED,
		SECRET_APPROVAL_CLOSED,
		SECRET_APPROVAL_REOPENED
	}

	record AuditEvent(
			@NonNull AuditEventType eventType,
			@NonNull UUID projectId,
			@NonNull ActorType actorType,
			@NonNull UUID actorId,
			@NonNull Map<@NonNull String, @NonNull Object> metadata,
			@NonNull Instant occurredAt
	) {
		public AuditEvent {
			requireNonNull(eventType);
			requireNonNull(projectId);
			requireNonNull(actorType);
			requireNonNull(actorId);
			requireNonNull(metadata);
			requireNonNull(occurredAt);

			metadata = Map.copyOf(metadata);
		}
	}
}
