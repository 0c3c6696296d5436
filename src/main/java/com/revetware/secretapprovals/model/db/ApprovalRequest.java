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

package com.revetware.secretapprovals.model.db;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Maps to the {@code approval_request} table in the database.
 * <p>
 * {@code requiredApprovals} and the rows of {@code approval_request_approver} are a snapshot of the governing policy
 * taken when the request was created (or last upserted); later policy edits do not affect them.
 * <p>
 * {@code openCommitterId} mirrors {@code committerId} only while an upsert-mode request is open, so a unique index can
 * hold at most one such request per committer and environment.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record ApprovalRequest(
		@NonNull UUID approvalRequestId,
		@NonNull Long requestSequence,
		@NonNull String slug,
		@NonNull UUID projectId,
		@NonNull String environment,
		@NonNull UUID secretFolderId,
		@Nullable UUID approvalPolicyId,
		@NonNull UUID committerId,
		@NonNull ApprovalRequestStatus status,
		@NonNull Boolean hasMerged,
		@Nullable UUID statusChangedBy,
		@Nullable UUID openCommitterId,
		@NonNull Integer requiredApprovals,
		@NonNull Instant createdAt,
		@NonNull Instant updatedAt
) {
	public enum ApprovalRequestStatus {
		OPEN,
		CLOSED
	}

	public ApprovalRequest {
		requireNonNull(approvalRequestId);
		requireNonNull(requestSequence);
		requireNonNull(slug);
		requireNonNull(projectId);
		requireNonNull(environment);
		requireNonNull(secretFolderId);
		requireNonNull(committerId);
		requireNonNull(status);
		requireNonNull(hasMerged);
		requireNonNull(requiredApprovals);
		requireNonNull(createdAt);
		requireNonNull(updatedAt);
	}
}
