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

import java.time.Instant;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Maps to the {@code approval_review} table in the database.
 * <p>
 * At most one row exists per (request, reviewer); a new vote overwrites the previous one.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record ApprovalReview(
		@NonNull UUID approvalRequestId,
		@NonNull UUID reviewerId,
		@NonNull ReviewStatus status,
		@NonNull Instant createdAt,
		@NonNull Instant updatedAt
) {
	public enum ReviewStatus {
		PENDING,
		APPROVED,
		REJECTED
	}

	public ApprovalReview {
		requireNonNull(approvalRequestId);
		requireNonNull(reviewerId);
		requireNonNull(status);
		requireNonNull(createdAt);
		requireNonNull(updatedAt);
	}
}
