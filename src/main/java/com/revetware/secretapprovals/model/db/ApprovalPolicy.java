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
 * Maps to the {@code approval_policy} table in the database.
 * <p>
 * Approvers live in the {@code approval_policy_approver} child table. A {@code null} secret path governs the whole
 * environment; otherwise it is an exact path or a glob.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record ApprovalPolicy(
		@NonNull UUID approvalPolicyId,
		@NonNull Long creationSequence,
		@NonNull UUID projectId,
		@NonNull String environment,
		@Nullable String secretPath,
		@NonNull String name,
		@NonNull Integer requiredApprovals,
		@NonNull Instant createdAt,
		@NonNull Instant updatedAt
) {
	public ApprovalPolicy {
		requireNonNull(approvalPolicyId);
		requireNonNull(creationSequence);
		requireNonNull(projectId);
		requireNonNull(environment);
		requireNonNull(name);
		requireNonNull(requiredApprovals);
		requireNonNull(createdAt);
		requireNonNull(updatedAt);
	}
}
