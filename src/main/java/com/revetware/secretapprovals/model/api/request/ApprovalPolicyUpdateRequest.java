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

package com.revetware.secretapprovals.model.api.request;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.Set;
import java.util.UUID;

/**
 * Partial update of a policy: {@code null} fields are left unchanged.
 * <p>
 * A blank {@code secretPath} widens the policy to the whole environment. A non-null {@code approverIds} replaces the
 * approver set.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record ApprovalPolicyUpdateRequest(
		@Nullable UUID approvalPolicyId,
		@Nullable String secretPath,
		@Nullable String name,
		@Nullable Set<@Nullable UUID> approverIds,
		@Nullable Integer requiredApprovals
) {
	@NonNull
	public ApprovalPolicyUpdateRequest withApprovalPolicyId(@Nullable UUID approvalPolicyId) {
		return new ApprovalPolicyUpdateRequest(approvalPolicyId, secretPath, name, approverIds, requiredApprovals);
	}
}
