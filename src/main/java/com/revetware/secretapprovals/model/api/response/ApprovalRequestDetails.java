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

package com.revetware.secretapprovals.model.api.response;

import com.revetware.secretapprovals.model.db.ApprovalCommit;
import com.revetware.secretapprovals.model.db.ApprovalRequest;
import com.revetware.secretapprovals.model.db.ApprovalReview;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * An approval request together with everything a reviewer needs to judge it.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record ApprovalRequestDetails(
		@NonNull ApprovalRequest approvalRequest,
		@NonNull Set<@NonNull UUID> approverIds,
		@NonNull List<@NonNull ApprovalCommit> commits,
		@NonNull List<@NonNull ApprovalReview> reviews,
		@NonNull String secretPath,
		@Nullable String policyName
) {
	public ApprovalRequestDetails {
		requireNonNull(approvalRequest);
		requireNonNull(approverIds);
		requireNonNull(commits);
		requireNonNull(reviews);
		requireNonNull(secretPath);

		approverIds = Set.copyOf(approverIds);
		commits = List.copyOf(commits);
		reviews = List.copyOf(reviews);
	}
}
