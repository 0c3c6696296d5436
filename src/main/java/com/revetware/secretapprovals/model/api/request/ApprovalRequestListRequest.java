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

import com.revetware.secretapprovals.model.db.ApprovalRequest.ApprovalRequestStatus;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.UUID;

/**
 * Filters for listing approval requests. Only {@code projectId} is required.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record ApprovalRequestListRequest(
		@Nullable UUID projectId,
		@Nullable ApprovalRequestStatus status,
		@Nullable String environment,
		@Nullable UUID committerId,
		@Nullable Integer limit,
		@Nullable Integer offset,
		@Nullable SortDirection sortDirection
) {
	public enum SortDirection {
		ASCENDING,
		DESCENDING
	}

	@NonNull
	public static ApprovalRequestListRequest forProjectId(@Nullable UUID projectId) {
		return new ApprovalRequestListRequest(projectId, null, null, null, null, null, null);
	}

	@NonNull
	public ApprovalRequestListRequest withStatus(@Nullable ApprovalRequestStatus status) {
		return new ApprovalRequestListRequest(projectId, status, environment, committerId, limit, offset, sortDirection);
	}

	@NonNull
	public ApprovalRequestListRequest withEnvironment(@Nullable String environment) {
		return new ApprovalRequestListRequest(projectId, status, environment, committerId, limit, offset, sortDirection);
	}

	@NonNull
	public ApprovalRequestListRequest withCommitterId(@Nullable UUID committerId) {
		return new ApprovalRequestListRequest(projectId, status, environment, committerId, limit, offset, sortDirection);
	}

	@NonNull
	public ApprovalRequestListRequest withPage(@Nullable Integer limit,
																						 @Nullable Integer offset) {
		return new ApprovalRequestListRequest(projectId, status, environment, committerId, limit, offset, sortDirection);
	}

	@NonNull
	public ApprovalRequestListRequest withSortDirection(@Nullable SortDirection sortDirection) {
		return new ApprovalRequestListRequest(projectId, status, environment, committerId, limit, offset, sortDirection);
	}
}
