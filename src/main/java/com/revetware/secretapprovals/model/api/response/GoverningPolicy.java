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

import com.revetware.secretapprovals.model.db.ApprovalPolicy;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * The policy referenced by an open request, with the folder path the request targets. The policy is absent when it
 * has since been deleted.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record GoverningPolicy(
		@NonNull UUID approvalRequestId,
		@Nullable ApprovalPolicy approvalPolicy,
		@NonNull String secretPath
) {
	public GoverningPolicy {
		requireNonNull(approvalRequestId);
		requireNonNull(secretPath);
	}
}
