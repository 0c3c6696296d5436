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
 * Maps to the {@code approval_commit} table in the database.
 * <p>
 * One proposed mutation of one secret. There is no plaintext name column: the target is identified by
 * {@code secretBlindIndex} (the new index for a create or a renaming update) and, for updates and deletes, by
 * {@code secretId}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record ApprovalCommit(
		@NonNull UUID approvalCommitId,
		@NonNull UUID approvalRequestId,
		@NonNull Integer commitOrder,
		@NonNull CommitOperation operation,
		@Nullable UUID secretId,
		@Nullable UUID secretVersionId,
		@NonNull String secretBlindIndex,
		@NonNull Integer version,
		@Nullable String secretKeyCiphertext,
		@Nullable String secretKeyIv,
		@Nullable String secretKeyTag,
		@Nullable String secretValueCiphertext,
		@Nullable String secretValueIv,
		@Nullable String secretValueTag,
		@Nullable String secretCommentCiphertext,
		@Nullable String secretCommentIv,
		@Nullable String secretCommentTag,
		@Nullable Boolean skipMultilineEncoding,
		@Nullable String algorithm,
		@Nullable String keyEncoding,
		@NonNull Instant createdAt
) {
	public enum CommitOperation {
		CREATE,
		UPDATE,
		DELETE
	}

	public ApprovalCommit {
		requireNonNull(approvalCommitId);
		requireNonNull(approvalRequestId);
		requireNonNull(commitOrder);
		requireNonNull(operation);
		requireNonNull(secretBlindIndex);
		requireNonNull(version);
		requireNonNull(createdAt);
	}
}
