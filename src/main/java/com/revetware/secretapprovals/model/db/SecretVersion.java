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

import com.revetware.secretapprovals.model.db.Secret.SecretType;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Maps to the {@code secret_version} table in the database.
 * <p>
 * Rows are append-only snapshots of a {@link Secret}. The only mutation is {@code isDeleted}, set when the secret itself
 * is deleted.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record SecretVersion(
		@NonNull UUID secretVersionId,
		@NonNull UUID secretId,
		@NonNull Integer version,
		@NonNull UUID projectId,
		@NonNull String environment,
		@NonNull UUID secretFolderId,
		@NonNull SecretType type,
		@NonNull String blindIndex,
		@NonNull String secretKeyCiphertext,
		@NonNull String secretKeyIv,
		@NonNull String secretKeyTag,
		@NonNull String secretValueCiphertext,
		@NonNull String secretValueIv,
		@NonNull String secretValueTag,
		@Nullable String secretCommentCiphertext,
		@Nullable String secretCommentIv,
		@Nullable String secretCommentTag,
		@NonNull Boolean skipMultilineEncoding,
		@NonNull String algorithm,
		@NonNull String keyEncoding,
		@NonNull Boolean isDeleted,
		@NonNull Instant createdAt
) {
	public SecretVersion {
		requireNonNull(secretVersionId);
		requireNonNull(secretId);
		requireNonNull(version);
		requireNonNull(projectId);
		requireNonNull(environment);
		requireNonNull(secretFolderId);
		requireNonNull(type);
		requireNonNull(blindIndex);
		requireNonNull(secretKeyCiphertext);
		requireNonNull(secretKeyIv);
		requireNonNull(secretKeyTag);
		requireNonNull(secretValueCiphertext);
		requireNonNull(secretValueIv);
		requireNonNull(secretValueTag);
		requireNonNull(skipMultilineEncoding);
		requireNonNull(algorithm);
		requireNonNull(keyEncoding);
		requireNonNull(isDeleted);
		requireNonNull(createdAt);
	}
}
