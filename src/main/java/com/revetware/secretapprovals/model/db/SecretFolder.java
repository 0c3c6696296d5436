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
 * Maps to the {@code secret_folder} table in the database.
 * <p>
 * Folders form a tree per (project, environment). Nodes only know their parent; the root is named {@code root} and
 * has no parent.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record SecretFolder(
		@NonNull UUID secretFolderId,
		@NonNull UUID projectId,
		@NonNull String environment,
		@Nullable UUID parentFolderId,
		@NonNull String name,
		@NonNull Instant createdAt
) {
	public SecretFolder {
		requireNonNull(secretFolderId);
		requireNonNull(projectId);
		requireNonNull(environment);
		requireNonNull(name);
		requireNonNull(createdAt);
	}
}
