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

import java.util.List;

/**
 * A batch of secret mutations keyed by plaintext secret name.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record ProposedSecretChanges(
		@Nullable List<@Nullable SecretCreate> creates,
		@Nullable List<@Nullable SecretUpdate> updates,
		@Nullable List<@Nullable SecretDelete> deletes
) {
	public record SecretCreate(
			@Nullable String secretName,
			@Nullable EncryptedSecretFields fields
	) {}

	/**
	 * {@code newSecretName} is non-null for a rename. {@code fields} carries the re-encrypted key when renaming and any
	 * changed value or comment.
	 */
	public record SecretUpdate(
			@Nullable String secretName,
			@Nullable String newSecretName,
			@Nullable EncryptedSecretFields fields
	) {}

	public record SecretDelete(
			@Nullable String secretName
	) {}

	@NonNull
	public List<@Nullable SecretCreate> createsOrEmpty() {
		return creates() == null ? List.of() : creates();
	}

	@NonNull
	public List<@Nullable SecretUpdate> updatesOrEmpty() {
		return updates() == null ? List.of() : updates();
	}

	@NonNull
	public List<@Nullable SecretDelete> deletesOrEmpty() {
		return deletes() == null ? List.of() : deletes();
	}

	@NonNull
	public Boolean isEmpty() {
		return createsOrEmpty().isEmpty() && updatesOrEmpty().isEmpty() && deletesOrEmpty().isEmpty();
	}
}
