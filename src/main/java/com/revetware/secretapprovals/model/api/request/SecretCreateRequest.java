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

import com.revetware.secretapprovals.model.db.Secret.SecretType;
import org.jspecify.annotations.Nullable;

import java.util.UUID;

/**
 * Direct creation of a secret, outside of any approval flow.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record SecretCreateRequest(
		@Nullable UUID projectId,
		@Nullable String environment,
		@Nullable String secretPath,
		@Nullable String secretName,
		@Nullable SecretType type,
		@Nullable EncryptedSecretFields fields
) {}
