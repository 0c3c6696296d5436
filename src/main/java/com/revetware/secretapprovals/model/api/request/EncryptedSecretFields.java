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

/**
 * Client-encrypted secret material. This system never decrypts it.
 * <p>
 * For creates, key and value ciphertext are required. For updates, {@code null} fields are left unchanged.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record EncryptedSecretFields(
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
		@Nullable String keyEncoding
) {
	@NonNull
	public static EncryptedSecretFields unchanged() {
		return new EncryptedSecretFields(null, null, null, null, null, null, null, null, null, null, null, null);
	}
}
