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

package com.revetware.secretapprovals.util;

import org.jspecify.annotations.NonNull;

import java.util.UUID;

/**
 * Contract for deriving deterministic, non-reversible lookup keys from plaintext secret names.
 * <p>
 * A mock implementor computes HMACs locally for development and tests, while a real implementor would defer to the
 * platform's key management service.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface BlindIndexer {
	/**
	 * Returns the per-project salt, creating one on first use.
	 */
	@NonNull
	String getOrCreateProjectSalt(@NonNull UUID projectId);

	@NonNull
	String computeBlindIndex(@NonNull String secretName,
													 @NonNull String salt);

	enum Type {
		MOCK,
		REAL
	}
}
