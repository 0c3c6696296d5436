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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.regex.Pattern;

/**
 * Utilities for validating user-supplied input.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Validator {
	private static final int SECRET_NAME_MAX_LENGTH;
	private static final int ENVIRONMENT_MAX_LENGTH;
	@NonNull
	private static final Pattern ENVIRONMENT_PATTERN;
	@NonNull
	private static final Pattern FOLDER_NAME_PATTERN;

	static {
		SECRET_NAME_MAX_LENGTH = 500;
		ENVIRONMENT_MAX_LENGTH = 64;
		ENVIRONMENT_PATTERN = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_-]*$");
		FOLDER_NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_.-]+$");
	}

	/**
	 * Secret names are opaque to this system apart from their length and the absence of whitespace.
	 */
	@NonNull
	public static Boolean isValidSecretName(@Nullable String secretName) {
		if (secretName == null)
			return false;

		if (secretName.length() == 0 || secretName.length() > SECRET_NAME_MAX_LENGTH)
			return false;

		return secretName.chars().noneMatch(Character::isWhitespace);
	}

	@NonNull
	public static Boolean isValidEnvironment(@Nullable String environment) {
		if (environment == null || environment.length() > ENVIRONMENT_MAX_LENGTH)
			return false;

		return ENVIRONMENT_PATTERN.matcher(environment).matches();
	}

	@NonNull
	public static Boolean isValidFolderName(@Nullable String folderName) {
		if (folderName == null)
			return false;

		return FOLDER_NAME_PATTERN.matcher(folderName).matches();
	}

	private Validator() {
		// Non-instantiable
	}
}
