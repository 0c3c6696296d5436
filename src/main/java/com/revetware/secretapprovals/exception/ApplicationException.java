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

package com.revetware.secretapprovals.exception;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Carries a user-presentable failure out of the service layer.
 * <p>
 * Each failure has an {@link ErrorKind} whose status code follows HTTP semantics, so a route layer can pass it through
 * verbatim. Lack of standing is reported separately via {@link AuthorizationException}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ApplicationException extends RuntimeException {
	@NonNull
	private final ErrorKind errorKind;
	@NonNull
	private final List<@NonNull String> generalErrors;
	@NonNull
	private final Map<@NonNull String, @NonNull List<@NonNull String>> fieldErrors;

	public enum ErrorKind {
		// Malformed, or not allowed in the request's current state
		BAD_REQUEST(400),
		// A folder, secret or approval request does not exist
		NOT_FOUND(404),
		// Conflicts with current secret state, or the request was already merged
		CONFLICT(409),
		// One or more input fields are invalid
		INVALID_FIELDS(422),
		STORAGE_ERROR(500);

		@NonNull
		private final Integer statusCode;

		ErrorKind(@NonNull Integer statusCode) {
			requireNonNull(statusCode);
			this.statusCode = statusCode;
		}

		@NonNull
		public Integer getStatusCode() {
			return this.statusCode;
		}
	}

	@NonNull
	public static ApplicationException badRequest(@NonNull String generalError) {
		requireNonNull(generalError);
		return new ApplicationException(ErrorKind.BAD_REQUEST, List.of(generalError), Map.of(), null);
	}

	@NonNull
	public static ApplicationException notFound(@NonNull String generalError) {
		requireNonNull(generalError);
		return new ApplicationException(ErrorKind.NOT_FOUND, List.of(generalError), Map.of(), null);
	}

	@NonNull
	public static ApplicationException conflict(@NonNull String generalError) {
		requireNonNull(generalError);
		return new ApplicationException(ErrorKind.CONFLICT, List.of(generalError), Map.of(), null);
	}

	@NonNull
	public static ApplicationException invalidFields(@NonNull ErrorCollector errorCollector) {
		requireNonNull(errorCollector);
		return new ApplicationException(ErrorKind.INVALID_FIELDS, errorCollector.generalErrors, errorCollector.fieldErrors, null);
	}

	@NonNull
	public static ApplicationException storageError(@NonNull String generalError,
																									@Nullable Throwable cause) {
		requireNonNull(generalError);
		return new ApplicationException(ErrorKind.STORAGE_ERROR, List.of(generalError), Map.of(), cause);
	}

	private ApplicationException(@NonNull ErrorKind errorKind,
															 @NonNull List<@NonNull String> generalErrors,
															 @NonNull Map<@NonNull String, @NonNull List<@NonNull String>> fieldErrors,
															 @Nullable Throwable cause) {
		super(createMessage(errorKind, generalErrors, fieldErrors), cause);

		this.errorKind = errorKind;
		this.generalErrors = List.copyOf(generalErrors);

		Map<String, List<String>> copiedFieldErrors = new LinkedHashMap<>(fieldErrors.size());

		for (Map.Entry<String, List<String>> entry : fieldErrors.entrySet())
			copiedFieldErrors.put(entry.getKey(), List.copyOf(entry.getValue()));

		this.fieldErrors = Collections.unmodifiableMap(copiedFieldErrors);
	}

	@NonNull
	private static String createMessage(@NonNull ErrorKind errorKind,
																			@NonNull List<@NonNull String> generalErrors,
																			@NonNull Map<@NonNull String, @NonNull List<@NonNull String>> fieldErrors) {
		requireNonNull(errorKind);
		requireNonNull(generalErrors);
		requireNonNull(fieldErrors);

		StringBuilder message = new StringBuilder(format("%s (status %d)", errorKind.name(), errorKind.getStatusCode()));

		if (generalErrors.size() > 0)
			message.append(format(", General Errors: %s", generalErrors));

		if (fieldErrors.size() > 0)
			message.append(format(", Field Errors: %s", fieldErrors));

		return message.toString();
	}

	/**
	 * Accumulates validation failures so every invalid field is reported at once.
	 */
	@NotThreadSafe
	public static class ErrorCollector {
		@NonNull
		private final List<@NonNull String> generalErrors;
		@NonNull
		private final Map<@NonNull String, @NonNull List<@NonNull String>> fieldErrors;

		public ErrorCollector() {
			this.generalErrors = new ArrayList<>();
			this.fieldErrors = new LinkedHashMap<>();
		}

		public void addGeneralError(@NonNull String generalError) {
			requireNonNull(generalError);
			this.generalErrors.add(generalError);
		}

		public void addFieldError(@NonNull String field,
															@NonNull String error) {
			requireNonNull(field);
			requireNonNull(error);

			List<@NonNull String> errors = this.fieldErrors.computeIfAbsent(field, ignored -> new ArrayList<>(4));

			if (!errors.contains(error))
				errors.add(error);
		}

		@NonNull
		public Boolean hasErrors() {
			return this.generalErrors.size() > 0 || this.fieldErrors.size() > 0;
		}
	}

	@NonNull
	public ErrorKind getErrorKind() {
		return this.errorKind;
	}

	@NonNull
	public Integer getStatusCode() {
		return getErrorKind().getStatusCode();
	}

	@NonNull
	public List<@NonNull String> getGeneralErrors() {
		return this.generalErrors;
	}

	@NonNull
	public Map<@NonNull String, @NonNull List<@NonNull String>> getFieldErrors() {
		return this.fieldErrors;
	}
}
