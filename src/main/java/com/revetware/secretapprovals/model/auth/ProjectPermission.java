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

package com.revetware.secretapprovals.model.auth;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import static com.revetware.secretapprovals.util.Normalizer.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A single recognized (subject, action) grant, e.g. {@code secrets:read}.
 * <p>
 * Grants arrive from the authorization layer as strings. Unknown subjects or actions are rejected when parsed rather than
 * carried along as untyped values.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record ProjectPermission(
		@NonNull Subject subject,
		@NonNull Action action
) {
	public ProjectPermission {
		requireNonNull(subject);
		requireNonNull(action);
	}

	public enum Subject {
		SECRETS("secrets"),
		SECRET_FOLDERS("secret-folders"),
		SECRET_APPROVAL("secret-approval"),
		MEMBERS("members");

		@NonNull
		private final String wireValue;

		Subject(@NonNull String wireValue) {
			requireNonNull(wireValue);
			this.wireValue = wireValue;
		}

		@NonNull
		public String getWireValue() {
			return this.wireValue;
		}

		@NonNull
		public static Optional<Subject> fromWireValue(@Nullable String value) {
			for (Subject subject : values())
				if (subject.getWireValue().equals(value))
					return Optional.of(subject);

			return Optional.empty();
		}
	}

	public enum Action {
		READ("read"),
		CREATE("create"),
		EDIT("edit"),
		DELETE("delete");

		@NonNull
		private final String wireValue;

		Action(@NonNull String wireValue) {
			requireNonNull(wireValue);
			this.wireValue = wireValue;
		}

		@NonNull
		public String getWireValue() {
			return this.wireValue;
		}

		@NonNull
		public static Optional<Action> fromWireValue(@Nullable String value) {
			for (Action action : values())
				if (action.getWireValue().equals(value))
					return Optional.of(action);

			return Optional.empty();
		}
	}

	@NonNull
	public static ProjectPermission of(@NonNull Subject subject,
																		 @NonNull Action action) {
		return new ProjectPermission(subject, action);
	}

	/**
	 * Parses a {@code subject:action} string such as {@code secrets:read}.
	 *
	 * @throws IllegalArgumentException if the subject or action is not recognized
	 */
	@NonNull
	public static ProjectPermission fromWireValue(@Nullable String wireValue) {
		String normalizedWireValue = trimAggressivelyToNull(wireValue);

		if (normalizedWireValue == null)
			throw new IllegalArgumentException("Permission value is required");

		int separatorIndex = normalizedWireValue.lastIndexOf(':');

		if (separatorIndex <= 0 || separatorIndex == normalizedWireValue.length() - 1)
			throw new IllegalArgumentException(format("Malformed permission '%s'", normalizedWireValue));

		String subjectAsString = normalizedWireValue.substring(0, separatorIndex);
		String actionAsString = normalizedWireValue.substring(separatorIndex + 1);

		Subject subject = Subject.fromWireValue(subjectAsString).orElseThrow(() ->
				new IllegalArgumentException(format("Unknown permission subject '%s'", subjectAsString)));
		Action action = Action.fromWireValue(actionAsString).orElseThrow(() ->
				new IllegalArgumentException(format("Unknown permission action '%s'", actionAsString)));

		return new ProjectPermission(subject, action);
	}

	@NonNull
	public static Set<@NonNull ProjectPermission> fromWireValues(@Nullable Set<@Nullable String> wireValues) {
		if (wireValues == null)
			return Set.of();

		Set<ProjectPermission> permissions = new LinkedHashSet<>(wireValues.size());

		for (String wireValue : wireValues)
			permissions.add(fromWireValue(wireValue));

		return Set.copyOf(permissions);
	}

	@NonNull
	public String toWireValue() {
		return format("%s:%s", subject().getWireValue(), action().getWireValue());
	}
}
