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

import java.util.Set;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * The already-authenticated caller of an operation, as resolved for a single project by the authorization layer.
 * <p>
 * {@code actorId} is the caller's project membership ID; it is the identity recorded as committer, reviewer and approver.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public record Actor(
		@NonNull ActorType actorType,
		@NonNull UUID actorId,
		@NonNull UUID projectId,
		@NonNull ProjectMembershipRole role,
		@NonNull Set<@NonNull ProjectPermission> permissions
) {
	public Actor {
		requireNonNull(actorType);
		requireNonNull(actorId);
		requireNonNull(projectId);
		requireNonNull(role);
		requireNonNull(permissions);

		permissions = Set.copyOf(permissions);
	}

	public enum ActorType {
		USER,
		SERVICE,
		IDENTITY
	}

	public enum ProjectMembershipRole {
		ADMIN,
		MEMBER,
		VIEWER,
		NO_ACCESS
	}

	@NonNull
	public static Actor forUser(@NonNull UUID actorId,
															@NonNull UUID projectId,
															@NonNull ProjectMembershipRole role) {
		requireNonNull(actorId);
		requireNonNull(projectId);
		requireNonNull(role);

		return new Actor(ActorType.USER, actorId, projectId, role, defaultPermissionsForRole(role));
	}

	@NonNull
	public Boolean isAdmin() {
		return role() == ProjectMembershipRole.ADMIN;
	}

	@NonNull
	public Boolean hasPermission(ProjectPermission.@NonNull Subject subject,
															 ProjectPermission.@NonNull Action action) {
		requireNonNull(subject);
		requireNonNull(action);

		return isAdmin() || permissions().contains(ProjectPermission.of(subject, action));
	}

	@NonNull
	private static Set<@NonNull ProjectPermission> defaultPermissionsForRole(@NonNull ProjectMembershipRole role) {
		requireNonNull(role);

		switch (role) {
			case ADMIN, MEMBER:
				return Set.of(
						ProjectPermission.of(ProjectPermission.Subject.SECRETS, ProjectPermission.Action.READ),
						ProjectPermission.of(ProjectPermission.Subject.SECRETS, ProjectPermission.Action.CREATE),
						ProjectPermission.of(ProjectPermission.Subject.SECRETS, ProjectPermission.Action.EDIT),
						ProjectPermission.of(ProjectPermission.Subject.SECRETS, ProjectPermission.Action.DELETE),
						ProjectPermission.of(ProjectPermission.Subject.SECRET_APPROVAL, ProjectPermission.Action.READ)
				);
			case VIEWER:
				return Set.of(ProjectPermission.of(ProjectPermission.Subject.SECRETS, ProjectPermission.Action.READ));
			default:
				return Set.of();
		}
	}
}
