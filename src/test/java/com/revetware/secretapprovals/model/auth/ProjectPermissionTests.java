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

import com.revetware.secretapprovals.model.auth.ProjectPermission.Action;
import com.revetware.secretapprovals.model.auth.ProjectPermission.Subject;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Set;
import java.util.UUID;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ProjectPermissionTests {
	@Test
	public void testParsing() {
		Assertions.assertEquals(ProjectPermission.of(Subject.SECRETS, Action.READ), ProjectPermission.fromWireValue("secrets:read"));
		Assertions.assertEquals(ProjectPermission.of(Subject.SECRET_FOLDERS, Action.CREATE), ProjectPermission.fromWireValue(" secret-folders:create "));
		Assertions.assertEquals("secret-approval:edit", ProjectPermission.of(Subject.SECRET_APPROVAL, Action.EDIT).toWireValue());

		Assertions.assertEquals(Set.of(ProjectPermission.of(Subject.MEMBERS, Action.DELETE)),
				ProjectPermission.fromWireValues(Set.of("members:delete")));
		Assertions.assertEquals(Set.of(), ProjectPermission.fromWireValues(null));
	}

	@Test
	public void testUnknownValuesRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> ProjectPermission.fromWireValue(null));
		Assertions.assertThrows(IllegalArgumentException.class, () -> ProjectPermission.fromWireValue("secrets"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> ProjectPermission.fromWireValue("secrets:"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> ProjectPermission.fromWireValue("widgets:read"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> ProjectPermission.fromWireValue("secrets:obliterate"));
	}

	@Test
	public void testRolePermissions() {
		Actor viewer = Actor.forUser(UUID.randomUUID(), UUID.randomUUID(), Actor.ProjectMembershipRole.VIEWER);
		Actor admin = Actor.forUser(UUID.randomUUID(), UUID.randomUUID(), Actor.ProjectMembershipRole.ADMIN);

		Assertions.assertTrue(viewer.hasPermission(Subject.SECRETS, Action.READ));
		Assertions.assertFalse(viewer.hasPermission(Subject.SECRETS, Action.CREATE), "Viewers are read-only");
		Assertions.assertTrue(admin.hasPermission(Subject.SECRET_FOLDERS, Action.CREATE), "Admins hold every permission");
	}
}
