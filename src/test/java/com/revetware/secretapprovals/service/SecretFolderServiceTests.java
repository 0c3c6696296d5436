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

package com.revetware.secretapprovals.service;

import com.revetware.secretapprovals.TestHarness;
import com.revetware.secretapprovals.exception.ApplicationException;
import com.revetware.secretapprovals.exception.AuthorizationException;
import com.revetware.secretapprovals.model.api.request.SecretFolderCreateRequest;
import com.revetware.secretapprovals.model.db.Secret;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.UUID;

import static com.revetware.secretapprovals.TestHarness.ENVIRONMENT;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class SecretFolderServiceTests {
	@Test
	public void testRootPathWithoutFolderTree() {
		TestHarness harness = new TestHarness();
		SecretFolderService secretFolderService = harness.getInstance(SecretFolderService.class);

		Assertions.assertEquals(SecretFolderService.getSentinelRootFolderId(),
				secretFolderService.findFolderIdByPath(harness.getProjectId(), ENVIRONMENT, "/").orElse(null),
				"Root path should resolve to the sentinel before any folder exists");
		Assertions.assertTrue(secretFolderService.findFolderIdByPath(harness.getProjectId(), ENVIRONMENT, "/app").isEmpty(),
				"Non-root paths should not resolve without a folder tree");
		Assertions.assertEquals("/", secretFolderService.findSecretPathByFolderId(SecretFolderService.getSentinelRootFolderId()).orElse(null));
	}

	@Test
	public void testNestedFolders() {
		TestHarness harness = new TestHarness();
		SecretFolderService secretFolderService = harness.getInstance(SecretFolderService.class);

		UUID appFolderId = createFolder(harness, "/", "app");
		UUID databaseFolderId = createFolder(harness, "/app/", "db");

		Assertions.assertEquals(appFolderId, secretFolderService.findFolderIdByPath(harness.getProjectId(), ENVIRONMENT, "/app").orElse(null));
		Assertions.assertEquals(databaseFolderId, secretFolderService.findFolderIdByPath(harness.getProjectId(), ENVIRONMENT, "/app/db/").orElse(null),
				"Trailing slash should not matter");
		Assertions.assertEquals("/app/db", secretFolderService.findSecretPathByFolderId(databaseFolderId).orElse(null));
		Assertions.assertTrue(secretFolderService.findFolderIdByPath(harness.getProjectId(), "prod", "/app").isEmpty(),
				"Folder trees are per-environment");

		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () -> createFolder(harness, "/app", "db"));
		Assertions.assertEquals(409, e.getStatusCode().intValue(), "Duplicate folder should conflict");

		e = Assertions.assertThrows(ApplicationException.class, () -> createFolder(harness, "/missing", "db"));
		Assertions.assertEquals(404, e.getStatusCode().intValue(), "Missing parent should be not found");

		e = Assertions.assertThrows(ApplicationException.class, () -> createFolder(harness, "/", "bad/name"));
		Assertions.assertEquals(422, e.getStatusCode().intValue(), "Invalid folder name should fail validation");
	}

	@Test
	public void testCreatingRootFolderRehomesExistingSecrets() {
		TestHarness harness = new TestHarness();
		SecretFolderService secretFolderService = harness.getInstance(SecretFolderService.class);
		SecretService secretService = harness.getInstance(SecretService.class);

		UUID secretId = harness.createSecret("API_KEY");

		Assertions.assertEquals(SecretFolderService.getSentinelRootFolderId(), secretService.findSecretById(secretId).get().secretFolderId());

		createFolder(harness, "/", "app");

		UUID rootFolderId = secretFolderService.findFolderIdByPath(harness.getProjectId(), ENVIRONMENT, "/").orElse(null);
		Secret secret = secretService.findSecretById(secretId).get();

		Assertions.assertNotNull(rootFolderId);
		Assertions.assertNotEquals(SecretFolderService.getSentinelRootFolderId(), rootFolderId, "A real root folder should now exist");
		Assertions.assertEquals(rootFolderId, secret.secretFolderId(), "Secret should have moved under the real root");
	}

	@Test
	public void testMembersCannotCreateFolders() {
		TestHarness harness = new TestHarness();
		SecretFolderService secretFolderService = harness.getInstance(SecretFolderService.class);

		Assertions.assertThrows(AuthorizationException.class, () -> harness.runAs(harness.member(), () ->
				secretFolderService.createFolder(new SecretFolderCreateRequest(harness.getProjectId(), ENVIRONMENT, "/", "app"))));
	}

	private UUID createFolder(TestHarness harness,
														String parentPath,
														String name) {
		return harness.callAs(harness.getAdmin(), () -> harness.getInstance(SecretFolderService.class).createFolder(
				new SecretFolderCreateRequest(harness.getProjectId(), ENVIRONMENT, parentPath, name)));
	}
}
