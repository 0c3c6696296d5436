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

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.revetware.secretapprovals.TestHarness;
import com.revetware.secretapprovals.exception.ApplicationException;
import com.revetware.secretapprovals.model.ApprovalCommitDraft;
import com.revetware.secretapprovals.model.SecretScope;
import com.revetware.secretapprovals.model.api.request.EncryptedSecretFields;
import com.revetware.secretapprovals.model.api.request.ProposedSecretChanges;
import com.revetware.secretapprovals.model.api.request.ProposedSecretChanges.SecretCreate;
import com.revetware.secretapprovals.model.api.request.ProposedSecretChanges.SecretDelete;
import com.revetware.secretapprovals.model.api.request.ProposedSecretChanges.SecretUpdate;
import com.revetware.secretapprovals.model.db.ApprovalCommit;
import com.revetware.secretapprovals.model.db.ApprovalCommit.CommitOperation;
import com.revetware.secretapprovals.model.db.ApprovalRequest;
import com.revetware.secretapprovals.model.db.Secret;
import com.revetware.secretapprovals.util.BlindIndexer;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static com.revetware.secretapprovals.TestHarness.ENVIRONMENT;
import static com.revetware.secretapprovals.TestHarness.creates;
import static com.revetware.secretapprovals.TestHarness.deletes;
import static com.revetware.secretapprovals.TestHarness.fields;
import static com.revetware.secretapprovals.TestHarness.update;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ApprovalCommitServiceTests {
	@Test
	public void testMalformedBatchesRejectedBeforeAnyLookup() {
		// Any call to the blind indexer means validation ran too late
		TestHarness harness = new TestHarness(new AbstractModule() {
			@NonNull
			@Provides
			@Singleton
			public BlindIndexer provideBlindIndexer() {
				return new BlindIndexer() {
					@NonNull
					@Override
					public String getOrCreateProjectSalt(@NonNull UUID projectId) {
						throw new IllegalStateException("Blind indexer should not have been called");
					}

					@NonNull
					@Override
					public String computeBlindIndex(@NonNull String secretName,
																					@NonNull String salt) {
						throw new IllegalStateException("Blind indexer should not have been called");
					}
				};
			}
		});

		ApprovalCommitService approvalCommitService = harness.getInstance(ApprovalCommitService.class);
		SecretScope scope = new SecretScope(harness.getProjectId(), ENVIRONMENT, "/");

		assertBadRequest(() -> approvalCommitService.buildApprovalCommits(scope, null), "Null batch");
		assertBadRequest(() -> approvalCommitService.buildApprovalCommits(scope, new ProposedSecretChanges(List.of(), List.of(), List.of())), "Empty batch");

		assertBadRequest(() -> approvalCommitService.buildApprovalCommits(scope, new ProposedSecretChanges(null, List.of(
				new SecretUpdate("DB_PASSWORD", null, fields("a")),
				new SecretUpdate("DB_PASSWORD", null, fields("b"))
		), null)), "Duplicate update targets");

		assertBadRequest(() -> approvalCommitService.buildApprovalCommits(scope, new ProposedSecretChanges(
				List.of(new SecretCreate("API_KEY", fields("a"))),
				null,
				List.of(new SecretDelete("API_KEY")))), "Same name created and deleted");

		assertBadRequest(() -> approvalCommitService.buildApprovalCommits(scope, new ProposedSecretChanges(
				List.of(new SecretCreate("NEW_NAME", fields("a"))),
				List.of(new SecretUpdate("OLD_NAME", "NEW_NAME", fields("b"))),
				null)), "Rename onto another name in the batch");

		assertBadRequest(() -> approvalCommitService.buildApprovalCommits(scope, creates("   ")), "Blank name");

		assertBadRequest(() -> approvalCommitService.buildApprovalCommits(scope, new ProposedSecretChanges(
				List.of(new SecretCreate("NO_CIPHERTEXT", null)), null, null)), "Create without ciphertext");
	}

	@Test
	public void testRenameRequiresReencryptedKey() {
		TestHarness harness = new TestHarness();
		harness.createPolicy(null, Set.of(harness.member().actorId()), 1);
		harness.createSecret("OLD_NAME");

		EncryptedSecretFields valueOnly = new EncryptedSecretFields(null, null, null, "value-ct", "value-iv", "value-tag",
				null, null, null, null, null, null);
		EncryptedSecretFields keyWithoutTag = new EncryptedSecretFields("key-ct", "key-iv", null, null, null, null,
				null, null, null, null, null, null);

		for (EncryptedSecretFields fields : Arrays.asList(null, EncryptedSecretFields.unchanged(), valueOnly, keyWithoutTag)) {
			ApplicationException e = Assertions.assertThrows(ApplicationException.class, () ->
					harness.requestChanges(harness.member(), update("OLD_NAME", "NEW_NAME", fields)));

			Assertions.assertEquals(400, e.getStatusCode().intValue(), "Rename without a complete key should be rejected");
		}

		Long requestCount = harness.getDatabase().queryForObject("SELECT COUNT(*) FROM approval_request", Long.class).get();
		Assertions.assertEquals(0L, requestCount.longValue(), "No request should have been stored");

		// A value-only change without a rename needs no key
		ApprovalRequest approvalRequest = harness.requestChanges(harness.member(), update("OLD_NAME", null, valueOnly));
		Assertions.assertNotNull(approvalRequest);
	}

	@Test
	public void testCommitsAreOrderedAndVersioned() {
		TestHarness harness = new TestHarness();
		ApprovalCommitService approvalCommitService = harness.getInstance(ApprovalCommitService.class);
		SecretService secretService = harness.getInstance(SecretService.class);

		Secret renamedSecret = secretService.findSecretById(harness.createSecret("OLD_NAME")).get();
		Secret deletedSecret = secretService.findSecretById(harness.createSecret("OBSOLETE")).get();

		// Input order differs from output order on purpose
		List<ApprovalCommitDraft> drafts = approvalCommitService.buildApprovalCommits(
				new SecretScope(harness.getProjectId(), ENVIRONMENT, "/"),
				new ProposedSecretChanges(
						List.of(new SecretCreate("FRESH", fields("fresh"))),
						List.of(new SecretUpdate("OLD_NAME", "NEW_NAME", fields("renamed"))),
						List.of(new SecretDelete("OBSOLETE"))));

		Assertions.assertEquals(List.of(CommitOperation.CREATE, CommitOperation.UPDATE, CommitOperation.DELETE),
				drafts.stream().map(ApprovalCommitDraft::operation).toList(), "Commits are out of order");

		ApprovalCommitDraft create = drafts.get(0);
		ApprovalCommitDraft rename = drafts.get(1);
		ApprovalCommitDraft delete = drafts.get(2);

		Assertions.assertEquals(0, create.version().intValue(), "Creates start at version 0");
		Assertions.assertNull(create.secretId());
		Assertions.assertNotEquals("FRESH", create.secretBlindIndex(), "Blind index must not be the plaintext name");

		Assertions.assertEquals(renamedSecret.secretId(), rename.secretId());
		Assertions.assertEquals(1, rename.version().intValue());
		Assertions.assertNotNull(rename.secretVersionId(), "Update should reference the latest version");
		Assertions.assertNotEquals(renamedSecret.blindIndex(), rename.secretBlindIndex(), "Rename should carry the new blind index");

		Assertions.assertEquals(deletedSecret.secretId(), delete.secretId());
		Assertions.assertEquals(deletedSecret.blindIndex(), delete.secretBlindIndex());
		Assertions.assertNotNull(delete.secretVersionId(), "Delete should reference the latest version");
	}

	@Test
	public void testCreateOfExistingSecretConflicts() {
		TestHarness harness = new TestHarness();

		harness.createPolicy(null, Set.of(UUID.randomUUID()), 1);
		harness.createSecret("API_KEY");

		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () ->
				harness.requestChanges(harness.member(), creates("API_KEY")));

		Assertions.assertEquals(409, e.getStatusCode().intValue(), "Bad status code");

		Long requestCount = harness.getDatabase().queryForObject("SELECT COUNT(*) FROM approval_request", Long.class).get();

		Assertions.assertEquals(0L, requestCount.longValue(), "No request should have been persisted");
	}

	@Test
	public void testMissingTargets() {
		TestHarness harness = new TestHarness();
		ApprovalCommitService approvalCommitService = harness.getInstance(ApprovalCommitService.class);
		SecretScope scope = new SecretScope(harness.getProjectId(), ENVIRONMENT, "/");

		harness.createSecret("EXISTING");
		harness.createSecret("TAKEN");

		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () ->
				approvalCommitService.buildApprovalCommits(scope, update("MISSING", null, fields("x"))));
		Assertions.assertEquals(409, e.getStatusCode().intValue(), "Updating a missing secret should conflict");

		e = Assertions.assertThrows(ApplicationException.class, () ->
				approvalCommitService.buildApprovalCommits(scope, update("EXISTING", "TAKEN", fields("x"))));
		Assertions.assertEquals(409, e.getStatusCode().intValue(), "Renaming onto an existing secret should conflict");

		e = Assertions.assertThrows(ApplicationException.class, () ->
				approvalCommitService.buildApprovalCommits(scope, deletes("MISSING")));
		Assertions.assertEquals(404, e.getStatusCode().intValue(), "Deleting a missing secret should be not found");

		e = Assertions.assertThrows(ApplicationException.class, () ->
				approvalCommitService.buildApprovalCommits(new SecretScope(harness.getProjectId(), ENVIRONMENT, "/nope"), creates("X")));
		Assertions.assertEquals(404, e.getStatusCode().intValue(), "Unknown folder should be not found");
	}

	@Test
	public void testStoredCommitsHoldNoPlaintextName() {
		TestHarness harness = new TestHarness();
		ApprovalRequestService approvalRequestService = harness.getInstance(ApprovalRequestService.class);

		harness.createPolicy(null, Set.of(UUID.randomUUID()), 1);

		ApprovalRequest approvalRequest = harness.requestChanges(harness.member(), creates("SUPER_SECRET_NAME"));
		List<ApprovalCommit> commits = approvalRequestService.findCommitsByApprovalRequestId(approvalRequest.approvalRequestId());

		Assertions.assertEquals(1, commits.size());
		Assertions.assertNotEquals("SUPER_SECRET_NAME", commits.get(0).secretBlindIndex());
		Assertions.assertEquals("SUPER_SECRET_NAME-key-ct", commits.get(0).secretKeyCiphertext(), "Ciphertext should be stored as given");

		Long nameColumnCount = harness.getDatabase().queryForObject("""
				SELECT COUNT(*)
				FROM INFORMATION_SCHEMA.COLUMNS
				WHERE TABLE_NAME='APPROVAL_COMMIT'
				AND COLUMN_NAME LIKE '%NAME%'
				""", Long.class).get();

		Assertions.assertEquals(0L, nameColumnCount.longValue(), "Commits must not have a name column");
	}

	private void assertBadRequest(@NonNull Runnable runnable,
																@NonNull String description) {
		ApplicationException e = Assertions.assertThrows(ApplicationException.class, runnable::run, description);
		Assertions.assertEquals(400, e.getStatusCode().intValue(), description);
	}
}
