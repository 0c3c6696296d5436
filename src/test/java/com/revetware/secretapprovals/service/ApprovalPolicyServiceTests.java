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
import com.revetware.secretapprovals.model.api.request.ApprovalPolicyCreateRequest;
import com.revetware.secretapprovals.model.api.request.ApprovalPolicyUpdateRequest;
import com.revetware.secretapprovals.model.auth.Actor;
import com.revetware.secretapprovals.model.db.ApprovalPolicy;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Set;
import java.util.UUID;

import static com.revetware.secretapprovals.TestHarness.ENVIRONMENT;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ApprovalPolicyServiceTests {
	@Test
	public void testPolicyPriority() {
		TestHarness harness = new TestHarness();
		ApprovalPolicyService approvalPolicyService = harness.getInstance(ApprovalPolicyService.class);
		Set<UUID> approverIds = Set.of(UUID.randomUUID());

		// Creation order deliberately puts the least specific policy first
		UUID environmentPolicyId = harness.createPolicy(null, approverIds, 1);
		UUID globPolicyId = harness.createPolicy("/glob/*", approverIds, 1);
		UUID exactPolicyId = harness.createPolicy("/exact", approverIds, 1);

		Assertions.assertEquals(exactPolicyId, resolve(harness, approvalPolicyService, "/exact"), "Exact path should win");
		Assertions.assertEquals(exactPolicyId, resolve(harness, approvalPolicyService, "/exact/"), "Trailing slash should still match exactly");
		Assertions.assertEquals(globPolicyId, resolve(harness, approvalPolicyService, "/glob/anything"), "Glob should beat environment-wide policy");
		Assertions.assertEquals(environmentPolicyId, resolve(harness, approvalPolicyService, "/unmatched"), "Environment-wide policy is the fallback");
		Assertions.assertEquals(environmentPolicyId, resolve(harness, approvalPolicyService, "/glob/anything/deeper"), "Single star must not cross segments");

		Assertions.assertTrue(approvalPolicyService.resolvePolicy(harness.getProjectId(), "prod", "/exact").isEmpty(),
				"Policies from other environments must not apply");
	}

	@Test
	public void testTiesKeepCreationOrder() {
		TestHarness harness = new TestHarness();
		ApprovalPolicyService approvalPolicyService = harness.getInstance(ApprovalPolicyService.class);
		Set<UUID> approverIds = Set.of(UUID.randomUUID());

		UUID firstPolicyId = harness.createPolicy("/app/*", approverIds, 1);
		harness.createPolicy("/app/**", approverIds, 1);

		Assertions.assertEquals(firstPolicyId, resolve(harness, approvalPolicyService, "/app/db"), "Earliest glob should win a tie");
	}

	@Test
	public void testRequiredApprovalsCannotExceedApprovers() {
		TestHarness harness = new TestHarness();
		ApprovalPolicyService approvalPolicyService = harness.getInstance(ApprovalPolicyService.class);

		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () ->
				harness.callAs(harness.getAdmin(), () -> approvalPolicyService.createPolicy(new ApprovalPolicyCreateRequest(
						harness.getProjectId(), ENVIRONMENT, "/app", "Too strict", Set.of(UUID.randomUUID(), UUID.randomUUID()), 3))));

		Assertions.assertEquals(422, e.getStatusCode().intValue(), "Bad status code");
		Assertions.assertTrue(e.getFieldErrors().containsKey("requiredApprovals"), "Missing 'requiredApprovals' field error");

		e = Assertions.assertThrows(ApplicationException.class, () ->
				harness.callAs(harness.getAdmin(), () -> approvalPolicyService.createPolicy(new ApprovalPolicyCreateRequest(
						harness.getProjectId(), ENVIRONMENT, "/app", "No approvers", Set.of(), 1))));

		Assertions.assertTrue(e.getFieldErrors().containsKey("approverIds"), "Missing 'approverIds' field error");

		e = Assertions.assertThrows(ApplicationException.class, () ->
				harness.callAs(harness.getAdmin(), () -> approvalPolicyService.createPolicy(new ApprovalPolicyCreateRequest(
						harness.getProjectId(), ENVIRONMENT, "/app", "Zero approvals", Set.of(UUID.randomUUID()), 0))));

		Assertions.assertTrue(e.getFieldErrors().containsKey("requiredApprovals"), "Missing 'requiredApprovals' field error");
		Assertions.assertTrue(approvalPolicyService.findPolicies(harness.getProjectId(), ENVIRONMENT).isEmpty(), "No policy should exist");
	}

	@Test
	public void testUpdatePolicy() {
		TestHarness harness = new TestHarness();
		ApprovalPolicyService approvalPolicyService = harness.getInstance(ApprovalPolicyService.class);
		UUID firstApproverId = UUID.randomUUID();
		UUID secondApproverId = UUID.randomUUID();

		UUID approvalPolicyId = harness.createPolicy("/app", Set.of(firstApproverId, secondApproverId), 2);

		// Shrinking the approver set below the quorum is rejected
		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () ->
				harness.callAs(harness.getAdmin(), () -> approvalPolicyService.updatePolicy(
						new ApprovalPolicyUpdateRequest(approvalPolicyId, null, null, Set.of(firstApproverId), null))));

		Assertions.assertEquals(422, e.getStatusCode().intValue(), "Bad status code");

		Boolean updated = harness.callAs(harness.getAdmin(), () -> approvalPolicyService.updatePolicy(
				new ApprovalPolicyUpdateRequest(approvalPolicyId, "", "Everything", Set.of(secondApproverId), 1)));

		Assertions.assertTrue(updated, "Policy should have been updated");

		ApprovalPolicy approvalPolicy = approvalPolicyService.findPolicyById(approvalPolicyId).get();

		Assertions.assertNull(approvalPolicy.secretPath(), "Blank path should widen the policy to the environment");
		Assertions.assertEquals("Everything", approvalPolicy.name());
		Assertions.assertEquals(1, approvalPolicy.requiredApprovals().intValue());
		Assertions.assertEquals(Set.of(secondApproverId), approvalPolicyService.findApproverIdsByPolicyId(approvalPolicyId),
				"Approvers should have been replaced");
	}

	@Test
	public void testOnlyAdministratorsManagePolicies() {
		TestHarness harness = new TestHarness();
		ApprovalPolicyService approvalPolicyService = harness.getInstance(ApprovalPolicyService.class);
		Actor member = harness.member();

		Assertions.assertThrows(AuthorizationException.class, () ->
				harness.callAs(member, () -> approvalPolicyService.createPolicy(new ApprovalPolicyCreateRequest(
						harness.getProjectId(), ENVIRONMENT, null, "Sneaky", Set.of(member.actorId()), 1))));

		UUID approvalPolicyId = harness.createPolicy(null, Set.of(member.actorId()), 1);

		Assertions.assertThrows(AuthorizationException.class, () ->
				harness.callAs(member, () -> approvalPolicyService.deletePolicy(approvalPolicyId)));

		Boolean deleted = harness.callAs(harness.getAdmin(), () -> approvalPolicyService.deletePolicy(approvalPolicyId));

		Assertions.assertTrue(deleted, "Admin should be able to delete the policy");
		Assertions.assertTrue(approvalPolicyService.findPolicyById(approvalPolicyId).isEmpty(), "Policy should be gone");
		Assertions.assertTrue(approvalPolicyService.findApproverIdsByPolicyId(approvalPolicyId).isEmpty(), "Approvers should cascade");
	}

	private UUID resolve(TestHarness harness,
											 ApprovalPolicyService approvalPolicyService,
											 String secretPath) {
		return approvalPolicyService.resolvePolicy(harness.getProjectId(), ENVIRONMENT, secretPath)
				.map(ApprovalPolicy::approvalPolicyId)
				.orElse(null);
	}
}
