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
import com.revetware.secretapprovals.mock.MockAuditLogger;
import com.revetware.secretapprovals.model.auth.Actor;
import com.revetware.secretapprovals.model.db.ApprovalRequest;
import com.revetware.secretapprovals.model.db.ApprovalRequest.ApprovalRequestStatus;
import com.revetware.secretapprovals.model.db.ApprovalReview;
import com.revetware.secretapprovals.model.db.ApprovalReview.ReviewStatus;
import com.revetware.secretapprovals.util.AuditLogger;
import com.revetware.secretapprovals.util.AuditLogger.AuditEvent;
import com.revetware.secretapprovals.util.AuditLogger.AuditEventType;
import com.revetware.secretapprovals.util.TransactionRunner;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.revetware.secretapprovals.TestHarness.creates;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ApprovalReviewServiceTests {
	@Test
	public void testVoteIsReplacedInPlace() {
		TestHarness harness = new TestHarness();
		ApprovalRequestService approvalRequestService = harness.getInstance(ApprovalRequestService.class);
		Actor approver = harness.member();

		harness.createPolicy(null, Set.of(approver.actorId()), 1);
		ApprovalRequest approvalRequest = harness.requestChanges(harness.member(), creates("API_KEY"));

		harness.vote(approver, approvalRequest, ReviewStatus.APPROVED);
		harness.vote(approver, approvalRequest, ReviewStatus.REJECTED);

		List<ApprovalReview> reviews = approvalRequestService.findReviewsByApprovalRequestId(approvalRequest.approvalRequestId());

		Assertions.assertEquals(1, reviews.size(), "A reviewer should only ever have one vote");
		Assertions.assertEquals(ReviewStatus.REJECTED, reviews.get(0).status(), "Latest vote should win");
		Assertions.assertEquals(ApprovalRequestStatus.OPEN,
				approvalRequestService.findApprovalRequestById(approvalRequest.approvalRequestId()).get().status(),
				"Votes must not change request status");
	}

	@Test
	public void testConcurrentVotesAreNotLost() throws Exception {
		TestHarness harness = new TestHarness();
		ApprovalRequestService approvalRequestService = harness.getInstance(ApprovalRequestService.class);
		Actor firstApprover = harness.member();
		Actor secondApprover = harness.member();

		harness.createPolicy(null, Set.of(firstApprover.actorId(), secondApprover.actorId()), 2);
		ApprovalRequest approvalRequest = harness.requestChanges(harness.member(), creates("API_KEY"));

		ExecutorService executorService = Executors.newFixedThreadPool(2);
		CountDownLatch startLatch = new CountDownLatch(1);

		try {
			List<Future<?>> futures = List.of(
					executorService.submit(() -> {
						startLatch.await();
						harness.vote(firstApprover, approvalRequest, ReviewStatus.APPROVED);
						return null;
					}),
					executorService.submit(() -> {
						startLatch.await();
						harness.vote(secondApprover, approvalRequest, ReviewStatus.APPROVED);
						return null;
					}));

			startLatch.countDown();

			for (Future<?> future : futures)
				future.get(30, TimeUnit.SECONDS);
		} finally {
			executorService.shutdownNow();
		}

		Assertions.assertEquals(2, approvalRequestService.findReviewsByApprovalRequestId(approvalRequest.approvalRequestId()).size(),
				"Both concurrent votes should have been recorded");
	}

	@Test
	public void testVoteWaitsForInFlightMerge() throws Exception {
		TestHarness harness = new TestHarness();
		ApprovalRequestService approvalRequestService = harness.getInstance(ApprovalRequestService.class);
		TransactionRunner transactionRunner = harness.getInstance(TransactionRunner.class);
		Actor approver = harness.member();

		harness.createPolicy(null, Set.of(approver.actorId()), 1);
		ApprovalRequest approvalRequest = harness.requestChanges(harness.member(), creates("API_KEY"));

		ExecutorService executorService = Executors.newSingleThreadExecutor();
		CountDownLatch claimedLatch = new CountDownLatch(1);

		try {
			// Stand-in for a merge that has claimed the request but not yet committed
			Future<?> merge = executorService.submit(() -> transactionRunner.performInTransaction(() -> {
				harness.getDatabase().execute("""
						UPDATE approval_request
						SET has_merged=TRUE, status='CLOSED'
						WHERE approval_request_id=?
						""", approvalRequest.approvalRequestId());

				claimedLatch.countDown();

				try {
					Thread.sleep(250L);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					throw new IllegalStateException(e);
				}
			}));

			Assertions.assertTrue(claimedLatch.await(30, TimeUnit.SECONDS), "Merge never claimed the request");

			ApplicationException e = Assertions.assertThrows(ApplicationException.class, () ->
					harness.vote(approver, approvalRequest, ReviewStatus.APPROVED));
			Assertions.assertEquals(400, e.getStatusCode().intValue(), "Vote should see the merge once it commits");

			merge.get(30, TimeUnit.SECONDS);
		} finally {
			executorService.shutdownNow();
		}

		Assertions.assertEquals(0, approvalRequestService.findReviewsByApprovalRequestId(approvalRequest.approvalRequestId()).size(),
				"No vote should have been recorded on a merged request");
	}

	@Test
	public void testOnlyParticipatingUsersMayVote() {
		TestHarness harness = new TestHarness();
		ApprovalReviewService approvalReviewService = harness.getInstance(ApprovalReviewService.class);
		Actor approver = harness.member();

		harness.createPolicy(null, Set.of(approver.actorId()), 1);
		ApprovalRequest approvalRequest = harness.requestChanges(harness.member(), creates("API_KEY"));

		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () ->
				harness.vote(harness.serviceToken(), approvalRequest, ReviewStatus.APPROVED));
		Assertions.assertEquals(400, e.getStatusCode().intValue(), "Service tokens cannot vote");

		Assertions.assertThrows(AuthorizationException.class, () ->
				harness.vote(harness.member(), approvalRequest, ReviewStatus.APPROVED));

		e = Assertions.assertThrows(ApplicationException.class, () ->
				harness.callAs(approver, () -> approvalReviewService.submitReview(approvalRequest.approvalRequestId(), null)));
		Assertions.assertEquals(400, e.getStatusCode().intValue(), "Missing status should be rejected");
	}

	@Test
	public void testStatusTransitions() {
		TestHarness harness = new TestHarness();
		ApprovalReviewService approvalReviewService = harness.getInstance(ApprovalReviewService.class);
		Actor approver = harness.member();

		harness.createPolicy(null, Set.of(approver.actorId()), 1);
		ApprovalRequest approvalRequest = harness.requestChanges(harness.member(), creates("API_KEY"));

		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () ->
				harness.callAs(approver, () -> approvalReviewService.setRequestStatus(approvalRequest.approvalRequestId(), ApprovalRequestStatus.OPEN)));
		Assertions.assertEquals(400, e.getStatusCode().intValue(), "Opening an open request should fail");

		ApprovalRequest closedApprovalRequest = harness.callAs(approver, () ->
				approvalReviewService.setRequestStatus(approvalRequest.approvalRequestId(), ApprovalRequestStatus.CLOSED));

		Assertions.assertEquals(ApprovalRequestStatus.CLOSED, closedApprovalRequest.status());
		Assertions.assertEquals(approver.actorId(), closedApprovalRequest.statusChangedBy());
		Assertions.assertNull(closedApprovalRequest.openCommitterId(), "Closed requests should release the open slot");

		e = Assertions.assertThrows(ApplicationException.class, () ->
				harness.callAs(approver, () -> approvalReviewService.setRequestStatus(approvalRequest.approvalRequestId(), ApprovalRequestStatus.CLOSED)));
		Assertions.assertEquals(400, e.getStatusCode().intValue(), "Closing a closed request should fail");

		ApprovalRequest reopenedApprovalRequest = harness.callAs(harness.getAdmin(), () ->
				approvalReviewService.setRequestStatus(approvalRequest.approvalRequestId(), ApprovalRequestStatus.OPEN));

		Assertions.assertEquals(ApprovalRequestStatus.OPEN, reopenedApprovalRequest.status());
		Assertions.assertEquals(harness.getAdmin().actorId(), reopenedApprovalRequest.statusChangedBy());

		MockAuditLogger auditLogger = (MockAuditLogger) harness.getInstance(AuditLogger.class);
		List<AuditEventType> eventTypes = auditLogger.getRecordedEvents().stream().map(AuditEvent::eventType).toList();

		Assertions.assertTrue(eventTypes.contains(AuditEventType.SECRET_APPROVAL_CLOSED), "Close should have been audited");
		Assertions.assertTrue(eventTypes.contains(AuditEventType.SECRET_APPROVAL_REOPENED), "Reopen should have been audited");
	}

	@Test
	public void testReopenCannotShadowNewerOpenRequest() {
		TestHarness harness = new TestHarness();
		ApprovalReviewService approvalReviewService = harness.getInstance(ApprovalReviewService.class);
		Actor committer = harness.member();

		harness.createPolicy(null, Set.of(harness.member().actorId()), 1);

		ApprovalRequest firstApprovalRequest = harness.requestChanges(committer, creates("FIRST"));

		harness.runAs(committer, () ->
				approvalReviewService.setRequestStatus(firstApprovalRequest.approvalRequestId(), ApprovalRequestStatus.CLOSED));

		ApprovalRequest secondApprovalRequest = harness.requestChanges(committer, creates("SECOND"));

		Assertions.assertNotEquals(firstApprovalRequest.approvalRequestId(), secondApprovalRequest.approvalRequestId(),
				"Closed request should not be reused");

		ApplicationException e = Assertions.assertThrows(ApplicationException.class, () ->
				harness.callAs(committer, () -> approvalReviewService.setRequestStatus(firstApprovalRequest.approvalRequestId(), ApprovalRequestStatus.OPEN)));

		Assertions.assertEquals(409, e.getStatusCode().intValue(), "Committer may only have one open request");
	}
}
