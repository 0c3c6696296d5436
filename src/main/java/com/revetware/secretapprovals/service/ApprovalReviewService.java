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

import com.google.inject.Inject;
import com.google.inject.Provider;
import com.lokalized.Strings;
import com.pyranid.Database;
import com.pyranid.DatabaseException;
import com.revetware.secretapprovals.Configuration;
import com.revetware.secretapprovals.Configuration.ApprovalRequestMode;
import com.revetware.secretapprovals.CurrentContext;
import com.revetware.secretapprovals.exception.ApplicationException;
import com.revetware.secretapprovals.exception.AuthorizationException;
import com.revetware.secretapprovals.model.auth.Actor;
import com.revetware.secretapprovals.model.auth.Actor.ActorType;
import com.revetware.secretapprovals.model.db.ApprovalRequest;
import com.revetware.secretapprovals.model.db.ApprovalRequest.ApprovalRequestStatus;
import com.revetware.secretapprovals.model.db.ApprovalReview;
import com.revetware.secretapprovals.model.db.ApprovalReview.ReviewStatus;
import com.revetware.secretapprovals.util.AuditEventRecorder;
import com.revetware.secretapprovals.util.AuditLogger.AuditEvent;
import com.revetware.secretapprovals.util.AuditLogger.AuditEventType;
import com.revetware.secretapprovals.util.TransactionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Records reviewer votes and explicit open/close transitions of approval requests.
 * <p>
 * Votes never change a request's status; only closing, reopening and merging do.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ApprovalReviewService {
	@Nonnull
	private final Provider<CurrentContext> currentContextProvider;
	@Nonnull
	private final Configuration configuration;
	@Nonnull
	private final ApprovalRequestService approvalRequestService;
	@Nonnull
	private final AuditEventRecorder auditEventRecorder;
	@Nonnull
	private final TransactionRunner transactionRunner;
	@Nonnull
	private final Database database;
	@Nonnull
	private final Strings strings;
	@Nonnull
	private final Logger logger;

	@Inject
	public ApprovalReviewService(@Nonnull Provider<CurrentContext> currentContextProvider,
															 @Nonnull Configuration configuration,
															 @Nonnull ApprovalRequestService approvalRequestService,
															 @Nonnull AuditEventRecorder auditEventRecorder,
															 @Nonnull TransactionRunner transactionRunner,
															 @Nonnull Database database,
															 @Nonnull Strings strings) {
		requireNonNull(currentContextProvider);
		requireNonNull(configuration);
		requireNonNull(approvalRequestService);
		requireNonNull(auditEventRecorder);
		requireNonNull(transactionRunner);
		requireNonNull(database);
		requireNonNull(strings);

		this.currentContextProvider = currentContextProvider;
		this.configuration = configuration;
		this.approvalRequestService = approvalRequestService;
		this.auditEventRecorder = auditEventRecorder;
		this.transactionRunner = transactionRunner;
		this.database = database;
		this.strings = strings;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	/**
	 * Records the current actor's vote, replacing any earlier vote of theirs on the same request.
	 */
	@Nonnull
	public ApprovalReview submitReview(@Nullable UUID approvalRequestId,
																		 @Nullable ReviewStatus status) {
		if (status == null)
			throw ApplicationException.badRequest(getStrings().get("Review status is required."));

		Actor actor = findAuthorizedActor();
		ApprovalRequest approvalRequest = findParticipatingRequest(approvalRequestId, actor);

		getLogger().debug("Member {} votes {} on approval request {}", actor.actorId(), status.name(),
				approvalRequest.approvalRequestId());

		return getTransactionRunner().performInTransaction(() -> {
			// Holds the request row until commit, so a merge cannot claim it between this check and the vote
			long unmergedCount = getDatabase().execute("""
					UPDATE approval_request
					SET updated_at=updated_at
					WHERE approval_request_id=?
					AND has_merged=FALSE
					""", approvalRequest.approvalRequestId());

			if (unmergedCount == 0)
				throw ApplicationException.badRequest(getStrings().get("Approval request has been merged."));

			// Atomic find-or-append keyed on (approval_request_id, reviewer_id)
			getDatabase().execute("""
					MERGE INTO approval_review
					USING (VALUES (CAST(? AS UUID), CAST(? AS UUID), CAST(? AS VARCHAR(32)))) AS vote(approval_request_id, reviewer_id, status)
					ON approval_review.approval_request_id=vote.approval_request_id AND approval_review.reviewer_id=vote.reviewer_id
					WHEN MATCHED THEN UPDATE SET approval_review.status=vote.status, approval_review.updated_at=NOW()
					WHEN NOT MATCHED THEN INSERT (approval_request_id, reviewer_id, status) VALUES (vote.approval_request_id, vote.reviewer_id, vote.status)
					""", approvalRequest.approvalRequestId(), actor.actorId(), status.name());

			return getDatabase().queryForObject("""
					SELECT *
					FROM approval_review
					WHERE approval_request_id=?
					AND reviewer_id=?
					""", ApprovalReview.class, approvalRequest.approvalRequestId(), actor.actorId()).get();
		});
	}

	/**
	 * Closes or reopens a request.
	 */
	@Nonnull
	public ApprovalRequest setRequestStatus(@Nullable UUID approvalRequestId,
																					@Nullable ApprovalRequestStatus status) {
		if (status == null)
			throw ApplicationException.badRequest(getStrings().get("Status is required."));

		Actor actor = findAuthorizedActor();
		ApprovalRequest approvalRequest = findParticipatingRequest(approvalRequestId, actor);

		if (approvalRequest.hasMerged())
			throw ApplicationException.badRequest(getStrings().get("Approval request has been merged."));

		if (approvalRequest.status() == ApprovalRequestStatus.CLOSED && status == ApprovalRequestStatus.CLOSED)
			throw ApplicationException.badRequest(getStrings().get("Approval request is already closed."));

		if (approvalRequest.status() == ApprovalRequestStatus.OPEN && status == ApprovalRequestStatus.OPEN)
			throw ApplicationException.badRequest(getStrings().get("Approval request is already open."));

		// Only upsert-mode requests hold the committer's single open slot
		UUID openCommitterId = status == ApprovalRequestStatus.OPEN
				&& getConfiguration().getApprovalRequestMode() == ApprovalRequestMode.UPSERT ? approvalRequest.committerId() : null;

		ApprovalRequest updatedApprovalRequest = getTransactionRunner().performInTransaction(() -> {
			long updatedCount;

			try {
				updatedCount = getDatabase().execute("""
						UPDATE approval_request
						SET status=?, status_changed_by=?, open_committer_id=?, updated_at=NOW()
						WHERE approval_request_id=?
						AND status=?
						AND has_merged=FALSE
						""", status, actor.actorId(), openCommitterId, approvalRequest.approvalRequestId(), approvalRequest.status());
			} catch (DatabaseException e) {
				if (e.getMessage() != null && e.getMessage().toUpperCase().contains("APPROVAL_REQUEST_OPEN_COMMITTER_UNIQUE_IDX"))
					throw ApplicationException.conflict(getStrings().get("The committer already has an open approval request in this environment."));

				throw e;
			}

			if (updatedCount == 0)
				throw ApplicationException.conflict(getStrings().get("Approval request was modified concurrently."));

			getAuditEventRecorder().recordAfterCommit(new AuditEvent(
					status == ApprovalRequestStatus.CLOSED ? AuditEventType.SECRET_APPROVAL_CLOSED : AuditEventType.SECRET_APPROVAL_REOPENED,
					approvalRequest.projectId(), actor.actorType(), actor.actorId(),
					Map.of("approvalRequestId", approvalRequest.approvalRequestId(), "status", status.name()), Instant.now()));

			return getApprovalRequestService().findApprovalRequestById(approvalRequest.approvalRequestId()).get();
		});

		getLogger().info("Approval request {} is now {}", approvalRequest.approvalRequestId(), status.name());

		return updatedApprovalRequest;
	}

	@Nonnull
	protected Actor findAuthorizedActor() {
		Actor actor = getCurrentContext().getActor().orElseThrow(() ->
				new AuthorizationException(getStrings().get("You must be authenticated to perform this action.")));

		if (actor.actorType() != ActorType.USER)
			throw ApplicationException.badRequest(getStrings().get("Must be a user."));

		return actor;
	}

	@Nonnull
	protected ApprovalRequest findParticipatingRequest(@Nullable UUID approvalRequestId,
																										 @Nonnull Actor actor) {
		requireNonNull(actor);

		ApprovalRequest approvalRequest = getApprovalRequestService().findApprovalRequestById(approvalRequestId).orElseThrow(() ->
				ApplicationException.notFound(getStrings().get("Approval request was not found.")));

		if (!getApprovalRequestService().isParticipant(approvalRequest,
				getApprovalRequestService().findApproverIdsByApprovalRequestId(approvalRequest.approvalRequestId()), actor))
			throw new AuthorizationException(getStrings().get("You are not authorized to review this approval request."), actor.actorId());

		return approvalRequest;
	}

	@Nonnull
	private CurrentContext getCurrentContext() {
		return this.currentContextProvider.get();
	}

	@Nonnull
	private Configuration getConfiguration() {
		return this.configuration;
	}

	@Nonnull
	private ApprovalRequestService getApprovalRequestService() {
		return this.approvalRequestService;
	}

	@Nonnull
	private AuditEventRecorder getAuditEventRecorder() {
		return this.auditEventRecorder;
	}

	@Nonnull
	private TransactionRunner getTransactionRunner() {
		return this.transactionRunner;
	}

	@Nonnull
	private Database getDatabase() {
		return this.database;
	}

	@Nonnull
	private Strings getStrings() {
		return this.strings;
	}

	@Nonnull
	private Logger getLogger() {
		return this.logger;
	}
}
