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
import com.revetware.secretapprovals.CurrentContext;
import com.revetware.secretapprovals.exception.ApplicationException;
import com.revetware.secretapprovals.exception.AuthorizationException;
import com.revetware.secretapprovals.model.api.request.EncryptedSecretFields;
import com.revetware.secretapprovals.model.auth.Actor;
import com.revetware.secretapprovals.model.auth.Actor.ActorType;
import com.revetware.secretapprovals.model.db.ApprovalCommit;
import com.revetware.secretapprovals.model.db.ApprovalRequest;
import com.revetware.secretapprovals.model.db.ApprovalRequest.ApprovalRequestStatus;
import com.revetware.secretapprovals.model.db.ApprovalReview;
import com.revetware.secretapprovals.model.db.ApprovalReview.ReviewStatus;
import com.revetware.secretapprovals.model.db.Secret;
import com.revetware.secretapprovals.model.db.Secret.SecretType;
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
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Applies an approved request's commits to the live secrets.
 * <p>
 * A merge either applies every commit and closes the request, or changes nothing. The request row is claimed by the
 * first statement of the merge transaction, so at most one of several concurrent merges of the same request succeeds.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ApprovalMergeService {
	@Nonnull
	private final Provider<CurrentContext> currentContextProvider;
	@Nonnull
	private final ApprovalRequestService approvalRequestService;
	@Nonnull
	private final SecretService secretService;
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
	public ApprovalMergeService(@Nonnull Provider<CurrentContext> currentContextProvider,
															@Nonnull ApprovalRequestService approvalRequestService,
															@Nonnull SecretService secretService,
															@Nonnull AuditEventRecorder auditEventRecorder,
															@Nonnull TransactionRunner transactionRunner,
															@Nonnull Database database,
															@Nonnull Strings strings) {
		requireNonNull(currentContextProvider);
		requireNonNull(approvalRequestService);
		requireNonNull(secretService);
		requireNonNull(auditEventRecorder);
		requireNonNull(transactionRunner);
		requireNonNull(database);
		requireNonNull(strings);

		this.currentContextProvider = currentContextProvider;
		this.approvalRequestService = approvalRequestService;
		this.secretService = secretService;
		this.auditEventRecorder = auditEventRecorder;
		this.transactionRunner = transactionRunner;
		this.database = database;
		this.strings = strings;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@Nonnull
	public ApprovalRequest merge(@Nullable UUID approvalRequestId) {
		ApprovalRequest approvalRequest = getApprovalRequestService().findApprovalRequestById(approvalRequestId).orElseThrow(() ->
				ApplicationException.notFound(getStrings().get("Approval request was not found.")));

		Actor actor = getCurrentContext().getActor().orElseThrow(() ->
				new AuthorizationException(getStrings().get("You must be authenticated to perform this action.")));

		if (actor.actorType() != ActorType.USER)
			throw ApplicationException.badRequest(getStrings().get("Must be a user."));

		Set<UUID> approverIds = getApprovalRequestService().findApproverIdsByApprovalRequestId(approvalRequest.approvalRequestId());

		if (!getApprovalRequestService().isParticipant(approvalRequest, approverIds, actor))
			throw new AuthorizationException(getStrings().get("You are not authorized to merge this approval request."), actor.actorId());

		if (approvalRequest.hasMerged())
			throw ApplicationException.conflict(getStrings().get("Approval request has already been merged."));

		if (approvalRequest.status() == ApprovalRequestStatus.CLOSED)
			throw ApplicationException.badRequest(getStrings().get("Approval request is closed."));

		ensureQuorum(approvalRequest, approverIds);

		getLogger().info("Merging approval request {} ({})", approvalRequest.approvalRequestId(), approvalRequest.slug());

		ApprovalRequest mergedApprovalRequest = getTransactionRunner().performInTransaction(() -> {
			claimApprovalRequest(approvalRequest, actor);

			// Votes may have changed since the check above
			ensureQuorum(approvalRequest, approverIds);

			List<ApprovalCommit> commits = getApprovalRequestService().findCommitsByApprovalRequestId(approvalRequest.approvalRequestId());

			for (ApprovalCommit commit : commits)
				applyCommit(approvalRequest, commit);

			getAuditEventRecorder().recordAfterCommit(new AuditEvent(AuditEventType.SECRET_APPROVAL_MERGED,
					approvalRequest.projectId(), actor.actorType(), actor.actorId(), Map.of(
					"approvalRequestId", approvalRequest.approvalRequestId(),
					"environment", approvalRequest.environment(),
					"secretFolderId", approvalRequest.secretFolderId(),
					"commitCount", commits.size()
			), Instant.now()));

			return getApprovalRequestService().findApprovalRequestById(approvalRequest.approvalRequestId()).get();
		});

		getLogger().info("Merged approval request {}", approvalRequest.approvalRequestId());

		return mergedApprovalRequest;
	}

	/**
	 * Counts approvals from the request's snapshot approvers. Votes from anyone else never count.
	 */
	@Nonnull
	public Long countApprovals(@Nonnull UUID approvalRequestId,
														 @Nonnull Set<UUID> approverIds) {
		requireNonNull(approvalRequestId);
		requireNonNull(approverIds);

		return getApprovalRequestService().findReviewsByApprovalRequestId(approvalRequestId).stream()
				.filter(review -> review.status() == ReviewStatus.APPROVED)
				.map(ApprovalReview::reviewerId)
				.filter(approverIds::contains)
				.distinct()
				.count();
	}

	protected void ensureQuorum(@Nonnull ApprovalRequest approvalRequest,
															@Nonnull Set<UUID> approverIds) {
		requireNonNull(approvalRequest);
		requireNonNull(approverIds);

		long approvalCount = countApprovals(approvalRequest.approvalRequestId(), approverIds);

		if (approvalCount < approvalRequest.requiredApprovals())
			throw ApplicationException.badRequest(getStrings().get("Doesn't have minimum approvals needed."));
	}

	protected void claimApprovalRequest(@Nonnull ApprovalRequest approvalRequest,
																			@Nonnull Actor actor) {
		requireNonNull(approvalRequest);
		requireNonNull(actor);

		long claimedCount = getDatabase().execute("""
				UPDATE approval_request
				SET has_merged=TRUE, status=?, status_changed_by=?, open_committer_id=NULL, updated_at=NOW()
				WHERE approval_request_id=?
				AND has_merged=FALSE
				AND status=?
				""", ApprovalRequestStatus.CLOSED, actor.actorId(), approvalRequest.approvalRequestId(), ApprovalRequestStatus.OPEN);

		if (claimedCount > 0)
			return;

		ApprovalRequest currentApprovalRequest = getApprovalRequestService().findApprovalRequestById(approvalRequest.approvalRequestId()).orElseThrow(() ->
				ApplicationException.notFound(getStrings().get("Approval request was not found.")));

		if (currentApprovalRequest.hasMerged())
			throw ApplicationException.conflict(getStrings().get("Approval request has already been merged."));

		throw ApplicationException.badRequest(getStrings().get("Approval request is closed."));
	}

	protected void applyCommit(@Nonnull ApprovalRequest approvalRequest,
														 @Nonnull ApprovalCommit commit) {
		requireNonNull(approvalRequest);
		requireNonNull(commit);

		switch (commit.operation()) {
			case CREATE -> {
				if (getSecretService().findSecretsByBlindIndexes(approvalRequest.projectId(), approvalRequest.environment(),
						approvalRequest.secretFolderId(), SecretType.SHARED, Set.of(commit.secretBlindIndex())).size() > 0)
					throw ApplicationException.conflict(getStrings().get("Secrets already exist."));

				getSecretService().insertSecret(approvalRequest.projectId(), approvalRequest.environment(),
						approvalRequest.secretFolderId(), SecretType.SHARED, commit.secretBlindIndex(), toEncryptedSecretFields(commit));
			}
			case UPDATE -> {
				Secret secret = getSecretService().findSecretById(commit.secretId()).orElseThrow(() ->
						ApplicationException.notFound(getStrings().get("Secret to update was not found.")));

				boolean renaming = !secret.blindIndex().equals(commit.secretBlindIndex());

				if (renaming && getSecretService().findSecretsByBlindIndexes(secret.projectId(), secret.environment(),
						secret.secretFolderId(), null, Set.of(commit.secretBlindIndex())).size() > 0)
					throw ApplicationException.conflict(getStrings().get("Secret with new name already exist."));

				getSecretService().updateSecret(secret, commit.secretBlindIndex(), toEncryptedSecretFields(commit));
			}
			case DELETE -> {
				Secret secret = getSecretService().findSecretById(commit.secretId()).orElseThrow(() ->
						ApplicationException.notFound(getStrings().get("Deleted secrets not found.")));

				getSecretService().deleteSecret(secret);
			}
			default -> throw new IllegalStateException("Unexpected commit operation " + commit.operation().name());
		}
	}

	@Nonnull
	protected EncryptedSecretFields toEncryptedSecretFields(@Nonnull ApprovalCommit commit) {
		requireNonNull(commit);

		return new EncryptedSecretFields(commit.secretKeyCiphertext(), commit.secretKeyIv(), commit.secretKeyTag(),
				commit.secretValueCiphertext(), commit.secretValueIv(), commit.secretValueTag(),
				commit.secretCommentCiphertext(), commit.secretCommentIv(), commit.secretCommentTag(),
				commit.skipMultilineEncoding(), commit.algorithm(), commit.keyEncoding());
	}

	@Nonnull
	private CurrentContext getCurrentContext() {
		return this.currentContextProvider.get();
	}

	@Nonnull
	private ApprovalRequestService getApprovalRequestService() {
		return this.approvalRequestService;
	}

	@Nonnull
	private SecretService getSecretService() {
		return this.secretService;
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
