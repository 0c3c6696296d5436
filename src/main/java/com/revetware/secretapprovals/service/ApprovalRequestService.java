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
import com.revetware.secretapprovals.exception.ApplicationException.ErrorCollector;
import com.revetware.secretapprovals.exception.AuthorizationException;
import com.revetware.secretapprovals.model.ApprovalCommitDraft;
import com.revetware.secretapprovals.model.SecretScope;
import com.revetware.secretapprovals.model.api.request.ApprovalRequestCreateRequest;
import com.revetware.secretapprovals.model.api.request.ApprovalRequestListRequest;
import com.revetware.secretapprovals.model.api.request.ApprovalRequestListRequest.SortDirection;
import com.revetware.secretapprovals.model.api.request.EncryptedSecretFields;
import com.revetware.secretapprovals.model.api.response.ApprovalRequestCount;
import com.revetware.secretapprovals.model.api.response.ApprovalRequestDetails;
import com.revetware.secretapprovals.model.api.response.GoverningPolicy;
import com.revetware.secretapprovals.model.auth.Actor;
import com.revetware.secretapprovals.model.auth.Actor.ActorType;
import com.revetware.secretapprovals.model.auth.ProjectPermission;
import com.revetware.secretapprovals.model.db.ApprovalCommit;
import com.revetware.secretapprovals.model.db.ApprovalPolicy;
import com.revetware.secretapprovals.model.db.ApprovalRequest;
import com.revetware.secretapprovals.model.db.ApprovalRequest.ApprovalRequestStatus;
import com.revetware.secretapprovals.model.db.ApprovalReview;
import com.revetware.secretapprovals.util.AuditEventRecorder;
import com.revetware.secretapprovals.util.AuditLogger.AuditEvent;
import com.revetware.secretapprovals.util.AuditLogger.AuditEventType;
import com.revetware.secretapprovals.util.TransactionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static com.revetware.secretapprovals.util.Normalizer.normalizeEnvironment;
import static com.revetware.secretapprovals.util.Normalizer.normalizeSecretPath;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Persists approval requests and answers questions about them.
 * <p>
 * Every request carries a snapshot of its governing policy's approvers and required approval count. In
 * {@link ApprovalRequestMode#UPSERT} mode a committer has at most one open request per environment, and resubmitting
 * replaces its contents.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ApprovalRequestService {
	@Nonnull
	private static final String SLUG_ALPHABET;
	private static final int SLUG_LENGTH;
	@Nonnull
	private static final SecureRandom SECURE_RANDOM;

	static {
		SLUG_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
		SLUG_LENGTH = 8;
		SECURE_RANDOM = new SecureRandom();
	}

	@Nonnull
	private final Provider<CurrentContext> currentContextProvider;
	@Nonnull
	private final Configuration configuration;
	@Nonnull
	private final ApprovalPolicyService approvalPolicyService;
	@Nonnull
	private final ApprovalCommitService approvalCommitService;
	@Nonnull
	private final SecretFolderService secretFolderService;
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
	public ApprovalRequestService(@Nonnull Provider<CurrentContext> currentContextProvider,
																@Nonnull Configuration configuration,
																@Nonnull ApprovalPolicyService approvalPolicyService,
																@Nonnull ApprovalCommitService approvalCommitService,
																@Nonnull SecretFolderService secretFolderService,
																@Nonnull AuditEventRecorder auditEventRecorder,
																@Nonnull TransactionRunner transactionRunner,
																@Nonnull Database database,
																@Nonnull Strings strings) {
		requireNonNull(currentContextProvider);
		requireNonNull(configuration);
		requireNonNull(approvalPolicyService);
		requireNonNull(approvalCommitService);
		requireNonNull(secretFolderService);
		requireNonNull(auditEventRecorder);
		requireNonNull(transactionRunner);
		requireNonNull(database);
		requireNonNull(strings);

		this.currentContextProvider = currentContextProvider;
		this.configuration = configuration;
		this.approvalPolicyService = approvalPolicyService;
		this.approvalCommitService = approvalCommitService;
		this.secretFolderService = secretFolderService;
		this.auditEventRecorder = auditEventRecorder;
		this.transactionRunner = transactionRunner;
		this.database = database;
		this.strings = strings;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@Nonnull
	public Optional<ApprovalRequest> findApprovalRequestById(@Nullable UUID approvalRequestId) {
		if (approvalRequestId == null)
			return Optional.empty();

		return getDatabase().queryForObject("""
				SELECT *
				FROM approval_request
				WHERE approval_request_id=?
				""", ApprovalRequest.class, approvalRequestId);
	}

	@Nonnull
	public Set<UUID> findApproverIdsByApprovalRequestId(@Nullable UUID approvalRequestId) {
		if (approvalRequestId == null)
			return Set.of();

		return new LinkedHashSet<>(getDatabase().queryForList("""
				SELECT approver_id
				FROM approval_request_approver
				WHERE approval_request_id=?
				ORDER BY approver_id
				""", UUID.class, approvalRequestId));
	}

	@Nonnull
	public List<ApprovalCommit> findCommitsByApprovalRequestId(@Nullable UUID approvalRequestId) {
		if (approvalRequestId == null)
			return List.of();

		return getDatabase().queryForList("""
				SELECT *
				FROM approval_commit
				WHERE approval_request_id=?
				ORDER BY commit_order
				""", ApprovalCommit.class, approvalRequestId);
	}

	@Nonnull
	public List<ApprovalReview> findReviewsByApprovalRequestId(@Nullable UUID approvalRequestId) {
		if (approvalRequestId == null)
			return List.of();

		return getDatabase().queryForList("""
				SELECT *
				FROM approval_review
				WHERE approval_request_id=?
				ORDER BY created_at, reviewer_id
				""", ApprovalReview.class, approvalRequestId);
	}

	/**
	 * Validates proposed changes, resolves the governing policy and stores an open approval request for the current actor.
	 */
	@Nonnull
	public ApprovalRequest generateApprovalRequest(@Nonnull ApprovalRequestCreateRequest request) {
		requireNonNull(request);

		UUID projectId = request.projectId();
		String environment = normalizeEnvironment(request.environment()).orElse(null);
		String secretPath = normalizeSecretPath(request.secretPath()).orElse("/");
		ErrorCollector errorCollector = new ErrorCollector();

		if (projectId == null)
			errorCollector.addFieldError("projectId", getStrings().get("Project ID is required."));

		if (environment == null)
			errorCollector.addFieldError("environment", getStrings().get("Environment is required."));

		if (errorCollector.hasErrors())
			throw ApplicationException.invalidFields(errorCollector);

		Actor actor = getCurrentActor();

		if (actor.actorType() == ActorType.SERVICE)
			throw ApplicationException.badRequest(getStrings().get("Cannot use service token."));

		if (!actor.projectId().equals(projectId) || !actor.hasPermission(ProjectPermission.Subject.SECRETS, ProjectPermission.Action.READ))
			throw new AuthorizationException(getStrings().get("You are not authorized to perform this action."), actor.actorId());

		SecretScope scope = new SecretScope(projectId, environment, secretPath);

		ApprovalPolicy approvalPolicy = getApprovalPolicyService().resolvePolicy(projectId, environment, secretPath).orElseThrow(() ->
				ApplicationException.badRequest(getStrings().get("No approval policy governs '{{secretPath}}' in environment '{{environment}}'.",
						Map.of("secretPath", secretPath, "environment", environment))));

		ApprovalRequest approvalRequest = getTransactionRunner().performInTransaction(() -> {
			List<ApprovalCommitDraft> drafts = getApprovalCommitService().buildApprovalCommits(scope, request.changes());
			UUID secretFolderId = getSecretFolderService().findFolderIdByPath(projectId, environment, secretPath).get();

			ApprovalRequest persistedApprovalRequest = getConfiguration().getApprovalRequestMode() == ApprovalRequestMode.UPSERT
					? upsertOpenRequest(scope, secretFolderId, approvalPolicy, actor.actorId(), drafts)
					: createRequest(scope, secretFolderId, approvalPolicy, actor.actorId(), drafts);

			getAuditEventRecorder().recordAfterCommit(new AuditEvent(AuditEventType.SECRET_APPROVAL_REQUEST_CREATED, projectId,
					actor.actorType(), actor.actorId(), Map.of(
					"approvalRequestId", persistedApprovalRequest.approvalRequestId(),
					"approvalPolicyId", approvalPolicy.approvalPolicyId(),
					"environment", environment,
					"secretFolderId", secretFolderId,
					"commitCount", drafts.size()
			), Instant.now()));

			return persistedApprovalRequest;
		});

		getLogger().info("Approval request {} ({}) is open for {} under policy '{}'", approvalRequest.approvalRequestId(),
				approvalRequest.slug(), secretPath, approvalPolicy.name());

		return approvalRequest;
	}

	/**
	 * Reuses the committer's open request in the scope's environment, replacing its commits, policy snapshot and votes,
	 * or creates a new one.
	 */
	@Nonnull
	public ApprovalRequest upsertOpenRequest(@Nonnull SecretScope scope,
																					 @Nonnull UUID secretFolderId,
																					 @Nonnull ApprovalPolicy approvalPolicy,
																					 @Nonnull UUID committerId,
																					 @Nonnull List<ApprovalCommitDraft> drafts) {
		requireNonNull(scope);
		requireNonNull(secretFolderId);
		requireNonNull(approvalPolicy);
		requireNonNull(committerId);
		requireNonNull(drafts);

		return getTransactionRunner().performInTransaction(() -> {
			// Only a request that is still open and unmerged may be rewritten
			long claimedCount = getDatabase().execute("""
					UPDATE approval_request
					SET secret_folder_id=?, approval_policy_id=?, required_approvals=?, updated_at=NOW()
					WHERE project_id=?
					AND environment=?
					AND open_committer_id=?
					AND has_merged=FALSE
					AND status=?
					""", secretFolderId, approvalPolicy.approvalPolicyId(), approvalPolicy.requiredApprovals(),
					scope.projectId(), scope.environment(), committerId, ApprovalRequestStatus.OPEN);

			if (claimedCount == 0)
				return insertApprovalRequest(scope, secretFolderId, approvalPolicy, committerId, committerId, drafts);

			UUID approvalRequestId = getDatabase().queryForObject("""
					SELECT approval_request_id
					FROM approval_request
					WHERE project_id=?
					AND environment=?
					AND open_committer_id=?
					""", UUID.class, scope.projectId(), scope.environment(), committerId).get();

			getLogger().debug("Replacing contents of open approval request {}", approvalRequestId);

			getDatabase().execute("DELETE FROM approval_commit WHERE approval_request_id=?", approvalRequestId);
			getDatabase().execute("DELETE FROM approval_request_approver WHERE approval_request_id=?", approvalRequestId);
			getDatabase().execute("DELETE FROM approval_review WHERE approval_request_id=?", approvalRequestId);

			insertApprovers(approvalRequestId, getApprovalPolicyService().findApproverIdsByPolicyId(approvalPolicy.approvalPolicyId()));
			insertCommits(approvalRequestId, drafts);

			return findApprovalRequestById(approvalRequestId).get();
		});
	}

	/**
	 * Always stores a new open request.
	 */
	@Nonnull
	public ApprovalRequest createRequest(@Nonnull SecretScope scope,
																			 @Nonnull UUID secretFolderId,
																			 @Nonnull ApprovalPolicy approvalPolicy,
																			 @Nonnull UUID committerId,
																			 @Nonnull List<ApprovalCommitDraft> drafts) {
		requireNonNull(scope);
		requireNonNull(secretFolderId);
		requireNonNull(approvalPolicy);
		requireNonNull(committerId);
		requireNonNull(drafts);

		return getTransactionRunner().performInTransaction(() ->
				insertApprovalRequest(scope, secretFolderId, approvalPolicy, committerId, null, drafts));
	}

	@Nonnull
	public ApprovalRequestDetails findApprovalRequestDetails(@Nullable UUID approvalRequestId) {
		ApprovalRequest approvalRequest = findApprovalRequestById(approvalRequestId).orElseThrow(() ->
				ApplicationException.notFound(getStrings().get("Approval request was not found.")));

		Actor actor = getCurrentActor();
		Set<UUID> approverIds = findApproverIdsByApprovalRequestId(approvalRequest.approvalRequestId());

		if (!isParticipant(approvalRequest, approverIds, actor))
			throw new AuthorizationException(getStrings().get("You are not authorized to view this approval request."), actor.actorId());

		String secretPath = getSecretFolderService().findSecretPathByFolderId(approvalRequest.secretFolderId()).orElse("/");
		String policyName = getApprovalPolicyService().findPolicyById(approvalRequest.approvalPolicyId())
				.map(ApprovalPolicy::name)
				.orElse(null);

		return new ApprovalRequestDetails(approvalRequest, approverIds,
				findCommitsByApprovalRequestId(approvalRequest.approvalRequestId()),
				findReviewsByApprovalRequestId(approvalRequest.approvalRequestId()),
				secretPath, policyName);
	}

	/**
	 * Lists requests visible to the current actor. Administrators see everything in the project, others only requests
	 * they committed or are an approver on.
	 */
	@Nonnull
	public List<ApprovalRequest> findApprovalRequests(@Nonnull ApprovalRequestListRequest request) {
		requireNonNull(request);

		UUID projectId = request.projectId();

		if (projectId == null)
			throw ApplicationException.invalidFields(projectIdRequiredErrors());

		Actor actor = getCurrentActor();
		ensureProjectMember(actor, projectId);

		int limit = request.limit() == null || request.limit() < 1 ? getConfiguration().getDefaultPageSize() : request.limit();
		limit = Math.min(limit, getConfiguration().getMaximumPageSize());
		int offset = request.offset() == null || request.offset() < 0 ? 0 : request.offset();
		String sortOrder = request.sortDirection() == SortDirection.ASCENDING ? "ASC" : "DESC";

		StringBuilder sql = new StringBuilder("SELECT * FROM approval_request WHERE project_id=?");
		List<Object> parameters = new ArrayList<>();
		parameters.add(projectId);

		if (request.status() != null) {
			sql.append(" AND status=?");
			parameters.add(request.status());
		}

		String environment = normalizeEnvironment(request.environment()).orElse(null);

		if (environment != null) {
			sql.append(" AND environment=?");
			parameters.add(environment);
		}

		if (request.committerId() != null) {
			sql.append(" AND committer_id=?");
			parameters.add(request.committerId());
		}

		appendVisibilityClause(sql, parameters, actor);

		sql.append(format(" ORDER BY created_at %s, request_sequence %s LIMIT ? OFFSET ?", sortOrder, sortOrder));
		parameters.add(limit);
		parameters.add(offset);

		return getDatabase().queryForList(sql.toString(), ApprovalRequest.class, parameters.toArray());
	}

	/**
	 * For each open request in an environment, the policy it references and the folder path it targets.
	 */
	@Nonnull
	public List<GoverningPolicy> findGoverningPolicies(@Nullable UUID projectId,
																										 @Nullable String environment) {
		String normalizedEnvironment = normalizeEnvironment(environment).orElse(null);

		if (projectId == null || normalizedEnvironment == null)
			return List.of();

		Actor actor = getCurrentActor();
		ensureProjectMember(actor, projectId);

		StringBuilder sql = new StringBuilder("SELECT * FROM approval_request WHERE project_id=? AND environment=? AND status=?");
		List<Object> parameters = new ArrayList<>(List.of(projectId, normalizedEnvironment, ApprovalRequestStatus.OPEN));

		appendVisibilityClause(sql, parameters, actor);
		sql.append(" ORDER BY created_at, request_sequence");

		List<GoverningPolicy> governingPolicies = new ArrayList<>();

		for (ApprovalRequest approvalRequest : getDatabase().queryForList(sql.toString(), ApprovalRequest.class, parameters.toArray()))
			governingPolicies.add(new GoverningPolicy(approvalRequest.approvalRequestId(),
					getApprovalPolicyService().findPolicyById(approvalRequest.approvalPolicyId()).orElse(null),
					getSecretFolderService().findSecretPathByFolderId(approvalRequest.secretFolderId()).orElse("/")));

		return governingPolicies;
	}

	@Nonnull
	public ApprovalRequestCount findApprovalRequestCount(@Nullable UUID projectId) {
		if (projectId == null)
			throw ApplicationException.invalidFields(projectIdRequiredErrors());

		Actor actor = getCurrentActor();
		ensureProjectMember(actor, projectId);

		return new ApprovalRequestCount(countByStatus(projectId, ApprovalRequestStatus.OPEN, actor),
				countByStatus(projectId, ApprovalRequestStatus.CLOSED, actor));
	}

	/**
	 * Administrators, the committer and snapshot approvers may read, review, close, reopen and merge a request.
	 */
	@Nonnull
	public Boolean isParticipant(@Nonnull ApprovalRequest approvalRequest,
															 @Nonnull Set<UUID> approverIds,
															 @Nonnull Actor actor) {
		requireNonNull(approvalRequest);
		requireNonNull(approverIds);
		requireNonNull(actor);

		if (!actor.projectId().equals(approvalRequest.projectId()))
			return false;

		return actor.isAdmin()
				|| actor.actorId().equals(approvalRequest.committerId())
				|| approverIds.contains(actor.actorId());
	}

	@Nonnull
	protected ApprovalRequest insertApprovalRequest(@Nonnull SecretScope scope,
																									@Nonnull UUID secretFolderId,
																									@Nonnull ApprovalPolicy approvalPolicy,
																									@Nonnull UUID committerId,
																									@Nullable UUID openCommitterId,
																									@Nonnull List<ApprovalCommitDraft> drafts) {
		requireNonNull(scope);
		requireNonNull(secretFolderId);
		requireNonNull(approvalPolicy);
		requireNonNull(committerId);
		requireNonNull(drafts);

		UUID approvalRequestId = UUID.randomUUID();

		try {
			getDatabase().execute("""
							INSERT INTO approval_request (
								approval_request_id,
								request_sequence,
								slug,
								project_id,
								environment,
								secret_folder_id,
								approval_policy_id,
								committer_id,
								status,
								open_committer_id,
								required_approvals
							) VALUES (?,NEXT VALUE FOR approval_request_sequence,?,?,?,?,?,?,?,?,?)
							""", approvalRequestId, generateSlug(), scope.projectId(), scope.environment(), secretFolderId,
					approvalPolicy.approvalPolicyId(), committerId, ApprovalRequestStatus.OPEN, openCommitterId,
					approvalPolicy.requiredApprovals());
		} catch (DatabaseException e) {
			if (e.getMessage() != null && e.getMessage().toUpperCase().contains("APPROVAL_REQUEST_OPEN_COMMITTER_UNIQUE_IDX"))
				throw ApplicationException.conflict(getStrings().get("You already have an open approval request in this environment."));

			throw e;
		}

		insertApprovers(approvalRequestId, getApprovalPolicyService().findApproverIdsByPolicyId(approvalPolicy.approvalPolicyId()));
		insertCommits(approvalRequestId, drafts);

		getLogger().debug("Inserted approval request {} with {} commit[s]", approvalRequestId, drafts.size());

		return findApprovalRequestById(approvalRequestId).get();
	}

	protected void insertApprovers(@Nonnull UUID approvalRequestId,
																 @Nonnull Set<UUID> approverIds) {
		requireNonNull(approvalRequestId);
		requireNonNull(approverIds);

		for (UUID approverId : approverIds)
			getDatabase().execute("""
					INSERT INTO approval_request_approver (
						approval_request_id,
						approver_id
					) VALUES (?,?)
					""", approvalRequestId, approverId);
	}

	protected void insertCommits(@Nonnull UUID approvalRequestId,
															 @Nonnull List<ApprovalCommitDraft> drafts) {
		requireNonNull(approvalRequestId);
		requireNonNull(drafts);

		int commitOrder = 0;

		for (ApprovalCommitDraft draft : drafts) {
			EncryptedSecretFields fields = draft.fields();

			getDatabase().execute("""
							INSERT INTO approval_commit (
								approval_commit_id,
								approval_request_id,
								commit_order,
								operation,
								secret_id,
								secret_version_id,
								secret_blind_index,
								version,
								secret_key_ciphertext,
								secret_key_iv,
								secret_key_tag,
								secret_value_ciphertext,
								secret_value_iv,
								secret_value_tag,
								secret_comment_ciphertext,
								secret_comment_iv,
								secret_comment_tag,
								skip_multiline_encoding,
								algorithm,
								key_encoding
							) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
							""", draft.approvalCommitId(), approvalRequestId, commitOrder++, draft.operation(), draft.secretId(),
					draft.secretVersionId(), draft.secretBlindIndex(), draft.version(),
					fields.secretKeyCiphertext(), fields.secretKeyIv(), fields.secretKeyTag(),
					fields.secretValueCiphertext(), fields.secretValueIv(), fields.secretValueTag(),
					fields.secretCommentCiphertext(), fields.secretCommentIv(), fields.secretCommentTag(),
					fields.skipMultilineEncoding(), fields.algorithm(), fields.keyEncoding());
		}
	}

	@Nonnull
	protected Long countByStatus(@Nonnull UUID projectId,
															 @Nonnull ApprovalRequestStatus status,
															 @Nonnull Actor actor) {
		requireNonNull(projectId);
		requireNonNull(status);
		requireNonNull(actor);

		StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM approval_request WHERE project_id=? AND status=?");
		List<Object> parameters = new ArrayList<>(List.of(projectId, status));

		appendVisibilityClause(sql, parameters, actor);

		return getDatabase().queryForObject(sql.toString(), Long.class, parameters.toArray()).orElse(0L);
	}

	protected void appendVisibilityClause(@Nonnull StringBuilder sql,
																				@Nonnull List<Object> parameters,
																				@Nonnull Actor actor) {
		requireNonNull(sql);
		requireNonNull(parameters);
		requireNonNull(actor);

		if (actor.isAdmin())
			return;

		sql.append("""
				 AND (committer_id=? OR EXISTS (
					SELECT 1
					FROM approval_request_approver ara
					WHERE ara.approval_request_id=approval_request.approval_request_id
					AND ara.approver_id=?
				))""");

		parameters.add(actor.actorId());
		parameters.add(actor.actorId());
	}

	protected void ensureProjectMember(@Nonnull Actor actor,
																		 @Nonnull UUID projectId) {
		requireNonNull(actor);
		requireNonNull(projectId);

		if (!actor.projectId().equals(projectId))
			throw new AuthorizationException(getStrings().get("You are not authorized to perform this action."), actor.actorId());
	}

	@Nonnull
	protected Actor getCurrentActor() {
		return getCurrentContext().getActor().orElseThrow(() ->
				new AuthorizationException(getStrings().get("You must be authenticated to perform this action.")));
	}

	@Nonnull
	protected String generateSlug() {
		StringBuilder slug = new StringBuilder(SLUG_LENGTH);

		for (int i = 0; i < SLUG_LENGTH; ++i)
			slug.append(SLUG_ALPHABET.charAt(SECURE_RANDOM.nextInt(SLUG_ALPHABET.length())));

		return slug.toString();
	}

	@Nonnull
	private ErrorCollector projectIdRequiredErrors() {
		ErrorCollector errorCollector = new ErrorCollector();
		errorCollector.addFieldError("projectId", getStrings().get("Project ID is required."));
		return errorCollector;
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
	private ApprovalPolicyService getApprovalPolicyService() {
		return this.approvalPolicyService;
	}

	@Nonnull
	private ApprovalCommitService getApprovalCommitService() {
		return this.approvalCommitService;
	}

	@Nonnull
	private SecretFolderService getSecretFolderService() {
		return this.secretFolderService;
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
