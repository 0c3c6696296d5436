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
import com.revetware.secretapprovals.exception.ApplicationException.ErrorCollector;
import com.revetware.secretapprovals.exception.AuthorizationException;
import com.revetware.secretapprovals.model.api.request.ApprovalPolicyCreateRequest;
import com.revetware.secretapprovals.model.api.request.ApprovalPolicyUpdateRequest;
import com.revetware.secretapprovals.model.auth.Actor;
import com.revetware.secretapprovals.model.db.ApprovalPolicy;
import com.revetware.secretapprovals.util.GlobMatcher;
import com.revetware.secretapprovals.util.TransactionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.revetware.secretapprovals.util.Normalizer.normalizeEnvironment;
import static com.revetware.secretapprovals.util.Normalizer.normalizeSecretPath;
import static com.revetware.secretapprovals.util.Normalizer.trimAggressivelyToNull;
import static com.revetware.secretapprovals.util.Validator.isValidEnvironment;
import static java.util.Objects.requireNonNull;

/**
 * Administers approval policies and resolves which one governs a secret path.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ApprovalPolicyService {
	@Nonnull
	private final Provider<CurrentContext> currentContextProvider;
	@Nonnull
	private final TransactionRunner transactionRunner;
	@Nonnull
	private final Database database;
	@Nonnull
	private final Strings strings;
	@Nonnull
	private final Logger logger;

	@Inject
	public ApprovalPolicyService(@Nonnull Provider<CurrentContext> currentContextProvider,
															 @Nonnull TransactionRunner transactionRunner,
															 @Nonnull Database database,
															 @Nonnull Strings strings) {
		requireNonNull(currentContextProvider);
		requireNonNull(transactionRunner);
		requireNonNull(database);
		requireNonNull(strings);

		this.currentContextProvider = currentContextProvider;
		this.transactionRunner = transactionRunner;
		this.database = database;
		this.strings = strings;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@Nonnull
	public Optional<ApprovalPolicy> findPolicyById(@Nullable UUID approvalPolicyId) {
		if (approvalPolicyId == null)
			return Optional.empty();

		return getDatabase().queryForObject("""
				SELECT *
				FROM approval_policy
				WHERE approval_policy_id=?
				""", ApprovalPolicy.class, approvalPolicyId);
	}

	/**
	 * Policies in creation order, optionally narrowed to a single environment.
	 */
	@Nonnull
	public List<ApprovalPolicy> findPolicies(@Nullable UUID projectId,
																					 @Nullable String environment) {
		if (projectId == null)
			return List.of();

		String normalizedEnvironment = normalizeEnvironment(environment).orElse(null);

		if (normalizedEnvironment == null)
			return getDatabase().queryForList("""
					SELECT *
					FROM approval_policy
					WHERE project_id=?
					ORDER BY creation_sequence
					""", ApprovalPolicy.class, projectId);

		return getDatabase().queryForList("""
				SELECT *
				FROM approval_policy
				WHERE project_id=?
				AND environment=?
				ORDER BY creation_sequence
				""", ApprovalPolicy.class, projectId, normalizedEnvironment);
	}

	@Nonnull
	public Set<UUID> findApproverIdsByPolicyId(@Nullable UUID approvalPolicyId) {
		if (approvalPolicyId == null)
			return Set.of();

		List<UUID> approverIds = getDatabase().queryForList("""
				SELECT approver_id
				FROM approval_policy_approver
				WHERE approval_policy_id=?
				ORDER BY approver_id
				""", UUID.class, approvalPolicyId);

		return new LinkedHashSet<>(approverIds);
	}

	/**
	 * Picks the policy governing {@code secretPath}.
	 * <p>
	 * Candidates are the environment's policies with no path or with a path matching {@code secretPath}. An exact path
	 * outranks a glob, which outranks an environment-wide policy. Among equals the earliest-created policy wins.
	 */
	@Nonnull
	public Optional<ApprovalPolicy> resolvePolicy(@Nonnull UUID projectId,
																								@Nonnull String environment,
																								@Nonnull String secretPath) {
		requireNonNull(projectId);
		requireNonNull(environment);
		requireNonNull(secretPath);

		List<ApprovalPolicy> candidates = findPolicies(projectId, environment).stream()
				.filter(policy -> policy.secretPath() == null || GlobMatcher.matches(policy.secretPath(), secretPath))
				.collect(Collectors.toCollection(ArrayList::new));

		// List.sort is stable, so creation order breaks ties
		candidates.sort(Comparator.comparingInt((ApprovalPolicy policy) -> specificityScore(policy.secretPath())).reversed());

		Optional<ApprovalPolicy> approvalPolicy = candidates.stream().findFirst();

		getLogger().debug("Resolved policy {} for path '{}' in environment '{}'",
				approvalPolicy.map(policy -> policy.approvalPolicyId().toString()).orElse("(none)"), secretPath, environment);

		return approvalPolicy;
	}

	@Nonnull
	public UUID createPolicy(@Nonnull ApprovalPolicyCreateRequest request) {
		requireNonNull(request);

		UUID approvalPolicyId = UUID.randomUUID();
		UUID projectId = request.projectId();
		String environment = normalizeEnvironment(request.environment()).orElse(null);
		String secretPath = normalizeSecretPath(request.secretPath()).orElse(null);
		String name = trimAggressivelyToNull(request.name());
		Set<UUID> approverIds = normalizeApproverIds(request.approverIds());
		Integer requiredApprovals = request.requiredApprovals();
		ErrorCollector errorCollector = new ErrorCollector();

		if (projectId == null)
			errorCollector.addFieldError("projectId", getStrings().get("Project ID is required."));

		if (environment == null)
			errorCollector.addFieldError("environment", getStrings().get("Environment is required."));
		else if (!isValidEnvironment(environment))
			errorCollector.addFieldError("environment", getStrings().get("Environment is invalid."));

		if (name == null)
			errorCollector.addFieldError("name", getStrings().get("Name is required."));

		validateApprovers(approverIds, requiredApprovals, errorCollector);

		if (errorCollector.hasErrors())
			throw ApplicationException.invalidFields(errorCollector);

		ensureAdministrator(projectId);

		getLogger().info("Creating approval policy '{}' for environment '{}' and path '{}'", name, environment,
				secretPath == null ? "(any)" : secretPath);

		getTransactionRunner().performInTransaction(() -> {
			getDatabase().execute("""
					INSERT INTO approval_policy (
						approval_policy_id,
						creation_sequence,
						project_id,
						environment,
						secret_path,
						name,
						required_approvals
					) VALUES (?,NEXT VALUE FOR approval_policy_sequence,?,?,?,?,?)
					""", approvalPolicyId, projectId, environment, secretPath, name, requiredApprovals);

			insertApprovers(approvalPolicyId, approverIds);
		});

		return approvalPolicyId;
	}

	@Nonnull
	public Boolean updatePolicy(@Nonnull ApprovalPolicyUpdateRequest request) {
		requireNonNull(request);

		ApprovalPolicy approvalPolicy = findPolicyById(request.approvalPolicyId()).orElseThrow(() ->
				ApplicationException.notFound(getStrings().get("Approval policy was not found.")));

		ensureAdministrator(approvalPolicy.projectId());

		String secretPath = request.secretPath() == null
				? approvalPolicy.secretPath()
				: normalizeSecretPath(request.secretPath()).orElse(null);
		String name = request.name() == null ? approvalPolicy.name() : trimAggressivelyToNull(request.name());
		Set<UUID> approverIds = request.approverIds() == null
				? findApproverIdsByPolicyId(approvalPolicy.approvalPolicyId())
				: normalizeApproverIds(request.approverIds());
		Integer requiredApprovals = request.requiredApprovals() == null
				? approvalPolicy.requiredApprovals()
				: request.requiredApprovals();
		ErrorCollector errorCollector = new ErrorCollector();

		if (name == null)
			errorCollector.addFieldError("name", getStrings().get("Name is required."));

		validateApprovers(approverIds, requiredApprovals, errorCollector);

		if (errorCollector.hasErrors())
			throw ApplicationException.invalidFields(errorCollector);

		return getTransactionRunner().performInTransaction(() -> {
			boolean updated = getDatabase().execute("""
					UPDATE approval_policy
					SET secret_path=?, name=?, required_approvals=?, updated_at=NOW()
					WHERE approval_policy_id=?
					""", secretPath, name, requiredApprovals, approvalPolicy.approvalPolicyId()) > 0;

			if (updated && request.approverIds() != null) {
				getDatabase().execute("DELETE FROM approval_policy_approver WHERE approval_policy_id=?", approvalPolicy.approvalPolicyId());
				insertApprovers(approvalPolicy.approvalPolicyId(), approverIds);
			}

			return updated;
		});
	}

	@Nonnull
	public Boolean deletePolicy(@Nonnull UUID approvalPolicyId) {
		requireNonNull(approvalPolicyId);

		ApprovalPolicy approvalPolicy = findPolicyById(approvalPolicyId).orElse(null);

		if (approvalPolicy == null)
			return false;

		ensureAdministrator(approvalPolicy.projectId());

		getLogger().info("Deleting approval policy '{}'", approvalPolicy.name());

		return getTransactionRunner().performInTransaction(() ->
				getDatabase().execute("DELETE FROM approval_policy WHERE approval_policy_id=?", approvalPolicyId) > 0);
	}

	@Nonnull
	protected Integer specificityScore(@Nullable String policySecretPath) {
		if (policySecretPath == null)
			return 0;

		return GlobMatcher.containsGlobPattern(policySecretPath) ? 1 : 2;
	}

	protected void validateApprovers(@Nonnull Set<UUID> approverIds,
																	 @Nullable Integer requiredApprovals,
																	 @Nonnull ErrorCollector errorCollector) {
		requireNonNull(approverIds);
		requireNonNull(errorCollector);

		if (approverIds.isEmpty())
			errorCollector.addFieldError("approverIds", getStrings().get("At least one approver is required."));

		if (requiredApprovals == null)
			errorCollector.addFieldError("requiredApprovals", getStrings().get("Required approvals is required."));
		else if (requiredApprovals < 1)
			errorCollector.addFieldError("requiredApprovals", getStrings().get("At least one approval is required."));
		else if (!approverIds.isEmpty() && requiredApprovals > approverIds.size())
			errorCollector.addFieldError("requiredApprovals",
					getStrings().get("The number of approvals should be lower than the number of approvers."));
	}

	@Nonnull
	protected Set<UUID> normalizeApproverIds(@Nullable Set<UUID> approverIds) {
		if (approverIds == null)
			return Set.of();

		return approverIds.stream()
				.filter(Objects::nonNull)
				.collect(Collectors.toCollection(LinkedHashSet::new));
	}

	protected void insertApprovers(@Nonnull UUID approvalPolicyId,
																 @Nonnull Set<UUID> approverIds) {
		requireNonNull(approvalPolicyId);
		requireNonNull(approverIds);

		for (UUID approverId : approverIds)
			getDatabase().execute("""
					INSERT INTO approval_policy_approver (
						approval_policy_id,
						approver_id
					) VALUES (?,?)
					""", approvalPolicyId, approverId);
	}

	protected void ensureAdministrator(@Nullable UUID projectId) {
		Actor actor = getCurrentContext().getActor().orElseThrow(() ->
				new AuthorizationException(getStrings().get("You must be authenticated to perform this action.")));

		if (!actor.isAdmin() || !actor.projectId().equals(projectId))
			throw new AuthorizationException(getStrings().get("Only project administrators can manage approval policies."),
					actor.actorId());
	}

	@Nonnull
	private CurrentContext getCurrentContext() {
		return this.currentContextProvider.get();
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
