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

package com.revetware.secretapprovals;

import com.google.inject.Module;
import com.pyranid.Database;
import com.revetware.secretapprovals.model.api.request.ApprovalPolicyCreateRequest;
import com.revetware.secretapprovals.model.api.request.ApprovalRequestCreateRequest;
import com.revetware.secretapprovals.model.api.request.EncryptedSecretFields;
import com.revetware.secretapprovals.model.api.request.ProposedSecretChanges;
import com.revetware.secretapprovals.model.api.request.ProposedSecretChanges.SecretCreate;
import com.revetware.secretapprovals.model.api.request.ProposedSecretChanges.SecretDelete;
import com.revetware.secretapprovals.model.api.request.ProposedSecretChanges.SecretUpdate;
import com.revetware.secretapprovals.model.api.request.SecretCreateRequest;
import com.revetware.secretapprovals.model.auth.Actor;
import com.revetware.secretapprovals.model.auth.Actor.ActorType;
import com.revetware.secretapprovals.model.auth.Actor.ProjectMembershipRole;
import com.revetware.secretapprovals.model.db.ApprovalRequest;
import com.revetware.secretapprovals.model.db.ApprovalReview.ReviewStatus;
import com.revetware.secretapprovals.model.db.Secret.SecretType;
import com.revetware.secretapprovals.service.ApprovalMergeService;
import com.revetware.secretapprovals.service.ApprovalPolicyService;
import com.revetware.secretapprovals.service.ApprovalRequestService;
import com.revetware.secretapprovals.service.ApprovalReviewService;
import com.revetware.secretapprovals.service.SecretService;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Boots an isolated {@link App} for a single project and offers shortcuts for acting as project members.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class TestHarness {
	@NonNull
	public static final String ENVIRONMENT;

	static {
		ENVIRONMENT = "dev";
	}

	@NonNull
	private final App app;
	@NonNull
	private final UUID projectId;
	@NonNull
	private final Actor admin;

	public TestHarness(@Nullable Module... testingModules) {
		this(new Configuration("local"), testingModules);
	}

	public TestHarness(@NonNull Configuration configuration,
										 @Nullable Module... testingModules) {
		requireNonNull(configuration);

		this.app = new App(configuration, testingModules);
		this.projectId = UUID.randomUUID();
		this.admin = Actor.forUser(UUID.randomUUID(), this.projectId, ProjectMembershipRole.ADMIN);
	}

	@NonNull
	public Actor member() {
		return Actor.forUser(UUID.randomUUID(), getProjectId(), ProjectMembershipRole.MEMBER);
	}

	@NonNull
	public Actor serviceToken() {
		return new Actor(ActorType.SERVICE, UUID.randomUUID(), getProjectId(), ProjectMembershipRole.MEMBER,
				member().permissions());
	}

	public <T> T callAs(@NonNull Actor actor,
											@NonNull Supplier<T> supplier) {
		requireNonNull(actor);
		requireNonNull(supplier);

		return CurrentContext.withActor(actor).build().run(supplier);
	}

	public void runAs(@NonNull Actor actor,
										@NonNull Runnable runnable) {
		requireNonNull(actor);
		requireNonNull(runnable);

		CurrentContext.withActor(actor).build().run(runnable);
	}

	@NonNull
	public static EncryptedSecretFields fields(@NonNull String label) {
		requireNonNull(label);

		return new EncryptedSecretFields(label + "-key-ct", label + "-key-iv", label + "-key-tag",
				label + "-value-ct", label + "-value-iv", label + "-value-tag", null, null, null, null, null, null);
	}

	@NonNull
	public static ProposedSecretChanges creates(@NonNull String... secretNames) {
		return new ProposedSecretChanges(List.of(secretNames).stream()
				.map(secretName -> new SecretCreate(secretName, fields(secretName)))
				.toList(), null, null);
	}

	@NonNull
	public static ProposedSecretChanges update(@NonNull String secretName,
																						 @Nullable String newSecretName,
																						 @Nullable EncryptedSecretFields fields) {
		return new ProposedSecretChanges(null, List.of(new SecretUpdate(secretName, newSecretName, fields)), null);
	}

	@NonNull
	public static ProposedSecretChanges deletes(@NonNull String... secretNames) {
		return new ProposedSecretChanges(null, null, List.of(secretNames).stream().map(SecretDelete::new).toList());
	}

	@NonNull
	public UUID createPolicy(@Nullable String secretPath,
													 @NonNull Set<UUID> approverIds,
													 @NonNull Integer requiredApprovals) {
		return callAs(getAdmin(), () -> getInstance(ApprovalPolicyService.class).createPolicy(new ApprovalPolicyCreateRequest(
				getProjectId(), ENVIRONMENT, secretPath, "Policy for " + (secretPath == null ? "environment" : secretPath),
				approverIds, requiredApprovals)));
	}

	@NonNull
	public UUID createSecret(@NonNull String secretName) {
		return callAs(getAdmin(), () -> getInstance(SecretService.class).createSecret(new SecretCreateRequest(
				getProjectId(), ENVIRONMENT, "/", secretName, SecretType.SHARED, fields(secretName))));
	}

	@NonNull
	public ApprovalRequest requestChanges(@NonNull Actor committer,
																				@NonNull ProposedSecretChanges changes) {
		return callAs(committer, () -> getInstance(ApprovalRequestService.class).generateApprovalRequest(
				new ApprovalRequestCreateRequest(getProjectId(), ENVIRONMENT, "/", changes)));
	}

	public void vote(@NonNull Actor reviewer,
									 @NonNull ApprovalRequest approvalRequest,
									 @NonNull ReviewStatus status) {
		runAs(reviewer, () -> getInstance(ApprovalReviewService.class).submitReview(approvalRequest.approvalRequestId(), status));
	}

	@NonNull
	public ApprovalRequest merge(@NonNull Actor actor,
															 @NonNull ApprovalRequest approvalRequest) {
		return callAs(actor, () -> getInstance(ApprovalMergeService.class).merge(approvalRequest.approvalRequestId()));
	}

	@NonNull
	public <T> T getInstance(@NonNull Class<T> type) {
		requireNonNull(type);
		return getApp().getInjector().getInstance(type);
	}

	@NonNull
	public Database getDatabase() {
		return getInstance(Database.class);
	}

	@NonNull
	public App getApp() {
		return this.app;
	}

	@NonNull
	public UUID getProjectId() {
		return this.projectId;
	}

	@NonNull
	public Actor getAdmin() {
		return this.admin;
	}
}
