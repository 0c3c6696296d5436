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
import com.lokalized.Strings;
import com.revetware.secretapprovals.exception.ApplicationException;
import com.revetware.secretapprovals.model.ApprovalCommitDraft;
import com.revetware.secretapprovals.model.SecretScope;
import com.revetware.secretapprovals.model.api.request.EncryptedSecretFields;
import com.revetware.secretapprovals.model.api.request.ProposedSecretChanges;
import com.revetware.secretapprovals.model.api.request.ProposedSecretChanges.SecretCreate;
import com.revetware.secretapprovals.model.api.request.ProposedSecretChanges.SecretDelete;
import com.revetware.secretapprovals.model.api.request.ProposedSecretChanges.SecretUpdate;
import com.revetware.secretapprovals.model.db.ApprovalCommit.CommitOperation;
import com.revetware.secretapprovals.model.db.Secret;
import com.revetware.secretapprovals.model.db.Secret.SecretType;
import com.revetware.secretapprovals.model.db.SecretVersion;
import com.revetware.secretapprovals.util.BlindIndexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.revetware.secretapprovals.util.Normalizer.trimAggressivelyToNull;
import static com.revetware.secretapprovals.util.Validator.isValidSecretName;
import static java.util.Objects.requireNonNull;

/**
 * Turns a batch of proposed secret changes into validated commits.
 * <p>
 * The batch is checked for internal consistency before anything is looked up. Plaintext names are used only to compute
 * blind indexes and never leave this class.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class ApprovalCommitService {
	@Nonnull
	private final SecretService secretService;
	@Nonnull
	private final SecretFolderService secretFolderService;
	@Nonnull
	private final BlindIndexer blindIndexer;
	@Nonnull
	private final Strings strings;
	@Nonnull
	private final Logger logger;

	@Inject
	public ApprovalCommitService(@Nonnull SecretService secretService,
															 @Nonnull SecretFolderService secretFolderService,
															 @Nonnull BlindIndexer blindIndexer,
															 @Nonnull Strings strings) {
		requireNonNull(secretService);
		requireNonNull(secretFolderService);
		requireNonNull(blindIndexer);
		requireNonNull(strings);

		this.secretService = secretService;
		this.secretFolderService = secretFolderService;
		this.blindIndexer = blindIndexer;
		this.strings = strings;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	/**
	 * Validates {@code changes} against the secrets currently stored under {@code scope}.
	 *
	 * @return commits ordered creates, then updates, then deletes, each in input order
	 */
	@Nonnull
	public List<ApprovalCommitDraft> buildApprovalCommits(@Nonnull SecretScope scope,
																												@Nullable ProposedSecretChanges changes) {
		requireNonNull(scope);

		validateBatch(changes);

		List<SecretCreate> creates = changes.createsOrEmpty();
		List<SecretUpdate> updates = changes.updatesOrEmpty();
		List<SecretDelete> deletes = changes.deletesOrEmpty();

		UUID secretFolderId = getSecretFolderService().findFolderIdByPath(scope.projectId(), scope.environment(), scope.secretPath())
				.orElseThrow(() -> ApplicationException.notFound(getStrings().get("Folder with path '{{secretPath}}' was not found.",
						Map.of("secretPath", scope.secretPath()))));

		String salt = getBlindIndexer().getOrCreateProjectSalt(scope.projectId());
		Function<String, String> blindIndexFunction = (secretName) ->
				getBlindIndexer().computeBlindIndex(trimAggressivelyToNull(secretName), salt);

		List<ApprovalCommitDraft> drafts = new ArrayList<>(creates.size() + updates.size() + deletes.size());

		// Creates
		if (creates.size() > 0) {
			List<String> blindIndexes = creates.stream().map(create -> blindIndexFunction.apply(create.secretName())).toList();

			if (findSharedSecretsByBlindIndex(scope, secretFolderId, blindIndexes).size() > 0)
				throw ApplicationException.conflict(getStrings().get("Secrets already exist."));

			for (int i = 0; i < creates.size(); ++i)
				drafts.add(new ApprovalCommitDraft(UUID.randomUUID(), CommitOperation.CREATE, null, null,
						blindIndexes.get(i), 0, creates.get(i).fields()));
		}

		// Updates
		if (updates.size() > 0) {
			List<String> blindIndexes = updates.stream().map(update -> blindIndexFunction.apply(update.secretName())).toList();
			Map<String, Secret> secretsByBlindIndex = findSharedSecretsByBlindIndex(scope, secretFolderId, blindIndexes);

			if (!secretsByBlindIndex.keySet().containsAll(blindIndexes))
				throw ApplicationException.conflict(getStrings().get("Secrets to update do not exist."));

			Map<Integer, String> newBlindIndexesByPosition = new LinkedHashMap<>();

			for (int i = 0; i < updates.size(); ++i)
				if (trimAggressivelyToNull(updates.get(i).newSecretName()) != null)
					newBlindIndexesByPosition.put(i, blindIndexFunction.apply(updates.get(i).newSecretName()));

			// A rename may not land on any existing secret in the folder, whatever its type
			if (newBlindIndexesByPosition.size() > 0
					&& getSecretService().findSecretsByBlindIndexes(scope.projectId(), scope.environment(), secretFolderId, null,
					newBlindIndexesByPosition.values()).size() > 0)
				throw ApplicationException.conflict(getStrings().get("Secret with new name already exist."));

			for (int i = 0; i < updates.size(); ++i) {
				SecretUpdate update = updates.get(i);
				Secret secret = secretsByBlindIndex.get(blindIndexes.get(i));
				String targetBlindIndex = newBlindIndexesByPosition.getOrDefault(i, secret.blindIndex());
				EncryptedSecretFields fields = update.fields() == null ? EncryptedSecretFields.unchanged() : update.fields();

				drafts.add(new ApprovalCommitDraft(UUID.randomUUID(), CommitOperation.UPDATE, secret.secretId(),
						findLatestSecretVersionId(secret), targetBlindIndex, secret.version() == null ? 1 : secret.version(), fields));
			}
		}

		// Deletes
		if (deletes.size() > 0) {
			List<String> blindIndexes = deletes.stream().map(delete -> blindIndexFunction.apply(delete.secretName())).toList();
			Map<String, Secret> secretsByBlindIndex = findSharedSecretsByBlindIndex(scope, secretFolderId, blindIndexes);

			if (!secretsByBlindIndex.keySet().containsAll(blindIndexes))
				throw ApplicationException.notFound(getStrings().get("Deleted secrets not found."));

			for (String blindIndex : blindIndexes) {
				Secret secret = secretsByBlindIndex.get(blindIndex);

				drafts.add(new ApprovalCommitDraft(UUID.randomUUID(), CommitOperation.DELETE, secret.secretId(),
						findLatestSecretVersionId(secret), secret.blindIndex(), secret.version(), EncryptedSecretFields.unchanged()));
			}
		}

		getLogger().debug("Built {} commit[s] for folder ID {} ({} create[s], {} update[s], {} delete[s])", drafts.size(),
				secretFolderId, creates.size(), updates.size(), deletes.size());

		return drafts;
	}

	/**
	 * Rejects malformed batches without touching storage or the blind indexer.
	 */
	protected void validateBatch(@Nullable ProposedSecretChanges changes) {
		if (changes == null || changes.isEmpty())
			throw ApplicationException.badRequest(getStrings().get("Empty commits."));

		List<String> secretNames = new ArrayList<>();

		for (SecretCreate create : changes.createsOrEmpty()) {
			secretNames.add(validateSecretName(create == null ? null : create.secretName()));

			if (!getSecretService().hasRequiredCiphertext(create.fields()))
				throw ApplicationException.badRequest(getStrings().get("Encrypted secret key and value are required."));
		}

		List<String> newSecretNames = new ArrayList<>();

		for (SecretUpdate update : changes.updatesOrEmpty()) {
			secretNames.add(validateSecretName(update == null ? null : update.secretName()));

			if (update.newSecretName() != null) {
				newSecretNames.add(validateSecretName(update.newSecretName()));

				// The stored key ciphertext must decrypt to the new name
				if (!getSecretService().hasRequiredKeyCiphertext(update.fields()))
					throw ApplicationException.badRequest(getStrings().get("Renaming a secret requires its re-encrypted key."));
			}
		}

		for (SecretDelete delete : changes.deletesOrEmpty())
			secretNames.add(validateSecretName(delete == null ? null : delete.secretName()));

		Set<String> uniqueSecretNames = new HashSet<>(secretNames);

		if (uniqueSecretNames.size() != secretNames.size())
			throw ApplicationException.badRequest(getStrings().get("A secret may only appear once per request."));

		Set<String> uniqueNewSecretNames = new HashSet<>(newSecretNames);

		if (uniqueNewSecretNames.size() != newSecretNames.size())
			throw ApplicationException.badRequest(getStrings().get("Secrets cannot be renamed to the same name."));

		for (String newSecretName : newSecretNames)
			if (uniqueSecretNames.contains(newSecretName))
				throw ApplicationException.badRequest(getStrings().get("Secret '{{secretName}}' cannot be renamed to a name already used in this request.",
						Map.of("secretName", newSecretName)));
	}

	@Nonnull
	protected String validateSecretName(@Nullable String secretName) {
		String normalizedSecretName = trimAggressivelyToNull(secretName);

		if (normalizedSecretName == null)
			throw ApplicationException.badRequest(getStrings().get("Secret name is required."));

		if (!isValidSecretName(normalizedSecretName))
			throw ApplicationException.badRequest(getStrings().get("Secret name is invalid."));

		return normalizedSecretName;
	}

	@Nonnull
	protected Map<String, Secret> findSharedSecretsByBlindIndex(@Nonnull SecretScope scope,
																															@Nonnull UUID secretFolderId,
																															@Nonnull List<String> blindIndexes) {
		requireNonNull(scope);
		requireNonNull(secretFolderId);
		requireNonNull(blindIndexes);

		return getSecretService().findSecretsByBlindIndexes(scope.projectId(), scope.environment(), secretFolderId,
						SecretType.SHARED, new HashSet<>(blindIndexes)).stream()
				.collect(Collectors.toMap(Secret::blindIndex, Function.identity(), (first, second) -> first));
	}

	@Nullable
	protected UUID findLatestSecretVersionId(@Nonnull Secret secret) {
		requireNonNull(secret);
		return getSecretService().findLatestSecretVersion(secret.secretId()).map(SecretVersion::secretVersionId).orElse(null);
	}

	@Nonnull
	private SecretService getSecretService() {
		return this.secretService;
	}

	@Nonnull
	private SecretFolderService getSecretFolderService() {
		return this.secretFolderService;
	}

	@Nonnull
	private BlindIndexer getBlindIndexer() {
		return this.blindIndexer;
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
