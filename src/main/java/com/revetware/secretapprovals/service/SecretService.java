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
import com.revetware.secretapprovals.CurrentContext;
import com.revetware.secretapprovals.exception.ApplicationException;
import com.revetware.secretapprovals.exception.ApplicationException.ErrorCollector;
import com.revetware.secretapprovals.exception.AuthorizationException;
import com.revetware.secretapprovals.model.api.request.EncryptedSecretFields;
import com.revetware.secretapprovals.model.api.request.SecretCreateRequest;
import com.revetware.secretapprovals.model.auth.Actor;
import com.revetware.secretapprovals.model.auth.ProjectPermission;
import com.revetware.secretapprovals.model.db.Secret;
import com.revetware.secretapprovals.model.db.Secret.SecretType;
import com.revetware.secretapprovals.model.db.SecretVersion;
import com.revetware.secretapprovals.util.BlindIndexer;
import com.revetware.secretapprovals.util.TransactionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.revetware.secretapprovals.util.Normalizer.normalizeEnvironment;
import static com.revetware.secretapprovals.util.Normalizer.normalizeSecretPath;
import static com.revetware.secretapprovals.util.Normalizer.trimAggressivelyToNull;
import static com.revetware.secretapprovals.util.Validator.isValidSecretName;
import static java.util.Objects.requireNonNull;

/**
 * Reads and writes live secrets and their version history.
 * <p>
 * The {@code insert/update/delete} methods do not validate or authorize; they are the storage primitives that direct
 * creation and approval merges build on, and must be called inside a transaction.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class SecretService {
	@Nonnull
	private static final String DEFAULT_ALGORITHM;
	@Nonnull
	private static final String DEFAULT_KEY_ENCODING;

	static {
		DEFAULT_ALGORITHM = "aes-256-gcm";
		DEFAULT_KEY_ENCODING = "utf8";
	}

	@Nonnull
	private final Provider<CurrentContext> currentContextProvider;
	@Nonnull
	private final SecretFolderService secretFolderService;
	@Nonnull
	private final BlindIndexer blindIndexer;
	@Nonnull
	private final TransactionRunner transactionRunner;
	@Nonnull
	private final Database database;
	@Nonnull
	private final Strings strings;
	@Nonnull
	private final Logger logger;

	@Inject
	public SecretService(@Nonnull Provider<CurrentContext> currentContextProvider,
											 @Nonnull SecretFolderService secretFolderService,
											 @Nonnull BlindIndexer blindIndexer,
											 @Nonnull TransactionRunner transactionRunner,
											 @Nonnull Database database,
											 @Nonnull Strings strings) {
		requireNonNull(currentContextProvider);
		requireNonNull(secretFolderService);
		requireNonNull(blindIndexer);
		requireNonNull(transactionRunner);
		requireNonNull(database);
		requireNonNull(strings);

		this.currentContextProvider = currentContextProvider;
		this.secretFolderService = secretFolderService;
		this.blindIndexer = blindIndexer;
		this.transactionRunner = transactionRunner;
		this.database = database;
		this.strings = strings;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@Nonnull
	public Optional<Secret> findSecretById(@Nullable UUID secretId) {
		if (secretId == null)
			return Optional.empty();

		return getDatabase().queryForObject("""
				SELECT *
				FROM secret
				WHERE secret_id=?
				""", Secret.class, secretId);
	}

	/**
	 * Finds secrets in a folder by blind index. A {@code null} type matches secrets of any type.
	 */
	@Nonnull
	public List<Secret> findSecretsByBlindIndexes(@Nonnull UUID projectId,
																								@Nonnull String environment,
																								@Nonnull UUID secretFolderId,
																								@Nullable SecretType type,
																								@Nonnull Collection<String> blindIndexes) {
		requireNonNull(projectId);
		requireNonNull(environment);
		requireNonNull(secretFolderId);
		requireNonNull(blindIndexes);

		if (blindIndexes.isEmpty())
			return List.of();

		List<Object> parameters = new ArrayList<>(blindIndexes.size() + 4);
		parameters.add(projectId);
		parameters.add(environment);
		parameters.add(secretFolderId);

		String typeClause = "";

		if (type != null) {
			typeClause = "AND type=?";
			parameters.add(type);
		}

		parameters.addAll(blindIndexes);

		String placeholders = blindIndexes.stream().map(blindIndex -> "?").collect(Collectors.joining(","));

		return getDatabase().queryForList(String.format("""
				SELECT *
				FROM secret
				WHERE project_id=?
				AND environment=?
				AND secret_folder_id=?
				%s
				AND blind_index IN (%s)
				ORDER BY created_at, secret_id
				""", typeClause, placeholders), Secret.class, parameters.toArray());
	}

	@Nonnull
	public List<SecretVersion> findSecretVersionsBySecretId(@Nullable UUID secretId) {
		if (secretId == null)
			return List.of();

		return getDatabase().queryForList("""
				SELECT *
				FROM secret_version
				WHERE secret_id=?
				ORDER BY version
				""", SecretVersion.class, secretId);
	}

	@Nonnull
	public Optional<SecretVersion> findLatestSecretVersion(@Nullable UUID secretId) {
		if (secretId == null)
			return Optional.empty();

		return getDatabase().queryForObject("""
				SELECT *
				FROM secret_version
				WHERE secret_id=?
				AND version=(SELECT MAX(version) FROM secret_version WHERE secret_id=?)
				""", SecretVersion.class, secretId, secretId);
	}

	/**
	 * Creates a secret directly, without an approval request.
	 */
	@Nonnull
	public UUID createSecret(@Nonnull SecretCreateRequest request) {
		requireNonNull(request);

		UUID projectId = request.projectId();
		String environment = normalizeEnvironment(request.environment()).orElse(null);
		String secretPath = normalizeSecretPath(request.secretPath()).orElse("/");
		String secretName = trimAggressivelyToNull(request.secretName());
		SecretType type = request.type() == null ? SecretType.SHARED : request.type();
		EncryptedSecretFields fields = request.fields();
		ErrorCollector errorCollector = new ErrorCollector();

		if (projectId == null)
			errorCollector.addFieldError("projectId", getStrings().get("Project ID is required."));

		if (environment == null)
			errorCollector.addFieldError("environment", getStrings().get("Environment is required."));

		if (secretName == null)
			errorCollector.addFieldError("secretName", getStrings().get("Secret name is required."));
		else if (!isValidSecretName(secretName))
			errorCollector.addFieldError("secretName", getStrings().get("Secret name is invalid."));

		if (!hasRequiredCiphertext(fields))
			errorCollector.addFieldError("fields", getStrings().get("Encrypted secret key and value are required."));

		if (errorCollector.hasErrors())
			throw ApplicationException.invalidFields(errorCollector);

		Actor actor = getCurrentContext().getActor().orElseThrow(() ->
				new AuthorizationException(getStrings().get("You must be authenticated to perform this action.")));

		if (!actor.projectId().equals(projectId) || !actor.hasPermission(ProjectPermission.Subject.SECRETS, ProjectPermission.Action.CREATE))
			throw new AuthorizationException(getStrings().get("You are not authorized to perform this action."), actor.actorId());

		return getTransactionRunner().performInTransaction(() -> {
			UUID secretFolderId = getSecretFolderService().findFolderIdByPath(projectId, environment, secretPath).orElseThrow(() ->
					ApplicationException.notFound(getStrings().get("Folder with path '{{secretPath}}' was not found.",
							Map.of("secretPath", secretPath))));

			String salt = getBlindIndexer().getOrCreateProjectSalt(projectId);
			String blindIndex = getBlindIndexer().computeBlindIndex(secretName, salt);

			try {
				return insertSecret(projectId, environment, secretFolderId, type, blindIndex, fields);
			} catch (DatabaseException e) {
				if (e.getMessage() != null && e.getMessage().toUpperCase().contains("SECRET_BLIND_INDEX_UNIQUE_IDX"))
					throw ApplicationException.conflict(getStrings().get("Secrets already exist."));

				throw e;
			}
		});
	}

	/**
	 * Inserts a secret at version 1 along with its first version row.
	 */
	@Nonnull
	public UUID insertSecret(@Nonnull UUID projectId,
													 @Nonnull String environment,
													 @Nonnull UUID secretFolderId,
													 @Nonnull SecretType type,
													 @Nonnull String blindIndex,
													 @Nonnull EncryptedSecretFields fields) {
		requireNonNull(projectId);
		requireNonNull(environment);
		requireNonNull(secretFolderId);
		requireNonNull(type);
		requireNonNull(blindIndex);
		requireNonNull(fields);

		UUID secretId = UUID.randomUUID();

		getDatabase().execute("""
						INSERT INTO secret (
							secret_id,
							project_id,
							environment,
							secret_folder_id,
							type,
							blind_index,
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
						) VALUES (?,?,?,?,?,?,1,?,?,?,?,?,?,?,?,?,?,?,?)
						""", secretId, projectId, environment, secretFolderId, type, blindIndex,
				fields.secretKeyCiphertext(), fields.secretKeyIv(), fields.secretKeyTag(),
				fields.secretValueCiphertext(), fields.secretValueIv(), fields.secretValueTag(),
				fields.secretCommentCiphertext(), fields.secretCommentIv(), fields.secretCommentTag(),
				fields.skipMultilineEncoding() == null ? Boolean.FALSE : fields.skipMultilineEncoding(),
				fields.algorithm() == null ? DEFAULT_ALGORITHM : fields.algorithm(),
				fields.keyEncoding() == null ? DEFAULT_KEY_ENCODING : fields.keyEncoding());

		insertSecretVersion(findSecretById(secretId).get());

		getLogger().debug("Inserted secret ID {} in folder ID {}", secretId, secretFolderId);

		return secretId;
	}

	/**
	 * Applies changed fields and an optional new blind index, increments the version and appends a version row.
	 *
	 * @return the new version number
	 */
	@Nonnull
	public Integer updateSecret(@Nonnull Secret secret,
															@Nonnull String blindIndex,
															@Nullable EncryptedSecretFields changedFields) {
		requireNonNull(secret);
		requireNonNull(blindIndex);

		EncryptedSecretFields fields = changedFields == null ? EncryptedSecretFields.unchanged() : changedFields;

		Integer nextVersion = secret.version() + 1;

		// Version check guards against a concurrent writer having moved the secret on
		long updatedCount = getDatabase().execute("""
						UPDATE secret
						SET blind_index=?,
						version=?,
						secret_key_ciphertext=COALESCE(?, secret_key_ciphertext),
						secret_key_iv=COALESCE(?, secret_key_iv),
						secret_key_tag=COALESCE(?, secret_key_tag),
						secret_value_ciphertext=COALESCE(?, secret_value_ciphertext),
						secret_value_iv=COALESCE(?, secret_value_iv),
						secret_value_tag=COALESCE(?, secret_value_tag),
						secret_comment_ciphertext=COALESCE(?, secret_comment_ciphertext),
						secret_comment_iv=COALESCE(?, secret_comment_iv),
						secret_comment_tag=COALESCE(?, secret_comment_tag),
						skip_multiline_encoding=COALESCE(?, skip_multiline_encoding),
						algorithm=COALESCE(?, algorithm),
						key_encoding=COALESCE(?, key_encoding),
						updated_at=NOW()
						WHERE secret_id=?
						AND version=?
						""", blindIndex, nextVersion,
				fields.secretKeyCiphertext(), fields.secretKeyIv(), fields.secretKeyTag(),
				fields.secretValueCiphertext(), fields.secretValueIv(), fields.secretValueTag(),
				fields.secretCommentCiphertext(), fields.secretCommentIv(), fields.secretCommentTag(),
				fields.skipMultilineEncoding(), fields.algorithm(), fields.keyEncoding(),
				secret.secretId(), secret.version());

		if (updatedCount == 0)
			throw ApplicationException.conflict(getStrings().get("Secret was modified concurrently."));

		insertSecretVersion(findSecretById(secret.secretId()).get());

		return nextVersion;
	}

	/**
	 * Deletes the secret row and marks all of its versions as deleted.
	 */
	public void deleteSecret(@Nonnull Secret secret) {
		requireNonNull(secret);

		getDatabase().execute("DELETE FROM secret WHERE secret_id=?", secret.secretId());
		getDatabase().execute("UPDATE secret_version SET is_deleted=TRUE WHERE secret_id=?", secret.secretId());
	}

	@Nonnull
	public Boolean hasRequiredCiphertext(@Nullable EncryptedSecretFields fields) {
		if (fields == null)
			return false;

		return hasRequiredKeyCiphertext(fields)
				&& fields.secretValueCiphertext() != null && fields.secretValueIv() != null && fields.secretValueTag() != null;
	}

	@Nonnull
	public Boolean hasRequiredKeyCiphertext(@Nullable EncryptedSecretFields fields) {
		if (fields == null)
			return false;

		return fields.secretKeyCiphertext() != null && fields.secretKeyIv() != null && fields.secretKeyTag() != null;
	}

	protected void insertSecretVersion(@Nonnull Secret secret) {
		requireNonNull(secret);

		getDatabase().execute("""
						INSERT INTO secret_version (
							secret_version_id,
							secret_id,
							version,
							project_id,
							environment,
							secret_folder_id,
							type,
							blind_index,
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
						""", UUID.randomUUID(), secret.secretId(), secret.version(), secret.projectId(), secret.environment(),
				secret.secretFolderId(), secret.type(), secret.blindIndex(),
				secret.secretKeyCiphertext(), secret.secretKeyIv(), secret.secretKeyTag(),
				secret.secretValueCiphertext(), secret.secretValueIv(), secret.secretValueTag(),
				secret.secretCommentCiphertext(), secret.secretCommentIv(), secret.secretCommentTag(),
				secret.skipMultilineEncoding(), secret.algorithm(), secret.keyEncoding());
	}

	@Nonnull
	private CurrentContext getCurrentContext() {
		return this.currentContextProvider.get();
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
