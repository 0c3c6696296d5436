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
import com.revetware.secretapprovals.model.api.request.SecretFolderCreateRequest;
import com.revetware.secretapprovals.model.auth.Actor;
import com.revetware.secretapprovals.model.auth.ProjectPermission;
import com.revetware.secretapprovals.model.db.SecretFolder;
import com.revetware.secretapprovals.util.TransactionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.revetware.secretapprovals.util.Normalizer.normalizeEnvironment;
import static com.revetware.secretapprovals.util.Normalizer.normalizeSecretPath;
import static com.revetware.secretapprovals.util.Normalizer.trimAggressivelyToNull;
import static com.revetware.secretapprovals.util.Validator.isValidEnvironment;
import static com.revetware.secretapprovals.util.Validator.isValidFolderName;
import static java.util.Objects.requireNonNull;

/**
 * Resolves secret paths to folders and back.
 * <p>
 * Each (project, environment) has a tree of folders rooted at a folder named {@code root}. Until the first folder is
 * created the tree does not exist, and the root path {@code /} resolves to {@link #getSentinelRootFolderId()}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class SecretFolderService {
	@Nonnull
	private static final UUID SENTINEL_ROOT_FOLDER_ID;
	@Nonnull
	private static final String ROOT_FOLDER_NAME;

	static {
		SENTINEL_ROOT_FOLDER_ID = new UUID(0L, 0L);
		ROOT_FOLDER_NAME = "root";
	}

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
	public SecretFolderService(@Nonnull Provider<CurrentContext> currentContextProvider,
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
	public static UUID getSentinelRootFolderId() {
		return SENTINEL_ROOT_FOLDER_ID;
	}

	@Nonnull
	public Optional<SecretFolder> findFolderById(@Nullable UUID secretFolderId) {
		if (secretFolderId == null)
			return Optional.empty();

		return getDatabase().queryForObject("""
				SELECT *
				FROM secret_folder
				WHERE secret_folder_id=?
				""", SecretFolder.class, secretFolderId);
	}

	/**
	 * Finds the folder ID for a path like {@code /app/db}.
	 * <p>
	 * Returns the sentinel root ID for {@code /} when the environment has no folder tree yet.
	 */
	@Nonnull
	public Optional<UUID> findFolderIdByPath(@Nullable UUID projectId,
																					 @Nullable String environment,
																					 @Nullable String secretPath) {
		String normalizedEnvironment = normalizeEnvironment(environment).orElse(null);
		String normalizedSecretPath = normalizeSecretPath(secretPath).orElse(null);

		if (projectId == null || normalizedEnvironment == null || normalizedSecretPath == null)
			return Optional.empty();

		SecretFolder rootFolder = findRootFolder(projectId, normalizedEnvironment).orElse(null);

		if (rootFolder == null)
			return normalizedSecretPath.equals("/") ? Optional.of(getSentinelRootFolderId()) : Optional.empty();

		UUID currentFolderId = rootFolder.secretFolderId();

		for (String segment : splitPath(normalizedSecretPath)) {
			SecretFolder childFolder = findChildFolder(currentFolderId, segment).orElse(null);

			if (childFolder == null)
				return Optional.empty();

			currentFolderId = childFolder.secretFolderId();
		}

		return Optional.of(currentFolderId);
	}

	/**
	 * Walks parent pointers from the given folder up to the root and returns the folder's path, e.g. {@code /app/db}.
	 */
	@Nonnull
	public Optional<String> findSecretPathByFolderId(@Nullable UUID secretFolderId) {
		if (secretFolderId == null)
			return Optional.empty();

		if (secretFolderId.equals(getSentinelRootFolderId()))
			return Optional.of("/");

		List<String> segments = new ArrayList<>();
		SecretFolder currentFolder = findFolderById(secretFolderId).orElse(null);

		if (currentFolder == null)
			return Optional.empty();

		while (currentFolder.parentFolderId() != null) {
			segments.add(currentFolder.name());
			currentFolder = findFolderById(currentFolder.parentFolderId()).orElse(null);

			// Broken tree
			if (currentFolder == null)
				return Optional.empty();
		}

		Collections.reverse(segments);

		return Optional.of("/" + String.join("/", segments));
	}

	@Nonnull
	public UUID createFolder(@Nonnull SecretFolderCreateRequest request) {
		requireNonNull(request);

		UUID projectId = request.projectId();
		String environment = normalizeEnvironment(request.environment()).orElse(null);
		String parentPath = normalizeSecretPath(request.parentPath()).orElse("/");
		String name = trimAggressivelyToNull(request.name());
		ErrorCollector errorCollector = new ErrorCollector();

		if (projectId == null)
			errorCollector.addFieldError("projectId", getStrings().get("Project ID is required."));

		if (environment == null)
			errorCollector.addFieldError("environment", getStrings().get("Environment is required."));
		else if (!isValidEnvironment(environment))
			errorCollector.addFieldError("environment", getStrings().get("Environment is invalid."));

		if (name == null)
			errorCollector.addFieldError("name", getStrings().get("Folder name is required."));
		else if (!isValidFolderName(name))
			errorCollector.addFieldError("name", getStrings().get("Folder name is invalid."));

		if (errorCollector.hasErrors())
			throw ApplicationException.invalidFields(errorCollector);

		Actor actor = getCurrentContext().getActor().orElseThrow(() ->
				new AuthorizationException(getStrings().get("You must be authenticated to perform this action.")));

		if (!actor.projectId().equals(projectId) || !actor.hasPermission(ProjectPermission.Subject.SECRET_FOLDERS, ProjectPermission.Action.CREATE))
			throw new AuthorizationException(getStrings().get("You are not authorized to perform this action."), actor.actorId());

		return getTransactionRunner().performInTransaction(() -> {
			UUID rootFolderId = findOrCreateRootFolder(projectId, environment);
			UUID parentFolderId = parentPath.equals("/") ? rootFolderId : findFolderIdByPath(projectId, environment, parentPath).orElse(null);

			if (parentFolderId == null)
				throw ApplicationException.notFound(getStrings().get("Folder with path '{{secretPath}}' was not found.",
						Map.of("secretPath", parentPath)));

			if (findChildFolder(parentFolderId, name).isPresent())
				throw ApplicationException.conflict(getStrings().get("A folder named '{{name}}' already exists.", Map.of("name", name)));

			UUID secretFolderId = UUID.randomUUID();

			getDatabase().execute("""
					INSERT INTO secret_folder (
						secret_folder_id,
						project_id,
						environment,
						parent_folder_id,
						name
					) VALUES (?,?,?,?,?)
					""", secretFolderId, projectId, environment, parentFolderId, name);

			getLogger().info("Created folder {} in project ID {}, environment '{}'", secretFolderId, projectId, environment);

			return secretFolderId;
		});
	}

	// Creating the root re-homes anything filed under the sentinel root
	@Nonnull
	protected UUID findOrCreateRootFolder(@Nonnull UUID projectId,
																				@Nonnull String environment) {
		requireNonNull(projectId);
		requireNonNull(environment);

		SecretFolder rootFolder = findRootFolder(projectId, environment).orElse(null);

		if (rootFolder != null)
			return rootFolder.secretFolderId();

		UUID rootFolderId = UUID.randomUUID();

		getDatabase().execute("""
				INSERT INTO secret_folder (
					secret_folder_id,
					project_id,
					environment,
					name
				) VALUES (?,?,?,?)
				""", rootFolderId, projectId, environment, ROOT_FOLDER_NAME);

		for (String table : List.of("secret", "secret_version", "approval_request"))
			getDatabase().execute(String.format("""
					UPDATE %s
					SET secret_folder_id=?
					WHERE project_id=? AND environment=? AND secret_folder_id=?
					""", table), rootFolderId, projectId, environment, getSentinelRootFolderId());

		getLogger().debug("Created root folder {} for project ID {}, environment '{}'", rootFolderId, projectId, environment);

		return rootFolderId;
	}

	@Nonnull
	protected Optional<SecretFolder> findRootFolder(@Nonnull UUID projectId,
																									@Nonnull String environment) {
		requireNonNull(projectId);
		requireNonNull(environment);

		return getDatabase().queryForObject("""
				SELECT *
				FROM secret_folder
				WHERE project_id=?
				AND environment=?
				AND parent_folder_id IS NULL
				""", SecretFolder.class, projectId, environment);
	}

	@Nonnull
	protected Optional<SecretFolder> findChildFolder(@Nonnull UUID parentFolderId,
																									 @Nonnull String name) {
		requireNonNull(parentFolderId);
		requireNonNull(name);

		return getDatabase().queryForObject("""
				SELECT *
				FROM secret_folder
				WHERE parent_folder_id=?
				AND name=?
				""", SecretFolder.class, parentFolderId, name);
	}

	@Nonnull
	private List<String> splitPath(@Nonnull String normalizedSecretPath) {
		requireNonNull(normalizedSecretPath);

		if (normalizedSecretPath.equals("/"))
			return List.of();

		return List.of(normalizedSecretPath.substring(1).split("/"));
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
