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

import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.util.Modules;
import com.pyranid.Database;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * Encapsulates the entire system in a single reusable type.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class App {
	@NonNull
	private final Configuration configuration;
	@NonNull
	private final Injector injector;
	@NonNull
	private final Logger logger;

	public App(@NonNull Configuration configuration,
						 @Nullable Module... testingModules) {
		requireNonNull(configuration);

		// Use Guice modules for DI.
		// Also permit overrides for testing, e.g. swap in a failing audit logger
		Module module = new AppModule(configuration);

		if (testingModules != null && testingModules.length > 0)
			module = Modules.override(module).with(testingModules);

		this.configuration = configuration;
		this.injector = Guice.createInjector(module);
		this.logger = LoggerFactory.getLogger(App.class);

		initializeDatabase();

		getLogger().debug("Secret approvals app initialized in {} environment ({} request mode)",
				configuration.getEnvironment(), configuration.getApprovalRequestMode().name());
	}

	// A real system would keep its table creates/DDL in migration files outside of Java code
	private void initializeDatabase() {
		Database database = getInjector().getInstance(Database.class);

		database.execute("""
				CREATE TABLE secret_folder (
					secret_folder_id UUID PRIMARY KEY,
					project_id UUID NOT NULL,
					environment VARCHAR(64) NOT NULL,
					parent_folder_id UUID REFERENCES secret_folder(secret_folder_id) ON DELETE CASCADE,
					name VARCHAR(256) NOT NULL,
					created_at TIMESTAMP DEFAULT NOW() NOT NULL
				)
				""");

		database.execute("CREATE UNIQUE INDEX secret_folder_name_unique_idx ON secret_folder(project_id, environment, parent_folder_id, name)");

		// Secret names are never stored in plaintext: blind_index is the lookup key, the key columns hold ciphertext
		database.execute("""
				CREATE TABLE secret (
					secret_id UUID PRIMARY KEY,
					project_id UUID NOT NULL,
					environment VARCHAR(64) NOT NULL,
					secret_folder_id UUID NOT NULL,
					type VARCHAR(16) NOT NULL,
					blind_index VARCHAR(128) NOT NULL,
					version INTEGER NOT NULL,
					secret_key_ciphertext VARCHAR(16000) NOT NULL,
					secret_key_iv VARCHAR(128) NOT NULL,
					secret_key_tag VARCHAR(128) NOT NULL,
					secret_value_ciphertext VARCHAR(16000) NOT NULL,
					secret_value_iv VARCHAR(128) NOT NULL,
					secret_value_tag VARCHAR(128) NOT NULL,
					secret_comment_ciphertext VARCHAR(16000),
					secret_comment_iv VARCHAR(128),
					secret_comment_tag VARCHAR(128),
					skip_multiline_encoding BOOLEAN DEFAULT FALSE NOT NULL,
					algorithm VARCHAR(32) NOT NULL,
					key_encoding VARCHAR(32) NOT NULL,
					created_at TIMESTAMP DEFAULT NOW() NOT NULL,
					updated_at TIMESTAMP DEFAULT NOW() NOT NULL,
					CONSTRAINT secret_type_check CHECK (type IN ('SHARED', 'PERSONAL')),
					CONSTRAINT secret_version_check CHECK (version >= 1)
				)
				""");

		database.execute("CREATE UNIQUE INDEX secret_blind_index_unique_idx ON secret(project_id, environment, secret_folder_id, type, blind_index)");

		// No foreign key to secret: versions outlive a deleted secret
		database.execute("""
				CREATE TABLE secret_version (
					secret_version_id UUID PRIMARY KEY,
					secret_id UUID NOT NULL,
					version INTEGER NOT NULL,
					project_id UUID NOT NULL,
					environment VARCHAR(64) NOT NULL,
					secret_folder_id UUID NOT NULL,
					type VARCHAR(16) NOT NULL,
					blind_index VARCHAR(128) NOT NULL,
					secret_key_ciphertext VARCHAR(16000) NOT NULL,
					secret_key_iv VARCHAR(128) NOT NULL,
					secret_key_tag VARCHAR(128) NOT NULL,
					secret_value_ciphertext VARCHAR(16000) NOT NULL,
					secret_value_iv VARCHAR(128) NOT NULL,
					secret_value_tag VARCHAR(128) NOT NULL,
					secret_comment_ciphertext VARCHAR(16000),
					secret_comment_iv VARCHAR(128),
					secret_comment_tag VARCHAR(128),
					skip_multiline_encoding BOOLEAN DEFAULT FALSE NOT NULL,
					algorithm VARCHAR(32) NOT NULL,
					key_encoding VARCHAR(32) NOT NULL,
					is_deleted BOOLEAN DEFAULT FALSE NOT NULL,
					created_at TIMESTAMP DEFAULT NOW() NOT NULL,
					CONSTRAINT secret_version_unique_idx UNIQUE (secret_id, version)
				)
				""");

		database.execute("CREATE SEQUENCE approval_policy_sequence START WITH 1");

		database.execute("""
				CREATE TABLE approval_policy (
					approval_policy_id UUID PRIMARY KEY,
					creation_sequence BIGINT NOT NULL,
					project_id UUID NOT NULL,
					environment VARCHAR(64) NOT NULL,
					secret_path VARCHAR(1024),
					name VARCHAR(256) NOT NULL,
					required_approvals INTEGER NOT NULL,
					created_at TIMESTAMP DEFAULT NOW() NOT NULL,
					updated_at TIMESTAMP DEFAULT NOW() NOT NULL,
					CONSTRAINT approval_policy_required_approvals_check CHECK (required_approvals >= 1)
				)
				""");

		database.execute("CREATE INDEX approval_policy_environment_idx ON approval_policy(project_id, environment)");

		database.execute("""
				CREATE TABLE approval_policy_approver (
					approval_policy_id UUID NOT NULL REFERENCES approval_policy(approval_policy_id) ON DELETE CASCADE,
					approver_id UUID NOT NULL,
					PRIMARY KEY (approval_policy_id, approver_id)
				)
				""");

		database.execute("CREATE SEQUENCE approval_request_sequence START WITH 1");

		// Policies are referenced, never owned: deleting one leaves its requests (and their snapshots) intact
		database.execute("""
				CREATE TABLE approval_request (
					approval_request_id UUID PRIMARY KEY,
					request_sequence BIGINT NOT NULL,
					slug VARCHAR(16) NOT NULL,
					project_id UUID NOT NULL,
					environment VARCHAR(64) NOT NULL,
					secret_folder_id UUID NOT NULL,
					approval_policy_id UUID REFERENCES approval_policy(approval_policy_id) ON DELETE SET NULL,
					committer_id UUID NOT NULL,
					status VARCHAR(16) NOT NULL,
					has_merged BOOLEAN DEFAULT FALSE NOT NULL,
					status_changed_by UUID,
					open_committer_id UUID,
					required_approvals INTEGER NOT NULL,
					created_at TIMESTAMP DEFAULT NOW() NOT NULL,
					updated_at TIMESTAMP DEFAULT NOW() NOT NULL,
					CONSTRAINT approval_request_slug_unique_idx UNIQUE (slug),
					CONSTRAINT approval_request_open_committer_unique_idx UNIQUE (project_id, environment, open_committer_id),
					CONSTRAINT approval_request_status_check CHECK (status IN ('OPEN', 'CLOSED'))
				)
				""");

		database.execute("CREATE INDEX approval_request_committer_idx ON approval_request(project_id, environment, committer_id, status)");

		database.execute("""
				CREATE TABLE approval_request_approver (
					approval_request_id UUID NOT NULL REFERENCES approval_request(approval_request_id) ON DELETE CASCADE,
					approver_id UUID NOT NULL,
					PRIMARY KEY (approval_request_id, approver_id)
				)
				""");

		database.execute("""
				CREATE TABLE approval_commit (
					approval_commit_id UUID PRIMARY KEY,
					approval_request_id UUID NOT NULL REFERENCES approval_request(approval_request_id) ON DELETE CASCADE,
					commit_order INTEGER NOT NULL,
					operation VARCHAR(16) NOT NULL,
					secret_id UUID,
					secret_version_id UUID,
					secret_blind_index VARCHAR(128) NOT NULL,
					version INTEGER NOT NULL,
					secret_key_ciphertext VARCHAR(16000),
					secret_key_iv VARCHAR(128),
					secret_key_tag VARCHAR(128),
					secret_value_ciphertext VARCHAR(16000),
					secret_value_iv VARCHAR(128),
					secret_value_tag VARCHAR(128),
					secret_comment_ciphertext VARCHAR(16000),
					secret_comment_iv VARCHAR(128),
					secret_comment_tag VARCHAR(128),
					skip_multiline_encoding BOOLEAN,
					algorithm VARCHAR(32),
					key_encoding VARCHAR(32),
					created_at TIMESTAMP DEFAULT NOW() NOT NULL,
					CONSTRAINT approval_commit_operation_check CHECK (operation IN ('CREATE', 'UPDATE', 'DELETE'))
				)
				""");

		database.execute("CREATE INDEX approval_commit_request_idx ON approval_commit(approval_request_id, commit_order)");

		database.execute("""
				CREATE TABLE approval_review (
					approval_request_id UUID NOT NULL REFERENCES approval_request(approval_request_id) ON DELETE CASCADE,
					reviewer_id UUID NOT NULL,
					status VARCHAR(16) NOT NULL,
					created_at TIMESTAMP DEFAULT NOW() NOT NULL,
					updated_at TIMESTAMP DEFAULT NOW() NOT NULL,
					PRIMARY KEY (approval_request_id, reviewer_id),
					CONSTRAINT approval_review_status_check CHECK (status IN ('PENDING', 'APPROVED', 'REJECTED'))
				)
				""");
	}

	@NonNull
	public Configuration getConfiguration() {
		return this.configuration;
	}

	@NonNull
	public Injector getInjector() {
		return this.injector;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
