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

package com.revetware.secretapprovals.util;

import com.google.inject.Inject;
import com.pyranid.Database;
import com.pyranid.TransactionResult;
import com.revetware.secretapprovals.util.AuditLogger.AuditEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Hands audit events to the {@link AuditLogger} once the enclosing transaction has committed.
 * <p>
 * Events for rolled-back work are dropped. A failing audit logger is logged and reported, and never affects the caller.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AuditEventRecorder {
	@Nonnull
	private final AuditLogger auditLogger;
	@Nonnull
	private final ErrorReporter errorReporter;
	@Nonnull
	private final Database database;
	@Nonnull
	private final Logger logger;

	@Inject
	public AuditEventRecorder(@Nonnull AuditLogger auditLogger,
														@Nonnull ErrorReporter errorReporter,
														@Nonnull Database database) {
		requireNonNull(auditLogger);
		requireNonNull(errorReporter);
		requireNonNull(database);

		this.auditLogger = auditLogger;
		this.errorReporter = errorReporter;
		this.database = database;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	public void recordAfterCommit(@Nonnull AuditEvent auditEvent) {
		requireNonNull(auditEvent);

		if (getDatabase().currentTransaction().isPresent()) {
			getDatabase().currentTransaction().get().addPostTransactionOperation((transactionResult) -> {
				if (transactionResult == TransactionResult.COMMITTED)
					record(auditEvent);
				else
					getLogger().debug("Dropping {} audit event, transaction did not commit", auditEvent.eventType().name());
			});
		} else {
			record(auditEvent);
		}
	}

	protected void record(@Nonnull AuditEvent auditEvent) {
		requireNonNull(auditEvent);

		try {
			getAuditLogger().recordEvent(auditEvent);
		} catch (RuntimeException e) {
			Map<String, Object> context = new LinkedHashMap<>();
			context.put("eventType", auditEvent.eventType().name());
			context.put("projectId", auditEvent.projectId());

			Object approvalRequestId = auditEvent.metadata().get("approvalRequestId");

			if (approvalRequestId != null)
				context.put("approvalRequestId", approvalRequestId);

			getLogger().warn(format("Unable to record %s audit event for project ID %s",
					auditEvent.eventType().name(), auditEvent.projectId()), e);
			getErrorReporter().reportError("Unable to record audit event", e, context);
		}
	}

	@Nonnull
	private AuditLogger getAuditLogger() {
		return this.auditLogger;
	}

	@Nonnull
	private ErrorReporter getErrorReporter() {
		return this.errorReporter;
	}

	@Nonnull
	private Database getDatabase() {
		return this.database;
	}

	@Nonnull
	private Logger getLogger() {
		return this.logger;
	}
}
