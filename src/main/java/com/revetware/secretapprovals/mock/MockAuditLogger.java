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

package com.revetware.secretapprovals.mock;

import com.google.gson.Gson;
import com.revetware.secretapprovals.util.AuditLogger;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static java.util.Objects.requireNonNull;

/**
 * Mock implementation of {@link AuditLogger} which writes events to a logger as JSON and keeps them in memory.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MockAuditLogger implements AuditLogger {
	@NonNull
	private final Gson gson;
	@NonNull
	private final List<@NonNull AuditEvent> recordedEvents;
	@NonNull
	private final Logger logger;

	public MockAuditLogger(@NonNull Gson gson) {
		requireNonNull(gson);

		this.gson = gson;
		this.recordedEvents = new CopyOnWriteArrayList<>();
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@Override
	public void recordEvent(@NonNull AuditEvent auditEvent) {
		requireNonNull(auditEvent);

		getRecordedEvents().add(auditEvent);
		getLogger().info("Audit event {}: {}", auditEvent.eventType().name(), getGson().toJson(auditEvent));
	}

	/**
	 * Events recorded so far, oldest first.
	 */
	@NonNull
	public List<@NonNull AuditEvent> getRecordedEvents() {
		return this.recordedEvents;
	}

	@NonNull
	private Gson getGson() {
		return this.gson;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}
}
