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

import com.revetware.secretapprovals.util.ErrorReporter;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static com.revetware.secretapprovals.util.Normalizer.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * {@link ErrorReporter} for local runs and tests.
 * <p>
 * Each report is logged with its context appended, e.g.
 * {@code Unable to record audit event [approvalRequestId=..., eventType=SECRET_APPROVAL_MERGED, projectId=...]},
 * and kept in memory so tests can assert on what was reported.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MockErrorReporter implements ErrorReporter {
	@NonNull
	private final List<@NonNull ReportedError> reportedErrors;
	@NonNull
	private final Logger logger;

	public MockErrorReporter() {
		this.reportedErrors = new CopyOnWriteArrayList<>();
		this.logger = LoggerFactory.getLogger(getClass());
	}

	@Override
	public void reportError(@Nullable String message,
													@Nullable Throwable throwable,
													@NonNull Map<@NonNull String, @NonNull Object> context) {
		requireNonNull(context);

		ReportedError reportedError = new ReportedError(trimAggressivelyToNull(message), throwable, context);
		getReportedErrors().add(reportedError);

		if (throwable != null)
			getLogger().error(reportedError.describe(), throwable);
		else
			getLogger().error(reportedError.describe());
	}

	@NonNull
	public List<@NonNull ReportedError> getReportedErrors() {
		return this.reportedErrors;
	}

	@NonNull
	private Logger getLogger() {
		return this.logger;
	}

	public record ReportedError(
			@Nullable String message,
			@Nullable Throwable throwable,
			@NonNull Map<@NonNull String, @NonNull Object> context
	) {
		public ReportedError {
			requireNonNull(context);
			// Sorted so the description is stable
			context = Collections.unmodifiableMap(new TreeMap<>(context));
		}

		@NonNull
		public String describe() {
			String description = message;

			if (description == null)
				description = throwable == null ? "Unexpected error" : format("Unexpected %s", throwable.getClass().getSimpleName());

			if (context.isEmpty())
				return description;

			return format("%s [%s]", description, context.entrySet().stream()
					.map(entry -> format("%s=%s", entry.getKey(), entry.getValue()))
					.collect(Collectors.joining(", ")));
		}
	}
}
