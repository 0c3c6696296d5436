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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.revetware.secretapprovals.util.AuditLogger;
import com.revetware.secretapprovals.util.BlindIndexer;
import com.revetware.secretapprovals.util.ErrorReporter;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Encapsulates system-wide configuration.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class Configuration {
	@Nonnull
	private static final Locale DEFAULT_LOCALE;
	@Nonnull
	private static final ZoneId DEFAULT_TIME_ZONE;
	@Nonnull
	private static final Gson GSON;

	static {
		DEFAULT_LOCALE = Locale.US;
		DEFAULT_TIME_ZONE = ZoneId.of("UTC");
		GSON = new GsonBuilder().disableHtmlEscaping().create();
	}

	/**
	 * How a new approval request relates to the committer's existing open request in the same environment.
	 */
	public enum ApprovalRequestMode {
		// Reuse the committer's open request, replacing its commits
		UPSERT,
		// Always create a new request
		MULTIPLE
	}

	@Nonnull
	private final String environment;
	@Nonnull
	private final ApprovalRequestMode approvalRequestMode;
	@Nonnull
	private final Integer defaultPageSize;
	@Nonnull
	private final Integer maximumPageSize;
	@Nonnull
	private final Long saltCacheMaximumSize;
	@Nonnull
	private final Duration saltCacheExpiration;
	@Nonnull
	private final BlindIndexer.Type blindIndexerType;
	@Nonnull
	private final AuditLogger.Type auditLoggerType;
	@Nonnull
	private final ErrorReporter.Type errorReporterType;

	public Configuration(@Nonnull String environment) {
		requireNonNull(environment);

		ConfigFile configFile = loadConfigFileForEnvironment(environment);

		this.environment = environment;
		this.approvalRequestMode = requireNonNull(configFile.approvalRequestMode());
		this.defaultPageSize = requireNonNull(configFile.defaultPageSize());
		this.maximumPageSize = requireNonNull(configFile.maximumPageSize());
		this.saltCacheMaximumSize = requireNonNull(configFile.saltCache().maximumSize());
		this.saltCacheExpiration = Duration.ofSeconds(configFile.saltCache().expirationInSeconds());
		this.blindIndexerType = configFile.blindIndexer().type();
		this.auditLoggerType = configFile.auditLogger().type();
		this.errorReporterType = configFile.errorReporter().type();

		if (this.defaultPageSize < 1 || this.defaultPageSize > this.maximumPageSize)
			throw new IllegalArgumentException(format("Default page size %d must be between 1 and the maximum page size %d",
					this.defaultPageSize, this.maximumPageSize));

		// Initialize Logback if not done already
		if (System.getProperty("logback.configurationFile") == null)
			System.setProperty("logback.configurationFile", format("config/%s/logback.xml", environment));
	}

	private Configuration(@Nonnull Configuration configuration,
												@Nonnull ApprovalRequestMode approvalRequestMode) {
		requireNonNull(configuration);
		requireNonNull(approvalRequestMode);

		this.environment = configuration.getEnvironment();
		this.approvalRequestMode = approvalRequestMode;
		this.defaultPageSize = configuration.getDefaultPageSize();
		this.maximumPageSize = configuration.getMaximumPageSize();
		this.saltCacheMaximumSize = configuration.getSaltCacheMaximumSize();
		this.saltCacheExpiration = configuration.getSaltCacheExpiration();
		this.blindIndexerType = configuration.getBlindIndexerType();
		this.auditLoggerType = configuration.getAuditLoggerType();
		this.errorReporterType = configuration.getErrorReporterType();
	}

	/**
	 * Returns a copy of this configuration which uses the given request mode.
	 */
	@Nonnull
	public Configuration withApprovalRequestMode(@Nonnull ApprovalRequestMode approvalRequestMode) {
		requireNonNull(approvalRequestMode);
		return new Configuration(this, approvalRequestMode);
	}

	@Nonnull
	private ConfigFile loadConfigFileForEnvironment(@Nonnull String environment) {
		requireNonNull(environment);

		String configFile = format("config/%s/settings.json", environment);

		try (InputStream inputStream = Configuration.class.getClassLoader().getResourceAsStream(configFile)) {
			if (inputStream == null)
				throw new IllegalArgumentException(format("Config file not found on classpath at %s", configFile));

			return GSON.fromJson(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8), ConfigFile.class);
		} catch (IOException e) {
			throw new UncheckedIOException(format("Error reading from %s", configFile), e);
		}
	}

	// Record that maps to the config/{environment}/settings.json file format
	private record ConfigFile(
			@Nonnull ApprovalRequestMode approvalRequestMode,
			@Nonnull Integer defaultPageSize,
			@Nonnull Integer maximumPageSize,
			@Nonnull ConfigSaltCache saltCache,
			@Nonnull ConfigBlindIndexer blindIndexer,
			@Nonnull ConfigAuditLogger auditLogger,
			@Nonnull ConfigErrorReporter errorReporter
	) {
		public ConfigFile {
			requireNonNull(approvalRequestMode);
			requireNonNull(defaultPageSize);
			requireNonNull(maximumPageSize);
			requireNonNull(saltCache);
			requireNonNull(blindIndexer);
			requireNonNull(auditLogger);
			requireNonNull(errorReporter);
		}

		private record ConfigSaltCache(
				@Nonnull Long maximumSize,
				@Nonnull Long expirationInSeconds
		) {
			public ConfigSaltCache {
				requireNonNull(maximumSize);
				requireNonNull(expirationInSeconds);
			}
		}

		private record ConfigBlindIndexer(
				@Nonnull BlindIndexer.Type type
		) {
			public ConfigBlindIndexer {
				requireNonNull(type);
			}
		}

		private record ConfigAuditLogger(
				@Nonnull AuditLogger.Type type
		) {
			public ConfigAuditLogger {
				requireNonNull(type);
			}
		}

		private record ConfigErrorReporter(
				@Nonnull ErrorReporter.Type type
		) {
			public ConfigErrorReporter {
				requireNonNull(type);
			}
		}
	}

	@Nonnull
	public static Locale getDefaultLocale() {
		return DEFAULT_LOCALE;
	}

	@Nonnull
	public static ZoneId getDefaultTimeZone() {
		return DEFAULT_TIME_ZONE;
	}

	@Nonnull
	public String getEnvironment() {
		return this.environment;
	}

	@Nonnull
	public ApprovalRequestMode getApprovalRequestMode() {
		return this.approvalRequestMode;
	}

	@Nonnull
	public Integer getDefaultPageSize() {
		return this.defaultPageSize;
	}

	@Nonnull
	public Integer getMaximumPageSize() {
		return this.maximumPageSize;
	}

	@Nonnull
	public Long getSaltCacheMaximumSize() {
		return this.saltCacheMaximumSize;
	}

	@Nonnull
	public Duration getSaltCacheExpiration() {
		return this.saltCacheExpiration;
	}

	@Nonnull
	public BlindIndexer.Type getBlindIndexerType() {
		return this.blindIndexerType;
	}

	@Nonnull
	public AuditLogger.Type getAuditLoggerType() {
		return this.auditLoggerType;
	}

	@Nonnull
	public ErrorReporter.Type getErrorReporterType() {
		return this.errorReporterType;
	}
}
