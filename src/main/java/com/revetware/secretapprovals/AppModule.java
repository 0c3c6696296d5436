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
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import com.google.inject.AbstractModule;
import com.google.inject.Injector;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.lokalized.DefaultStrings;
import com.lokalized.LocalizedStringLoader;
import com.lokalized.Strings;
import com.pyranid.Database;
import com.pyranid.DefaultInstanceProvider;
import com.pyranid.DefaultStatementLogger;
import com.pyranid.StatementContext;
import com.pyranid.StatementLog;
import com.revetware.secretapprovals.mock.MockAuditLogger;
import com.revetware.secretapprovals.mock.MockBlindIndexer;
import com.revetware.secretapprovals.mock.MockErrorReporter;
import com.revetware.secretapprovals.util.AuditLogger;
import com.revetware.secretapprovals.util.BlindIndexer;
import com.revetware.secretapprovals.util.ErrorReporter;
import com.revetware.secretapprovals.util.LoggingRedactor;
import org.hsqldb.jdbc.JDBCDataSource;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.io.IOException;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.UUID;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class AppModule extends AbstractModule {
	@Nonnull
	private final Configuration configuration;

	public AppModule(@Nonnull Configuration configuration) {
		requireNonNull(configuration);
		this.configuration = configuration;
	}

	@Nonnull
	@Provides
	@Singleton
	public Configuration provideConfiguration() {
		return this.configuration;
	}

	// What context is bound to the current thread?
	@Nonnull
	@Provides
	public CurrentContext provideCurrentContext() {
		return CurrentContext.get();
	}

	// Provides a way to talk to a relational database
	@Nonnull
	@Provides
	@Singleton
	public Database provideDatabase(@Nonnull Injector injector) {
		requireNonNull(injector);

		// In-memory datasource for HSQLDB.
		// Each App instance gets its own isolated database to support parallel test execution in the same JVM instance
		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", UUID.randomUUID()));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		// Use Pyranid to simplify JDBC operations
		return Database.forDataSource(dataSource)
				// Use Google Guice when Pyranid needs to vend instances
				.instanceProvider(new DefaultInstanceProvider() {
					@Override
					@Nonnull
					public <T> T provide(@Nonnull StatementContext<T> statementContext,
															 @Nonnull Class<T> instanceType) {
						return injector.getInstance(instanceType);
					}
				})
				.statementLogger(new DefaultStatementLogger() {
					@Nonnull
					private final Logger logger = LoggerFactory.getLogger("com.revetware.secretapprovals.StatementLogger");

					@Override
					public void log(@Nonnull StatementLog statementLog) {
						if (logger.isTraceEnabled())
							logger.trace("SQL took {}ms:\n{}\nParameters: {}", format("%.2f", statementLog.getTotalDuration().toNanos() / 1000000.0),
									statementLog.getStatementContext().getStatement().getSql().stripIndent().trim(),
									LoggingRedactor.redact(String.valueOf(statementLog.getStatementContext().getParameters())));
					}
				})
				.build();
	}

	// Provides context-aware localization
	@Nonnull
	@Provides
	@Singleton
	public Strings provideStrings() {
		String defaultLanguageCode = Configuration.getDefaultLocale().getLanguage();

		return new DefaultStrings.Builder(defaultLanguageCode,
				() -> LocalizedStringLoader.loadFromFilesystem(Paths.get("src/main/resources/strings")))
				// Rely on the current context's preferred locale (if any) to pick the appropriate localization file
				.localeSupplier(() -> CurrentContext.find()
						.map(CurrentContext::getLocale)
						.orElse(Configuration.getDefaultLocale()))
				.build();
	}

	@Nonnull
	@Provides
	@Singleton
	public BlindIndexer provideBlindIndexer(@NonNull Configuration configuration) {
		requireNonNull(configuration);

		BlindIndexer blindIndexer = null;

		switch (configuration.getBlindIndexerType()) {
			case MOCK -> blindIndexer = new MockBlindIndexer(configuration.getSaltCacheMaximumSize(), configuration.getSaltCacheExpiration());
			case REAL ->
					throw new IllegalStateException(format("Need to create a real %s implementation", BlindIndexer.class.getSimpleName()));
		}

		return blindIndexer;
	}

	@Nonnull
	@Provides
	@Singleton
	public AuditLogger provideAuditLogger(@NonNull Configuration configuration,
																				@NonNull Gson gson) {
		requireNonNull(configuration);
		requireNonNull(gson);

		AuditLogger auditLogger = null;

		switch (configuration.getAuditLoggerType()) {
			case MOCK -> auditLogger = new MockAuditLogger(gson);
			case REAL ->
					throw new IllegalStateException(format("Need to create a real %s implementation", AuditLogger.class.getSimpleName()));
		}

		return auditLogger;
	}

	@Nonnull
	@Provides
	@Singleton
	public ErrorReporter provideErrorReporter(@NonNull Configuration configuration) {
		requireNonNull(configuration);

		ErrorReporter errorReporter = null;

		switch (configuration.getErrorReporterType()) {
			case MOCK -> errorReporter = new MockErrorReporter();
			case REAL ->
					throw new IllegalStateException(format("Need to create a real %s implementation", ErrorReporter.class.getSimpleName()));
		}

		return errorReporter;
	}

	// Supports "complex" types to/from JSON, e.g. audit event payloads
	@Nonnull
	@Provides
	@Singleton
	public Gson provideGson() {
		return new GsonBuilder()
				.disableHtmlEscaping()
				// Use ISO formatting for Instants
				.registerTypeAdapter(Instant.class, new TypeAdapter<Instant>() {
					@Override
					public void write(@Nonnull JsonWriter jsonWriter,
														@Nullable Instant instant) throws IOException {
						if (instant == null)
							jsonWriter.nullValue();
						else
							jsonWriter.value(instant.toString());
					}

					@Override
					@Nullable
					public Instant read(@Nonnull JsonReader jsonReader) throws IOException {
						return Instant.parse(jsonReader.nextString());
					}
				})
				.create();
	}
}
