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
import com.lokalized.Strings;
import com.pyranid.Database;
import com.pyranid.DatabaseException;
import com.revetware.secretapprovals.exception.ApplicationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.sql.SQLException;
import java.util.Optional;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;

/**
 * Runs service operations inside a database transaction.
 * <p>
 * If a transaction is already open on the current thread the operation joins it, so service methods can call each other
 * freely. The outermost call owns the transaction: it commits on success, rolls back on any exception, retries once when
 * the database reports a transient serialization failure (SQLSTATE class {@code 40}) and converts any other storage
 * failure into a {@code 500} {@link ApplicationException}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class TransactionRunner {
	private static final int MAXIMUM_ATTEMPTS;

	static {
		MAXIMUM_ATTEMPTS = 2;
	}

	@Nonnull
	private final Database database;
	@Nonnull
	private final Strings strings;
	@Nonnull
	private final Logger logger;

	@Inject
	public TransactionRunner(@Nonnull Database database,
													 @Nonnull Strings strings) {
		requireNonNull(database);
		requireNonNull(strings);

		this.database = database;
		this.strings = strings;
		this.logger = LoggerFactory.getLogger(getClass());
	}

	public void performInTransaction(@Nonnull Runnable operation) {
		requireNonNull(operation);

		performInTransaction(() -> {
			operation.run();
			return null;
		});
	}

	@Nullable
	public <T> T performInTransaction(@Nonnull Supplier<T> operation) {
		requireNonNull(operation);

		// Already inside a transaction? Participate in it
		if (getDatabase().currentTransaction().isPresent())
			return operation.get();

		int attempt = 1;

		while (true) {
			try {
				return getDatabase().transaction(() -> {
					return Optional.ofNullable(operation.get());
				}).orElse(null);
			} catch (DatabaseException e) {
				if (attempt < MAXIMUM_ATTEMPTS && isTransientFailure(e)) {
					getLogger().warn("Transient database failure on attempt {}, retrying...", attempt, e);
					++attempt;
					continue;
				}

				throw ApplicationException.storageError(getStrings().get("Unable to complete the operation due to a storage error."), e);
			}
		}
	}

	@Nonnull
	protected Boolean isTransientFailure(@Nonnull Throwable throwable) {
		requireNonNull(throwable);

		Throwable current = throwable;

		while (current != null) {
			if (current instanceof SQLException) {
				String sqlState = ((SQLException) current).getSQLState();

				if (sqlState != null && sqlState.startsWith("40"))
					return true;
			}

			current = current.getCause() == current ? null : current.getCause();
		}

		return false;
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
