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

import com.revetware.secretapprovals.model.auth.Actor;
import org.slf4j.MDC;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Keeps track of context: which actor/time zone/locale/etc. is applied to the current thread of execution?
 * <p>
 * Bindings nest: {@link #run(Supplier)} restores whatever context was bound before it once the work completes. Context
 * is not inherited by other threads; work handed to an executor must bind its own.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class CurrentContext {
	@Nonnull
	private static final ThreadLocal<CurrentContext> CURRENT_CONTEXT_HOLDER;
	@Nonnull
	private static final String LOGGING_CONTEXT_KEY;

	static {
		CURRENT_CONTEXT_HOLDER = new ThreadLocal<>();
		LOGGING_CONTEXT_KEY = "CURRENT_CONTEXT";
	}

	@Nonnull
	public static CurrentContext get() {
		return find().orElseThrow(() ->
				new IllegalStateException(format("No %s is bound to the current thread", CurrentContext.class.getSimpleName())));
	}

	@Nonnull
	public static Optional<CurrentContext> find() {
		return Optional.ofNullable(CURRENT_CONTEXT_HOLDER.get());
	}

	@NotThreadSafe
	public static class Builder {
		@Nullable
		private Locale locale;
		@Nullable
		private ZoneId timeZone;
		@Nullable
		private Actor actor;

		private Builder() {}

		@Nonnull
		public Builder locale(@Nullable Locale locale) {
			this.locale = locale;
			return this;
		}

		@Nonnull
		public Builder timeZone(@Nullable ZoneId timeZone) {
			this.timeZone = timeZone;
			return this;
		}

		@Nonnull
		public Builder actor(@Nullable Actor actor) {
			this.actor = actor;
			return this;
		}

		@Nonnull
		public CurrentContext build() {
			return new CurrentContext(this);
		}
	}

	@Nonnull
	public static Builder with(@Nullable Locale locale,
														 @Nullable ZoneId timeZone) {
		return new Builder().locale(locale).timeZone(timeZone);
	}

	@Nonnull
	public static Builder withActor(@Nullable Actor actor) {
		return new Builder().actor(actor);
	}

	@Nonnull
	private final Locale locale;
	@Nonnull
	private final ZoneId timeZone;
	@Nullable
	private final Actor actor;

	private CurrentContext(@Nonnull Builder builder) {
		requireNonNull(builder);

		this.timeZone = builder.timeZone == null ? Configuration.getDefaultTimeZone() : builder.timeZone;
		this.locale = builder.locale == null ? Configuration.getDefaultLocale() : builder.locale;
		this.actor = builder.actor;
	}

	public void run(@Nonnull Runnable runnable) {
		requireNonNull(runnable);
		run(() -> {
			runnable.run();
			return null;
		});
	}

	@Nullable
	public <T> T run(@Nonnull Supplier<T> supplier) {
		requireNonNull(supplier);

		// Capture the previous binding and MDC value to restore them later
		CurrentContext previousCurrentContext = CURRENT_CONTEXT_HOLDER.get();
		String previousMdc = MDC.get(LOGGING_CONTEXT_KEY);

		CURRENT_CONTEXT_HOLDER.set(this);

		try {
			MDC.put(LOGGING_CONTEXT_KEY, determineLoggingDescription());
			return supplier.get();
		} finally {
			if (previousCurrentContext != null)
				CURRENT_CONTEXT_HOLDER.set(previousCurrentContext);
			else
				CURRENT_CONTEXT_HOLDER.remove();

			if (previousMdc != null)
				MDC.put(LOGGING_CONTEXT_KEY, previousMdc);
			else
				MDC.remove(LOGGING_CONTEXT_KEY);
		}
	}

	@Override
	public String toString() {
		StringJoiner joiner = new StringJoiner(", ", format("%s{", CurrentContext.class.getSimpleName()), "}");

		getActor().ifPresent(actor -> joiner.add(format("actorId=%s", actor.actorId())));

		joiner.add(format("locale=%s", getLocale().toLanguageTag()));
		joiner.add(format("timeZone=%s", getTimeZone().getId()));

		return joiner.toString();
	}

	@Nonnull
	public Optional<Actor> getActor() {
		return Optional.ofNullable(this.actor);
	}

	@Nonnull
	public ZoneId getTimeZone() {
		return this.timeZone;
	}

	@Nonnull
	public Locale getLocale() {
		return this.locale;
	}

	@Nonnull
	private String determineLoggingDescription() {
		Actor actor = this.getActor().orElse(null);

		if (actor == null)
			return "unauthenticated";

		return format("%s %s (project %s)", actor.actorType().name().toLowerCase(Locale.ROOT), actor.actorId(), actor.projectId());
	}
}
