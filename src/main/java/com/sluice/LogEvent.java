/*
 * Copyright 2022-2026 Revetware LLC.
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

package com.sluice;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Something noteworthy that happened inside Sluice, delivered to {@link LifecycleObserver#didReceiveLogEvent(LogEvent)}.
 * <p>
 * Events tied to a connection carry its remote address; events tied to an exchange also carry the {@link Request}
 * and, once known, the {@link CycleOutcome} the exchange ended with.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class LogEvent {
	@NonNull
	private final LogEventType logEventType;
	@NonNull
	private final String message;
	@Nullable
	private final Throwable throwable;
	@Nullable
	private final Request request;
	@Nullable
	private final InetSocketAddress remoteAddress;
	@Nullable
	private final CycleOutcome cycleOutcome;

	@NonNull
	public static Builder with(@NonNull LogEventType logEventType,
														 @NonNull String message) {
		requireNonNull(logEventType);
		requireNonNull(message);

		return new Builder(logEventType, message);
	}

	protected LogEvent(@NonNull Builder builder) {
		requireNonNull(builder);

		this.logEventType = builder.logEventType;
		this.message = builder.message;
		this.throwable = builder.throwable;
		this.request = builder.request;
		this.cycleOutcome = builder.cycleOutcome;

		InetSocketAddress remoteAddress = builder.remoteAddress;

		if (remoteAddress == null && builder.request != null)
			remoteAddress = builder.request.getRemoteAddress().orElse(null);

		this.remoteAddress = remoteAddress;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{logEventType=%s, message=%s, remoteAddress=%s, cycleOutcome=%s, throwable=%s}", getClass().getSimpleName(),
				getLogEventType(), getMessage(), getRemoteAddress().orElse(null), getCycleOutcome().orElse(null), getThrowable().orElse(null));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof LogEvent logEvent))
			return false;

		return Objects.equals(getLogEventType(), logEvent.getLogEventType())
				&& Objects.equals(getMessage(), logEvent.getMessage())
				&& Objects.equals(getThrowable(), logEvent.getThrowable())
				&& Objects.equals(getRequest(), logEvent.getRequest())
				&& Objects.equals(getRemoteAddress(), logEvent.getRemoteAddress())
				&& Objects.equals(getCycleOutcome(), logEvent.getCycleOutcome());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getLogEventType(), getMessage(), getThrowable(), getRequest(), getRemoteAddress(), getCycleOutcome());
	}

	@NonNull
	public LogEventType getLogEventType() {
		return this.logEventType;
	}

	@NonNull
	public String getMessage() {
		return this.message;
	}

	@NonNull
	public Optional<Throwable> getThrowable() {
		return Optional.ofNullable(this.throwable);
	}

	@NonNull
	public Optional<Request> getRequest() {
		return Optional.ofNullable(this.request);
	}

	/**
	 * The peer this event concerns. Falls back to the request's remote address when only a request was supplied.
	 */
	@NonNull
	public Optional<InetSocketAddress> getRemoteAddress() {
		return Optional.ofNullable(this.remoteAddress);
	}

	/**
	 * How the exchange ended, for events raised when an exchange reaches its terminal outcome.
	 */
	@NonNull
	public Optional<CycleOutcome> getCycleOutcome() {
		return Optional.ofNullable(this.cycleOutcome);
	}

	/**
	 * Builder used to construct instances of {@link LogEvent}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final LogEventType logEventType;
		@NonNull
		private final String message;
		@Nullable
		private Throwable throwable;
		@Nullable
		private Request request;
		@Nullable
		private InetSocketAddress remoteAddress;
		@Nullable
		private CycleOutcome cycleOutcome;

		protected Builder(@NonNull LogEventType logEventType,
											@NonNull String message) {
			requireNonNull(logEventType);
			requireNonNull(message);

			this.logEventType = logEventType;
			this.message = message;
		}

		@NonNull
		public Builder throwable(@Nullable Throwable throwable) {
			this.throwable = throwable;
			return this;
		}

		@NonNull
		public Builder request(@Nullable Request request) {
			this.request = request;
			return this;
		}

		@NonNull
		public Builder remoteAddress(@Nullable InetSocketAddress remoteAddress) {
			this.remoteAddress = remoteAddress;
			return this;
		}

		@NonNull
		public Builder cycleOutcome(@Nullable CycleOutcome cycleOutcome) {
			this.cycleOutcome = cycleOutcome;
			return this;
		}

		@NonNull
		public LogEvent build() {
			return new LogEvent(this);
		}
	}
}
