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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;

import static java.util.Objects.requireNonNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class DefaultLifecycleObserver implements LifecycleObserver {
	@Nonnull
	private static final DefaultLifecycleObserver DEFAULT_INSTANCE;
	@Nonnull
	private static final Logger LOGGER;

	static {
		DEFAULT_INSTANCE = new DefaultLifecycleObserver();
		LOGGER = LoggerFactory.getLogger("com.sluice");
	}

	@Nonnull
	public static DefaultLifecycleObserver defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	static void log(@Nonnull LogEvent logEvent) {
		requireNonNull(logEvent);

		String message = logEvent.getRequest().isPresent()
				? logEvent.getMessage() + " [" + logEvent.getRequest().get() + "]"
				: logEvent.getMessage();

		if (logEvent.getCycleOutcome().isPresent())
			message = message + " (outcome " + logEvent.getCycleOutcome().get().name() + ")";
		Throwable throwable = logEvent.getThrowable().orElse(null);

		switch (logEvent.getLogEventType()) {
			// Routine client behavior, not worth a warning
			case CLIENT_DISCONNECTED, REQUEST_TIMEOUT, SERVER_UNPARSEABLE_REQUEST, CONNECTION_REJECTED -> {
				if (LOGGER.isDebugEnabled())
					LOGGER.debug("[{}] {}", logEvent.getLogEventType().name(), message, throwable);
			}
			case REQUEST_LIMIT_REACHED, CONFIGURATION_UNSUPPORTED ->
					LOGGER.info("[{}] {}", logEvent.getLogEventType().name(), message, throwable);
			default -> LOGGER.warn("[{}] {}", logEvent.getLogEventType().name(), message, throwable);
		}
	}

	// No method overrides
}
