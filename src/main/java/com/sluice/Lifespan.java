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

/**
 * Application startup and shutdown hooks, each invoked exactly once per serving lifetime by {@link Sluice}.
 * <p>
 * {@link #startup()} runs before the server accepts connections; if it throws, startup is aborted and
 * {@link Sluice#start()} fails with a {@link com.sluice.exception.LifespanException}.
 * {@link #shutdown()} runs after every connection has been drained (or force-closed) and should complete promptly.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface Lifespan {
	default void startup() throws Exception {
		// No-op by default
	}

	default void shutdown() throws Exception {
		// No-op by default
	}

	/**
	 * Acquires a {@link Lifespan} that does nothing.
	 *
	 * @return a no-op lifespan
	 */
	static Lifespan defaultInstance() {
		return DefaultLifespan.INSTANCE;
	}

	final class DefaultLifespan implements Lifespan {
		private static final DefaultLifespan INSTANCE = new DefaultLifespan();

		private DefaultLifespan() {}
	}
}
