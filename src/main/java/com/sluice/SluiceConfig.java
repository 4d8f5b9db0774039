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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Defines how a Sluice instance is configured: the {@link Server} that owns the sockets, the {@link Application} it
 * fronts, and the hooks that observe its lifecycle.
 * <p>
 * Instances can be acquired via the {@link #withServer(Server)} builder factory method.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class SluiceConfig {
	@NonNull
	private final Server server;
	@NonNull
	private final Application application;
	@NonNull
	private final Lifespan lifespan;
	@NonNull
	private final LifecycleObserver lifecycleObserver;

	/**
	 * Vends a configuration builder for the given server.
	 *
	 * @param server the server necessary for construction
	 * @return a builder for {@link SluiceConfig} instances
	 */
	@NonNull
	public static Builder withServer(@NonNull Server server) {
		requireNonNull(server);
		return new Builder(server);
	}

	protected SluiceConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.application == null)
			throw new IllegalStateException(format("No %s was specified for %s", Application.class.getSimpleName(), SluiceConfig.class.getSimpleName()));

		this.server = builder.server;
		this.application = builder.application;
		this.lifespan = builder.lifespan != null ? builder.lifespan : Lifespan.defaultInstance();
		this.lifecycleObserver = builder.lifecycleObserver != null ? builder.lifecycleObserver : LifecycleObserver.defaultInstance();
	}

	@NonNull
	public Server getServer() {
		return this.server;
	}

	@NonNull
	public Application getApplication() {
		return this.application;
	}

	@NonNull
	public Lifespan getLifespan() {
		return this.lifespan;
	}

	@NonNull
	public LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}

	/**
	 * Builder used to construct instances of {@link SluiceConfig}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private Server server;
		@Nullable
		private Application application;
		@Nullable
		private Lifespan lifespan;
		@Nullable
		private LifecycleObserver lifecycleObserver;

		Builder(@NonNull Server server) {
			requireNonNull(server);
			this.server = server;
		}

		@NonNull
		public Builder server(@NonNull Server server) {
			requireNonNull(server);
			this.server = server;
			return this;
		}

		@NonNull
		public Builder application(@Nullable Application application) {
			this.application = application;
			return this;
		}

		@NonNull
		public Builder lifespan(@Nullable Lifespan lifespan) {
			this.lifespan = lifespan;
			return this;
		}

		@NonNull
		public Builder lifecycleObserver(@Nullable LifecycleObserver lifecycleObserver) {
			this.lifecycleObserver = lifecycleObserver;
			return this;
		}

		@NonNull
		public SluiceConfig build() {
			return new SluiceConfig(this);
		}
	}
}
