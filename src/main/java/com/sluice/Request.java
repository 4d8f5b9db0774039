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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Description of an HTTP request handed to an {@link Application}: request line, headers and a lazily-read body.
 * <p>
 * Header names are case-insensitive.  Repeated headers keep every value, in arrival order.
 * <p>
 * Instances are constructed by the server via {@link #with(String, String)}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Request {
	@NonNull
	private final String id;
	@NonNull
	private final String method;
	@NonNull
	private final String target;
	@NonNull
	private final String path;
	@Nullable
	private final String query;
	@NonNull
	private final String httpVersion;
	@NonNull
	private final Map<@NonNull String, @NonNull List<@NonNull String>> headers;
	@Nullable
	private final InetSocketAddress remoteAddress;
	@NonNull
	private final RequestBody body;

	/**
	 * Acquires a builder for {@link Request} instances.
	 *
	 * @param method the HTTP method, e.g. {@code GET}
	 * @param target the raw request target, e.g. {@code /widgets?color=red}
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull String method,
														 @NonNull String target) {
		requireNonNull(method);
		requireNonNull(target);

		return new Builder(method, target);
	}

	protected Request(@NonNull Builder builder) {
		requireNonNull(builder);

		this.id = builder.id != null ? builder.id : "0";
		this.method = builder.method;
		this.target = builder.target;
		this.httpVersion = builder.httpVersion != null ? builder.httpVersion : "HTTP/1.1";
		this.remoteAddress = builder.remoteAddress;
		this.body = builder.body != null ? builder.body : EmptyRequestBody.INSTANCE;

		int queryIndex = this.target.indexOf('?');
		this.path = queryIndex == -1 ? this.target : this.target.substring(0, queryIndex);
		this.query = queryIndex == -1 ? null : this.target.substring(queryIndex + 1);

		Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		if (builder.headers != null)
			for (Map.Entry<String, List<String>> entry : builder.headers.entrySet())
				headers.computeIfAbsent(entry.getKey(), name -> new ArrayList<>()).addAll(entry.getValue());

		headers.replaceAll((name, values) -> Collections.unmodifiableList(values));
		this.headers = Collections.unmodifiableMap(headers);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{id=%s, method=%s, target=%s, httpVersion=%s}", getClass().getSimpleName(),
				getId(), getMethod(), getTarget(), getHttpVersion());
	}

	/**
	 * Server-assigned identifier, unique per server instance, of the form {@code <connection>-<sequence>}.
	 *
	 * @return the request identifier
	 */
	@NonNull
	public String getId() {
		return this.id;
	}

	@NonNull
	public String getMethod() {
		return this.method;
	}

	/**
	 * The request target exactly as it appeared on the request line.
	 *
	 * @return the raw request target
	 */
	@NonNull
	public String getTarget() {
		return this.target;
	}

	/**
	 * The request target up to (not including) the first {@code ?}, still percent-encoded.
	 *
	 * @return the path
	 */
	@NonNull
	public String getPath() {
		return this.path;
	}

	/**
	 * The raw query string after the first {@code ?}, if any.
	 *
	 * @return the query string, or {@link Optional#empty()} if the target has none
	 */
	@NonNull
	public Optional<String> getQuery() {
		return Optional.ofNullable(this.query);
	}

	@NonNull
	public String getHttpVersion() {
		return this.httpVersion;
	}

	@NonNull
	public Map<@NonNull String, @NonNull List<@NonNull String>> getHeaders() {
		return this.headers;
	}

	/**
	 * The first value of the named header, if present.
	 *
	 * @param name the case-insensitive header name
	 * @return the first header value, or {@link Optional#empty()} if absent
	 */
	@NonNull
	public Optional<String> getHeader(@NonNull String name) {
		requireNonNull(name);

		List<String> values = getHeaders().get(name);
		return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(0));
	}

	@NonNull
	public Optional<InetSocketAddress> getRemoteAddress() {
		return Optional.ofNullable(this.remoteAddress);
	}

	@NonNull
	public RequestBody getBody() {
		return this.body;
	}

	/**
	 * Builder used to construct instances of {@link Request} via {@link Request#with(String, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String method;
		@NonNull
		private final String target;
		@Nullable
		private String id;
		@Nullable
		private String httpVersion;
		@Nullable
		private Map<String, List<String>> headers;
		@Nullable
		private InetSocketAddress remoteAddress;
		@Nullable
		private RequestBody body;

		protected Builder(@NonNull String method,
											@NonNull String target) {
			requireNonNull(method);
			requireNonNull(target);

			this.method = method;
			this.target = target;
		}

		@NonNull
		public Builder id(@Nullable String id) {
			this.id = id;
			return this;
		}

		@NonNull
		public Builder httpVersion(@Nullable String httpVersion) {
			this.httpVersion = httpVersion;
			return this;
		}

		@NonNull
		public Builder headers(@Nullable Map<String, List<String>> headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public Builder remoteAddress(@Nullable InetSocketAddress remoteAddress) {
			this.remoteAddress = remoteAddress;
			return this;
		}

		@NonNull
		public Builder body(@Nullable RequestBody body) {
			this.body = body;
			return this;
		}

		@NonNull
		public Request build() {
			return new Request(this);
		}
	}

	private static final class EmptyRequestBody implements RequestBody {
		private static final EmptyRequestBody INSTANCE = new EmptyRequestBody();

		@Override
		@NonNull
		public Optional<byte[]> readChunk() {
			return Optional.empty();
		}
	}
}
