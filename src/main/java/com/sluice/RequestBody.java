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

import com.sluice.exception.ClientDisconnectedException;
import com.sluice.exception.MalformedRequestException;
import org.jspecify.annotations.NonNull;

import java.io.ByteArrayOutputStream;
import java.util.Optional;

/**
 * Pull-style access to a request body, chunk by chunk, in the order the bytes arrived.
 * <p>
 * The body is a finite, non-restartable sequence: each chunk is handed out at most once, and once the end has been
 * reached every further call reports the end again.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public interface RequestBody {
	/**
	 * Blocks until the next chunk of body data is available, the body has ended, or the exchange is abandoned.
	 *
	 * @return the next chunk, or {@link Optional#empty()} once the body has been fully consumed
	 * @throws ClientDisconnectedException if the client disconnected or the exchange was cancelled
	 * @throws MalformedRequestException   if the body's framing turned out to be invalid
	 */
	@NonNull
	Optional<byte[]> readChunk();

	/**
	 * Reads every remaining chunk and concatenates them.
	 *
	 * @return the rest of the body, possibly empty
	 * @throws ClientDisconnectedException if the client disconnected or the exchange was cancelled
	 * @throws MalformedRequestException   if the body's framing turned out to be invalid
	 */
	@NonNull
	default byte[] readAllBytes() {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();

		while (true) {
			byte[] chunk = readChunk().orElse(null);

			if (chunk == null)
				return bytes.toByteArray();

			bytes.writeBytes(chunk);
		}
	}
}
