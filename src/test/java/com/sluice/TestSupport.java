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

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
final class TestSupport {
	private TestSupport() {}

	static int findFreePort() throws IOException {
		try (ServerSocket ss = new ServerSocket(0)) {
			ss.setReuseAddress(true);
			return ss.getLocalPort();
		}
	}

	static Socket connectWithRetry(String host, int port, int timeoutMs) throws IOException, InterruptedException {
		long deadline = System.currentTimeMillis() + timeoutMs;
		IOException last = null;
		while (System.currentTimeMillis() < deadline) {
			try {
				Socket s = new Socket();
				s.connect(new InetSocketAddress(host, port), Math.max(250, timeoutMs / 2));
				s.setSoTimeout(5_000);
				return s;
			} catch (IOException e) {
				last = e;
				Thread.sleep(30);
			}
		}
		throw (last != null ? last : new IOException("Unable to connect to " + host + ":" + port));
	}

	static void send(Socket socket, String raw) throws IOException {
		OutputStream out = socket.getOutputStream();
		out.write(raw.getBytes(StandardCharsets.ISO_8859_1));
		out.flush();
	}

	static Server quietServer(int port) {
		return Server.withPort(port)
				.host("127.0.0.1")
				.concurrency(1)
				.shutdownTimeout(Duration.ofSeconds(5))
				.build();
	}

	/**
	 * Reads one response off the socket, honoring Content-Length, chunked framing or read-until-close.
	 */
	static RawResponse readResponse(InputStream in, boolean headRequest) throws IOException {
		String statusLine = readLine(in);
		String[] parts = statusLine.split(" ", 3);
		int statusCode = Integer.parseInt(parts[1]);

		Map<String, String> headers = new LinkedHashMap<>();
		String line;
		while (!(line = readLine(in)).isEmpty()) {
			int colon = line.indexOf(':');
			headers.put(line.substring(0, colon).trim().toLowerCase(Locale.US), line.substring(colon + 1).trim());
		}

		ByteArrayOutputStream body = new ByteArrayOutputStream();

		if (headRequest || statusCode == 204 || statusCode == 304) {
			// no body
		} else if ("chunked".equalsIgnoreCase(headers.get("transfer-encoding"))) {
			while (true) {
				int size = Integer.parseInt(readLine(in).trim(), 16);
				if (size == 0) {
					readLine(in);
					break;
				}
				body.write(readExactly(in, size));
				readLine(in);
			}
		} else if (headers.containsKey("content-length")) {
			body.write(readExactly(in, Integer.parseInt(headers.get("content-length"))));
		} else {
			byte[] buf = new byte[8192];
			int n;
			while ((n = in.read(buf)) != -1)
				body.write(buf, 0, n);
		}

		return new RawResponse(statusCode, headers, body.toString(StandardCharsets.UTF_8));
	}

	static RawResponse readResponse(InputStream in) throws IOException {
		return readResponse(in, false);
	}

	/**
	 * @return {@code true} if the peer closed the connection (EOF or reset) without sending anything more
	 */
	static boolean isClosedByPeer(Socket socket) throws IOException {
		try {
			return socket.getInputStream().read() == -1;
		} catch (java.net.SocketException e) {
			return true;
		}
	}

	private static String readLine(InputStream in) throws IOException {
		ByteArrayOutputStream line = new ByteArrayOutputStream();
		int previous = -1;
		while (true) {
			int b = in.read();
			if (b == -1)
				throw new EOFException("Connection closed mid-line");
			if (previous == '\r' && b == '\n') {
				byte[] bytes = line.toByteArray();
				return new String(bytes, 0, bytes.length - 1, StandardCharsets.ISO_8859_1);
			}
			line.write(b);
			previous = b;
		}
	}

	private static byte[] readExactly(InputStream in, int length) throws IOException {
		byte[] bytes = in.readNBytes(length);
		if (bytes.length != length)
			throw new EOFException("Expected " + length + " bytes, got " + bytes.length);
		return bytes;
	}

	record RawResponse(int statusCode, Map<String, String> headers, String body) {
		Optional<String> header(String name) {
			return Optional.ofNullable(headers.get(name.toLowerCase(Locale.US)));
		}
	}

	static class QuietLifecycleObserver implements LifecycleObserver {
		@Override
		public void didReceiveLogEvent(LogEvent logEvent) {
			// quiet
		}
	}
}
