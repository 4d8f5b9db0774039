/**
 * MIT License
 *
 * Copyright (c) 2022 Elliot Barlas
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.sluice.internal.http;

import java.time.Duration;

/**
 * Transport settings shared by the acceptor and every connection event loop of one server.
 */
public class Options {

    private String host = "0.0.0.0";
    private int port = 8080;
    private int concurrency = Runtime.getRuntime().availableProcessors();
    private boolean reuseAddr = true;
    private Duration resolution = Duration.ofMillis(100);
    private Duration requestTimeout = Duration.ofSeconds(60);
    private Duration keepAliveTimeout = Duration.ofSeconds(5);
    private Duration disconnectGracePeriod = Duration.ofSeconds(5);
    private int readBufferSize = 1_024 * 64;
    private int acceptLength = 0;
    private int maxRequestHeadSize = 1_024 * 64;
    private int maxConnections = 0;
    private int writeHighWatermark = 1_024 * 64;
    private int writeLowWatermark = 1_024 * 16;
    private String serverHeader = "sluice";
    private boolean dateHeaderEnabled = true;

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public int concurrency() {
        return concurrency;
    }

    public boolean reuseAddr() {
        return reuseAddr;
    }

    public Duration resolution() {
        return resolution;
    }

    public Duration requestTimeout() {
        return requestTimeout;
    }

    public Duration keepAliveTimeout() {
        return keepAliveTimeout;
    }

    public Duration disconnectGracePeriod() {
        return disconnectGracePeriod;
    }

    public int readBufferSize() {
        return readBufferSize;
    }

    public int acceptLength() {
        return acceptLength;
    }

    public int maxRequestHeadSize() {
        return maxRequestHeadSize;
    }

    public int maxConnections() {
        return maxConnections;
    }

    public int writeHighWatermark() {
        return writeHighWatermark;
    }

    public int writeLowWatermark() {
        return writeLowWatermark;
    }

    /**
     * @return value for the {@code Server} response header, or {@code null} to omit it
     */
    public String serverHeader() {
        return serverHeader;
    }

    public boolean dateHeaderEnabled() {
        return dateHeaderEnabled;
    }

    public Options withHost(String host) {
        this.host = host;
        return this;
    }

    public Options withPort(int port) {
        this.port = port;
        return this;
    }

    public Options withConcurrency(int concurrency) {
        this.concurrency = concurrency;
        return this;
    }

    public Options withReuseAddr(boolean reuseAddr) {
        this.reuseAddr = reuseAddr;
        return this;
    }

    public Options withResolution(Duration resolution) {
        this.resolution = resolution;
        return this;
    }

    public Options withRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        return this;
    }

    public Options withKeepAliveTimeout(Duration keepAliveTimeout) {
        this.keepAliveTimeout = keepAliveTimeout;
        return this;
    }

    public Options withDisconnectGracePeriod(Duration disconnectGracePeriod) {
        this.disconnectGracePeriod = disconnectGracePeriod;
        return this;
    }

    public Options withReadBufferSize(int readBufferSize) {
        this.readBufferSize = readBufferSize;
        return this;
    }

    public Options withAcceptLength(int acceptLength) {
        this.acceptLength = acceptLength;
        return this;
    }

    public Options withMaxRequestHeadSize(int maxRequestHeadSize) {
        this.maxRequestHeadSize = maxRequestHeadSize;
        return this;
    }

    public Options withMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
        return this;
    }

    public Options withWriteWatermarks(int writeHighWatermark, int writeLowWatermark) {
        if (writeLowWatermark < 0 || writeLowWatermark >= writeHighWatermark) {
            throw new IllegalArgumentException("Write watermarks must satisfy 0 <= low < high");
        }
        this.writeHighWatermark = writeHighWatermark;
        this.writeLowWatermark = writeLowWatermark;
        return this;
    }

    public Options withServerHeader(String serverHeader) {
        this.serverHeader = serverHeader;
        return this;
    }

    public Options withDateHeaderEnabled(boolean dateHeaderEnabled) {
        this.dateHeaderEnabled = dateHeaderEnabled;
        return this;
    }
}
