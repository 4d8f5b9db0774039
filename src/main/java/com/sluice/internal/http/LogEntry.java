package com.sluice.internal.http;

/**
 * Key-value pair in a transport trace line, e.g. {@code event=read_bytes}.
 */
public record LogEntry(String key, String value) {
}
