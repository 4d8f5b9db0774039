package com.sluice.internal.http;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Request line and headers of one parsed request, plus the body framing they declare.
 *
 * @param contentLength declared body length, or {@code -1} when the body is chunked
 */
record RequestHead(String method, String target, String version, List<Header> headers, boolean chunked, long contentLength) {

    static final String HTTP_1_0 = "HTTP/1.0";
    static final String HTTP_1_1 = "HTTP/1.1";

    boolean httpOneDotZero() {
        return HTTP_1_0.equalsIgnoreCase(version);
    }

    boolean hasBody() {
        return chunked || contentLength > 0;
    }

    /**
     * Whether any header named {@code headerName} carries {@code token} in its comma-separated value list.
     */
    boolean hasHeaderToken(String headerName, String token) {
        return hasHeaderToken(headers, headerName, token);
    }

    /**
     * Header values grouped by name, preserving arrival order.
     */
    Map<String, List<String>> headerValues() {
        Map<String, List<String>> values = new LinkedHashMap<>();
        for (Header header : headers) {
            values.computeIfAbsent(header.name(), name -> new ArrayList<>()).add(header.value());
        }
        return values;
    }

    static boolean hasHeaderToken(List<Header> headers, String headerName, String token) {
        if (headers == null) {
            return false;
        }
        for (Header header : headers) {
            if (!header.name().equalsIgnoreCase(headerName)) {
                continue;
            }
            String value = header.value();
            if (value == null) {
                continue;
            }
            for (String part : value.split(",")) {
                if (token.equalsIgnoreCase(part.trim())) {
                    return true;
                }
            }
        }
        return false;
    }
}
