package com.sluice.internal.http;

import com.sluice.exception.MalformedRequestException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Incremental HTTP/1.1 request parser.
 * <p>
 * Each call to {@link #next()} consumes as much of the tokenizer as it can and reports one {@link Event}. A request
 * is reported as {@link Event#HEAD_COMPLETE}, then zero or more {@link Event#BODY_CHUNK}s, then
 * {@link Event#MESSAGE_COMPLETE}, after which the parser is ready for the next pipelined request. Body chunks are
 * handed out as soon as their bytes arrive, for both {@code Content-Length} and chunked bodies.
 * <p>
 * Framing errors are thrown as {@link MalformedRequestException}; a request head larger than the configured maximum
 * is reported with status 431.
 */
class RequestParser {

    enum Event {
        NEED_MORE_DATA,
        HEAD_COMPLETE,
        BODY_CHUNK,
        MESSAGE_COMPLETE
    }

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] SPACE = " ".getBytes(StandardCharsets.US_ASCII);

    private static final String HEADER_CONTENT_LENGTH = "Content-Length";
    private static final String HEADER_TRANSFER_ENCODING = "Transfer-Encoding";
    private static final String CHUNKED = "chunked";
    private static final String HTTP_PREFIX = "HTTP/";

    private static final int RADIX_HEX = 16;

    enum State {
        METHOD(p -> p.tokenizer.next(SPACE), RequestParser::parseMethod),
        TARGET(p -> p.tokenizer.next(SPACE), RequestParser::parseTarget),
        VERSION(p -> p.tokenizer.next(CRLF), RequestParser::parseVersion),
        HEADER(p -> p.tokenizer.next(CRLF), RequestParser::parseHeader),
        BODY(p -> p.tokenizer.nextUpTo(p.bodyRemaining), RequestParser::parseBody),
        CHUNK_SIZE(p -> p.tokenizer.next(CRLF), RequestParser::parseChunkSize),
        CHUNK_DATA(p -> p.tokenizer.nextUpTo(p.chunkRemaining), RequestParser::parseChunkData),
        CHUNK_DATA_END(p -> p.tokenizer.next(CRLF), RequestParser::parseChunkDataEnd),
        CHUNK_TRAILER(p -> p.tokenizer.next(CRLF), RequestParser::parseChunkTrailer),
        DONE(null, null);

        final Function<RequestParser, byte[]> tokenSupplier;
        final BiFunction<RequestParser, byte[], Event> tokenConsumer;

        State(Function<RequestParser, byte[]> tokenSupplier, BiFunction<RequestParser, byte[], Event> tokenConsumer) {
            this.tokenSupplier = tokenSupplier;
            this.tokenConsumer = tokenConsumer;
        }

        boolean head() {
            return this == METHOD || this == TARGET || this == VERSION || this == HEADER;
        }

        boolean chunkLine() {
            return this == CHUNK_SIZE || this == CHUNK_DATA_END || this == CHUNK_TRAILER;
        }
    }

    private final ByteTokenizer tokenizer;
    private final int maxHeadSize;

    private State state = State.METHOD;
    private int headBytes;
    private int trailerBytes;
    private long bodyRemaining;
    private long chunkRemaining;

    private String method;
    private String target;
    private String version;
    private List<Header> headers = new ArrayList<>();
    private RequestHead head;
    private byte[] chunk;

    RequestParser(ByteTokenizer tokenizer, int maxHeadSize) {
        this.tokenizer = tokenizer;
        this.maxHeadSize = maxHeadSize;
    }

    Event next() {
        while (true) {
            if (state == State.DONE) {
                reset();
                return Event.MESSAGE_COMPLETE;
            }
            int before = tokenizer.remaining();
            byte[] token = state.tokenSupplier.apply(this);
            if (token == null) {
                if (state.head()) {
                    if (headBytes + tokenizer.remaining() > maxHeadSize) {
                        throw new MalformedRequestException("request head exceeds " + maxHeadSize + " bytes", 431);
                    }
                    if ((state == State.METHOD || state == State.TARGET) && tokenizer.contains(CRLF)) {
                        throw new MalformedRequestException("malformed request line");
                    }
                } else if (state.chunkLine()) {
                    checkChunkLine(tokenizer.remaining());
                    if (state == State.CHUNK_DATA_END && tokenizer.remaining() >= CRLF.length) {
                        throw new MalformedRequestException("chunk data not terminated by CRLF");
                    }
                }
                return Event.NEED_MORE_DATA;
            }
            if (state.head()) {
                headBytes += before - tokenizer.remaining();
                if (headBytes > maxHeadSize) {
                    throw new MalformedRequestException("request head exceeds " + maxHeadSize + " bytes", 431);
                }
            } else if (state.chunkLine()) {
                checkChunkLine(token.length);
            }
            Event event = state.tokenConsumer.apply(this, token);
            if (event != null) {
                return event;
            }
        }
    }

    /**
     * The head reported by the most recent {@link Event#HEAD_COMPLETE}.
     */
    RequestHead head() {
        return head;
    }

    /**
     * The bytes reported by the most recent {@link Event#BODY_CHUNK}.
     */
    byte[] chunk() {
        return chunk;
    }

    /**
     * Whether some, but not all, of a request head has arrived.
     */
    boolean hasPartialHead() {
        return state.head() && (headBytes > 0 || tokenizer.remaining() > 0);
    }

    // Chunk-size, chunk terminator and trailer lines are bounded like the head
    private void checkChunkLine(int lineBytes) {
        if (lineBytes > maxHeadSize) {
            throw new MalformedRequestException("chunked body line exceeds " + maxHeadSize + " bytes");
        }
    }

    private void reset() {
        state = State.METHOD;
        headBytes = 0;
        trailerBytes = 0;
        bodyRemaining = 0;
        chunkRemaining = 0;
        method = null;
        target = null;
        version = null;
        headers = new ArrayList<>();
        chunk = null;
    }

    private Event parseMethod(byte[] token) {
        requireToken(token, "method");
        method = new String(token, StandardCharsets.US_ASCII);
        state = State.TARGET;
        return null;
    }

    private Event parseTarget(byte[] token) {
        if (token.length == 0) {
            throw new MalformedRequestException("empty request target");
        }
        for (byte b : token) {
            if ((b & 0x80) != 0 || b < 0x21 || b == 0x7F) {
                throw new MalformedRequestException("invalid request target");
            }
        }
        target = new String(token, StandardCharsets.US_ASCII);
        state = State.VERSION;
        return null;
    }

    private Event parseVersion(byte[] token) {
        String value = new String(token, StandardCharsets.US_ASCII);
        if (!value.startsWith(HTTP_PREFIX)) {
            throw new MalformedRequestException("invalid http version");
        }
        if (!value.equals(RequestHead.HTTP_1_1) && !value.equals(RequestHead.HTTP_1_0)) {
            throw new MalformedRequestException("unsupported http version " + value, 505);
        }
        version = value;
        state = State.HEADER;
        return null;
    }

    private Event parseHeader(byte[] token) {
        if (token.length > 0) {
            headers.add(parseHeaderLine(token));
            return null;
        }

        // CR-LF on own line, end of headers
        Long contentLength = findContentLength();
        boolean hasTransferEncodingHeader = hasTransferEncodingHeader();
        List<String> transferEncodings = findTransferEncodings();

        if (hasTransferEncodingHeader && transferEncodings.isEmpty()) {
            throw new MalformedRequestException("invalid transfer-encoding header value");
        }
        if (contentLength != null && hasTransferEncodingHeader) {
            throw new MalformedRequestException("multiple message lengths");
        }

        boolean chunked = false;
        if (hasTransferEncodingHeader) {
            if (!hasOnlyChunkedEncoding(transferEncodings)) {
                throw new MalformedRequestException("unsupported transfer-encoding", 501);
            }
            chunked = true;
            state = State.CHUNK_SIZE;
        } else if (contentLength != null && contentLength > 0) {
            bodyRemaining = contentLength;
            state = State.BODY;
        } else {
            state = State.DONE;
        }

        head = new RequestHead(method, target, version, List.copyOf(headers), chunked,
                chunked ? -1 : (contentLength == null ? 0 : contentLength));
        return Event.HEAD_COMPLETE;
    }

    private static Header parseHeaderLine(byte[] line) {
        if (line[0] == ' ' || line[0] == '\t') {
            throw new MalformedRequestException("obsolete header line folding");
        }
        int colonIndex = indexOfColon(line);
        if (colonIndex <= 0) {
            throw new MalformedRequestException("malformed header line");
        }
        for (int i = 0; i < colonIndex; i++) {
            int b = line[i] & 0xFF;
            if (b > 0x7F || b <= 0x20) {
                throw new MalformedRequestException("invalid header name");
            }
        }
        int start = colonIndex + 1;
        while (start < line.length && (line[start] == ' ' || line[start] == '\t')) {
            start++;
        }
        int end = line.length;
        while (end > start && (line[end - 1] == ' ' || line[end - 1] == '\t')) {
            end--;
        }
        return new Header(
                new String(line, 0, colonIndex, StandardCharsets.US_ASCII),
                new String(line, start, end - start, StandardCharsets.ISO_8859_1));
    }

    private static int indexOfColon(byte[] line) {
        for (int i = 0; i < line.length; i++) {
            if (line[i] == ':') {
                return i;
            }
        }
        return -1;
    }

    private static void requireToken(byte[] token, String field) {
        if (token.length == 0) {
            throw new MalformedRequestException("empty " + field);
        }
        for (byte b : token) {
            if ((b & 0x80) != 0 || b <= 0x20 || b == 0x7F) {
                throw new MalformedRequestException("invalid " + field);
            }
        }
    }

    private Event parseBody(byte[] token) {
        chunk = token;
        bodyRemaining -= token.length;
        if (bodyRemaining == 0) {
            state = State.DONE;
        }
        return Event.BODY_CHUNK;
    }

    private Event parseChunkSize(byte[] token) {
        int end = token.length;
        for (int i = 0; i < token.length; i++) {
            if (token[i] == ';') {
                end = i;
                break;
            }
        }
        String sizeToken = new String(token, 0, end, StandardCharsets.US_ASCII).trim();
        if (sizeToken.isEmpty()) {
            throw new MalformedRequestException("invalid chunk size");
        }
        long chunkSize;
        try {
            chunkSize = Long.parseLong(sizeToken, RADIX_HEX);
        } catch (NumberFormatException e) {
            throw new MalformedRequestException("invalid chunk size", e);
        }
        if (chunkSize < 0) {
            throw new MalformedRequestException("invalid chunk size");
        }
        chunkRemaining = chunkSize;
        state = chunkSize == 0
                ? State.CHUNK_TRAILER
                : State.CHUNK_DATA;
        return null;
    }

    private Event parseChunkData(byte[] token) {
        chunk = token;
        chunkRemaining -= token.length;
        if (chunkRemaining == 0) {
            state = State.CHUNK_DATA_END;
        }
        return Event.BODY_CHUNK;
    }

    private Event parseChunkDataEnd(byte[] token) {
        if (token.length != 0) {
            throw new MalformedRequestException("chunk data not terminated by CRLF");
        }
        state = State.CHUNK_SIZE;
        return null;
    }

    private Event parseChunkTrailer(byte[] token) {
        // blank line indicates end of trailers; trailer fields themselves are dropped
        if (token.length == 0) {
            state = State.DONE;
            return null;
        }
        trailerBytes += token.length + CRLF.length;
        if (trailerBytes > maxHeadSize) {
            throw new MalformedRequestException("request trailers exceed " + maxHeadSize + " bytes", 431);
        }
        return null;
    }

    private Long findContentLength() {
        Long contentLength = null;
        for (Header header : headers) {
            if (!header.name().equalsIgnoreCase(HEADER_CONTENT_LENGTH)) {
                continue;
            }
            if (contentLength != null) {
                throw new MalformedRequestException("multiple content-length headers");
            }
            String value = header.value() == null ? "" : header.value().trim();
            if (value.isEmpty() || !value.chars().allMatch(Character::isDigit)) {
                throw new MalformedRequestException("invalid content-length header value");
            }
            try {
                contentLength = Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new MalformedRequestException("invalid content-length header value", e);
            }
        }
        return contentLength;
    }

    private boolean hasTransferEncodingHeader() {
        for (Header header : headers) {
            if (header.name().equalsIgnoreCase(HEADER_TRANSFER_ENCODING)) {
                return true;
            }
        }
        return false;
    }

    private List<String> findTransferEncodings() {
        List<String> transferEncodings = new ArrayList<>();
        for (Header header : headers) {
            if (!header.name().equalsIgnoreCase(HEADER_TRANSFER_ENCODING)) {
                continue;
            }
            String value = header.value();
            if (value == null) {
                continue;
            }
            for (String part : value.split(",")) {
                String normalized = normalizeTransferEncoding(part);
                if (normalized != null) {
                    transferEncodings.add(normalized);
                }
            }
        }
        return transferEncodings;
    }

    private String normalizeTransferEncoding(String value) {
        String trimmed = value.trim();
        int semicolon = trimmed.indexOf(';');
        String token = (semicolon == -1 ? trimmed : trimmed.substring(0, semicolon)).trim();
        return token.isEmpty() ? null : token.toLowerCase(Locale.ROOT);
    }

    private boolean hasOnlyChunkedEncoding(List<String> transferEncodings) {
        return transferEncodings.size() == 1 && CHUNKED.equals(transferEncodings.get(0));
    }

}
