package minis.protocol;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * RESP codec. {@link #decode(InputStream)} reads exactly one frame and never
 * reads past it, so it can be called repeatedly on the same connection stream.
 */
public final class Resp {
    public static final char ARRAY = '*';
    public static final char BULK_STRING = '$';
    public static final char SIMPLE_STRING = '+';
    public static final char ERROR = '-';
    public static final char INTEGER = ':';

    /** Upper bound for a single header or simple-string line. */
    public static final int MAX_LINE_LENGTH = 64 * 1024;

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] NULL_BULK = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] NULL_ARRAY = "*-1\r\n".getBytes(StandardCharsets.US_ASCII);

    private Resp() {
    }

    // --- SERIALIZATION ---

    public static byte[] encode(RespValue value) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        write(value, bos);
        return bos.toByteArray();
    }

    public static byte[] simpleString(String s) {
        return encode(new RespSimpleString(s));
    }

    public static byte[] error(String s) {
        return encode(new RespError(s));
    }

    public static byte[] bulkString(byte[] b) {
        return encode(RespBulkString.of(b));
    }

    private static void write(RespValue value, ByteArrayOutputStream out) {
        switch (value.getType()) {
            case SIMPLE_STRING:
                writeLine(out, SIMPLE_STRING, ((RespSimpleString) value).getValue());
                break;
            case ERROR:
                writeLine(out, ERROR, ((RespError) value).getMessage());
                break;
            case INTEGER:
                writeLine(out, INTEGER, Long.toString(((RespInteger) value).getValue()));
                break;
            case BULK_STRING: {
                byte[] b = ((RespBulkString) value).getBytes();
                if (b == null) {
                    out.writeBytes(NULL_BULK);
                } else {
                    writeLine(out, BULK_STRING, Integer.toString(b.length));
                    out.writeBytes(b);
                    out.writeBytes(CRLF);
                }
                break;
            }
            case ARRAY: {
                RespArray array = (RespArray) value;
                if (array.isNull()) {
                    out.writeBytes(NULL_ARRAY);
                } else {
                    writeLine(out, ARRAY, Integer.toString(array.size()));
                    for (RespValue element : array.getElements()) {
                        write(element, out);
                    }
                }
                break;
            }
            default:
                throw new IllegalStateException("Unhandled RESP type: " + value.getType());
        }
    }

    private static void writeLine(ByteArrayOutputStream out, char prefix, String text) {
        out.write(prefix);
        out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
        out.writeBytes(CRLF);
    }

    // --- PARSING ---

    /**
     * Reads one frame from the stream, blocking until it is complete.
     *
     * @throws RespException with {@link RespException.Kind#CLEAN_DISCONNECT} if the stream
     *         ends before the first byte of the frame, or another kind for malformed or
     *         truncated input
     * @throws IOException if the underlying stream fails
     */
    public static RespValue decode(InputStream in) throws IOException {
        int prefix = in.read();
        if (prefix == -1) {
            throw new RespException(RespException.Kind.CLEAN_DISCONNECT, "Connection closed");
        }
        return decodeBody(in, prefix);
    }

    private static RespValue decodeElement(InputStream in) throws IOException {
        int prefix = in.read();
        if (prefix == -1) {
            throw new RespException(RespException.Kind.TRUNCATED_INPUT, "Unexpected end of stream inside array");
        }
        return decodeBody(in, prefix);
    }

    private static RespValue decodeBody(InputStream in, int prefix) throws IOException {
        switch (prefix) {
            case SIMPLE_STRING:
                return new RespSimpleString(readLine(in));
            case ERROR:
                return new RespError(readLine(in));
            case INTEGER:
                return new RespInteger(parseLong(readLine(in), "integer"));
            case BULK_STRING:
                return readBulkString(in);
            case ARRAY:
                return readArray(in);
            default:
                throw new RespException(RespException.Kind.UNKNOWN_TYPE,
                        "Unknown RESP type byte: 0x" + Integer.toHexString(prefix));
        }
    }

    private static RespBulkString readBulkString(InputStream in) throws IOException {
        long len = parseLong(readLine(in), "bulk length");
        if (len == -1) return RespBulkString.NULL;
        if (len < 0 || len > Integer.MAX_VALUE - 2) {
            throw new RespException(RespException.Kind.INVALID_INTEGER, "Invalid bulk length: " + len);
        }

        // readNBytes grows its buffer as data arrives, so a bogus length does not allocate up front
        int total = (int) len + 2;
        byte[] data = in.readNBytes(total);
        if (data.length < total) {
            throw new RespException(RespException.Kind.TRUNCATED_INPUT,
                    "Bulk string truncated: expected " + total + " bytes, got " + data.length);
        }
        // Trailing CRLF is consumed, not validated
        byte[] payload = new byte[(int) len];
        System.arraycopy(data, 0, payload, 0, payload.length);
        return RespBulkString.of(payload);
    }

    private static RespArray readArray(InputStream in) throws IOException {
        long count = parseLong(readLine(in), "array length");
        if (count == -1) return RespArray.NULL;
        if (count < 0 || count > Integer.MAX_VALUE) {
            throw new RespException(RespException.Kind.INVALID_INTEGER, "Invalid array length: " + count);
        }

        List<RespValue> elements = new ArrayList<>((int) Math.min(count, 16));
        for (long i = 0; i < count; i++) {
            elements.add(decodeElement(in));
        }
        return RespArray.of(elements);
    }

    private static String readLine(InputStream in) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        int prev = -1;
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                if (prev != '\r') {
                    throw new RespException(RespException.Kind.MALFORMED_LINE, "Line terminated by LF without CR");
                }
                byte[] raw = buffer.toByteArray();
                return new String(raw, 0, raw.length - 1, StandardCharsets.UTF_8);
            }
            if (buffer.size() >= MAX_LINE_LENGTH) {
                throw new RespException(RespException.Kind.MALFORMED_LINE, "Protocol line too long");
            }
            buffer.write(b);
            prev = b;
        }
        throw new RespException(RespException.Kind.MALFORMED_LINE, "Stream ended before CRLF", true);
    }

    private static long parseLong(String line, String what) throws RespException {
        try {
            return Long.parseLong(line);
        } catch (NumberFormatException e) {
            throw new RespException(RespException.Kind.INVALID_INTEGER, "Invalid " + what + ": '" + line + "'");
        }
    }
}
