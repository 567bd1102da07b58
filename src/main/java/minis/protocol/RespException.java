package minis.protocol;

import java.io.IOException;

/**
 * Decoding failure. Every kind is fatal to the connection that produced it;
 * {@link Kind#CLEAN_DISCONNECT} is the peer closing between frames and is not an error condition.
 */
public class RespException extends IOException {

    public enum Kind {
        UNKNOWN_TYPE,
        MALFORMED_LINE,
        INVALID_INTEGER,
        TRUNCATED_INPUT,
        CLEAN_DISCONNECT
    }

    private final Kind kind;
    private final boolean endOfInput;

    public RespException(Kind kind, String message) {
        this(kind, message, kind == Kind.TRUNCATED_INPUT || kind == Kind.CLEAN_DISCONNECT);
    }

    public RespException(Kind kind, String message, boolean endOfInput) {
        super(message);
        this.kind = kind;
        this.endOfInput = endOfInput;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * True when the stream ran out before the frame was complete. A buffering
     * reader can retry once more bytes arrive; a blocking reader has hit EOF.
     */
    public boolean isEndOfInput() {
        return endOfInput;
    }

    public boolean isCleanDisconnect() {
        return kind == Kind.CLEAN_DISCONNECT;
    }
}
