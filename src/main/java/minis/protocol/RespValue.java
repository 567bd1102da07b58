package minis.protocol;

/**
 * A decoded or to-be-encoded RESP value.
 * The set of subclasses is closed: {@link RespSimpleString}, {@link RespError},
 * {@link RespInteger}, {@link RespBulkString} and {@link RespArray}.
 * Callers switch on {@link #getType()} instead of instanceof chains.
 */
public abstract class RespValue {

    public enum Type {
        SIMPLE_STRING,
        ERROR,
        INTEGER,
        BULK_STRING,
        ARRAY
    }

    // Only subclasses in this package.
    RespValue() {
    }

    public abstract Type getType();

    /** True for the {@code $-1} and {@code *-1} sentinels. */
    public boolean isNull() {
        return false;
    }
}
