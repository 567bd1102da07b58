package minis.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Length-prefixed binary string. {@link #NULL} is the {@code $-1} sentinel,
 * which is distinct from an empty bulk string.
 */
public final class RespBulkString extends RespValue {
    public static final RespBulkString NULL = new RespBulkString(null);

    private final byte[] bytes;

    private RespBulkString(byte[] bytes) {
        this.bytes = bytes;
    }

    /** Wraps the given array without copying; callers must not mutate it afterwards. */
    public static RespBulkString of(byte[] bytes) {
        return bytes == null ? NULL : new RespBulkString(bytes);
    }

    public static RespBulkString of(String s) {
        return s == null ? NULL : new RespBulkString(s.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] getBytes() {
        return bytes;
    }

    public String asString() {
        return bytes == null ? null : new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean isNull() {
        return bytes == null;
    }

    @Override
    public Type getType() {
        return Type.BULK_STRING;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespBulkString)) return false;
        return Arrays.equals(bytes, ((RespBulkString) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return bytes == null ? "$-1" : "$\"" + asString() + "\"";
    }
}
