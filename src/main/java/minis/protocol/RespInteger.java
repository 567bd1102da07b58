package minis.protocol;

public final class RespInteger extends RespValue {
    private final long value;

    public RespInteger(long value) {
        this.value = value;
    }

    public long getValue() {
        return value;
    }

    @Override
    public Type getType() {
        return Type.INTEGER;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespInteger)) return false;
        return value == ((RespInteger) o).value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return ":" + value;
    }
}
