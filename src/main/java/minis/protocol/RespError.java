package minis.protocol;

import java.util.Objects;

public final class RespError extends RespValue {
    private final String message;

    public RespError(String message) {
        this.message = Objects.requireNonNull(message, "message");
    }

    public String getMessage() {
        return message;
    }

    @Override
    public Type getType() {
        return Type.ERROR;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespError)) return false;
        return message.equals(((RespError) o).message);
    }

    @Override
    public int hashCode() {
        return message.hashCode();
    }

    @Override
    public String toString() {
        return "-" + message;
    }
}
