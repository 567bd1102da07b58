package minis.protocol;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sequence of values. {@link #NULL} is the {@code *-1} sentinel.
 * Elements are never Java {@code null}; a nested null is a sentinel value.
 */
public final class RespArray extends RespValue {
    public static final RespArray NULL = new RespArray(null);

    private final List<RespValue> elements;

    private RespArray(List<RespValue> elements) {
        this.elements = elements;
    }

    public static RespArray of(List<? extends RespValue> elements) {
        if (elements == null) return NULL;
        List<RespValue> copy = new ArrayList<>(elements.size());
        for (RespValue v : elements) {
            copy.add(Objects.requireNonNull(v, "array element"));
        }
        return new RespArray(Collections.unmodifiableList(copy));
    }

    public static RespArray of(RespValue... elements) {
        return of(Arrays.asList(elements));
    }

    /** Convenience for building requests: every argument becomes a bulk string. */
    public static RespArray ofBulkStrings(String... args) {
        List<RespValue> list = new ArrayList<>(args.length);
        for (String a : args) {
            list.add(RespBulkString.of(a));
        }
        return new RespArray(Collections.unmodifiableList(list));
    }

    /** Empty list for the null sentinel. */
    public List<RespValue> getElements() {
        return elements == null ? Collections.emptyList() : elements;
    }

    public int size() {
        return elements == null ? 0 : elements.size();
    }

    public RespValue get(int index) {
        return getElements().get(index);
    }

    @Override
    public boolean isNull() {
        return elements == null;
    }

    @Override
    public Type getType() {
        return Type.ARRAY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RespArray)) return false;
        return Objects.equals(elements, ((RespArray) o).elements);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(elements);
    }

    @Override
    public String toString() {
        return elements == null ? "*-1" : "*" + elements;
    }
}
