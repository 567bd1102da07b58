package minis.db;

/**
 * A stored string value and its absolute expiry in epoch millis ({@code -1} = never).
 * Entries are replaced, never mutated, so a reader holding one sees a consistent pair.
 */
public final class ValueEntry {
    public static final long NO_EXPIRY = -1;

    private final byte[] value;
    private final long expireAt;

    public ValueEntry(byte[] value, long expireAt) {
        this.value = value;
        this.expireAt = expireAt;
    }

    public byte[] getValue() {
        return value;
    }

    public long getExpireAt() {
        return expireAt;
    }

    public boolean hasExpiry() {
        return expireAt != NO_EXPIRY;
    }

    // An entry is gone from the instant it expires, so a TTL of 0 is never visible.
    public boolean isExpired(long now) {
        return expireAt != NO_EXPIRY && now >= expireAt;
    }
}
