package minikv.db;

/**
 * One stored row. Immutable: a SET replaces the whole entry, value and deadline together.
 */
public final class ValueEntry {
    private final String value;
    private final long expireAt;

    public ValueEntry(String value, long expireAt) {
        this.value = value;
        this.expireAt = expireAt;
    }

    public String getValue() {
        return value;
    }

    /** Absolute deadline in epoch millis. */
    public long getExpireAt() {
        return expireAt;
    }

    /** An entry is gone from the moment its deadline is reached. */
    public boolean isExpired(long now) {
        return now >= expireAt;
    }
}
