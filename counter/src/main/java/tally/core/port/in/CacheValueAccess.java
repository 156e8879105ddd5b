package tally.core.port.in;

/**
 * Use case for typed values kept in the counter store.
 *
 * <p>Reads return the caller's default when the key is absent, the value does not
 * parse as the requested type, or the store is unavailable. Writes are silently
 * dropped when the store is unavailable.
 */
public interface CacheValueAccess {

    String getString(String key, String defaultValue);

    long getLong(String key, long defaultValue);

    double getDouble(String key, double defaultValue);

    /**
     * Store a string value.
     *
     * @param key the key
     * @param value the value
     * @param ttlSeconds expiry in seconds; zero or negative stores without expiry
     */
    void set(String key, String value, double ttlSeconds);

    void set(String key, long value, double ttlSeconds);

    void set(String key, double value, double ttlSeconds);
}
