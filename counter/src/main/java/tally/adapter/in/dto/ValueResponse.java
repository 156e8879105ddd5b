package tally.adapter.in.dto;

/**
 * A typed cache value, or the caller's default when none is stored.
 *
 * @param key   the cache key
 * @param value the value
 */
public record ValueResponse(String key, Object value) {}
