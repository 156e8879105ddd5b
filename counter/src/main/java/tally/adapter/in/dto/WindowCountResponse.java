package tally.adapter.in.dto;

/**
 * Sliding-window count for a key.
 *
 * @param key           logical counter key
 * @param windowSeconds window length in seconds
 * @param count         occurrences in the window (0 when the store is unavailable)
 */
public record WindowCountResponse(String key, double windowSeconds, long count) {}
