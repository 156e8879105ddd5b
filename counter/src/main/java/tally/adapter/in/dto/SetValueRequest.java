package tally.adapter.in.dto;

import java.util.List;

/**
 * DTO for storing a typed cache value.
 *
 * @param value      string, integer or floating-point value (required)
 * @param ttlSeconds optional expiry in seconds; defaults to one day, non-positive stores without expiry
 * @param whenAll    optional conditions; nothing is stored unless all are true
 */
public record SetValueRequest(Object value, Double ttlSeconds, List<Boolean> whenAll) implements GatedRequest {}
