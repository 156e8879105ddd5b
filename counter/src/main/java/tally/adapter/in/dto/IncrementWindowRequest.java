package tally.adapter.in.dto;

import java.util.List;

/**
 * DTO for counting one occurrence in a sliding window.
 *
 * @param key           logical counter key (required, e.g., "acct:123:login_attempts")
 * @param windowSeconds window length in seconds (required, positive)
 * @param maxTtlSeconds optional cap on bucket retention
 * @param whenAll       optional conditions; the counter is left untouched unless all are true
 */
public record IncrementWindowRequest(String key, Double windowSeconds, Double maxTtlSeconds, List<Boolean> whenAll)
        implements GatedRequest {}
