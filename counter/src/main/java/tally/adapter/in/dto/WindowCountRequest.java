package tally.adapter.in.dto;

import java.util.List;

/**
 * DTO for reading a sliding-window count.
 *
 * @param key           logical counter key
 * @param windowSeconds window length in seconds
 * @param whenAll       optional conditions; the count is reported as 0 unless all are true
 */
public record WindowCountRequest(String key, Double windowSeconds, List<Boolean> whenAll) implements GatedRequest {}
