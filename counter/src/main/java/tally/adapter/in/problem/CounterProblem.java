package tally.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

/**
 * RFC 7807 Problem Details factory for counter API errors.
 *
 * <p>All problems here are 4xx client errors; store failures never reach the
 * HTTP layer because counters fail open.
 */
public final class CounterProblem {

    private CounterProblem() {
        // Utility class - prevent instantiation
    }

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem validationError(String detail) {
        return HttpProblem.builder()
                .withTitle("Validation Error")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem invalidCounter(String key, Double windowSeconds) {
        return validationError("Invalid counter: key '%s' with window %s; key must be non-blank and window positive"
                .formatted(key, windowSeconds));
    }

    public static HttpProblem windowTooLong(double windowSeconds, int maxBuckets) {
        return validationError("Window of %s seconds spans more than %d buckets".formatted(windowSeconds, maxBuckets));
    }
}
