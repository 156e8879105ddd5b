package tally.adapter.in.rest;

import java.util.OptionalDouble;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

import org.jboss.logging.Logger;

import tally.adapter.in.dto.IncrementWindowRequest;
import tally.adapter.in.dto.WindowCountRequest;
import tally.adapter.in.dto.WindowCountResponse;
import tally.adapter.in.problem.CounterProblem;
import tally.core.model.counter.CounterKey;
import tally.core.port.in.WindowCounting;
import tally.core.service.BucketKeyScheme;

/**
 * REST resource for sliding-window velocity counters.
 *
 * <p>Both endpoints answer 200 with a count even when the store is down; only
 * malformed requests are rejected.
 */
@Path("/counters")
@ApplicationScoped
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class VelocityCounterResource {

    private static final Logger LOG = Logger.getLogger(VelocityCounterResource.class);

    private final WindowCounting counting;

    public VelocityCounterResource(WindowCounting counting) {
        this.counting = counting;
    }

    /**
     * Count one occurrence and return the window total including it.
     *
     * @param request the counter and its conditions
     * @return the window count, 0 when the conditions are not met
     */
    @POST
    @Path("/increment")
    public WindowCountResponse increment(IncrementWindowRequest request) {
        if (request == null) {
            throw CounterProblem.badRequest("Request body is required");
        }
        final var window = requireCounter(request.key(), request.windowSeconds());
        if (!request.conditionsMet()) {
            LOG.debugv("Skipping increment of {0}, conditions not met", request.key());
            return new WindowCountResponse(request.key(), window, 0);
        }

        final var maxTtl = request.maxTtlSeconds() == null
                ? OptionalDouble.empty()
                : OptionalDouble.of(request.maxTtlSeconds());
        final var count = counting.increment(request.key(), window, maxTtl);
        return new WindowCountResponse(request.key(), window, count);
    }

    /**
     * Read the window total without counting.
     *
     * @param request the counter and its conditions
     * @return the window count, 0 when the conditions are not met
     */
    @POST
    @Path("/query")
    public WindowCountResponse query(WindowCountRequest request) {
        if (request == null) {
            throw CounterProblem.badRequest("Request body is required");
        }
        final var window = requireCounter(request.key(), request.windowSeconds());
        if (!request.conditionsMet()) {
            return new WindowCountResponse(request.key(), window, 0);
        }
        return new WindowCountResponse(request.key(), window, counting.query(request.key(), window));
    }

    private static double requireCounter(String key, Double windowSeconds) {
        if (windowSeconds == null || !CounterKey.isValid(key, windowSeconds)) {
            throw CounterProblem.invalidCounter(key, windowSeconds);
        }
        if (!BucketKeyScheme.withinBucketLimit(windowSeconds)) {
            throw CounterProblem.windowTooLong(windowSeconds, BucketKeyScheme.MAX_BUCKETS);
        }
        return windowSeconds;
    }
}
