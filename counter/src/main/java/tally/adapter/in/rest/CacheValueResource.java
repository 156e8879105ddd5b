package tally.adapter.in.rest;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import org.jboss.logging.Logger;

import tally.adapter.in.dto.GatedRequest;
import tally.adapter.in.dto.SetValueRequest;
import tally.adapter.in.dto.ValueResponse;
import tally.adapter.in.problem.CounterProblem;
import tally.core.port.in.CacheValueAccess;

/**
 * REST resource for typed cache values shared between rule evaluations.
 *
 * <p>Reads answer the caller's {@code default} whenever no usable value is stored.
 */
@Path("/values/{key}")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class CacheValueResource {

    private static final Logger LOG = Logger.getLogger(CacheValueResource.class);

    static final double DEFAULT_TTL_SECONDS = 86_400;

    private final CacheValueAccess values;

    public CacheValueResource(CacheValueAccess values) {
        this.values = values;
    }

    /**
     * Read a string value.
     *
     * @param key the cache key
     * @param def value to answer when nothing usable is stored
     * @param whenAll optional repeated conditions; {@code def} is answered unless all are true
     * @return the value
     */
    @GET
    @Path("/string")
    public ValueResponse getString(
            @PathParam("key") String key,
            @QueryParam("default") @DefaultValue("") String def,
            @QueryParam("whenAll") List<Boolean> whenAll) {
        if (!GatedRequest.allTrue(whenAll)) {
            return new ValueResponse(key, def);
        }
        return new ValueResponse(key, values.getString(key, def));
    }

    @GET
    @Path("/int")
    public ValueResponse getInt(
            @PathParam("key") String key,
            @QueryParam("default") @DefaultValue("0") long def,
            @QueryParam("whenAll") List<Boolean> whenAll) {
        if (!GatedRequest.allTrue(whenAll)) {
            return new ValueResponse(key, def);
        }
        return new ValueResponse(key, values.getLong(key, def));
    }

    @GET
    @Path("/float")
    public ValueResponse getFloat(
            @PathParam("key") String key,
            @QueryParam("default") @DefaultValue("0") double def,
            @QueryParam("whenAll") List<Boolean> whenAll) {
        if (!GatedRequest.allTrue(whenAll)) {
            return new ValueResponse(key, def);
        }
        return new ValueResponse(key, values.getDouble(key, def));
    }

    /**
     * Store a value. Strings, integers and floats keep their type.
     *
     * @param key the cache key
     * @param request the value, its ttl and conditions
     * @return 204 No Content, also when the conditions are not met
     */
    @PUT
    @Consumes(MediaType.APPLICATION_JSON)
    public Response set(@PathParam("key") String key, SetValueRequest request) {
        if (request == null || request.value() == null) {
            throw CounterProblem.badRequest("A value is required");
        }
        if (!request.conditionsMet()) {
            LOG.debugv("Skipping set of {0}, conditions not met", key);
            return Response.noContent().build();
        }

        final var ttl = request.ttlSeconds() == null ? DEFAULT_TTL_SECONDS : request.ttlSeconds();
        final var value = request.value();
        if (value instanceof String s) {
            values.set(key, s, ttl);
        } else if (value instanceof Double || value instanceof Float || value instanceof BigDecimal) {
            values.set(key, ((Number) value).doubleValue(), ttl);
        } else if (value instanceof BigInteger big) {
            values.set(key, toLong(big), ttl);
        } else if (value instanceof Number n) {
            values.set(key, n.longValue(), ttl);
        } else {
            throw CounterProblem.validationError(
                    "Unsupported value type %s; expected string, integer or float"
                            .formatted(value.getClass().getSimpleName()));
        }
        return Response.noContent().build();
    }

    private static long toLong(BigInteger value) {
        try {
            return value.longValueExact();
        } catch (ArithmeticException e) {
            throw CounterProblem.validationError("Integer value %s is out of range".formatted(value));
        }
    }
}
