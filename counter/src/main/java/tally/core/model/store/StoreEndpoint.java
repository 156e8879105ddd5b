package tally.core.model.store;

import java.util.Objects;
import java.util.Optional;

/**
 * One {@code host:port} entry of the store server list.
 *
 * @param host the host name or address
 * @param port the TCP port
 */
public record StoreEndpoint(String host, int port) {

    public StoreEndpoint {
        Objects.requireNonNull(host, "host must not be null");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    /**
     * Parse a {@code host:port} server entry.
     *
     * @param server the configured entry
     * @return the endpoint, or empty if the entry is not exactly {@code host:port} with a valid port
     */
    public static Optional<StoreEndpoint> parse(String server) {
        if (server == null) {
            return Optional.empty();
        }
        final var parts = server.trim().split(":");
        if (parts.length != 2 || parts[0].isBlank()) {
            return Optional.empty();
        }
        try {
            final var port = Integer.parseInt(parts[1]);
            if (port < 1 || port > 65535) {
                return Optional.empty();
            }
            return Optional.of(new StoreEndpoint(parts[0], port));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
