package io.mcoda.routing;

/**
 * Base type of routing failures. Thrown directly for registry lookups that fail outright, such as
 * an unknown agent slug.
 */
public class RoutingException extends RuntimeException {
    public RoutingException(String message) {
        super(message);
    }

    public RoutingException(String message, Throwable cause) {
        super(message, cause);
    }
}
