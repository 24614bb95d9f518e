package it.unimib.datai.lambdagateway.gateway.invoke;

import it.unimib.datai.lambdagateway.gateway.route.RouteId;

/**
 * The payload of a request could not be built; the remote function was not called.
 */
public class SetupException extends RuntimeException {
    private final RouteId route;

    public SetupException(RouteId route, Throwable cause) {
        super("Setup failed for route " + route + ": " + cause.getMessage(), cause);
        this.route = route;
    }

    public RouteId route() {
        return route;
    }
}
