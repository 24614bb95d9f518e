package it.unimib.datai.lambdagateway.gateway.deploy;

import it.unimib.datai.lambdagateway.gateway.route.RouteId;

/**
 * Bundling or publishing of a route failed at startup. Carries the original error as cause
 * and reuses its message.
 */
public class DeploymentException extends RuntimeException {
    private final RouteId route;

    public DeploymentException(RouteId route, Throwable cause) {
        super(cause.getMessage(), cause);
        this.route = route;
    }

    public RouteId route() {
        return route;
    }
}
