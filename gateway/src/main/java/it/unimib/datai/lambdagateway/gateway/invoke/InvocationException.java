package it.unimib.datai.lambdagateway.gateway.invoke;

import it.unimib.datai.lambdagateway.common.platform.RemoteResult;
import it.unimib.datai.lambdagateway.gateway.route.RouteId;

import java.util.Optional;

/**
 * The remote call failed, timed out, or the function reported an error.
 */
public class InvocationException extends RuntimeException {
    private final RouteId route;
    private final String functionName;
    private final RemoteResult result;

    public InvocationException(RouteId route, RemoteResult result) {
        super("Invocation of " + result.functionName() + " failed for route " + route + ": " + result.functionError());
        this.route = route;
        this.functionName = result.functionName();
        this.result = result;
    }

    public InvocationException(RouteId route, String functionName, Throwable cause) {
        super("Invocation of " + functionName + " failed for route " + route + ": " + cause, cause);
        this.route = route;
        this.functionName = functionName;
        this.result = null;
    }

    public RouteId route() {
        return route;
    }

    public String functionName() {
        return functionName;
    }

    /**
     * The result the function returned when it reported an error, empty when the call itself failed.
     */
    public Optional<RemoteResult> result() {
        return Optional.ofNullable(result);
    }
}
