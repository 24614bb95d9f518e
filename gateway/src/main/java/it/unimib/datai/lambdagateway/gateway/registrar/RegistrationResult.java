package it.unimib.datai.lambdagateway.gateway.registrar;

import it.unimib.datai.lambdagateway.gateway.deploy.DeploymentException;
import it.unimib.datai.lambdagateway.gateway.route.ConfigurationException;
import it.unimib.datai.lambdagateway.gateway.route.LambdaRoute;
import it.unimib.datai.lambdagateway.gateway.route.RouteId;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.ServerResponse;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of registering the lambda routes: either the router binding every route, or the
 * first failure with the error exactly as it was raised.
 */
public final class RegistrationResult {
    private final RouterFunction<ServerResponse> router;
    private final List<LambdaRoute> routes;
    private final Failure failure;

    private RegistrationResult(RouterFunction<ServerResponse> router, List<LambdaRoute> routes, Failure failure) {
        this.router = router;
        this.routes = routes;
        this.failure = failure;
    }

    static RegistrationResult registered(RouterFunction<ServerResponse> router, List<LambdaRoute> routes) {
        return new RegistrationResult(router, List.copyOf(routes), null);
    }

    static RegistrationResult failed(RouteId route, Stage stage, Throwable error) {
        return new RegistrationResult(null, List.of(), new Failure(route, stage, error));
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public List<LambdaRoute> routes() {
        return routes;
    }

    public Optional<RouterFunction<ServerResponse>> router() {
        return Optional.ofNullable(router);
    }

    public Optional<Failure> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Returns the router, or throws the failure: configuration errors as they are,
     * deployment errors as a {@link DeploymentException} caused by the original error.
     */
    public RouterFunction<ServerResponse> routerOrThrow() {
        if (failure == null) {
            return router;
        }
        if (failure.error() instanceof ConfigurationException configurationError) {
            throw configurationError;
        }
        throw new DeploymentException(failure.route(), failure.error());
    }

    public enum Stage {
        VALIDATION,
        DEPLOYMENT
    }

    public record Failure(RouteId route, Stage stage, Throwable error) {
    }
}
