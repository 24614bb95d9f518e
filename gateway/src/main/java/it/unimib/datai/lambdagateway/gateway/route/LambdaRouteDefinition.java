package it.unimib.datai.lambdagateway.gateway.route;

import it.unimib.datai.lambdagateway.common.model.DeploySpec;
import it.unimib.datai.lambdagateway.gateway.hook.PayloadBuilder;
import it.unimib.datai.lambdagateway.gateway.hook.ResponseFinalizer;

/**
 * Raw, not yet validated configuration of a lambda route.
 * Declare instances as beans to register routes programmatically.
 */
public record LambdaRouteDefinition(
        String method,
        String path,
        String name,
        PayloadBuilder setup,
        ResponseFinalizer complete,
        DeploySpec deploy
) {
    public static LambdaRouteDefinition of(String method, String path, String name) {
        return new LambdaRouteDefinition(method, path, name, null, null, null);
    }

    public LambdaRouteDefinition withSetup(PayloadBuilder setup) {
        return new LambdaRouteDefinition(method, path, name, setup, complete, deploy);
    }

    public LambdaRouteDefinition withComplete(ResponseFinalizer complete) {
        return new LambdaRouteDefinition(method, path, name, setup, complete, deploy);
    }

    public LambdaRouteDefinition withDeploy(DeploySpec deploy) {
        return new LambdaRouteDefinition(method, path, name, setup, complete, deploy);
    }

    public RouteId id() {
        return RouteId.of(method, path);
    }
}
