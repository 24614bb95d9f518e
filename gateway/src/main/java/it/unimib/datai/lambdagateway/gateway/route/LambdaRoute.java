package it.unimib.datai.lambdagateway.gateway.route;

import it.unimib.datai.lambdagateway.common.model.DeploySpec;
import it.unimib.datai.lambdagateway.gateway.hook.PayloadBuilder;
import it.unimib.datai.lambdagateway.gateway.hook.ResponseFinalizer;

/**
 * Validated and normalized lambda route. Hooks are never null: absent hooks are replaced
 * by {@link PayloadBuilder#requestEnvelope()} and {@link ResponseFinalizer#standard()}.
 */
public record LambdaRoute(
        RouteId id,
        String functionName,
        PayloadBuilder setup,
        ResponseFinalizer complete,
        DeploySpec deploy
) {
    public boolean deploys() {
        return deploy != null;
    }
}
