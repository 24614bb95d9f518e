package it.unimib.datai.lambdagateway.gateway.deploy;

import it.unimib.datai.lambdagateway.common.platform.FunctionArtifact;
import it.unimib.datai.lambdagateway.common.platform.FunctionHandle;
import it.unimib.datai.lambdagateway.common.platform.FunctionPlatform;
import it.unimib.datai.lambdagateway.gateway.route.LambdaRoute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Bundles a route's code and, when the platform holds deployment credentials, publishes it.
 * Errors from the bundler and the platform are propagated unchanged.
 */
public class FunctionDeployer {
    private static final Logger log = LoggerFactory.getLogger(FunctionDeployer.class);

    private final CodeBundler bundler;
    private final FunctionPlatform platform;
    private final String role;

    public FunctionDeployer(CodeBundler bundler, FunctionPlatform platform, String role) {
        this.bundler = bundler;
        this.platform = platform;
        this.role = role;
    }

    /**
     * Returns the handle of the published function, or empty when publishing is disabled.
     */
    public Optional<FunctionHandle> deploy(LambdaRoute route) throws IOException {
        if (!route.deploys()) {
            return Optional.empty();
        }

        FunctionArtifact artifact = bundler.bundle(route.functionName(), route.deploy());

        if (!platform.canPublish()) {
            log.warn("No deployment credentials configured, route {} is not published and invokes existing function {}",
                    route.id(), route.functionName());
            return Optional.empty();
        }

        FunctionHandle handle = platform.publish(artifact, role);
        log.info("Published function {} for route {} ({} bytes)", handle.functionName(), route.id(), artifact.size());
        return Optional.of(handle);
    }
}
