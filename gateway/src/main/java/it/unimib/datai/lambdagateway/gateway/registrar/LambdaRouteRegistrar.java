package it.unimib.datai.lambdagateway.gateway.registrar;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimib.datai.lambdagateway.common.platform.FunctionPlatform;
import it.unimib.datai.lambdagateway.gateway.deploy.DeploymentCache;
import it.unimib.datai.lambdagateway.gateway.deploy.FunctionDeployer;
import it.unimib.datai.lambdagateway.gateway.invoke.InvocationPipeline;
import it.unimib.datai.lambdagateway.gateway.metrics.GatewayMetrics;
import it.unimib.datai.lambdagateway.gateway.route.ConfigurationException;
import it.unimib.datai.lambdagateway.gateway.route.LambdaConfigValidator;
import it.unimib.datai.lambdagateway.gateway.route.LambdaRoute;
import it.unimib.datai.lambdagateway.gateway.route.LambdaRouteDefinition;
import it.unimib.datai.lambdagateway.gateway.route.RouteId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Registers lambda routes once, before the server starts accepting requests: validates every
 * route, deploys the routes that ask for it, then binds an {@link InvocationPipeline} per route.
 * Owns the {@link DeploymentCache} shared by those pipelines.
 */
public class LambdaRouteRegistrar {
    private static final Logger log = LoggerFactory.getLogger(LambdaRouteRegistrar.class);

    private final LambdaConfigValidator validator;
    private final FunctionDeployer deployer;
    private final FunctionPlatform platform;
    private final ObjectMapper objectMapper;
    private final Duration invokeTimeout;
    private final GatewayMetrics metrics;
    private final DeploymentCache deploymentCache = new DeploymentCache();

    public LambdaRouteRegistrar(LambdaConfigValidator validator,
                                FunctionDeployer deployer,
                                FunctionPlatform platform,
                                ObjectMapper objectMapper,
                                Duration invokeTimeout,
                                GatewayMetrics metrics) {
        this.validator = validator;
        this.deployer = deployer;
        this.platform = platform;
        this.objectMapper = objectMapper;
        this.invokeTimeout = invokeTimeout;
        this.metrics = metrics;
    }

    public DeploymentCache deploymentCache() {
        return deploymentCache;
    }

    public RegistrationResult register(List<LambdaRouteDefinition> definitions) {
        if (deploymentCache.isSealed()) {
            throw new IllegalStateException("Lambda routes are already registered");
        }

        // Validate everything first so an invalid route never leaves a half-deployed gateway.
        List<LambdaRoute> routes = new ArrayList<>();
        Set<RouteId> seen = new HashSet<>();
        for (LambdaRouteDefinition definition : definitions) {
            try {
                LambdaRoute route = validator.validate(definition);
                if (!seen.add(route.id())) {
                    throw new ConfigurationException(route.id().toString(), "route is declared more than once");
                }
                routes.add(route);
            } catch (ConfigurationException e) {
                log.error("Rejected lambda route {}: {}", definition.id(), e.errors());
                return RegistrationResult.failed(definition.id(), RegistrationResult.Stage.VALIDATION, e);
            }
        }

        for (LambdaRoute route : routes) {
            if (!route.deploys()) {
                continue;
            }
            try {
                deployer.deploy(route).ifPresent(handle -> {
                    deploymentCache.put(route.id(), handle);
                    metrics.deploy(route.id().toString());
                });
            } catch (IOException | RuntimeException e) {
                log.error("Deployment of route {} failed: {}", route.id(), e.getMessage());
                return RegistrationResult.failed(route.id(), RegistrationResult.Stage.DEPLOYMENT, e);
            }
        }
        deploymentCache.seal();

        RouterFunction<ServerResponse> router = bind(routes);
        log.info("Registered {} lambda routes ({} deployed)", routes.size(), deploymentCache.size());
        return RegistrationResult.registered(router, routes);
    }

    private RouterFunction<ServerResponse> bind(List<LambdaRoute> routes) {
        Optional<RouterFunction<ServerResponse>> router = Optional.empty();
        for (LambdaRoute route : routes) {
            InvocationPipeline pipeline = new InvocationPipeline(
                    route, deploymentCache, platform, objectMapper, invokeTimeout, metrics);
            RouterFunction<ServerResponse> single = RouterFunctions.route(
                    RequestPredicates.method(HttpMethod.valueOf(route.id().method()))
                            .and(RequestPredicates.path(route.id().path())),
                    pipeline);
            router = Optional.of(router.map(existing -> existing.and(single)).orElse(single));
            log.info("Bound {} to function {}", route.id(), route.functionName());
        }
        return router.orElse(request -> Mono.empty());
    }
}
