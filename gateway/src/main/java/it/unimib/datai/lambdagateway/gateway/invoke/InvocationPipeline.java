package it.unimib.datai.lambdagateway.gateway.invoke;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimib.datai.lambdagateway.common.platform.FunctionHandle;
import it.unimib.datai.lambdagateway.common.platform.FunctionPlatform;
import it.unimib.datai.lambdagateway.common.platform.RemoteResult;
import it.unimib.datai.lambdagateway.gateway.deploy.DeploymentCache;
import it.unimib.datai.lambdagateway.gateway.hook.InvocationOutcome;
import it.unimib.datai.lambdagateway.gateway.hook.RequestContext;
import it.unimib.datai.lambdagateway.gateway.hook.ResponseFinalizer;
import it.unimib.datai.lambdagateway.gateway.metrics.GatewayMetrics;
import it.unimib.datai.lambdagateway.gateway.route.LambdaRoute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.server.HandlerFunction;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Request handler of one lambda route.
 * <p>
 * Stages run strictly in order: setup, invoke, complete. A setup failure skips the remote call;
 * both setup and invocation failures reach the route's {@link ResponseFinalizer}, and nothing
 * but a {@link ServerResponse} ever leaves this handler.
 */
public class InvocationPipeline implements HandlerFunction<ServerResponse> {
    private static final Logger log = LoggerFactory.getLogger(InvocationPipeline.class);

    private final LambdaRoute route;
    private final DeploymentCache deploymentCache;
    private final FunctionPlatform platform;
    private final ObjectMapper objectMapper;
    private final Duration invokeTimeout;
    private final GatewayMetrics metrics;

    public InvocationPipeline(LambdaRoute route,
                              DeploymentCache deploymentCache,
                              FunctionPlatform platform,
                              ObjectMapper objectMapper,
                              Duration invokeTimeout,
                              GatewayMetrics metrics) {
        this.route = route;
        this.deploymentCache = deploymentCache;
        this.platform = platform;
        this.objectMapper = objectMapper;
        this.invokeTimeout = invokeTimeout;
        this.metrics = metrics;
    }

    @Override
    public Mono<ServerResponse> handle(ServerRequest request) {
        metrics.invocation(route.id().toString());
        return request.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new RequestContext(route.id(), route.functionName(), request, body))
                .flatMap(this::process)
                .onErrorResume(ex -> {
                    metrics.setupError(route.id().toString());
                    RequestContext context = new RequestContext(route.id(), route.functionName(), request, null);
                    return complete(InvocationOutcome.failure(new SetupException(route.id(), ex)), context);
                });
    }

    private Mono<ServerResponse> process(RequestContext context) {
        return setup(context)
                .flatMap(this::invoke)
                .map(InvocationOutcome::success)
                .onErrorResume(ex -> Mono.just(InvocationOutcome.failure(ex)))
                .flatMap(outcome -> complete(outcome, context));
    }

    private Mono<Optional<String>> setup(RequestContext context) {
        return Mono.defer(() -> route.setup().build(context))
                .map(payload -> Optional.of(serialize(payload)))
                .defaultIfEmpty(Optional.empty())
                .onErrorMap(ex -> {
                    metrics.setupError(route.id().toString());
                    log.debug("Setup failed for route {}: {}", route.id(), ex.toString());
                    return new SetupException(route.id(), ex);
                });
    }

    private Mono<RemoteResult> invoke(Optional<String> payload) {
        long startNs = System.nanoTime();
        return Mono.defer(() -> {
                    FunctionHandle handle = resolveHandle();
                    return Mono.fromFuture(handle.invoke(payload.orElse(null)))
                            .timeout(invokeTimeout)
                            .flatMap(result -> result.failed()
                                    ? Mono.<RemoteResult>error(new InvocationException(route.id(), result))
                                    : Mono.just(result));
                })
                .onErrorMap(ex -> !(ex instanceof InvocationException),
                        ex -> new InvocationException(route.id(), route.functionName(), ex))
                .doOnError(ex -> {
                    metrics.invocationError(route.id().toString());
                    log.debug("{}", ex.getMessage());
                })
                .doOnSuccess(result -> metrics.latency(route.id().toString())
                        .record(System.nanoTime() - startNs, TimeUnit.NANOSECONDS));
    }

    private FunctionHandle resolveHandle() {
        return deploymentCache.get(route.id())
                .orElseGet(() -> platform.byName(route.functionName()));
    }

    private Mono<ServerResponse> complete(InvocationOutcome outcome, RequestContext context) {
        return Mono.defer(() -> route.complete().complete(outcome, context))
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("complete hook produced no response")))
                .onErrorResume(ex -> {
                    log.error("Completing route {} failed: {}", route.id(), ex.getMessage(), ex);
                    return ResponseFinalizer.standard().complete(InvocationOutcome.failure(ex), context);
                });
    }

    private String serialize(Object payload) {
        if (payload instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
