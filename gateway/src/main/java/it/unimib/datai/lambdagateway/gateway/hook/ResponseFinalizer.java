package it.unimib.datai.lambdagateway.gateway.hook;

import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

/**
 * Post-invocation hook. Always receives control, on success and on failure, and its
 * response is sent to the client as is.
 */
@FunctionalInterface
public interface ResponseFinalizer {

    Mono<ServerResponse> complete(InvocationOutcome outcome, RequestContext context);

    /**
     * 200 with the raw remote payload on success, 500 with a generic error body otherwise.
     */
    static ResponseFinalizer standard() {
        return StandardResponseFinalizer.INSTANCE;
    }
}
