package it.unimib.datai.lambdagateway.gateway.hook;

import it.unimib.datai.lambdagateway.common.platform.RemoteResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Map;

final class StandardResponseFinalizer implements ResponseFinalizer {
    static final StandardResponseFinalizer INSTANCE = new StandardResponseFinalizer();

    static final Map<String, Object> ERROR_BODY = Map.of(
            "error", "INTERNAL_ERROR",
            "message", "An unexpected error occurred"
    );

    private StandardResponseFinalizer() {
    }

    @Override
    public Mono<ServerResponse> complete(InvocationOutcome outcome, RequestContext context) {
        if (outcome.failed()) {
            return ServerResponse.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(ERROR_BODY);
        }

        RemoteResult result = outcome.result().orElseThrow();
        if (result.payload() == null) {
            return ServerResponse.ok().build();
        }
        return ServerResponse.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(result.payload().getBytes(StandardCharsets.UTF_8));
    }
}
