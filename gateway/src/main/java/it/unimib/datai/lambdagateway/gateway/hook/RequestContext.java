package it.unimib.datai.lambdagateway.gateway.hook;

import it.unimib.datai.lambdagateway.common.model.RequestEnvelope;
import it.unimib.datai.lambdagateway.gateway.route.RouteId;
import org.springframework.web.reactive.function.server.ServerRequest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The request being served by a lambda route, with its body already read.
 */
public record RequestContext(
        RouteId route,
        String functionName,
        ServerRequest request,
        String body
) {
    public String method() {
        return request.method().name();
    }

    public String path() {
        return request.path();
    }

    public Map<String, List<String>> headers() {
        return new LinkedHashMap<>(request.headers().asHttpHeaders());
    }

    public Map<String, List<String>> query() {
        return new LinkedHashMap<>(request.queryParams());
    }

    public Map<String, String> params() {
        return request.pathVariables();
    }

    public RequestEnvelope toEnvelope() {
        return new RequestEnvelope(method(), path(), headers(), query(), params(), body == null || body.isEmpty() ? null : body);
    }
}
