package it.unimib.datai.lambdagateway.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * Default invocation payload: the inbound request split by origin so the remote
 * function can rebuild it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RequestEnvelope(
        String method,
        String path,
        Map<String, List<String>> headers,
        Map<String, List<String>> query,
        Map<String, String> params,
        String body
) {
    public RequestEnvelope {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
        query = query == null ? Map.of() : Map.copyOf(query);
        params = params == null ? Map.of() : Map.copyOf(params);
    }
}
