package it.unimib.datai.lambdagateway.gateway.config;

import it.unimib.datai.lambdagateway.common.model.RouteSpec;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Process-wide gateway settings. Platform credentials are owned by the platform module.
 *
 * @param role               execution role used for every deployment
 * @param invokeTimeout      upper bound of a single remote invocation
 * @param functionNamePrefix prefix of function names derived for deployed routes without a name
 * @param routes             declaratively configured lambda routes
 */
@ConfigurationProperties(prefix = "lambdagateway")
public record GatewayProperties(
        String role,
        Duration invokeTimeout,
        String functionNamePrefix,
        List<RouteSpec> routes
) {
    public Duration invokeTimeoutOrDefault() {
        return invokeTimeout != null && !invokeTimeout.isZero() && !invokeTimeout.isNegative()
                ? invokeTimeout
                : Duration.ofSeconds(30);
    }

    public String functionNamePrefixOrDefault() {
        return functionNamePrefix != null && !functionNamePrefix.isBlank() ? functionNamePrefix : "lambdagateway";
    }

    public List<RouteSpec> routesOrEmpty() {
        return routes == null ? List.of() : routes;
    }
}
