package it.unimib.datai.lambdagateway.gateway.route;

import java.util.Locale;

/**
 * Stable identity of a route: HTTP method plus path pattern.
 */
public record RouteId(String method, String path) {

    public static RouteId of(String method, String path) {
        return new RouteId(method == null ? null : method.trim().toUpperCase(Locale.ROOT), path);
    }

    @Override
    public String toString() {
        return method + " " + path;
    }
}
