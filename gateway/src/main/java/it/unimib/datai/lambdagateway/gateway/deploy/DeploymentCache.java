package it.unimib.datai.lambdagateway.gateway.deploy;

import it.unimib.datai.lambdagateway.common.platform.FunctionHandle;
import it.unimib.datai.lambdagateway.gateway.route.RouteId;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Handles of functions published at startup, keyed by route.
 * Written once per route during registration, then sealed and only read.
 */
public class DeploymentCache {
    private final Map<RouteId, FunctionHandle> handles = new ConcurrentHashMap<>();
    private volatile boolean sealed;

    public void put(RouteId route, FunctionHandle handle) {
        if (sealed) {
            throw new IllegalStateException("Deployment cache is sealed, cannot add " + route);
        }
        FunctionHandle existing = handles.putIfAbsent(route, handle);
        if (existing != null) {
            throw new IllegalStateException("Route " + route + " is already deployed as " + existing.functionName());
        }
    }

    public Optional<FunctionHandle> get(RouteId route) {
        return Optional.ofNullable(handles.get(route));
    }

    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public int size() {
        return handles.size();
    }

    public Map<RouteId, FunctionHandle> entries() {
        return Map.copyOf(handles);
    }
}
