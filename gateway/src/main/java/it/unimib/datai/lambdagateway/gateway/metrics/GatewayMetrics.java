package it.unimib.datai.lambdagateway.gateway.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class GatewayMetrics {
    private final MeterRegistry registry;
    private final Map<String, Counter> invocationCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> setupErrorCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> deployCounters = new ConcurrentHashMap<>();
    private final Map<String, Timer> latencyTimers = new ConcurrentHashMap<>();

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void invocation(String route) {
        counter(invocationCounters, "gateway_invocation_total", route).increment();
    }

    public void invocationError(String route) {
        counter(errorCounters, "gateway_invocation_error_total", route).increment();
    }

    public void setupError(String route) {
        counter(setupErrorCounters, "gateway_setup_error_total", route).increment();
    }

    public void deploy(String route) {
        counter(deployCounters, "gateway_deploy_total", route).increment();
    }

    public Timer latency(String route) {
        return latencyTimers.computeIfAbsent(route, name -> Timer.builder("gateway_invocation_latency_ms")
                .tag("route", name)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry));
    }

    private Counter counter(Map<String, Counter> map, String name, String route) {
        return map.computeIfAbsent(route, key -> Counter.builder(name)
                .tag("route", route)
                .register(registry));
    }
}
