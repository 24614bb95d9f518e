package it.unimib.datai.lambdagateway.gateway.route;

import java.util.List;

/**
 * Invalid or incomplete lambda route configuration. Fatal at startup.
 */
public class ConfigurationException extends RuntimeException {
    private final String route;
    private final List<String> errors;

    public ConfigurationException(String route, List<String> errors) {
        super("Invalid lambda configuration for route " + route + ": " + String.join("; ", errors));
        this.route = route;
        this.errors = List.copyOf(errors);
    }

    public ConfigurationException(String route, String error) {
        this(route, List.of(error));
    }

    public String route() {
        return route;
    }

    public List<String> errors() {
        return errors;
    }
}
