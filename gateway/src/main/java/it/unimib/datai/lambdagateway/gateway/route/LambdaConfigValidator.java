package it.unimib.datai.lambdagateway.gateway.route;

import it.unimib.datai.lambdagateway.common.model.DeploySpec;
import it.unimib.datai.lambdagateway.gateway.config.DeployDefaults;
import it.unimib.datai.lambdagateway.gateway.hook.PayloadBuilder;
import it.unimib.datai.lambdagateway.gateway.hook.ResponseFinalizer;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Validates a {@link LambdaRouteDefinition} before the route is accepted and normalizes it.
 */
public class LambdaConfigValidator {
    private static final Set<String> METHODS = Set.of("GET", "HEAD", "POST", "PUT", "PATCH", "DELETE", "OPTIONS");
    private static final int MAX_FUNCTION_NAME_LENGTH = 64;

    private final DeployDefaults defaults;
    private final String functionNamePrefix;

    public LambdaConfigValidator(DeployDefaults defaults, String functionNamePrefix) {
        this.defaults = defaults;
        this.functionNamePrefix = functionNamePrefix;
    }

    public LambdaRoute validate(LambdaRouteDefinition definition) {
        List<String> errors = errors(definition);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(String.valueOf(definition.id()), errors);
        }

        RouteId id = definition.id();
        DeploySpec deploy = definition.deploy() == null ? null : resolveDeploy(definition.deploy());
        String functionName = hasText(definition.name())
                ? definition.name().trim()
                : derivedFunctionName(id);
        return new LambdaRoute(
                id,
                functionName,
                definition.setup() == null ? PayloadBuilder.requestEnvelope() : definition.setup(),
                definition.complete() == null ? ResponseFinalizer.standard() : definition.complete(),
                deploy
        );
    }

    /**
     * Returns a list of human-readable validation errors (empty = valid).
     */
    public List<String> errors(LambdaRouteDefinition definition) {
        List<String> errors = new ArrayList<>();

        String method = definition.method();
        if (!hasText(method) || !METHODS.contains(method.trim().toUpperCase(Locale.ROOT))) {
            errors.add("method must be one of " + METHODS + ", got " + method);
        }
        if (!hasText(definition.path()) || !definition.path().startsWith("/")) {
            errors.add("path must start with '/', got " + definition.path());
        }
        if (definition.name() != null && definition.name().isBlank()) {
            errors.add("name must not be blank");
        }

        DeploySpec deploy = definition.deploy();
        if (deploy == null) {
            if (!hasText(definition.name())) {
                errors.add("either name or deploy is required");
            }
            return errors;
        }

        if (!hasText(deploy.source())) {
            errors.add("deploy.source is required");
        } else if (!isReadable(deploy.source())) {
            errors.add("deploy.source is not readable: " + deploy.source());
        }
        if (!hasText(deploy.export())) {
            errors.add("deploy.export is required");
        }
        if (deploy.memoryMb() != null && deploy.memoryMb() <= 0) {
            errors.add("deploy.memoryMb must be > 0, got " + deploy.memoryMb());
        }
        if (deploy.timeoutSeconds() != null && deploy.timeoutSeconds() <= 0) {
            errors.add("deploy.timeoutSeconds must be > 0, got " + deploy.timeoutSeconds());
        }
        return errors;
    }

    private DeploySpec resolveDeploy(DeploySpec deploy) {
        return new DeploySpec(
                deploy.source(),
                deploy.export().trim(),
                hasText(deploy.runtime()) ? deploy.runtime() : defaults.runtimeOrDefault(),
                deploy.memoryMb() == null ? defaults.memoryMbOrDefault() : deploy.memoryMb(),
                deploy.timeoutSeconds() == null ? defaults.timeoutSecondsOrDefault() : deploy.timeoutSeconds(),
                deploy.environment() == null ? Map.of() : Map.copyOf(deploy.environment()),
                deploy.description()
        );
    }

    String derivedFunctionName(RouteId id) {
        String slug = id.path().toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]", "-")
                .replaceAll("-{2,}", "-")
                .replaceAll("^-+", "")
                .replaceAll("-+$", "");
        if (slug.isBlank()) {
            slug = "root";
        }
        String name = functionNamePrefix + "-" + id.method().toLowerCase(Locale.ROOT) + "-" + slug;
        if (name.length() > MAX_FUNCTION_NAME_LENGTH) {
            name = name.substring(0, MAX_FUNCTION_NAME_LENGTH).replaceAll("-+$", "");
        }
        return name;
    }

    private static boolean isReadable(String source) {
        try {
            return Files.isReadable(Path.of(source));
        } catch (InvalidPathException e) {
            return false;
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
