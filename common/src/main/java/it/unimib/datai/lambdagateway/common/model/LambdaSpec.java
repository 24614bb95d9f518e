package it.unimib.datai.lambdagateway.common.model;

/**
 * The {@code lambda} block of a declaratively configured route.
 * Hooks are referenced by bean name.
 */
public record LambdaSpec(
        String name,
        String setup,
        String complete,
        DeploySpec deploy
) {
}
