package it.unimib.datai.lambdagateway.common.model;

import java.util.Map;

/**
 * Deploy-before-serve instructions of a lambda route.
 *
 * @param source         path of the entry file (or directory) to package
 * @param export         name of the exported handler inside the entry module
 * @param runtime        platform runtime identifier, e.g. {@code nodejs20.x}
 * @param memoryMb       memory size of the published function
 * @param timeoutSeconds execution timeout of the published function
 * @param environment    environment variables of the published function
 * @param description    free-form description stored on the published function
 */
public record DeploySpec(
        String source,
        String export,
        String runtime,
        Integer memoryMb,
        Integer timeoutSeconds,
        Map<String, String> environment,
        String description
) {
    public static DeploySpec of(String source, String export) {
        return new DeploySpec(source, export, null, null, null, null, null);
    }
}
