package it.unimib.datai.lambdagateway.common.platform;

import it.unimib.datai.lambdagateway.common.model.DeploySpec;

/**
 * A packaged, deployable function archive.
 *
 * @param functionName name the function is published under
 * @param handler      platform handler string, e.g. {@code index.handler}
 * @param archive      zip archive bytes
 * @param deploySpec   normalized runtime metadata of the function
 */
public record FunctionArtifact(
        String functionName,
        String handler,
        byte[] archive,
        DeploySpec deploySpec
) {
    public int size() {
        return archive == null ? 0 : archive.length;
    }
}
