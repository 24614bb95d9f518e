package it.unimib.datai.lambdagateway.gateway.deploy;

import it.unimib.datai.lambdagateway.common.model.DeploySpec;
import it.unimib.datai.lambdagateway.common.platform.FunctionArtifact;

import java.io.IOException;

/**
 * Packages a function's source into a deployable archive.
 */
@FunctionalInterface
public interface CodeBundler {

    FunctionArtifact bundle(String functionName, DeploySpec spec) throws IOException;
}
