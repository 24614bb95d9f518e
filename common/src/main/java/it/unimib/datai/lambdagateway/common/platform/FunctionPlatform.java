package it.unimib.datai.lambdagateway.common.platform;

import java.util.concurrent.CompletableFuture;

/**
 * Remote function platform: resolves functions by name and publishes packaged code.
 */
public interface FunctionPlatform {

    /**
     * Returns a handle for an existing function, backed by the platform's ambient credentials.
     */
    FunctionHandle byName(String functionName);

    /**
     * Publishes the artifact and returns a handle bound to the published function.
     * Platform failures are thrown unchanged.
     */
    FunctionHandle publish(FunctionArtifact artifact, String role);

    /**
     * Whether deployment credentials are configured.
     */
    boolean canPublish();

    static FunctionPlatform unavailable() {
        return Unavailable.INSTANCE;
    }

    final class Unavailable implements FunctionPlatform {
        private static final Unavailable INSTANCE = new Unavailable();

        private Unavailable() {
        }

        @Override
        public FunctionHandle byName(String functionName) {
            return new FunctionHandle() {
                @Override
                public String functionName() {
                    return functionName;
                }

                @Override
                public CompletableFuture<RemoteResult> invoke(String payload) {
                    return CompletableFuture.failedFuture(
                            new IllegalStateException("No function platform module is installed"));
                }
            };
        }

        @Override
        public FunctionHandle publish(FunctionArtifact artifact, String role) {
            throw new IllegalStateException("No function platform module is installed");
        }

        @Override
        public boolean canPublish() {
            return false;
        }
    }
}
