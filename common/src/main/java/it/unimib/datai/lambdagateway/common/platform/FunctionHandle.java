package it.unimib.datai.lambdagateway.common.platform;

import java.util.concurrent.CompletableFuture;

/**
 * A live reference to one remote function.
 */
public interface FunctionHandle {

    String functionName();

    /**
     * Invokes the function synchronously from the caller's point of view.
     * The returned future fails when the platform call itself fails.
     */
    CompletableFuture<RemoteResult> invoke(String payload);
}
