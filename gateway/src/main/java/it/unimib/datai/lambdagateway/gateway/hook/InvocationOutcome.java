package it.unimib.datai.lambdagateway.gateway.hook;

import it.unimib.datai.lambdagateway.common.platform.RemoteResult;
import it.unimib.datai.lambdagateway.gateway.invoke.InvocationException;

import java.util.Objects;
import java.util.Optional;

/**
 * What a {@link ResponseFinalizer} gets to see: the remote result, the error that stopped the
 * request (a {@code SetupException} or an {@link InvocationException}), or both when the
 * function returned a result flagged as an error.
 */
public final class InvocationOutcome {
    private final Throwable error;
    private final RemoteResult result;

    private InvocationOutcome(Throwable error, RemoteResult result) {
        this.error = error;
        this.result = result;
    }

    public static InvocationOutcome success(RemoteResult result) {
        return new InvocationOutcome(null, Objects.requireNonNull(result, "result"));
    }

    /**
     * A failed request. When the function itself reported the error, its result is kept next to it.
     */
    public static InvocationOutcome failure(Throwable error) {
        Objects.requireNonNull(error, "error");
        RemoteResult result = error instanceof InvocationException invocationError
                ? invocationError.result().orElse(null)
                : null;
        return new InvocationOutcome(error, result);
    }

    public Optional<Throwable> error() {
        return Optional.ofNullable(error);
    }

    public Optional<RemoteResult> result() {
        return Optional.ofNullable(result);
    }

    public boolean failed() {
        return error != null;
    }

    @Override
    public String toString() {
        return failed() ? "failure(" + error + ")" : "success(" + result.functionName() + ")";
    }
}
