package it.unimib.datai.lambdagateway.modules.awslambda;

import it.unimib.datai.lambdagateway.common.platform.FunctionHandle;
import it.unimib.datai.lambdagateway.common.platform.RemoteResult;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.lambda.LambdaAsyncClient;
import software.amazon.awssdk.services.lambda.model.InvocationType;
import software.amazon.awssdk.services.lambda.model.InvokeRequest;
import software.amazon.awssdk.services.lambda.model.InvokeResponse;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

final class AwsLambdaFunctionHandle implements FunctionHandle {
    private final String functionName;
    private final Supplier<LambdaAsyncClient> client;

    AwsLambdaFunctionHandle(String functionName, Supplier<LambdaAsyncClient> client) {
        this.functionName = Objects.requireNonNull(functionName, "functionName");
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public String functionName() {
        return functionName;
    }

    @Override
    public CompletableFuture<RemoteResult> invoke(String payload) {
        InvokeRequest.Builder request = InvokeRequest.builder()
                .functionName(functionName)
                .invocationType(InvocationType.REQUEST_RESPONSE);
        if (payload != null) {
            request.payload(SdkBytes.fromUtf8String(payload));
        }
        try {
            return client.get().invoke(request.build()).thenApply(this::toResult);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private RemoteResult toResult(InvokeResponse response) {
        String body = response.payload() == null ? null : response.payload().asUtf8String();
        int status = response.statusCode() == null ? 200 : response.statusCode();
        return new RemoteResult(functionName, status, body, response.functionError());
    }

    @Override
    public String toString() {
        return "AwsLambdaFunctionHandle{" + functionName + "}";
    }
}
