package it.unimib.datai.lambdagateway.modules.awslambda;

import it.unimib.datai.lambdagateway.common.model.DeploySpec;
import it.unimib.datai.lambdagateway.common.platform.FunctionArtifact;
import it.unimib.datai.lambdagateway.common.platform.FunctionHandle;
import it.unimib.datai.lambdagateway.common.platform.FunctionPlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.function.SingletonSupplier;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.lambda.LambdaAsyncClient;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.CreateFunctionRequest;
import software.amazon.awssdk.services.lambda.model.Environment;
import software.amazon.awssdk.services.lambda.model.FunctionCode;
import software.amazon.awssdk.services.lambda.model.GetFunctionRequest;
import software.amazon.awssdk.services.lambda.model.ResourceConflictException;
import software.amazon.awssdk.services.lambda.model.UpdateFunctionCodeRequest;
import software.amazon.awssdk.services.lambda.model.UpdateFunctionConfigurationRequest;
import software.amazon.awssdk.utils.SdkAutoCloseable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link FunctionPlatform} backed by AWS Lambda.
 * <p>
 * By-name invocations use a client built from the SDK default credentials chain. Publishing and
 * invoking published functions use the configured static credentials. Clients are created on
 * first use so that a gateway without region or credentials still starts.
 */
public class AwsLambdaPlatform implements FunctionPlatform, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AwsLambdaPlatform.class);

    private final List<SdkAutoCloseable> opened = new ArrayList<>();
    private final Supplier<LambdaAsyncClient> ambientInvoker;
    private final Supplier<LambdaClient> deployClient;
    private final Supplier<LambdaAsyncClient> deployInvoker;
    private final boolean canPublish;

    /**
     * @param ambientInvoker factory of the client used for by-name invocations
     * @param deployClient   factory of the client used to create and update functions, or {@code null}
     *                       when no deployment credentials are configured
     * @param deployInvoker  factory of the client used to invoke published functions, or {@code null}
     *                       when no deployment credentials are configured
     */
    public AwsLambdaPlatform(Supplier<LambdaAsyncClient> ambientInvoker,
                             Supplier<LambdaClient> deployClient,
                             Supplier<LambdaAsyncClient> deployInvoker) {
        this.ambientInvoker = lazily(Objects.requireNonNull(ambientInvoker, "ambientInvoker"));
        this.canPublish = deployClient != null && deployInvoker != null;
        this.deployClient = canPublish ? lazily(deployClient) : null;
        this.deployInvoker = canPublish ? lazily(deployInvoker) : null;
    }

    @Override
    public FunctionHandle byName(String functionName) {
        return new AwsLambdaFunctionHandle(functionName, ambientInvoker);
    }

    @Override
    public boolean canPublish() {
        return canPublish;
    }

    @Override
    public FunctionHandle publish(FunctionArtifact artifact, String role) {
        if (!canPublish) {
            throw new IllegalStateException("AWS Lambda deployment credentials are not configured");
        }
        LambdaClient client = deployClient.get();
        DeploySpec spec = artifact.deploySpec();
        GetFunctionRequest lookup = GetFunctionRequest.builder().functionName(artifact.functionName()).build();
        try {
            client.createFunction(CreateFunctionRequest.builder()
                    .functionName(artifact.functionName())
                    .role(role)
                    .runtime(spec.runtime())
                    .handler(artifact.handler())
                    .memorySize(spec.memoryMb())
                    .timeout(spec.timeoutSeconds())
                    .description(spec.description())
                    .environment(environment(spec.environment()))
                    .code(FunctionCode.builder().zipFile(SdkBytes.fromByteArray(artifact.archive())).build())
                    .publish(true)
                    .build());
            client.waiter().waitUntilFunctionActiveV2(lookup);
            log.info("Created AWS Lambda function {} ({} bytes)", artifact.functionName(), artifact.size());
        } catch (ResourceConflictException e) {
            log.info("AWS Lambda function {} already exists, updating it", artifact.functionName());
            client.updateFunctionConfiguration(UpdateFunctionConfigurationRequest.builder()
                    .functionName(artifact.functionName())
                    .role(role)
                    .runtime(spec.runtime())
                    .handler(artifact.handler())
                    .memorySize(spec.memoryMb())
                    .timeout(spec.timeoutSeconds())
                    .description(spec.description())
                    .environment(environment(spec.environment()))
                    .build());
            client.waiter().waitUntilFunctionUpdatedV2(lookup);
            client.updateFunctionCode(UpdateFunctionCodeRequest.builder()
                    .functionName(artifact.functionName())
                    .zipFile(SdkBytes.fromByteArray(artifact.archive()))
                    .publish(true)
                    .build());
            client.waiter().waitUntilFunctionUpdatedV2(lookup);
        }
        return new AwsLambdaFunctionHandle(artifact.functionName(), deployInvoker);
    }

    @Override
    public void close() {
        List<SdkAutoCloseable> clients;
        synchronized (opened) {
            clients = new ArrayList<>(opened);
            opened.clear();
        }
        clients.forEach(SdkAutoCloseable::close);
    }

    private static Environment environment(Map<String, String> variables) {
        return Environment.builder().variables(variables == null ? Map.of() : variables).build();
    }

    private <T extends SdkAutoCloseable> Supplier<T> lazily(Supplier<T> factory) {
        return SingletonSupplier.of(() -> {
            T client = factory.get();
            synchronized (opened) {
                opened.add(client);
            }
            return client;
        });
    }
}
