package it.unimib.datai.lambdagateway.gateway.config;

import it.unimib.datai.lambdagateway.common.model.DeploySpec;
import it.unimib.datai.lambdagateway.common.platform.FunctionArtifact;
import it.unimib.datai.lambdagateway.common.platform.FunctionHandle;
import it.unimib.datai.lambdagateway.common.platform.FunctionPlatform;
import it.unimib.datai.lambdagateway.common.platform.RemoteResult;
import it.unimib.datai.lambdagateway.gateway.deploy.CodeBundler;
import it.unimib.datai.lambdagateway.gateway.deploy.DeploymentCache;
import it.unimib.datai.lambdagateway.gateway.deploy.DeploymentException;
import it.unimib.datai.lambdagateway.gateway.deploy.ZipCodeBundler;
import it.unimib.datai.lambdagateway.gateway.hook.PayloadBuilder;
import it.unimib.datai.lambdagateway.gateway.route.ConfigurationException;
import it.unimib.datai.lambdagateway.gateway.route.LambdaRouteDefinition;
import it.unimib.datai.lambdagateway.gateway.route.RouteId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.test.util.TestPropertyValues;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.ServerResponse;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LambdaRoutesConfigurationTest {

    @TempDir
    Path tempDir;

    private Path source;

    @BeforeEach
    void setUp() throws IOException {
        source = Files.writeString(tempDir.resolve("foo.js"), "exports.handler = async () => 'ok';");
    }

    @Test
    void coreDefaults_provideUnavailablePlatformAndZipBundler() {
        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext(CoreDefaults.class)) {
            assertThat(context.getBean(FunctionPlatform.class)).isSameAs(FunctionPlatform.unavailable());
            assertThat(context.getBean(CodeBundler.class)).isInstanceOf(ZipCodeBundler.class);
        }
    }

    @Test
    void routesFromProperties_areRegisteredAtStartup() {
        FunctionPlatform platform = mock(FunctionPlatform.class);
        FunctionHandle handle = mock(FunctionHandle.class);
        when(handle.functionName()).thenReturn("foo");
        when(handle.invoke(any())).thenReturn(CompletableFuture.completedFuture(RemoteResult.success("foo", "\"ok\"")));
        when(platform.byName("foo")).thenReturn(handle);

        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            TestPropertyValues.of(
                    "lambdagateway.routes[0].method=GET",
                    "lambdagateway.routes[0].path=/foo",
                    "lambdagateway.routes[0].lambda.name=foo"
            ).applyTo(context);
            context.registerBean(FunctionPlatform.class, () -> platform);
            context.register(LambdaRoutesConfiguration.class);
            context.refresh();

            assertThat(context.getBean(FunctionPlatform.class)).isSameAs(platform);
            WebTestClient.bindToRouterFunction(router(context)).build()
                    .get().uri("/foo").exchange()
                    .expectStatus().isOk()
                    .expectBody(String.class).isEqualTo("\"ok\"");
            verify(platform).byName("foo");
        }
    }

    @Test
    void hooksAreResolvedByBeanName() {
        FunctionPlatform platform = mock(FunctionPlatform.class);
        FunctionHandle handle = mock(FunctionHandle.class);
        when(handle.functionName()).thenReturn("foo");
        when(handle.invoke(any())).thenReturn(CompletableFuture.completedFuture(RemoteResult.success("foo", "{}")));
        when(platform.byName("foo")).thenReturn(handle);

        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            TestPropertyValues.of(
                    "lambdagateway.routes[0].method=POST",
                    "lambdagateway.routes[0].path=/foo",
                    "lambdagateway.routes[0].lambda.name=foo",
                    "lambdagateway.routes[0].lambda.setup=fixedPayload"
            ).applyTo(context);
            context.registerBean(FunctionPlatform.class, () -> platform);
            context.registerBean("fixedPayload", PayloadBuilder.class, () -> requestContext -> Mono.just("fixed"));
            context.register(LambdaRoutesConfiguration.class);
            context.refresh();

            WebTestClient.bindToRouterFunction(router(context)).build()
                    .post().uri("/foo").exchange()
                    .expectStatus().isOk();
            verify(handle).invoke("fixed");
        }
    }

    @Test
    void programmaticDefinitions_areRegisteredWithDeployment() throws IOException {
        FunctionPlatform platform = mock(FunctionPlatform.class);
        FunctionHandle handle = mock(FunctionHandle.class);
        when(handle.functionName()).thenReturn("lambdagateway-get-bar");
        when(platform.canPublish()).thenReturn(true);
        when(platform.publish(any(FunctionArtifact.class), any())).thenReturn(handle);

        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            TestPropertyValues.of("lambdagateway.role=arn:aws:iam::123456789012:role/lambda").applyTo(context);
            context.registerBean(FunctionPlatform.class, () -> platform);
            context.registerBean("barRoute", LambdaRouteDefinition.class, () -> new LambdaRouteDefinition(
                    "GET", "/bar", null, null, null,
                    DeploySpec.of(source.toString(), "handler")));
            context.register(LambdaRoutesConfiguration.class);
            context.refresh();

            DeploymentCache cache = context.getBean(DeploymentCache.class);
            assertThat(cache.get(RouteId.of("GET", "/bar"))).containsSame(handle);
            verify(platform).publish(any(FunctionArtifact.class), eq("arn:aws:iam::123456789012:role/lambda"));
        }
    }

    @Test
    void invalidRoute_abortsStartup() {
        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            TestPropertyValues.of(
                    "lambdagateway.routes[0].method=GET",
                    "lambdagateway.routes[0].path=/foo",
                    "lambdagateway.routes[0].lambda.setup=missingHook"
            ).applyTo(context);
            context.register(LambdaRoutesConfiguration.class);

            assertThatThrownBy(context::refresh)
                    .hasRootCauseInstanceOf(ConfigurationException.class)
                    .hasStackTraceContaining("setup references unknown PayloadBuilder bean 'missingHook'");
        }
    }

    @Test
    void deploymentFailure_abortsStartup() {
        FunctionPlatform platform = mock(FunctionPlatform.class);
        when(platform.canPublish()).thenReturn(true);
        when(platform.publish(any(), any())).thenThrow(new IllegalStateException("ResourceNotFound"));

        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            TestPropertyValues.of(
                    "lambdagateway.routes[0].method=GET",
                    "lambdagateway.routes[0].path=/foo",
                    "lambdagateway.routes[0].lambda.deploy.source=" + source,
                    "lambdagateway.routes[0].lambda.deploy.export=handler"
            ).applyTo(context);
            context.registerBean(FunctionPlatform.class, () -> platform);
            context.register(LambdaRoutesConfiguration.class);

            assertThatThrownBy(context::refresh)
                    .hasRootCauseInstanceOf(IllegalStateException.class)
                    .hasRootCauseMessage("ResourceNotFound")
                    .satisfies(ex -> assertThat(causeOfType(ex, DeploymentException.class)).isNotNull());
        }
    }

    @SuppressWarnings("unchecked")
    private static RouterFunction<ServerResponse> router(AnnotationConfigApplicationContext context) {
        return context.getBean("lambdaRoutes", RouterFunction.class);
    }

    private static <T extends Throwable> T causeOfType(Throwable error, Class<T> type) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
        }
        return null;
    }
}
