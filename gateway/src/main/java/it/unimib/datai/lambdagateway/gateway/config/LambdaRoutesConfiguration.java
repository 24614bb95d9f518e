package it.unimib.datai.lambdagateway.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import it.unimib.datai.lambdagateway.common.platform.FunctionPlatform;
import it.unimib.datai.lambdagateway.gateway.deploy.CodeBundler;
import it.unimib.datai.lambdagateway.gateway.deploy.DeploymentCache;
import it.unimib.datai.lambdagateway.gateway.deploy.FunctionDeployer;
import it.unimib.datai.lambdagateway.gateway.metrics.GatewayMetrics;
import it.unimib.datai.lambdagateway.gateway.registrar.LambdaRouteRegistrar;
import it.unimib.datai.lambdagateway.gateway.registrar.RegistrationResult;
import it.unimib.datai.lambdagateway.gateway.route.HookResolver;
import it.unimib.datai.lambdagateway.gateway.route.LambdaConfigValidator;
import it.unimib.datai.lambdagateway.gateway.route.LambdaRouteDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.ServerResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Composition root of the lambda routes. Registration happens while the router bean is
 * created, so a failed registration aborts the application context before the server starts.
 */
@Configuration
@EnableConfigurationProperties({GatewayProperties.class, DeployDefaults.class})
@Import(CoreDefaults.class)
public class LambdaRoutesConfiguration {
    private static final Logger log = LoggerFactory.getLogger(LambdaRoutesConfiguration.class);

    @Bean
    GatewayMetrics gatewayMetrics(ObjectProvider<MeterRegistry> registry) {
        return new GatewayMetrics(registry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    LambdaConfigValidator lambdaConfigValidator(DeployDefaults defaults, GatewayProperties properties) {
        return new LambdaConfigValidator(defaults, properties.functionNamePrefixOrDefault());
    }

    @Bean
    HookResolver hookResolver(BeanFactory beanFactory) {
        return new HookResolver(beanFactory);
    }

    @Bean
    FunctionDeployer functionDeployer(CodeBundler bundler, FunctionPlatform platform, GatewayProperties properties) {
        return new FunctionDeployer(bundler, platform, properties.role());
    }

    @Bean
    LambdaRouteRegistrar lambdaRouteRegistrar(LambdaConfigValidator validator,
                                              FunctionDeployer deployer,
                                              FunctionPlatform platform,
                                              ObjectProvider<ObjectMapper> objectMapper,
                                              GatewayProperties properties,
                                              GatewayMetrics metrics) {
        return new LambdaRouteRegistrar(
                validator,
                deployer,
                platform,
                objectMapper.getIfAvailable(ObjectMapper::new),
                properties.invokeTimeoutOrDefault(),
                metrics);
    }

    @Bean
    DeploymentCache deploymentCache(LambdaRouteRegistrar registrar) {
        return registrar.deploymentCache();
    }

    @Bean
    RouterFunction<ServerResponse> lambdaRoutes(LambdaRouteRegistrar registrar,
                                                HookResolver hookResolver,
                                                GatewayProperties properties,
                                                ObjectProvider<LambdaRouteDefinition> definitions) {
        List<LambdaRouteDefinition> all = new ArrayList<>();
        properties.routesOrEmpty().forEach(spec -> all.add(hookResolver.resolve(spec)));
        definitions.orderedStream().forEach(all::add);

        RegistrationResult result = registrar.register(all);
        result.failure().ifPresent(failure ->
                log.error("Lambda route registration failed at {} of route {}", failure.stage(), failure.route()));
        return result.routerOrThrow();
    }
}
