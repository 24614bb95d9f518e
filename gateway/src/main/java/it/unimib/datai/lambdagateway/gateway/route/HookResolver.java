package it.unimib.datai.lambdagateway.gateway.route;

import it.unimib.datai.lambdagateway.common.model.LambdaSpec;
import it.unimib.datai.lambdagateway.common.model.RouteSpec;
import it.unimib.datai.lambdagateway.gateway.hook.PayloadBuilder;
import it.unimib.datai.lambdagateway.gateway.hook.ResponseFinalizer;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanFactory;

/**
 * Turns a declaratively configured route into a {@link LambdaRouteDefinition},
 * looking hooks up by bean name.
 */
public class HookResolver {
    private final BeanFactory beanFactory;

    public HookResolver(BeanFactory beanFactory) {
        this.beanFactory = beanFactory;
    }

    public LambdaRouteDefinition resolve(RouteSpec spec) {
        String route = spec.method() + " " + spec.path();
        LambdaSpec lambda = spec.lambda();
        if (lambda == null) {
            throw new ConfigurationException(route, "lambda block is required");
        }
        return new LambdaRouteDefinition(
                spec.method(),
                spec.path(),
                lambda.name(),
                hook(route, "setup", lambda.setup(), PayloadBuilder.class),
                hook(route, "complete", lambda.complete(), ResponseFinalizer.class),
                lambda.deploy()
        );
    }

    private <T> T hook(String route, String field, String beanName, Class<T> type) {
        if (beanName == null || beanName.isBlank()) {
            return null;
        }
        try {
            return beanFactory.getBean(beanName.trim(), type);
        } catch (BeansException e) {
            throw new ConfigurationException(route,
                    field + " references unknown " + type.getSimpleName() + " bean '" + beanName + "'");
        }
    }
}
