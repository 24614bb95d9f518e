package it.unimib.datai.lambdagateway.common.module;

import java.util.Set;

/**
 * Extension point for optional gateway modules loaded via ServiceLoader.
 */
public interface GatewayModule {

    /**
     * Human-readable module name used in startup logging.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Spring configuration classes to add to the gateway application sources.
     */
    Set<Class<?>> configurationClasses();
}
