package it.unimib.datai.lambdagateway.gateway;

import it.unimib.datai.lambdagateway.common.module.GatewayModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;

@SpringBootApplication
public class GatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(GatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication();
        application.setSources(applicationSources(Thread.currentThread().getContextClassLoader()));
        application.run(args);
    }

    static Set<String> applicationSources(ClassLoader classLoader) {
        Set<String> sources = new LinkedHashSet<>();
        sources.add(GatewayApplication.class.getName());

        List<String> moduleNames = new ArrayList<>();
        for (GatewayModule module : ServiceLoader.load(GatewayModule.class, classLoader)) {
            moduleNames.add(module.name());
            module.configurationClasses().stream()
                    .filter(Objects::nonNull)
                    .map(Class::getName)
                    .forEach(sources::add);
        }

        if (moduleNames.isEmpty()) {
            log.warn("No gateway module found, lambda routes cannot reach a function platform");
        } else {
            log.info("Gateway modules {} contribute {} configuration classes", moduleNames, sources.size() - 1);
        }

        return sources;
    }
}
