package it.unimib.datai.lambdagateway.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "lambdagateway.deploy-defaults")
public record DeployDefaults(
        String runtime,
        Integer memoryMb,
        Integer timeoutSeconds
) {
    public String runtimeOrDefault() {
        return runtime != null && !runtime.isBlank() ? runtime : "nodejs20.x";
    }

    public int memoryMbOrDefault() {
        return memoryMb != null && memoryMb > 0 ? memoryMb : 128;
    }

    public int timeoutSecondsOrDefault() {
        return timeoutSeconds != null && timeoutSeconds > 0 ? timeoutSeconds : 3;
    }
}
