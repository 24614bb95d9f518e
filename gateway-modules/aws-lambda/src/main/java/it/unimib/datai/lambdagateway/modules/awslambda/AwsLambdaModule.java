package it.unimib.datai.lambdagateway.modules.awslambda;

import it.unimib.datai.lambdagateway.common.module.GatewayModule;

import java.util.Set;

public final class AwsLambdaModule implements GatewayModule {
    @Override
    public String name() {
        return "aws-lambda";
    }

    @Override
    public Set<Class<?>> configurationClasses() {
        return Set.of(AwsLambdaConfiguration.class);
    }
}
