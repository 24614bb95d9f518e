package it.unimib.datai.lambdagateway.common.model;

public record RouteSpec(
        String method,
        String path,
        LambdaSpec lambda
) {
}
