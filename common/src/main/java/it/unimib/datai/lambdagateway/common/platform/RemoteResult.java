package it.unimib.datai.lambdagateway.common.platform;

/**
 * Raw result of a remote function invocation.
 *
 * @param functionName  the invoked function
 * @param statusCode    platform status code of the invoke call
 * @param payload       raw response payload produced by the function
 * @param functionError non-null when the platform reports that the function itself failed
 */
public record RemoteResult(
        String functionName,
        int statusCode,
        String payload,
        String functionError
) {
    public static RemoteResult success(String functionName, String payload) {
        return new RemoteResult(functionName, 200, payload, null);
    }

    public boolean failed() {
        return functionError != null && !functionError.isBlank();
    }
}
