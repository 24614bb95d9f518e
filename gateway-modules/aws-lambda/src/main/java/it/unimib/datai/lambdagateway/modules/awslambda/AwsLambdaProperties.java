package it.unimib.datai.lambdagateway.modules.awslambda;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;

/**
 * Credentials and endpoint of the AWS Lambda platform.
 *
 * @param region          AWS region; the SDK default region chain applies when blank
 * @param accessKeyId     access key used for deployments
 * @param secretAccessKey secret key used for deployments
 * @param sessionToken    optional session token of temporary credentials
 * @param endpoint        optional endpoint override, e.g. a local emulator
 */
@ConfigurationProperties(prefix = "lambdagateway.platform")
public record AwsLambdaProperties(
        String region,
        String accessKeyId,
        String secretAccessKey,
        String sessionToken,
        URI endpoint
) {
    public boolean hasCredentials() {
        return notBlank(accessKeyId) && notBlank(secretAccessKey);
    }

    public boolean hasRegion() {
        return notBlank(region);
    }

    public boolean hasSessionToken() {
        return notBlank(sessionToken);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
