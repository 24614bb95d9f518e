package it.unimib.datai.lambdagateway.modules.awslambda;

import it.unimib.datai.lambdagateway.common.platform.FunctionPlatform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.lambda.LambdaAsyncClient;
import software.amazon.awssdk.services.lambda.LambdaClient;

@Configuration
@EnableConfigurationProperties(AwsLambdaProperties.class)
public class AwsLambdaConfiguration {
    private static final Logger log = LoggerFactory.getLogger(AwsLambdaConfiguration.class);

    @Bean(destroyMethod = "close")
    FunctionPlatform awsLambdaPlatform(AwsLambdaProperties properties) {
        if (!properties.hasCredentials()) {
            log.info("AWS Lambda platform without deployment credentials, routes can only invoke existing functions");
            return new AwsLambdaPlatform(() -> configure(LambdaAsyncClient.builder(), properties).build(), null, null);
        }
        StaticCredentialsProvider credentials = StaticCredentialsProvider.create(credentials(properties));
        return new AwsLambdaPlatform(
                () -> configure(LambdaAsyncClient.builder(), properties).build(),
                () -> configure(LambdaClient.builder(), properties).credentialsProvider(credentials).build(),
                () -> configure(LambdaAsyncClient.builder(), properties).credentialsProvider(credentials).build());
    }

    static AwsCredentials credentials(AwsLambdaProperties properties) {
        if (properties.hasSessionToken()) {
            return AwsSessionCredentials.create(
                    properties.accessKeyId(), properties.secretAccessKey(), properties.sessionToken());
        }
        return AwsBasicCredentials.create(properties.accessKeyId(), properties.secretAccessKey());
    }

    private static <B extends AwsClientBuilder<B, ?>> B configure(B builder, AwsLambdaProperties properties) {
        if (properties.hasRegion()) {
            builder.region(Region.of(properties.region()));
        }
        if (properties.endpoint() != null) {
            builder.endpointOverride(properties.endpoint());
        }
        return builder;
    }
}
