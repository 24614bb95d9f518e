package it.unimib.datai.lambdagateway.gateway.config;

import it.unimib.datai.lambdagateway.common.platform.FunctionPlatform;
import it.unimib.datai.lambdagateway.gateway.deploy.CodeBundler;
import it.unimib.datai.lambdagateway.gateway.deploy.ZipCodeBundler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Fallback;

@Configuration
public class CoreDefaults {

    @Bean
    @Fallback
    @ConditionalOnMissingBean(FunctionPlatform.class)
    public FunctionPlatform functionPlatform() {
        return FunctionPlatform.unavailable();
    }

    @Bean
    @Fallback
    @ConditionalOnMissingBean(CodeBundler.class)
    public CodeBundler codeBundler() {
        return new ZipCodeBundler();
    }
}
