package com.deckflow.config;

import com.deckflow.domain.identity.adapter.gateway.IIdentityGateway;
import com.deckflow.infrastructure.identity.ConfiguredTokenIdentityGateway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 身份校验装配；外部身份服务接入时提供自己的 {@link IIdentityGateway} 即可替换。
 */
@Configuration
@EnableConfigurationProperties(IdentityProperties.class)
public class IdentityConfig {

    @Bean
    @ConditionalOnMissingBean(IIdentityGateway.class)
    public IIdentityGateway identityGateway(IdentityProperties properties) {
        return new ConfiguredTokenIdentityGateway(properties.getTokens());
    }
}
