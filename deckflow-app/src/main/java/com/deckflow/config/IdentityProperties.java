package com.deckflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 预签发凭证配置，前缀 app.auth。
 */
@Data
@ConfigurationProperties(prefix = "app.auth")
public class IdentityProperties {

    /** token -> userId */
    private Map<String, String> tokens = new LinkedHashMap<>();
}
