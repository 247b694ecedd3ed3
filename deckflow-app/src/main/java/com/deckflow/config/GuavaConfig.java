package com.deckflow.config;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Guava 缓存配置类。
 * <p>
 * 缓存相同输入的需求分析结果，重试与重复提交时不再调用大模型。
 * </p>
 *
 * @author deckflow
 * @since 2026-10-19
 */
@Configuration
public class GuavaConfig {

    @Bean(name = "analysisCache")
    public Cache<String, Map<String, Object>> analysisCache(
            @Value("${collaborator.analysis-cache-ttl-seconds:3600}") long ttlSeconds,
            @Value("${collaborator.analysis-cache-max-size:1000}") long maxSize) {
        return CacheBuilder.newBuilder()
                .expireAfterWrite(Math.max(ttlSeconds, 1L), TimeUnit.SECONDS)
                .maximumSize(Math.max(maxSize, 1L))
                .build();
    }

}
