package com.jreinhal.knowledge.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.knowledge.reasoning.QueryTrace;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TraceCacheConfig {
    @Bean
    public Cache<String, QueryTrace> queryTraceCache(@Value("${knowledge.trace.cache-size:1000}") long maxSize) {
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofHours(1L))
            .build();
    }
}
