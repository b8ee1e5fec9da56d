package com.recordplatform.schemashift.config;

import com.recordplatform.schemashift.service.resolver.ResolverCache;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class ResolverConfig {

    @Value("${schemashift.resolver.cache-ttl:5m}")
    private Duration cacheTtl;

    @Value("${schemashift.resolver.cache-max-size:10000}")
    private long cacheMaxSize;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResolverCache resolverCache(Clock clock) {
        return new ResolverCache(cacheTtl, cacheMaxSize, clock);
    }
}
