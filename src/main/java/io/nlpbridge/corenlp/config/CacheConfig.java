package io.nlpbridge.corenlp.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.cache.interceptor.CacheResolver;
import org.springframework.cache.support.NoOpCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collections;

@Configuration
@EnableCaching
public class CacheConfig {

    public static final String PIPELINES_CACHE = "pipelines";

    @Bean
    public CacheManager cacheManager() {
        // Pipelines hold loaded models in memory, keep them by reference
        return new ConcurrentMapCacheManager(PIPELINES_CACHE);
    }

    @Bean
    public CacheResolver pipelineCacheResolver(CacheManager cacheManager, BridgeConfig config) {
        return (context) -> {
            if (!config.pipeline().enableCache()) {
                return Collections.singletonList(new NoOpCache(PIPELINES_CACHE));
            }
            return Collections.singletonList(cacheManager.getCache(PIPELINES_CACHE));
        };
    }
}
