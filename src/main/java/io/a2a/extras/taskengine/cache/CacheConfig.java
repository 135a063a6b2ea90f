package io.a2a.extras.taskengine.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import io.a2a.extras.taskengine.A2aTaskEngineProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Cache of tasks in a final state, read by the JDBC backend. Those tasks never change, so
 * entries only leave through expiry, size eviction or clearing their context.
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "a2a.taskengine.cache", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CacheConfig {

    public static final String TASK_CACHE = "a2a-finalized-tasks";
    public static final String CACHE_MANAGER_BEAN = "a2aTaskEngineCacheManager";

    @Bean(CACHE_MANAGER_BEAN)
    public CaffeineCacheManager a2aTaskEngineCacheManager(A2aTaskEngineProperties properties) {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(TASK_CACHE);
        cacheManager.setCaffeine(caffeineConfig(properties.getCache()));
        cacheManager.setAllowNullValues(false);
        return cacheManager;
    }

    static Caffeine<Object, Object> caffeineConfig(A2aTaskEngineProperties.CacheProperties cache) {
        Caffeine<Object, Object> caffeine = Caffeine.newBuilder()
                .maximumSize(cache.getMaxSize())
                .expireAfterWrite(Duration.ofMinutes(cache.getTtlMinutes()));

        if (cache.isRecordStats()) {
            caffeine.recordStats();
        }

        return caffeine;
    }
}
