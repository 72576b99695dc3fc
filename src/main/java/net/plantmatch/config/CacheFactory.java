package net.plantmatch.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Factory for creating Caffeine caches with consistent configuration.
 */
@Slf4j
@Component
public class CacheFactory {

    /**
     * Create a cache bounded by entry count that expires entries {@code ttl} after they were written.
     */
    public <K, V> Cache<K, V> createCache(String name, int maxSize, Duration ttl) {
        log.info("Creating cache '{}' (max {} entries, ttl {})", name, maxSize, ttl);
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(ttl)
            .recordStats()
            .build();
    }
}
