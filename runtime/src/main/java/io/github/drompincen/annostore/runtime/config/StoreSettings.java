package io.github.drompincen.annostore.runtime.config;

import java.time.Duration;

/**
 * Tunables of the annotation store, bound from the {@code annostore.*} properties.
 */
public record StoreSettings(
        String externalBaseUrl,
        int pageSize,
        String rangeSelectorType,
        Duration searchCacheTtl,
        long searchCacheMaxSize,
        Duration taskTtl,
        String rootApiKey
) {
    public static StoreSettings defaults() {
        return new StoreSettings("http://localhost:8080", 100, "TextAnchorSelector",
                Duration.ofHours(1), 1000, Duration.ofHours(1), null);
    }

    public StoreSettings withPageSize(int pageSize) {
        return new StoreSettings(externalBaseUrl, pageSize, rangeSelectorType, searchCacheTtl,
                searchCacheMaxSize, taskTtl, rootApiKey);
    }

    public StoreSettings withSearchCache(Duration ttl, long maxSize) {
        return new StoreSettings(externalBaseUrl, pageSize, rangeSelectorType, ttl, maxSize, taskTtl, rootApiKey);
    }
}
