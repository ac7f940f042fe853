package io.github.drompincen.annostore.gateway.config;

import io.github.drompincen.annostore.runtime.config.StoreSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    StoreSettings storeSettings(@Value("${annostore.external-base-url:http://localhost:8080}") String externalBaseUrl,
                                @Value("${annostore.page-size:100}") int pageSize,
                                @Value("${annostore.range-selector-type:TextAnchorSelector}") String rangeSelectorType,
                                @Value("${annostore.search.cache-ttl:1h}") Duration searchCacheTtl,
                                @Value("${annostore.search.cache-max-size:1000}") long searchCacheMaxSize,
                                @Value("${annostore.tasks.ttl:1h}") Duration taskTtl,
                                @Value("${annostore.root-api-key:}") String rootApiKey) {
        if (rootApiKey.isBlank()) {
            log.warn("No annostore.root-api-key configured, root access is disabled");
        }
        log.info("Serving {} with page size {}", externalBaseUrl, pageSize);
        return new StoreSettings(externalBaseUrl, pageSize, rangeSelectorType, searchCacheTtl, searchCacheMaxSize,
                taskTtl, rootApiKey.isBlank() ? null : rootApiKey);
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
