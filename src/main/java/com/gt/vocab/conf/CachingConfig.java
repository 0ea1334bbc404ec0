package com.gt.vocab.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

@Configuration
@EnableCaching
@EnableScheduling
public class CachingConfig {

    private static final Logger log = LoggerFactory.getLogger(CachingConfig.class);

    public static final String WORDS_BY_FREQUENCY = "words_by_frequency";
    public static final String TEMPLATES = "templates";
    private static final long CACHE_EVICT_SCHEDULE_MS = 15 * 60 * 1000;

    @Bean
    public CacheManager getCatalogCacheManager() {
        return new ConcurrentMapCacheManager(WORDS_BY_FREQUENCY, TEMPLATES);
    }

    @CacheEvict(allEntries = true, value = {WORDS_BY_FREQUENCY, TEMPLATES})
    @Scheduled(fixedDelay = CACHE_EVICT_SCHEDULE_MS,  initialDelay = CACHE_EVICT_SCHEDULE_MS)
    public void reportCatalogCacheEvict() {
        log.info("Flushing " + WORDS_BY_FREQUENCY + " and " + TEMPLATES + " caches.");
    }

}
