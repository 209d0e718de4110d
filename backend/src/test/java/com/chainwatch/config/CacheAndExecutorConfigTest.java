package com.chainwatch.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class,
        SchedulerConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.INGESTION_EXECUTOR)
    ThreadPoolTaskExecutor ingestionExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Test
    @DisplayName("attribution caches are created and usable")
    void cachesCreatedAndUsed() {
        assertThat(cacheManager.getCache(CaffeineConfig.ENTITY_LABEL_CACHE)).isNotNull();
        assertThat(cacheManager.getCache(CaffeineConfig.WATCHLIST_CACHE)).isNotNull();
        assertThat(cacheManager.getCache(CaffeineConfig.PROVIDER_WALLET_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.ENTITY_LABEL_CACHE).put("key1", "value1");
        assertThat(cacheManager.getCache(CaffeineConfig.ENTITY_LABEL_CACHE).get("key1").get()).isEqualTo("value1");
    }

    @Test
    @DisplayName("ingestion executor has one thread per supported network")
    void ingestionExecutorCreated() {
        assertThat(ingestionExecutor.getCorePoolSize()).isEqualTo(8);
        assertThat(ingestionExecutor.getMaxPoolSize()).isEqualTo(8);
        assertThat(ingestionExecutor.getThreadNamePrefix()).isEqualTo("ingest-");
    }

    @Test
    @DisplayName("scheduler pool is created and configured")
    void schedulerPoolCreated() {
        assertThat(schedulerPool).isNotNull();
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("scheduler-");
        assertThat(schedulerPool.getPoolSize()).isLessThanOrEqualTo(2);
    }
}
