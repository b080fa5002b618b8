package com.dev.prostaff.config;

import com.dev.prostaff.security.InMemoryRevocationStore;
import com.dev.prostaff.security.RedisRevocationStore;
import com.dev.prostaff.security.RevocationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;

@Slf4j
@Configuration
public class RevocationConfig {

    @Bean
    @ConditionalOnProperty(prefix = "prostaff.revocation", name = "store", havingValue = "redis")
    RevocationStore redisRevocationStore(StringRedisTemplate redisTemplate, RevocationProperties properties, Clock clock) {
        log.info("Using Redis revocation store with key prefix '{}'", properties.keyPrefix());
        return new RedisRevocationStore(redisTemplate, properties.keyPrefix(), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "prostaff.revocation", name = "store", havingValue = "memory", matchIfMissing = true)
    RevocationStore inMemoryRevocationStore(TaskScheduler taskScheduler, RevocationProperties properties, Clock clock) {
        log.info("Using in-memory revocation store, purging every {}", properties.cleanupInterval());
        InMemoryRevocationStore store = new InMemoryRevocationStore(clock);
        taskScheduler.scheduleWithFixedDelay(store::purgeExpired, properties.cleanupInterval());
        return store;
    }
}
