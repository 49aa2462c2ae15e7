package com.rms.fanout.redis.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Redis connectivity itself ({@code ReactiveStringRedisTemplate}, Lettuce) comes from Spring Boot's
 * auto-configuration; only the store layout is ours.
 */
@Configuration
@EnableConfigurationProperties(RecentEventStoreProperties.class)
public class RedisStoreConfig {
}
