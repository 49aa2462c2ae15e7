package com.rms.fanout.cache;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(EventCacheProperties.class)
public class EventCacheConfig {

    /**
     * Time source for cache timestamps, store scores and subscription windows. Replaced in tests.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
