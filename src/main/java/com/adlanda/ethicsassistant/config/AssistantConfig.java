package com.adlanda.ethicsassistant.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans.
 */
@Configuration
public class AssistantConfig {

    /**
     * UTC clock used for processed and stored timestamps; replaced in tests.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
