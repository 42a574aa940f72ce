package com.chatrelay.server.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RealtimeConfig {

    /** Time source for rate windows, cache expiry and event timestamps. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
