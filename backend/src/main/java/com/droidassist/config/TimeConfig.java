package com.droidassist.config;

import com.droidassist.call.Ticker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {

    /**
     * Wall clock for record timestamps
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Monotonic clock for cooldowns and durations
     */
    @Bean
    public Ticker ticker() {
        return Ticker.system();
    }
}
