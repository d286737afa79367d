package com.droidassist.config;

import com.droidassist.call.CallEventListener;
import com.droidassist.call.CallMonitorLoop;
import com.droidassist.call.ResponseSequencer;
import com.droidassist.call.StateSampler;
import com.droidassist.call.Ticker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Call monitor wiring.
 *
 * Polling runs on one scheduler thread. Response sequences run on their own
 * executor; on shutdown it stops accepting work but lets a running sequence
 * finish, so a call is never left off-hook.
 */
@Configuration
public class CallMonitorConfig {

    @Value("${droidassist.monitor.poll-interval-ms:300}")
    private long pollIntervalMs;

    @Value("${droidassist.monitor.cooldown-ms:5000}")
    private long cooldownMs;

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService callMonitorScheduler() {
        return Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("call-monitor-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService callResponseExecutor() {
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("call-response-"));
    }

    @Bean(destroyMethod = "stop")
    public CallMonitorLoop callMonitorLoop(StateSampler stateSampler,
                                           ResponseSequencer responseSequencer,
                                           CallEventListener callEventListener,
                                           @Qualifier("callMonitorScheduler") ScheduledExecutorService scheduler,
                                           @Qualifier("callResponseExecutor") ExecutorService responseExecutor,
                                           Ticker ticker) {
        return new CallMonitorLoop(stateSampler, responseSequencer, callEventListener, scheduler,
            responseExecutor, ticker, Duration.ofMillis(pollIntervalMs), Duration.ofMillis(cooldownMs));
    }
}
