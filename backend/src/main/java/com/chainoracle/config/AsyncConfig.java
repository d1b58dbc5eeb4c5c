package com.chainoracle.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: fetch-executor and fanout-executor.
 * Fetch pool runs single adapter calls and health probes; fanout pool runs one resolution per aggregate target
 * (and blocks on the fetch pool), so it does not consume fetch slots.
 */
@Configuration
public class AsyncConfig {

    public static final String FETCH_EXECUTOR = "fetch-executor";
    public static final String FANOUT_EXECUTOR = "fanout-executor";

    @Bean(name = FETCH_EXECUTOR)
    public Executor fetchExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(8);
        e.setMaxPoolSize(32);
        e.setQueueCapacity(500);
        e.setThreadNamePrefix("fetch-");
        e.initialize();
        return e;
    }

    @Bean(name = FANOUT_EXECUTOR)
    public Executor fanoutExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(4);
        e.setThreadNamePrefix("fanout-");
        e.initialize();
        return e;
    }
}
