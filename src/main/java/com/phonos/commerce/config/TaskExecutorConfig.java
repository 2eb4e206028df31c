package com.phonos.commerce.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class TaskExecutorConfig {

    @Value("${app.pipeline.pool-size:4}")
    private int pipelinePoolSize;

    @Value("${app.pipeline.max-pool-size:8}")
    private int pipelineMaxPoolSize;

    @Value("${app.calls.max-concurrent:6}")
    private int maxConcurrentCalls;

    @Value("${app.analysis.pool-size:4}")
    private int analysisPoolSize;

    /**
     * One task per ticket: runs the classify/analyze/research/find/rank stages and then
     * hands off to the call batch.
     */
    @Bean("ticketPipelineExecutor")
    public ThreadPoolTaskExecutor ticketPipelineExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pipelinePoolSize);
        executor.setMaxPoolSize(Math.max(pipelinePoolSize, pipelineMaxPoolSize));
        executor.setQueueCapacity(200);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("TicketPipeline-");
        executor.initialize();
        return executor;
    }

    /**
     * Dial tasks. Threads only block while waiting for a call permit or the dial request itself;
     * call outcomes arrive through webhook-completed futures.
     */
    @Bean("storeCallExecutor")
    public ThreadPoolTaskExecutor storeCallExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(2, maxConcurrentCalls));
        executor.setMaxPoolSize(Math.max(2, maxConcurrentCalls) * 2);
        executor.setQueueCapacity(500);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("StoreCall-");
        executor.initialize();
        return executor;
    }

    @Bean("analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(analysisPoolSize);
        executor.setMaxPoolSize(analysisPoolSize * 2);
        executor.setQueueCapacity(500);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("Analysis-");
        executor.initialize();
        return executor;
    }
}
