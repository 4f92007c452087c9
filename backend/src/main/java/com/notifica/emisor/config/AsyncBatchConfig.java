package com.notifica.emisor.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class AsyncBatchConfig {

    @Value("${emisor.emission.render-threads:0}")
    private int renderThreads;

    @Value("${emisor.emission.coordinator-threads:2}")
    private int coordinatorThreads;

    /** Fixed pool for PDF rendering; 0 threads configured means one per available processor. */
    @Bean(name = "renderExecutor")
    public ThreadPoolTaskExecutor renderExecutor() {
        int size = renderThreads > 0 ? renderThreads : Runtime.getRuntime().availableProcessors();
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(size);
        exec.setMaxPoolSize(size);
        exec.setQueueCapacity(Integer.MAX_VALUE);
        exec.setThreadNamePrefix("emisor-render-");
        exec.initialize();
        return exec;
    }

    /** Runs started through the async endpoint; each one occupies a coordinator thread until it finishes. */
    @Bean(name = "emissionCoordinatorExecutor")
    public ThreadPoolTaskExecutor emissionCoordinatorExecutor() {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(Math.max(1, coordinatorThreads));
        exec.setMaxPoolSize(Math.max(1, coordinatorThreads));
        exec.setQueueCapacity(50);
        exec.setThreadNamePrefix("emisor-run-");
        exec.initialize();
        return exec;
    }
}
