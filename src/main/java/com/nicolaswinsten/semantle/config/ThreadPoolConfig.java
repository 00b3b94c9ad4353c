package com.nicolaswinsten.semantle.config;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded executor for embedding provider calls.
 *
 * <p>Sized by {@code semantle.embedding.pool.*}. When the pool and queue are full new tasks are
 * rejected, which surfaces to the caller as a retryable provider error instead of running a
 * network call on the request thread. The submitting thread's MDC is copied onto the worker.
 */
@Configuration
public class ThreadPoolConfig {

    private final SemantleProperties properties;

    public ThreadPoolConfig(SemantleProperties properties) {
        this.properties = properties;
    }

    @Bean(name = "embeddingExecutor")
    public ThreadPoolTaskExecutor embeddingExecutor() {
        SemantleProperties.Pool pool = properties.getEmbedding().getPool();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(pool.getCorePoolSize(), pool.getMaxPoolSize()));
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix(pool.getThreadNamePrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);

        executor.setTaskDecorator(runnable -> {
            Map<String, String> contextMap = MDC.getCopyOfContextMap();
            return () -> {
                Map<String, String> previous = MDC.getCopyOfContextMap();
                try {
                    if (contextMap != null) {
                        MDC.setContextMap(contextMap);
                    }
                    runnable.run();
                } finally {
                    MDC.clear();
                    if (previous != null) {
                        MDC.setContextMap(previous);
                    }
                }
            };
        });

        executor.initialize();
        return executor;
    }
}
