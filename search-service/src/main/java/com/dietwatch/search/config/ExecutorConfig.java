package com.dietwatch.search.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    /**
     * Runs the keyword and vector branches of a search. Bounded so a burst of searches is rejected
     * (and degrades) instead of queueing without limit.
     */
    @Bean(name = "searchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService searchExecutor(
            @Value("${search.executor.threads:16}") int threads,
            @Value("${search.executor.queue-capacity:256}") int queueCapacity
    ) {
        int poolSize = Math.max(2, threads);
        return new ThreadPoolExecutor(
                poolSize,
                poolSize,
                60L,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                namedThreads("search-branch-"),
                new ThreadPoolExecutor.AbortPolicy()
        );
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
