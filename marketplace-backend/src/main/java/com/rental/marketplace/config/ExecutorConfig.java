package com.rental.marketplace.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class ExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutorConfig.class);

    /**
     * Bounded pool the detection service runs its signal extractors on. When the queue is full
     * the task is rejected and the detection service scores that signal 0.
     */
    @Bean(name = "detectionExecutor", destroyMethod = "shutdown")
    public ExecutorService detectionExecutor(SpamDetectionProperties properties) {
        SpamDetectionProperties.Executor config = properties.getExecutor();
        log.info("Initializing detectionExecutor: core={}, max={}, queue={}",
                config.getCorePoolSize(), config.getMaxPoolSize(), config.getQueueCapacity());

        AtomicInteger counter = new AtomicInteger();
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                config.getCorePoolSize(),
                config.getMaxPoolSize(),
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(config.getQueueCapacity()),
                r -> {
                    Thread t = new Thread(r);
                    t.setName("spam-detect-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy() {
                    @Override
                    public void rejectedExecution(Runnable r, ThreadPoolExecutor e) {
                        log.warn("Detection executor saturated ({} queued), rejecting signal task",
                                e.getQueue().size());
                        super.rejectedExecution(r, e);
                    }
                });
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }
}
