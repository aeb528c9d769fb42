package com.componenttracker.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicLong;

@Configuration
public class TaskExecutorConfig {

    private static final Logger logger = LoggerFactory.getLogger(TaskExecutorConfig.class);

    @Value("${app.broadcast.queue-capacity:1000}")
    private int queueCapacity;

    /**
     * Single worker so events reach every client in publish order.
     */
    @Bean("broadcastExecutor")
    public ThreadPoolTaskExecutor broadcastExecutor() {
        return singleThreadExecutor(queueCapacity, new LoggingDiscardPolicy());
    }

    static ThreadPoolTaskExecutor singleThreadExecutor(int queueCapacity, RejectedExecutionHandler rejectedHandler) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(rejectedHandler);
        executor.setThreadNamePrefix("Broadcast-");
        executor.initialize();
        return executor;
    }

    /**
     * Drops the event when the queue is full and logs it, so a lagging subscriber never stalls an upload.
     */
    static final class LoggingDiscardPolicy implements RejectedExecutionHandler {

        private final AtomicLong discarded = new AtomicLong();

        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            long total = discarded.incrementAndGet();
            logger.warn("Broadcast queue full ({} pending), dropping event. {} event(s) dropped so far",
                    executor.getQueue().size(), total);
        }

        long getDiscardedCount() {
            return discarded.get();
        }
    }
}
