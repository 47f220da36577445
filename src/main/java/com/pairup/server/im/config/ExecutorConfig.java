package com.pairup.server.im.config;

import cn.hutool.core.thread.ExecutorBuilder;
import cn.hutool.core.thread.ThreadFactoryBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class ExecutorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Push deliveries run here, off the connection threads. A full queue rejects the task.
     */
    @Bean(name = "pushExecutor", destroyMethod = "shutdown")
    public ExecutorService pushExecutor(@Value("${messaging.push.threads:8}") int threads,
                                        @Value("${messaging.push.queue-capacity:1000}") int queueCapacity) {
        return ExecutorBuilder.create()
                .setCorePoolSize(threads)
                .setMaxPoolSize(threads)
                .setWorkQueue(new LinkedBlockingQueue<>(queueCapacity))
                .setThreadFactory(ThreadFactoryBuilder.create().setNamePrefix("push-").setDaemon(true).build())
                .setHandler(new ThreadPoolExecutor.AbortPolicy())
                .build();
    }

    @Bean(name = "pushTimeoutScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService pushTimeoutScheduler() {
        return Executors.newSingleThreadScheduledExecutor(
                ThreadFactoryBuilder.create().setNamePrefix("push-timeout-").setDaemon(true).build());
    }
}
