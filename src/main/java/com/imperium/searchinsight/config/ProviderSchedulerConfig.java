package com.imperium.searchinsight.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * provider 阻塞调用使用的有界 worker 池，与请求线程隔离。
 */
@Configuration
public class ProviderSchedulerConfig {

    @Bean(name = "providerScheduler", destroyMethod = "dispose")
    public Scheduler providerScheduler(
            @Value("${app.search.worker.thread-cap:16}") int threadCap,
            @Value("${app.search.worker.queued-task-cap:256}") int queuedTaskCap,
            @Value("${app.search.worker.ttl-seconds:60}") int ttlSeconds) {
        return Schedulers.newBoundedElastic(
                Math.max(1, threadCap),
                Math.max(1, queuedTaskCap),
                "search-provider",
                Math.max(1, ttlSeconds),
                true);
    }
}
