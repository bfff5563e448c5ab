package com.growthpilot.platform.scheduler.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class ExecutorConfig {

    private final SchedulerProperties properties;

    /**
     * Bounded pool for per-tweet dispatch. When the queue is full the cycle thread runs the task itself.
     */
    @Bean(name = "dispatchExecutor", destroyMethod = "shutdown")
    public ExecutorService dispatchExecutor() {
        int threads = properties.getDispatch().getWorkerThreads();
        int queueCapacity = properties.getDispatch().getQueueCapacity();
        AtomicInteger counter = new AtomicInteger();

        log.info("Initializing dispatchExecutor with {} threads, queue capacity {}", threads, queueCapacity);

        return new ThreadPoolExecutor(
                threads,
                threads,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r);
                    t.setName("tweet-dispatch-" + counter.incrementAndGet());
                    t.setDaemon(false);
                    return t;
                },
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }
}
