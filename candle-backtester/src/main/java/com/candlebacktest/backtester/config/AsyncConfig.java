package com.candlebacktest.backtester.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools for asynchronous backtest runs and the event worker.
 */
@Configuration
public class AsyncConfig {

    @Value("${backtest.worker.thread-count:3}")
    private int workerThreadCount;

    @Value("${backtest.events.worker-count:1}")
    private int eventWorkerCount;

    @Bean(name = "backtestExecutorService", destroyMethod = "shutdown")
    public ExecutorService backtestExecutorService() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(workerThreadCount,
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("BacktestRunner-" + counter.incrementAndGet());
                    thread.setDaemon(false);
                    return thread;
                });
    }

    @Bean(name = "eventWorkerExecutorService")
    public ExecutorService eventWorkerExecutorService() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(eventWorkerCount, 1),
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("BacktestEventWorker-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }
}
