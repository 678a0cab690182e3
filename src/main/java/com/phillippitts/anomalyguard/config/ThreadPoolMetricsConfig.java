package com.phillippitts.anomalyguard.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes pipeline and training executor gauges via Micrometer:
 * <ul>
 *   <li>{@code pipeline.pool.active} / {@code training.pool.active} - actively executing tasks</li>
 *   <li>{@code pipeline.pool.queued} / {@code training.pool.queued} - tasks waiting in the queue</li>
 *   <li>{@code pipeline.pool.completed} / {@code training.pool.completed} - cumulative completed tasks</li>
 * </ul>
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> trainingExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("pipelineExecutor") ObjectProvider<ThreadPoolTaskExecutor> pipelineExecutorProvider,
            @Qualifier("trainingExecutor") ObjectProvider<ThreadPoolTaskExecutor> trainingExecutorProvider) {
        this.pipelineExecutorProvider = pipelineExecutorProvider;
        this.trainingExecutorProvider = trainingExecutorProvider;
    }

    @Bean
    public MeterBinder executorMetrics() {
        return registry -> {
            bind(registry, "pipeline.pool", pipelineExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "training.pool", trainingExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Executor metrics registered: pipeline.pool.*, training.pool.*");
        };
    }

    private static void bind(MeterRegistry registry, String prefix, ThreadPoolExecutor executor) {
        Gauge.builder(prefix + ".size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .register(registry);
        Gauge.builder(prefix + ".active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .register(registry);
        Gauge.builder(prefix + ".queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .register(registry);
        Gauge.builder(prefix + ".completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .register(registry);
    }

    /**
     * Logs executor health every 5 minutes.
     */
    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        log("Pipeline", pipelineExecutorProvider.getObject().getThreadPoolExecutor());
        log("Training", trainingExecutorProvider.getObject().getThreadPoolExecutor());
    }

    private static void log(String name, ThreadPoolExecutor executor) {
        LOG.info("{} pool health: size={}/{}, active={}, queued={}, completed={}",
                name,
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
