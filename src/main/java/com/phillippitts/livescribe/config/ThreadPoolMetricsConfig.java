package com.phillippitts.livescribe.config;

import io.micrometer.core.instrument.Gauge;
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
 * Exposes the provider executor through Micrometer gauges ({@code livescribe.pool.size},
 * {@code .active}, {@code .queued}, {@code .completed}) and logs a health line every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    static final String POOL_PREFIX = "livescribe.pool";

    private final ObjectProvider<ThreadPoolTaskExecutor> sttExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("sttExecutor") ObjectProvider<ThreadPoolTaskExecutor> sttExecutorProvider) {
        this.sttExecutorProvider = sttExecutorProvider;
    }

    @Bean
    public MeterBinder sttExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = this.sttExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder(POOL_PREFIX + ".size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the provider pool")
                    .register(registry);
            Gauge.builder(POOL_PREFIX + ".active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Threads actively running provider calls")
                    .register(registry);
            Gauge.builder(POOL_PREFIX + ".queued", executor, e -> e.getQueue().size())
                    .description("Provider calls waiting in the queue")
                    .register(registry);
            Gauge.builder(POOL_PREFIX + ".completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed provider calls")
                    .register(registry);

            LOG.info("Provider pool metrics registered: {}.*", POOL_PREFIX);
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = this.sttExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Provider pool health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
