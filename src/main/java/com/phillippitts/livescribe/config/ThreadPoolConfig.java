package com.phillippitts.livescribe.config;

import com.phillippitts.livescribe.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the bounded executor that runs provider calls in parallel.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.stt.*}).
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor for recognition and diarization running side by side.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue are
     * full, the caller thread executes the task, providing backpressure instead of failing fast.
     *
     * <p>MDC propagation: copies the Log4j2 ThreadContext (session id) from the submitting thread to
     * the pool thread.
     */
    @Bean(name = "sttExecutor")
    public ThreadPoolTaskExecutor sttExecutor() {
        ThreadPoolProperties.SttPoolProperties sttProps = threadPoolProperties.getStt();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(sttProps.getCorePoolSize());
        executor.setMaxPoolSize(sttProps.getMaxPoolSize());
        executor.setQueueCapacity(sttProps.getQueueCapacity());
        executor.setThreadNamePrefix(sttProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(sttProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
