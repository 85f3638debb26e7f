package com.phillippitts.scalogram.config;

import com.phillippitts.scalogram.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the executors used by the batch pipeline.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and batch size.
 *
 * <p>Rejection policy for both pools: {@link ThreadPoolExecutor.CallerRunsPolicy}.
 * When the pool and queue are full, the submitting thread runs the task itself,
 * providing backpressure instead of failing.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor running one pipeline task per input file.
     *
     * <p>Pool sizing configured via {@code threadpool.batch.*}:
     * <ul>
     *   <li>Core pool: default 2</li>
     *   <li>Max pool: default 4</li>
     *   <li>Queue: default 100 files</li>
     * </ul>
     *
     * @return executor for file-level work
     */
    @Bean(name = "batchExecutor")
    public Executor batchExecutor() {
        return buildExecutor(threadPoolProperties.getBatch());
    }

    /**
     * Executor computing coefficient rows of one transform in parallel.
     *
     * <p>Pool sizing configured via {@code threadpool.scale.*}:
     * <ul>
     *   <li>Core pool: default 4</li>
     *   <li>Max pool: default 8</li>
     *   <li>Queue: default 256 rows</li>
     * </ul>
     *
     * @return executor for scale-level work
     */
    @Bean(name = "scaleExecutor")
    public Executor scaleExecutor() {
        return buildExecutor(threadPoolProperties.getScale());
    }

    private static Executor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the Log4j2 ThreadContext of the submitting thread into the worker thread, so the
     * {@code signalId} of a file shows up in logs written by scale workers.
     *
     * @return decorator restoring the worker's previous context afterwards
     */
    static TaskDecorator threadContextPropagator() {
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
