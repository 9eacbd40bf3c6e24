package com.phillippitts.airplay.config;

import com.phillippitts.airplay.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Pipeline and event executors, sized from {@code threadpool.*}.
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    static final String PIPELINE_THREAD_PREFIX = "pipeline-";
    static final String EVENT_THREAD_PREFIX = "event-pool-";

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Fixed-size pool running station polls, {@code workers} threads over a bounded queue.
     *
     * <p>A full pool throws ({@link ThreadPoolExecutor.AbortPolicy}); the scheduler counts the
     * refusal as backpressure and offers the station again on its next tick, so the scheduler
     * thread never runs a pipeline itself. Workers inherit the submitter's stationId and pollId.
     */
    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor() {
        ThreadPoolProperties.Pipeline pipeline = threadPoolProperties.pipeline();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pipeline.workers());
        executor.setMaxPoolSize(pipeline.workers());
        executor.setQueueCapacity(pipeline.queueCapacity());
        executor.setThreadNamePrefix(PIPELINE_THREAD_PREFIX);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagation());
        executor.initialize();
        return executor;
    }

    /**
     * Pool behind the async pipeline event listeners. Events are never dropped: with the queue
     * full the publishing worker runs the listener ({@link ThreadPoolExecutor.CallerRunsPolicy}).
     */
    @Bean(name = "eventExecutor")
    public ThreadPoolTaskExecutor eventExecutor() {
        ThreadPoolProperties.Event event = threadPoolProperties.event();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(event.coreWorkers());
        executor.setMaxPoolSize(event.maxWorkers());
        executor.setQueueCapacity(event.queueCapacity());
        executor.setThreadNamePrefix(EVENT_THREAD_PREFIX);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextPropagation());
        executor.initialize();
        return executor;
    }

    static TaskDecorator threadContextPropagation() {
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
