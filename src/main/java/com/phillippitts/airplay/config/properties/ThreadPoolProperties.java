package com.phillippitts.airplay.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Sizes of the station pipeline pool and the event listener pool.
 *
 * @param pipeline station pollers; each worker runs one poll from capture to recording
 * @param event    async listeners (logging, metrics) behind {@code @Async("eventExecutor")}
 */
@ConfigurationProperties(prefix = "threadpool")
@Validated
public record ThreadPoolProperties(Pipeline pipeline, Event event) {

    public ThreadPoolProperties {
        if (pipeline == null) {
            pipeline = new Pipeline(null, null);
        }
        if (event == null) {
            event = new Event(null, null, null);
        }
    }

    public static ThreadPoolProperties defaults() {
        return new ThreadPoolProperties(null, null);
    }

    /**
     * @param workers       concurrent station polls; the pool never grows past this
     * @param queueCapacity polls waiting for a worker before submissions are refused
     */
    public record Pipeline(Integer workers, Integer queueCapacity) {
        public Pipeline {
            if (workers == null) {
                workers = 20;
            }
            if (queueCapacity == null) {
                queueCapacity = 20;
            }
            if (workers <= 0) {
                throw new IllegalArgumentException("threadpool.pipeline.workers must be positive: " + workers);
            }
            if (queueCapacity < 0) {
                throw new IllegalArgumentException("threadpool.pipeline.queue-capacity must be >= 0: " + queueCapacity);
            }
        }
    }

    /**
     * @param coreWorkers   listener threads kept alive
     * @param maxWorkers    upper bound once the queue is full
     * @param queueCapacity pending events before the publisher runs the listener itself
     */
    public record Event(Integer coreWorkers, Integer maxWorkers, Integer queueCapacity) {
        public Event {
            if (coreWorkers == null) {
                coreWorkers = 2;
            }
            if (maxWorkers == null) {
                maxWorkers = 4;
            }
            if (queueCapacity == null) {
                queueCapacity = 100;
            }
            if (coreWorkers <= 0 || maxWorkers < coreWorkers) {
                throw new IllegalArgumentException("threadpool.event needs 0 < core-workers <= max-workers, got "
                        + coreWorkers + "/" + maxWorkers);
            }
        }
    }
}
