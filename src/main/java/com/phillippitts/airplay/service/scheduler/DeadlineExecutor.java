package com.phillippitts.airplay.service.scheduler;

import com.phillippitts.airplay.exception.PipelineSaturatedException;
import com.phillippitts.airplay.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tasks on a bounded executor with a hard deadline per task.
 *
 * <p>The deadline clock starts when a worker picks the task up, not when it is queued. When it
 * fires, the task is cancelled with interruption and {@code onDeadline} runs on the timer thread.
 * A worker whose task was cancelled returns to the pool normally.
 */
public class DeadlineExecutor implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(DeadlineExecutor.class);

    private final Executor executor;
    private final ScheduledExecutorService timer;

    public DeadlineExecutor(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        AtomicInteger seq = new AtomicInteger();
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "deadline-timer-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Submits a task.
     *
     * @param taskName   name used in logs and exceptions
     * @param deadline   maximum run time once started
     * @param onDeadline invoked once if the deadline cancels the task, may be null
     * @return future of the task; {@code get()} throws CancellationException after a deadline
     * @throws PipelineSaturatedException if the executor refuses the task
     */
    public <T> Future<T> submit(String taskName, Callable<T> task, Duration deadline, Runnable onDeadline) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(deadline, "deadline");
        DeadlineTask<T> ft = new DeadlineTask<>(taskName, task, deadline, onDeadline);
        try {
            executor.execute(ft);
        } catch (RejectedExecutionException e) {
            throw new PipelineSaturatedException(taskName, e);
        }
        return ft;
    }

    @Override
    public void close() {
        timer.shutdownNow();
        try {
            if (!timer.awaitTermination(ProcessTimeouts.DEADLINE_TIMER_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("Deadline timer did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private final class DeadlineTask<T> extends FutureTask<T> {
        private final String name;
        private final Duration deadline;
        private final Runnable onDeadline;

        DeadlineTask(String name, Callable<T> callable, Duration deadline, Runnable onDeadline) {
            super(callable);
            this.name = name;
            this.deadline = deadline;
            this.onDeadline = onDeadline;
        }

        @Override
        public void run() {
            ScheduledFuture<?> guard = timer.schedule(this::expire, deadline.toMillis(), TimeUnit.MILLISECONDS);
            try {
                super.run();
            } finally {
                guard.cancel(false);
            }
        }

        private void expire() {
            if (cancel(true)) {
                LOG.warn("{} exceeded deadline of {}ms; cancelled", name, deadline.toMillis());
                if (onDeadline != null) {
                    try {
                        onDeadline.run();
                    } catch (RuntimeException e) {
                        LOG.error("Deadline callback of {} failed", name, e);
                    }
                }
            }
        }
    }
}
