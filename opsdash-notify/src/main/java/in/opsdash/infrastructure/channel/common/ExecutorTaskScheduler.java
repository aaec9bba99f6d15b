package in.opsdash.infrastructure.channel.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TaskScheduler} backed by a single daemon {@link ScheduledExecutorService}.
 *
 * Task exceptions are logged here; a scheduled future would otherwise keep them to itself.
 */
public class ExecutorTaskScheduler implements TaskScheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ExecutorTaskScheduler.class);

    private final String name;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    public ExecutorTaskScheduler(String name) {
        this(name, Clock.systemUTC());
    }

    public ExecutorTaskScheduler(String name, Clock clock) {
        this.name = name;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = scheduler.schedule(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("[{}] Scheduled task failed", name, e);
            }
        }, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
        return new FutureTask(future);
    }

    @Override
    public Clock clock() {
        return clock;
    }

    /**
     * Stop the worker thread, waiting briefly for a running task to finish.
     */
    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class FutureTask implements ScheduledTask {
        private final ScheduledFuture<?> future;

        private FutureTask(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
