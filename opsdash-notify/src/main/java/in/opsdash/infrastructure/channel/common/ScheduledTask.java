package in.opsdash.infrastructure.channel.common;

/**
 * Handle of a task registered with a {@link TaskScheduler}.
 */
public interface ScheduledTask {

    /**
     * Cancel the task if it has not run yet. Safe to call more than once.
     */
    void cancel();

    boolean isCancelled();
}
