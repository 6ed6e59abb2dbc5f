package io.datajob4j;

import io.datajob4j.core.InvalidScheduleException;
import io.datajob4j.core.JobDefinition;

import java.time.Instant;
import java.util.Set;

/**
 * Cron scheduler API.
 *
 * <p>Holds one trigger per job name and hands each fire event to a {@link JobRunner}. A job never runs
 * concurrently with itself: a fire that arrives while the previous run of the same name is still in
 * flight is coalesced into a no-op.
 */
public interface Scheduler {

    /**
     * Start evaluating triggers. Idempotent.
     */
    void start();

    /**
     * Stop evaluating triggers. Idempotent.
     *
     * @param wait when true, block until runs in flight have finished; when false, return immediately and
     *             let them finish on their own
     */
    void stop(boolean wait);

    /**
     * Register or replace the trigger for {@code job.name()}.
     *
     * @return the first fire time
     * @throws InvalidScheduleException if the cron expression is invalid or never fires
     */
    Instant schedule(JobDefinition job);

    /**
     * Remove the trigger for {@code name}. Unknown names only log a warning.
     *
     * @return true if a trigger was removed
     */
    boolean unschedule(String name);

    boolean isScheduled(String name);

    /**
     * @return next fire time, or null when the name is not scheduled
     */
    Instant nextFireTime(String name);

    Set<String> scheduledJobNames();

    /**
     * @return true while a run for {@code name} is in flight
     */
    boolean isRunning(String name);
}
