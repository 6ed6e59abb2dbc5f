package io.datajob4j;

import io.datajob4j.core.DuplicateJobException;
import io.datajob4j.core.JobDefinition;
import io.datajob4j.core.JobNotFoundException;
import io.datajob4j.core.RunOutcome;

import java.util.List;
import java.util.Optional;

/**
 * Management facade over the registry and the scheduler, used by outer layers (HTTP, CLI).
 */
public interface JobManager {

    /**
     * Persist and schedule a new job.
     *
     * @throws DuplicateJobException if the name is taken
     */
    JobDefinition create(JobDefinition job);

    /**
     * Replace an existing job's definition and reschedule it. {@code created_at} and {@code last_run} are kept.
     *
     * @throws JobNotFoundException if no job has this name
     */
    JobDefinition update(JobDefinition job);

    /**
     * Unschedule and remove.
     *
     * @throws JobNotFoundException if no job has this name
     */
    void delete(String name);

    Optional<JobDefinition> get(String name);

    List<JobDefinition> list();

    /**
     * Run a stored job synchronously without delivering.
     *
     * @throws JobNotFoundException if no job has this name
     */
    RunOutcome testRun(String name);

    RunOutcome testRun(JobDefinition job);

    /**
     * Load every persisted job and schedule it. One bad record never blocks the others.
     *
     * @return number of jobs scheduled
     */
    int bootstrap();
}
