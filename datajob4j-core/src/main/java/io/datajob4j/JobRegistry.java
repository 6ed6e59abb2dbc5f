package io.datajob4j;

import io.datajob4j.core.JobDefinition;
import io.datajob4j.core.RegistryException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable keyed store of job definitions. Every call is one read-modify-write critical section.
 *
 * <p>All methods throw {@link RegistryException} on persistence failure.
 */
public interface JobRegistry {

    List<JobDefinition> findAll();

    Optional<JobDefinition> find(String name);

    boolean exists(String name);

    /**
     * Add a job unless the name is already taken. Check and write are one atomic step.
     *
     * @return false when a job with this name already exists, leaving it untouched
     */
    boolean insert(JobDefinition job);

    /**
     * Insert or replace by name.
     *
     * @return true when the job was created, false when an existing one was replaced
     */
    boolean save(JobDefinition job);

    /**
     * @return true if a job was removed
     */
    boolean delete(String name);

    /**
     * @return false when the job no longer exists
     */
    boolean updateLastRun(String name, Instant lastRun);
}
