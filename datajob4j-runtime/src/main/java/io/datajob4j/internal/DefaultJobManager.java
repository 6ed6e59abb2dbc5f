package io.datajob4j.internal;

import io.datajob4j.JobManager;
import io.datajob4j.JobRegistry;
import io.datajob4j.JobRunner;
import io.datajob4j.Scheduler;
import io.datajob4j.core.DuplicateJobException;
import io.datajob4j.core.JobDefinition;
import io.datajob4j.core.JobNotFoundException;
import io.datajob4j.core.RunOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the registry and the scheduler in step for create/update/delete, and exposes synchronous test runs.
 */
public class DefaultJobManager implements JobManager {
    private static final Logger log = LoggerFactory.getLogger(DefaultJobManager.class);

    private final JobRegistry registry;
    private final Scheduler scheduler;
    private final JobRunner runner;

    public DefaultJobManager(JobRegistry registry, Scheduler scheduler, JobRunner runner) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
    }

    @Override
    public JobDefinition create(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        if (!registry.insert(job)) {
            throw new DuplicateJobException(job.name());
        }

        try {
            scheduler.schedule(job);
        } catch (RuntimeException e) {
            registry.delete(job.name());
            throw e;
        }
        log.info("datajob job created name={}", job.name());
        return job;
    }

    @Override
    public JobDefinition update(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        JobDefinition existing = registry.find(job.name())
                .orElseThrow(() -> new JobNotFoundException(job.name()));

        JobDefinition merged = job.withTimestampsOf(existing);
        scheduler.schedule(merged);
        try {
            registry.save(merged);
        } catch (RuntimeException e) {
            scheduler.schedule(existing);
            throw e;
        }
        log.info("datajob job updated name={}", job.name());
        return merged;
    }

    @Override
    public void delete(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (!registry.exists(name)) {
            throw new JobNotFoundException(name);
        }
        scheduler.unschedule(name);
        registry.delete(name);
        log.info("datajob job deleted name={}", name);
    }

    @Override
    public Optional<JobDefinition> get(String name) {
        return registry.find(name);
    }

    @Override
    public List<JobDefinition> list() {
        return registry.findAll();
    }

    @Override
    public RunOutcome testRun(String name) {
        JobDefinition job = registry.find(name).orElseThrow(() -> new JobNotFoundException(name));
        return runner.test(job);
    }

    @Override
    public RunOutcome testRun(JobDefinition job) {
        return runner.test(Objects.requireNonNull(job, "job must not be null"));
    }

    @Override
    public int bootstrap() {
        List<JobDefinition> jobs = registry.findAll();
        int scheduled = 0;
        for (JobDefinition job : jobs) {
            try {
                scheduler.schedule(job);
                scheduled++;
            } catch (RuntimeException e) {
                log.error("datajob job could not be scheduled at boot, skipped name={} msg={}", job.name(), e.getMessage(), e);
            }
        }
        log.info("datajob bootstrap scheduled {} of {} job(s)", scheduled, jobs.size());
        return scheduled;
    }
}
