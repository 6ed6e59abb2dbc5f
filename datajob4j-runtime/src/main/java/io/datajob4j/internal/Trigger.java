package io.datajob4j.internal;

import io.datajob4j.core.JobDefinition;
import io.datajob4j.utils.CronSchedule;

import java.time.Instant;

/**
 * Live schedule state of one job. Mutated only under the scheduler's lock.
 */
final class Trigger {

    private final JobDefinition job;
    private final CronSchedule schedule;
    private volatile Instant nextFireAt;

    Trigger(JobDefinition job, CronSchedule schedule, Instant nextFireAt) {
        this.job = job;
        this.schedule = schedule;
        this.nextFireAt = nextFireAt;
    }

    JobDefinition job() {
        return job;
    }

    CronSchedule schedule() {
        return schedule;
    }

    Instant nextFireAt() {
        return nextFireAt;
    }

    void advance(Instant next) {
        this.nextFireAt = next;
    }
}
