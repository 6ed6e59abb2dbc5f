package io.datajob4j;

import io.datajob4j.core.JobDefinition;
import io.datajob4j.core.RunOutcome;

/**
 * Runs the fetch, transform, format and deliver pipeline for one job.
 * <p>
 * Implementations never throw: every failure is turned into a {@link RunOutcome}.
 */
public interface JobRunner {

    /**
     * Full run: deliver the result (or a failure notice) and record {@code last_run} on success.
     */
    RunOutcome run(JobDefinition job);

    /**
     * Synchronous trial: fetch, transform and format only. Nothing is delivered or persisted.
     */
    RunOutcome test(JobDefinition job);
}
