package io.datajob4j.internal;

import io.datajob4j.JobRegistry;
import io.datajob4j.JobRunner;
import io.datajob4j.core.Dataset;
import io.datajob4j.core.DeliveryException;
import io.datajob4j.core.JobDefinition;
import io.datajob4j.core.PipelineException;
import io.datajob4j.core.RunOutcome;
import io.datajob4j.core.Stage;
import io.datajob4j.pipeline.DataFetcher;
import io.datajob4j.pipeline.Notifier;
import io.datajob4j.pipeline.ResultFormatter;
import io.datajob4j.pipeline.TransformRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Orchestrates fetch → transform → format → deliver for one job.
 *
 * <p>The first failing stage short-circuits the rest and is reported through a failure notice. Losing the
 * failure notice, or failing to record {@code last_run} after a delivered result, is logged only.
 */
public class PipelineJobRunner implements JobRunner {
    private static final Logger log = LoggerFactory.getLogger(PipelineJobRunner.class);

    private final DataFetcher fetcher;
    private final TransformRunner transformRunner;
    private final ResultFormatter formatter;
    private final Notifier notifier;
    private final JobRegistry registry;

    public PipelineJobRunner(DataFetcher fetcher,
                             TransformRunner transformRunner,
                             ResultFormatter formatter,
                             Notifier notifier,
                             JobRegistry registry) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher must not be null");
        this.transformRunner = Objects.requireNonNull(transformRunner, "transformRunner must not be null");
        this.formatter = Objects.requireNonNull(formatter, "formatter must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public RunOutcome run(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");

        Instant startedAt = nowInstant();
        log.info("datajob run started name={} source={}", job.name(), job.source().location());

        RunOutcome outcome = execute(job, true);
        Duration took = Duration.between(startedAt, outcome.finishedAt());

        if (outcome.success()) {
            log.info("datajob run succeeded name={} rows={} took={}", job.name(), outcome.output().rowCount(), took);
            recordLastRun(job.name(), outcome.finishedAt());
        } else {
            log.error("datajob run failed name={} stage={} msg={} took={}",
                    job.name(), outcome.stage().label(), outcome.message(), took);
            sendFailureNotice(job, outcome);
        }
        return outcome;
    }

    @Override
    public RunOutcome test(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");

        log.info("datajob test run started name={}", job.name());
        RunOutcome outcome = execute(job, false);
        if (outcome.success()) {
            log.info("datajob test run succeeded name={} rows={}", job.name(), outcome.output().rowCount());
        } else {
            log.warn("datajob test run failed name={} {}", job.name(), outcome.failureDescription());
        }
        return outcome;
    }

    private RunOutcome execute(JobDefinition job, boolean deliver) {
        Stage stage = Stage.FETCH;
        try {
            Dataset input = fetcher.fetch(job.source());
            log.debug("datajob fetched name={} rows={} columns={}", job.name(), input.rowCount(), input.columns());

            stage = Stage.TRANSFORM;
            Dataset output = transformRunner.run(job.transform(), input);

            stage = Stage.FORMAT;
            String content = formatter.format(output);

            if (deliver) {
                stage = Stage.DELIVERY;
                notifier.deliverSuccess(job.name(), job.recipients(), content);
            }
            return RunOutcome.success(job.name(), output, content, nowInstant());
        } catch (PipelineException e) {
            log.debug("datajob stage failed name={} stage={}", job.name(), e.stage(), e);
            return RunOutcome.failure(job.name(), e.stage(), e.getMessage(), nowInstant());
        } catch (RuntimeException e) {
            log.error("datajob stage raised unexpectedly name={} stage={} msg={}", job.name(), stage, e.getMessage(), e);
            return RunOutcome.failure(job.name(), stage, e.getClass().getSimpleName() + ": " + e.getMessage(), nowInstant());
        }
    }

    private void recordLastRun(String name, Instant finishedAt) {
        try {
            if (!registry.updateLastRun(name, finishedAt)) {
                log.warn("datajob last_run not recorded, job no longer exists name={}", name);
            }
        } catch (RuntimeException e) {
            log.error("datajob last_run update failed name={} msg={}", name, e.getMessage(), e);
        }
    }

    private void sendFailureNotice(JobDefinition job, RunOutcome outcome) {
        try {
            notifier.deliverFailure(job.name(), job.recipients(), outcome.failureDescription());
        } catch (DeliveryException e) {
            log.error("datajob failure notice lost name={} msg={}", job.name(), e.getMessage(), e);
        } catch (RuntimeException e) {
            log.error("datajob failure notice raised unexpectedly name={} msg={}", job.name(), e.getMessage(), e);
        }
    }

    /**
     * Utility: current time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }
}
