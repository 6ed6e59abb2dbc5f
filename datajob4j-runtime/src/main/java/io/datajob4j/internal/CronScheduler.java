package io.datajob4j.internal;

import io.datajob4j.JobRunner;
import io.datajob4j.Scheduler;
import io.datajob4j.config.DataJobProperties;
import io.datajob4j.core.InvalidScheduleException;
import io.datajob4j.core.JobDefinition;
import io.datajob4j.core.RunOutcome;
import io.datajob4j.utils.CronSchedule;
import io.datajob4j.utils.CronSchedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process cron scheduler.
 *
 * <p>One daemon poller thread evaluates triggers; each fire runs the {@link JobRunner} on a fixed worker pool so a
 * slow job never blocks trigger evaluation. Rules per fire event:
 * <ul>
 *   <li>Same-name runs never overlap: if the previous run is still in flight, the fire is coalesced (skipped)</li>
 *   <li>A fire evaluated later than {@code misfireGraceTime} after its scheduled time is dropped</li>
 *   <li>After a fire, a coalesce or a drop, the next fire time is the first cron time after now, so missed
 *       fires never replay as a burst</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.schedule(job);
 * scheduler.start();
 * ...
 * scheduler.unschedule("daily-sales");
 * scheduler.stop(true);
 * }</pre>
 */
public class CronScheduler implements Scheduler {
    private static final Logger log = LoggerFactory.getLogger(CronScheduler.class);

    private final DataJobProperties props;
    private final JobRunner runner;
    private final ZoneId zone;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile ExecutorService workerPool;
    private Thread pollerThread;

    private final ConcurrentHashMap<String, Trigger> triggers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Semaphore> perNameSem = new ConcurrentHashMap<>();
    private final Semaphore wakeSignal = new Semaphore(0);
    private int systemErrorCount = 0;

    public CronScheduler(DataJobProperties props, JobRunner runner) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.zone = CronSchedules.resolveZone(props.getTimezone());
    }

    private Semaphore semForName(String name) {
        return perNameSem.computeIfAbsent(name, n -> new Semaphore(1));
    }

    /**
     * Start evaluating triggers. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        try {
            props.validate();
        } catch (RuntimeException e) {
            started.set(false);
            throw e;
        }

        log.info("datajob scheduler starting with processEvery={}, misfireGraceTime={}, maxConcurrency={}, timezone={}",
                props.getProcessEvery(),
                props.getMisfireGraceTime(),
                props.getMaxConcurrency(),
                zone);

        synchronized (this) {
            if (workerPool == null) {
                workerPool = Executors.newFixedThreadPool(props.getMaxConcurrency(), r -> {
                    Thread t = new Thread(r);
                    t.setName("datajob.workerPool");
                    t.setDaemon(true);
                    return t;
                });
            }

            if (pollerThread == null) {
                pollerThread = new Thread(this::pollerLoop);
                pollerThread.setName("datajob.poller");
                pollerThread.setDaemon(true);
                pollerThread.start();
            }
        }
        log.info("datajob scheduler started with {} trigger(s)", triggers.size());
    }

    /**
     * Stop evaluating triggers. Idempotent.
     *
     * <p>With {@code wait}, blocks until every run in flight has finished. Without it, returns at once and the
     * runs complete on their own daemon threads.
     */
    @Override
    public void stop(boolean wait) {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("datajob scheduler stopping wait={} running={}", wait, runningJobNames());

        ExecutorService pool;
        synchronized (this) {
            if (pollerThread != null) {
                pollerThread.interrupt();
                pollerThread = null;
            }
            pool = workerPool;
            workerPool = null;
        }

        if (pool != null) {
            pool.shutdown();
            if (wait) {
                try {
                    while (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                        log.info("datajob scheduler still waiting for running jobs {}", runningJobNames());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("datajob scheduler interrupted while waiting for running jobs {}", runningJobNames());
                }
            }
        }

        wakeSignal.drainPermits();
        log.info("datajob scheduler stopped.");
    }

    @Override
    public synchronized Instant schedule(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");

        CronSchedule schedule = CronSchedules.parse(job.cron(), zone);
        Instant first = schedule.nextAfter(nowInstant());
        if (first == null) {
            throw new InvalidScheduleException(job.cron(), "expression never fires");
        }

        Trigger previous = triggers.put(job.name(), new Trigger(job, schedule, first));
        log.info("datajob job scheduled name={} cron={} nextFireAt={} replaced={}",
                job.name(), job.cron(), first, previous != null);
        wakeSignal.release();
        return first;
    }

    @Override
    public synchronized boolean unschedule(String name) {
        Objects.requireNonNull(name, "name must not be null");

        Trigger removed = triggers.remove(name);
        if (removed == null) {
            log.warn("datajob unschedule ignored, job is not scheduled name={}", name);
            return false;
        }
        log.info("datajob job unscheduled name={}", name);
        wakeSignal.release();
        return true;
    }

    @Override
    public boolean isScheduled(String name) {
        return triggers.containsKey(name);
    }

    @Override
    public Instant nextFireTime(String name) {
        Trigger t = triggers.get(name);
        return t == null ? null : t.nextFireAt();
    }

    @Override
    public Set<String> scheduledJobNames() {
        return Collections.unmodifiableSet(new TreeSet<>(triggers.keySet()));
    }

    @Override
    public boolean isRunning(String name) {
        Semaphore sem = perNameSem.get(name);
        return sem != null && sem.availablePermits() == 0;
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    /**
     * Evaluate every trigger against {@code now}: fire, coalesce or drop the due ones and advance them.
     *
     * @return number of runs handed to the worker pool
     */
    synchronized int pollOnce(Instant now) {
        int fired = 0;
        for (Trigger trigger : triggers.values()) {
            Instant due = trigger.nextFireAt();
            if (due == null || due.isAfter(now)) {
                continue;
            }

            String name = trigger.job().name();
            Duration late = Duration.between(due, now);
            if (late.compareTo(props.getMisfireGraceTime()) > 0) {
                log.warn("datajob fire dropped, missed by more than the grace window name={} scheduledAt={} late={}",
                        name, due, late);
            } else if (dispatch(trigger, due)) {
                fired++;
            }

            Instant next = trigger.schedule().nextAfter(now);
            trigger.advance(next);
            if (next == null) {
                triggers.remove(name, trigger);
                log.info("datajob job has no further fire times, removed name={}", name);
            }
        }
        return fired;
    }

    private boolean dispatch(Trigger trigger, Instant scheduledAt) {
        JobDefinition job = trigger.job();
        String name = job.name();

        ExecutorService pool = workerPool;
        if (pool == null) {
            log.debug("datajob fire skipped, scheduler not started name={}", name);
            return false;
        }

        Semaphore nameSem = semForName(name);
        if (!nameSem.tryAcquire()) {
            log.warn("datajob fire coalesced, previous run still in flight name={} scheduledAt={}", name, scheduledAt);
            return false;
        }

        try {
            pool.submit(() -> {
                try {
                    log.debug("datajob job fired name={} scheduledAt={}", name, scheduledAt);
                    RunOutcome outcome = runner.run(job);
                    log.debug("datajob job finished name={} success={}", name, outcome.success());
                } catch (Exception e) {
                    log.error("datajob runner raised unexpectedly name={} msg={}", name, e.getMessage(), e);
                } finally {
                    nameSem.release();
                }
            });
        } catch (RejectedExecutionException e) {
            nameSem.release();
            log.warn("datajob fire rejected, worker pool is shutting down name={}", name);
            return false;
        }
        return true;
    }

    private void pollerLoop() {
        while (started.get()) {
            try {
                pollOnce(nowInstant());
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("datajob pollOnce failed msg={}", e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            try {
                if (wakeSignal.tryAcquire(sleepMillis(), TimeUnit.MILLISECONDS)) {
                    wakeSignal.drainPermits();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Sleep until the earliest trigger, never longer than processEvery.
    private long sleepMillis() {
        long max = props.getProcessEvery().toMillis();
        Instant now = nowInstant();
        long sleep = max;
        for (Trigger t : triggers.values()) {
            Instant next = t.nextFireAt();
            if (next != null) {
                sleep = Math.min(sleep, Duration.between(now, next).toMillis());
            }
        }
        return Math.max(1L, sleep);
    }

    // Exponential backoff for repeated poll-loop failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private Set<String> runningJobNames() {
        Set<String> names = new TreeSet<>();
        perNameSem.forEach((name, sem) -> {
            if (sem.availablePermits() == 0) {
                names.add(name);
            }
        });
        return names;
    }
}
