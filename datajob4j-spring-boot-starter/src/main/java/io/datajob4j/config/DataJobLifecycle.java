package io.datajob4j.config;

import io.datajob4j.JobManager;
import io.datajob4j.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the scheduler lifecycle with the Spring container: stored jobs are scheduled, then triggers start.
 */
public class DataJobLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(DataJobLifecycle.class);

    private final JobManager jobManager;
    private final Scheduler scheduler;
    private final DataJobProperties props;
    private volatile boolean running = false;

    public DataJobLifecycle(JobManager jobManager, Scheduler scheduler, DataJobProperties props) {
        this.jobManager = jobManager;
        this.scheduler = scheduler;
        this.props = props;
    }

    @Override
    public void start() {
        int scheduled = jobManager.bootstrap();
        scheduler.start();
        running = true;
        log.info("datajob runtime started with {} job(s)", scheduled);
    }

    @Override
    public void stop() {
        scheduler.stop(props.isWaitForJobsOnShutdown());
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
