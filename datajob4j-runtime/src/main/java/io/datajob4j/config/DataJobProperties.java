package io.datajob4j.config;

import java.time.Duration;
import java.util.Objects;

import io.datajob4j.utils.CronSchedules;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the datajob scheduler and pipeline stages.
 */
@ConfigurationProperties(prefix = "datajob")
public class DataJobProperties {

    public enum RegistryType {
        FILE,
        MONGO
    }

    private boolean enabled = true;

    // scheduler
    private Duration processEvery = Duration.ofSeconds(1);
    private Duration misfireGraceTime = Duration.ofMinutes(5);
    private int maxConcurrency = 10;
    private String timezone = "UTC";
    private boolean waitForJobsOnShutdown = true;

    // registry
    private RegistryType registryType = RegistryType.FILE;
    private String registryPath = "./data/jobs.json";

    // pipeline
    private Duration transformTimeout = Duration.ofSeconds(300);
    private Duration fetchTimeout = Duration.ofSeconds(30);
    private int fetchMaxAttempts = 3;
    private Duration fetchBackoffUnit = Duration.ofSeconds(1); // retry n waits unit * 2^n
    private int deliveryMaxAttempts = 2;
    private Duration deliveryRetryDelay = Duration.ofSeconds(5);
    private boolean dryRun = false;

    // smtp
    private String mailHost;
    private int mailPort = 587;
    private String mailUsername;
    private String mailPassword;
    private String mailFrom;
    private boolean mailStartTls = true;

    /**
     * Reject settings the runtime cannot work with.
     *
     * @throws IllegalArgumentException on the first invalid value
     */
    public void validate() {
        requirePositive(processEvery, "datajob.processEvery");
        requirePositive(misfireGraceTime, "datajob.misfireGraceTime");
        requirePositive(transformTimeout, "datajob.transformTimeout");
        requirePositive(fetchTimeout, "datajob.fetchTimeout");
        Objects.requireNonNull(fetchBackoffUnit, "datajob.fetchBackoffUnit must not be null");
        if (fetchBackoffUnit.isNegative()) {
            throw new IllegalArgumentException("datajob.fetchBackoffUnit must not be negative");
        }
        Objects.requireNonNull(deliveryRetryDelay, "datajob.deliveryRetryDelay must not be null");
        if (deliveryRetryDelay.isNegative()) {
            throw new IllegalArgumentException("datajob.deliveryRetryDelay must not be negative");
        }
        if (maxConcurrency <= 0) {
            throw new IllegalArgumentException("datajob.maxConcurrency must be a positive number");
        }
        if (fetchMaxAttempts <= 0) {
            throw new IllegalArgumentException("datajob.fetchMaxAttempts must be a positive number");
        }
        if (deliveryMaxAttempts <= 0) {
            throw new IllegalArgumentException("datajob.deliveryMaxAttempts must be a positive number");
        }
        CronSchedules.resolveZone(timezone);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public Duration getMisfireGraceTime() {
        return misfireGraceTime;
    }

    public void setMisfireGraceTime(Duration misfireGraceTime) {
        this.misfireGraceTime = misfireGraceTime;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public boolean isWaitForJobsOnShutdown() {
        return waitForJobsOnShutdown;
    }

    public void setWaitForJobsOnShutdown(boolean waitForJobsOnShutdown) {
        this.waitForJobsOnShutdown = waitForJobsOnShutdown;
    }

    public RegistryType getRegistryType() {
        return registryType;
    }

    public void setRegistryType(RegistryType registryType) {
        this.registryType = registryType;
    }

    public String getRegistryPath() {
        return registryPath;
    }

    public void setRegistryPath(String registryPath) {
        this.registryPath = registryPath;
    }

    public Duration getTransformTimeout() {
        return transformTimeout;
    }

    public void setTransformTimeout(Duration transformTimeout) {
        this.transformTimeout = transformTimeout;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }

    public int getFetchMaxAttempts() {
        return fetchMaxAttempts;
    }

    public void setFetchMaxAttempts(int fetchMaxAttempts) {
        this.fetchMaxAttempts = fetchMaxAttempts;
    }

    public Duration getFetchBackoffUnit() {
        return fetchBackoffUnit;
    }

    public void setFetchBackoffUnit(Duration fetchBackoffUnit) {
        this.fetchBackoffUnit = fetchBackoffUnit;
    }

    public int getDeliveryMaxAttempts() {
        return deliveryMaxAttempts;
    }

    public void setDeliveryMaxAttempts(int deliveryMaxAttempts) {
        this.deliveryMaxAttempts = deliveryMaxAttempts;
    }

    public Duration getDeliveryRetryDelay() {
        return deliveryRetryDelay;
    }

    public void setDeliveryRetryDelay(Duration deliveryRetryDelay) {
        this.deliveryRetryDelay = deliveryRetryDelay;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public String getMailHost() {
        return mailHost;
    }

    public void setMailHost(String mailHost) {
        this.mailHost = mailHost;
    }

    public int getMailPort() {
        return mailPort;
    }

    public void setMailPort(int mailPort) {
        this.mailPort = mailPort;
    }

    public String getMailUsername() {
        return mailUsername;
    }

    public void setMailUsername(String mailUsername) {
        this.mailUsername = mailUsername;
    }

    public String getMailPassword() {
        return mailPassword;
    }

    public void setMailPassword(String mailPassword) {
        this.mailPassword = mailPassword;
    }

    public String getMailFrom() {
        return mailFrom;
    }

    public void setMailFrom(String mailFrom) {
        this.mailFrom = mailFrom;
    }

    public boolean isMailStartTls() {
        return mailStartTls;
    }

    public void setMailStartTls(boolean mailStartTls) {
        this.mailStartTls = mailStartTls;
    }
}
