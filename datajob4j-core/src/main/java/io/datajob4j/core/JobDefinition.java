package io.datajob4j.core;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.datajob4j.utils.CronSchedules;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Persisted description of a recurring data job.
 * <p>
 * Instances are validated on construction: a definition that exists is schedulable. JSON names follow the
 * registry layout ({@code job_name}, {@code schedule_time}, ...).
 */
public record JobDefinition(
        @JsonProperty("job_name") String name,
        @JsonProperty("schedule_time") String cron,
        @JsonProperty("data_source") DataSource source,
        @JsonProperty("processing_script") String transform,
        @JsonProperty("consumer_emails") List<String> recipients,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("last_run") Instant lastRun
) {
    public static final int MAX_NAME_LENGTH = 100;

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    public JobDefinition {
        Objects.requireNonNull(name, "name must not be null");
        name = name.trim();
        if (name.isEmpty()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("name must be at most " + MAX_NAME_LENGTH + " characters");
        }

        Objects.requireNonNull(cron, "cron must not be null");
        cron = cron.trim();
        CronSchedules.validate(cron);

        Objects.requireNonNull(source, "source must not be null");

        Objects.requireNonNull(transform, "transform must not be null");
        if (transform.isBlank()) {
            throw new IllegalArgumentException("transform must not be blank");
        }

        Objects.requireNonNull(recipients, "recipients must not be null");
        if (recipients.isEmpty()) {
            throw new IllegalArgumentException("recipients must not be empty");
        }
        List<String> cleaned = new ArrayList<>(recipients.size());
        for (String r : recipients) {
            if (r == null || !EMAIL.matcher(r.trim()).matches()) {
                throw new IllegalArgumentException("Invalid email address: " + r);
            }
            cleaned.add(r.trim());
        }
        recipients = List.copyOf(cleaned);

        Objects.requireNonNull(createdAt, "createdAt must not be null");
    }

    public JobDefinition withLastRun(Instant lastRun) {
        return new JobDefinition(name, cron, source, transform, recipients, createdAt, lastRun);
    }

    /**
     * Copy carrying this definition's schedule, source, code and recipients with the bookkeeping
     * timestamps of {@code existing}.
     */
    public JobDefinition withTimestampsOf(JobDefinition existing) {
        return new JobDefinition(name, cron, source, transform, recipients, existing.createdAt(), existing.lastRun());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String cron;
        private DataSource source;
        private String transform;
        private final List<String> recipients = new ArrayList<>();
        private Instant createdAt;
        private Instant lastRun;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder cron(String cron) {
            this.cron = cron;
            return this;
        }

        public Builder source(DataSource source) {
            this.source = source;
            return this;
        }

        public Builder apiSource(String url) {
            return source(new ApiSource(url));
        }

        public Builder fileSource(String path, FileFormat format) {
            return source(new FileSource(path, format));
        }

        public Builder transform(String transform) {
            this.transform = transform;
            return this;
        }

        public Builder recipients(List<String> recipients) {
            this.recipients.clear();
            if (recipients != null) {
                this.recipients.addAll(recipients);
            }
            return this;
        }

        public Builder recipient(String recipient) {
            this.recipients.add(recipient);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder lastRun(Instant lastRun) {
            this.lastRun = lastRun;
            return this;
        }

        /**
         * createdAt defaults to now.
         */
        public JobDefinition build() {
            return new JobDefinition(
                    name,
                    cron,
                    source,
                    transform,
                    recipients,
                    createdAt != null ? createdAt : Instant.now(),
                    lastRun
            );
        }
    }
}
