package io.datajob4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of one orchestrated run. Never persisted.
 *
 * <p>On success {@code output} and {@code content} are set; on failure {@code stage} and {@code message} are.
 */
public record RunOutcome(
        String jobName,
        boolean success,
        Dataset output,
        String content,
        Stage stage,
        String message,
        Instant finishedAt
) {
    public static RunOutcome success(String jobName, Dataset output, String content, Instant finishedAt) {
        return new RunOutcome(
                Objects.requireNonNull(jobName, "jobName must not be null"),
                true,
                Objects.requireNonNull(output, "output must not be null"),
                Objects.requireNonNull(content, "content must not be null"),
                null,
                null,
                finishedAt
        );
    }

    public static RunOutcome failure(String jobName, Stage stage, String message, Instant finishedAt) {
        return new RunOutcome(
                Objects.requireNonNull(jobName, "jobName must not be null"),
                false,
                null,
                null,
                Objects.requireNonNull(stage, "stage must not be null"),
                message,
                finishedAt
        );
    }

    /**
     * "Transform failed: ..." style text naming the failed stage, or null on success.
     */
    public String failureDescription() {
        if (success) {
            return null;
        }
        return stage.label() + " failed: " + message;
    }
}
