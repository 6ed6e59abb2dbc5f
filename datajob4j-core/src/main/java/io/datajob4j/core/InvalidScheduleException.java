package io.datajob4j.core;

/**
 * A cron expression could not be parsed, or never produces a fire time.
 */
public class InvalidScheduleException extends IllegalArgumentException {

    private final String expression;

    public InvalidScheduleException(String expression, String reason) {
        super("Invalid cron expression '" + expression + "': " + reason);
        this.expression = expression;
    }

    public InvalidScheduleException(String expression, String reason, Throwable cause) {
        super("Invalid cron expression '" + expression + "': " + reason, cause);
        this.expression = expression;
    }

    public String expression() {
        return expression;
    }
}
