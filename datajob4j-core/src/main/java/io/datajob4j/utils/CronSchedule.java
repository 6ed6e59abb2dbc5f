package io.datajob4j.utils;

import org.quartz.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.List;

/**
 * A parsed cron expression bound to a time zone. Produced by {@link CronSchedules#parse(String, ZoneId)}.
 * <p>
 * Holds one Quartz expression, or two when both day-of-month and day-of-week are restricted
 * (a time matches when either does).
 */
public final class CronSchedule {

    private final String expression;
    private final ZoneId zone;
    private final List<CronExpression> quartz;

    CronSchedule(String expression, ZoneId zone, List<CronExpression> quartz) {
        this.expression = expression;
        this.zone = zone;
        this.quartz = quartz;
    }

    public String expression() {
        return expression;
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * First fire time strictly after {@code after}, or {@code null} if the expression never fires again.
     */
    public synchronized Instant nextAfter(Instant after) {
        Date from = Date.from(after);
        Date best = null;
        for (CronExpression exp : quartz) {
            Date next = exp.getNextValidTimeAfter(from);
            if (next != null && (best == null || next.before(best))) {
                best = next;
            }
        }
        return best == null ? null : best.toInstant();
    }

    @Override
    public String toString() {
        return expression + " [" + zone + "]";
    }
}
