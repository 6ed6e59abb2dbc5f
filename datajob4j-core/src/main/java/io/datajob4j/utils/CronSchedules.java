package io.datajob4j.utils;

import io.datajob4j.core.InvalidScheduleException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TimeZone;
import java.util.TreeSet;

/**
 * Parses standard cron expressions into {@link CronSchedule}s backed by Quartz.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>5-field cron: minute hour day-of-month month day-of-week, e.g. "30 2 * * 1-5"</li>
 *   <li>6-field cron with a leading seconds field, e.g. "0 30 2 * * *"</li>
 * </ul>
 * <p>
 * Day-of-week follows cron numbering (0 and 7 are Sunday) and accepts SUN..SAT. Quartz numbers days from 1 and
 * requires {@code ?} in one of the two day fields, so expressions are translated before parsing.
 */
public final class CronSchedules {

    private static final Map<String, Integer> DAY_NAMES = Map.of(
            "SUN", 0, "MON", 1, "TUE", 2, "WED", 3, "THU", 4, "FRI", 5, "SAT", 6
    );

    private CronSchedules() {
    }

    /**
     * Parse an expression evaluated in {@code zone}.
     *
     * @throws InvalidScheduleException if the expression is malformed
     */
    public static CronSchedule parse(String spec, ZoneId zone) {
        if (spec == null) {
            throw new InvalidScheduleException("null", "expression must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new InvalidScheduleException(spec, "expression must not be empty");
        }
        ZoneId z = zone != null ? zone : ZoneOffset.UTC;

        List<CronExpression> expressions = new ArrayList<>();
        for (String quartz : toQuartz(s)) {
            if (!CronExpression.isValidExpression(quartz)) {
                throw new InvalidScheduleException(spec, "not a valid cron expression");
            }
            try {
                CronExpression exp = new CronExpression(quartz);
                exp.setTimeZone(TimeZone.getTimeZone(z));
                expressions.add(exp);
            } catch (ParseException e) {
                throw new InvalidScheduleException(spec, e.getMessage(), e);
            }
        }
        return new CronSchedule(s, z, List.copyOf(expressions));
    }

    /**
     * Parse only for validation, in UTC.
     *
     * @throws InvalidScheduleException if the expression is malformed
     */
    public static void validate(String spec) {
        parse(spec, ZoneOffset.UTC);
    }

    public static boolean isValid(String spec) {
        try {
            validate(spec);
            return true;
        } catch (InvalidScheduleException e) {
            return false;
        }
    }

    /**
     * Convenience: the next fire time of {@code spec} strictly after {@code after}.
     */
    public static Instant nextFireTime(String spec, ZoneId zone, Instant after) {
        return parse(spec, zone).nextAfter(after);
    }

    /**
     * Resolve an IANA zone id. Blank means UTC.
     *
     * @throws IllegalArgumentException for unknown zones
     */
    public static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown timezone: " + timezone, e);
        }
    }

    /**
     * Translate to one or two Quartz expressions.
     */
    static List<String> toQuartz(String spec) {
        String[] parts = spec.split("\\s+");
        String sec;
        String min;
        String hour;
        String dom;
        String month;
        String dow;
        if (parts.length == 5) {
            sec = "0";
            min = parts[0];
            hour = parts[1];
            dom = parts[2];
            month = parts[3];
            dow = parts[4];
        } else if (parts.length == 6) {
            sec = parts[0];
            min = parts[1];
            hour = parts[2];
            dom = parts[3];
            month = parts[4];
            dow = parts[5];
        } else {
            throw new InvalidScheduleException(spec, "expected 5 fields (minute hour day-of-month month day-of-week) or 6 with leading seconds, got " + parts.length);
        }

        boolean anyDom = "*".equals(dom) || "?".equals(dom);
        boolean anyDow = "*".equals(dow) || "?".equals(dow);
        String quartzDow = anyDow ? "?" : translateDayOfWeek(spec, dow);

        if (anyDow) {
            return List.of(String.join(" ", sec, min, hour, anyDom ? "*" : dom, month, "?"));
        }
        if (anyDom) {
            return List.of(String.join(" ", sec, min, hour, "?", month, quartzDow));
        }
        return List.of(
                String.join(" ", sec, min, hour, dom, month, "?"),
                String.join(" ", sec, min, hour, "?", month, quartzDow)
        );
    }

    // cron 0-7 (Sunday = 0 or 7) -> Quartz 1-7 (Sunday = 1), expanded to an explicit list
    private static String translateDayOfWeek(String spec, String field) {
        TreeSet<Integer> days = new TreeSet<>();
        for (String element : field.split(",")) {
            if (element.isEmpty()) {
                throw new InvalidScheduleException(spec, "empty day-of-week element");
            }
            int step = 1;
            String base = element;
            int slash = element.indexOf('/');
            if (slash >= 0) {
                base = element.substring(0, slash);
                step = parseNumber(spec, element.substring(slash + 1));
                if (step <= 0) {
                    throw new InvalidScheduleException(spec, "day-of-week step must be positive");
                }
            }

            int from;
            int to;
            if ("*".equals(base)) {
                from = 0;
                to = 6;
            } else if (base.contains("-")) {
                String[] range = base.split("-", 2);
                from = parseDay(spec, range[0]);
                to = parseDay(spec, range[1]);
                if (to == 0 && from > 0) {
                    to = 7;
                }
            } else {
                from = parseDay(spec, base);
                to = slash >= 0 ? 6 : from;
            }
            if (from > to) {
                throw new InvalidScheduleException(spec, "day-of-week range is reversed: " + base);
            }
            for (int d = from; d <= to; d += step) {
                days.add(d % 7);
            }
        }

        StringBuilder sb = new StringBuilder();
        for (int d : days) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(d + 1);
        }
        return sb.toString();
    }

    private static int parseDay(String spec, String token) {
        Integer named = DAY_NAMES.get(token.toUpperCase(Locale.ROOT));
        if (named != null) {
            return named;
        }
        int n = parseNumber(spec, token);
        if (n < 0 || n > 7) {
            throw new InvalidScheduleException(spec, "day-of-week out of range: " + token);
        }
        return n;
    }

    private static int parseNumber(String spec, String token) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new InvalidScheduleException(spec, "not a number: " + token, e);
        }
    }
}
