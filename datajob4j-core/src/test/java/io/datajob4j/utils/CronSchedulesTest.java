package io.datajob4j.utils;

import io.datajob4j.core.InvalidScheduleException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronSchedulesTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    @Test
    void fiveFieldCronShouldFireOnStep() {
        Instant next = CronSchedules.nextFireTime("*/5 * * * *", UTC, Instant.parse("2026-01-01T00:01:00Z"));
        assertEquals(Instant.parse("2026-01-01T00:05:00Z"), next);
    }

    @Test
    void nextFireTimeShouldBeStrictlyAfter() {
        Instant next = CronSchedules.nextFireTime("*/5 * * * *", UTC, Instant.parse("2026-01-01T00:05:00Z"));
        assertEquals(Instant.parse("2026-01-01T00:10:00Z"), next);
    }

    @Test
    void sixFieldCronShouldKeepSeconds() {
        Instant next = CronSchedules.nextFireTime("30 0 9 * * *", UTC, Instant.parse("2026-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2026-01-01T09:00:30Z"), next);
        assertEquals(List.of("30 0 9 * * ?"), CronSchedules.toQuartz("30 0 9 * * *"));
    }

    @Test
    void yearFieldShouldBeRejected() {
        InvalidScheduleException e = assertThrows(InvalidScheduleException.class,
                () -> CronSchedules.validate("0 0 9 * * * 2027"));
        assertTrue(e.getMessage().contains("got 7"), e.getMessage());
    }

    @Test
    void sundayShouldAcceptZeroSevenAndName() {
        // 2026-01-01 is a Thursday
        Instant from = Instant.parse("2026-01-01T00:00:00Z");
        Instant sunday = Instant.parse("2026-01-04T09:00:00Z");
        assertEquals(sunday, CronSchedules.nextFireTime("0 9 * * 0", UTC, from));
        assertEquals(sunday, CronSchedules.nextFireTime("0 9 * * 7", UTC, from));
        assertEquals(sunday, CronSchedules.nextFireTime("0 9 * * sun", UTC, from));
    }

    @Test
    void weekdayRangeShouldSkipWeekend() {
        Instant next = CronSchedules.nextFireTime("0 9 * * 1-5", UTC, Instant.parse("2026-01-02T10:00:00Z"));
        assertEquals(Instant.parse("2026-01-05T09:00:00Z"), next);
    }

    @Test
    void dayOfWeekStepShouldTranslateToQuartzNumbering() {
        assertEquals(List.of("0 0 0 ? * 1,3,5,7"), CronSchedules.toQuartz("0 0 * * */2"));
        assertEquals(List.of("0 0 0 ? * 1,2,3,4,5,6,7"), CronSchedules.toQuartz("0 0 * * 1-7"));
        assertEquals(List.of("0 0 0 ? * 2,3,4,5,6"), CronSchedules.toQuartz("0 0 * * MON-FRI"));
    }

    @Test
    void restrictedDayOfMonthAndWeekShouldFireWhenEitherMatches() {
        // 13th of the month or any Friday
        String spec = "0 0 13 * 5";
        assertEquals(Instant.parse("2026-01-02T00:00:00Z"),
                CronSchedules.nextFireTime(spec, UTC, Instant.parse("2026-01-01T00:00:00Z")));
        assertEquals(Instant.parse("2026-01-13T00:00:00Z"),
                CronSchedules.nextFireTime(spec, UTC, Instant.parse("2026-01-10T00:00:00Z")));
        assertEquals(2, CronSchedules.toQuartz(spec).size());
    }

    @Test
    void scheduleShouldBeEvaluatedInZone() {
        Instant next = CronSchedules.nextFireTime("0 9 * * *", ZoneId.of("Asia/Taipei"), Instant.parse("2026-01-01T00:00:00Z"));
        assertEquals(Instant.parse("2026-01-01T01:00:00Z"), next);
    }

    @Test
    void invalidExpressionsShouldBeRejected() {
        assertThrows(InvalidScheduleException.class, () -> CronSchedules.validate("not a cron"));
        assertThrows(InvalidScheduleException.class, () -> CronSchedules.validate("* * * *"));
        assertThrows(InvalidScheduleException.class, () -> CronSchedules.validate("61 * * * *"));
        assertThrows(InvalidScheduleException.class, () -> CronSchedules.validate("0 0 * * 8"));
        assertThrows(InvalidScheduleException.class, () -> CronSchedules.validate(""));
        assertThrows(InvalidScheduleException.class, () -> CronSchedules.validate(null));
    }

    @Test
    void isValidShouldRecognizeCommonSpecs() {
        assertTrue(CronSchedules.isValid("0 */10 * * * *"));
        assertTrue(CronSchedules.isValid("0 6 * * MON-FRI"));
        assertFalse(CronSchedules.isValid("every day"));
    }

    @Test
    void resolveZoneShouldDefaultToUtc() {
        assertEquals(ZoneOffset.UTC, CronSchedules.resolveZone(null));
        assertEquals(ZoneOffset.UTC, CronSchedules.resolveZone(" "));
        assertEquals(ZoneId.of("Europe/Paris"), CronSchedules.resolveZone("Europe/Paris"));
        assertThrows(IllegalArgumentException.class, () -> CronSchedules.resolveZone("Mars/Olympus"));
    }
}
