/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.model;

import io.kubesim.common.model.InvalidResourceException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class CronScheduleTest {
    @Test
    public void testTickBasedSchedule() {
        CronSchedule schedule = CronSchedule.parse("every-3-ticks");

        assertThat(schedule.isTickBased(), is(true));
        assertThat(schedule.matches(Instant.EPOCH, 3), is(true));
        assertThat(schedule.matches(Instant.EPOCH, 4), is(false));
        assertThat(schedule.matches(Instant.EPOCH, 6), is(true));
        assertThat(CronSchedule.parse("every-1-tick").matches(Instant.EPOCH, 7), is(true));
    }

    @Test
    public void testCronSchedule() {
        CronSchedule schedule = CronSchedule.parse("*/5 * * * *");

        assertThat(schedule.isTickBased(), is(false));
        assertThat(schedule.matches(Instant.parse("2024-01-01T00:05:00Z"), 5), is(true));
        assertThat(schedule.matches(Instant.parse("2024-01-01T00:05:30Z"), 5), is(true));
        assertThat(schedule.matches(Instant.parse("2024-01-01T00:03:00Z"), 3), is(false));
    }

    @Test
    public void testDayOfWeek() {
        // 2024-01-01 is a Monday
        CronSchedule mondays = CronSchedule.parse("0 0 * * 1");
        assertThat(mondays.matches(Instant.parse("2024-01-01T00:00:00Z"), 0), is(true));
        assertThat(mondays.matches(Instant.parse("2024-01-02T00:00:00Z"), 0), is(false));

        CronSchedule sundays = CronSchedule.parse("0 0 * * 0");
        assertThat(sundays.matches(Instant.parse("2024-01-07T00:00:00Z"), 0), is(true));
        assertThat(CronSchedule.parse("0 0 * * 7").matches(Instant.parse("2024-01-07T00:00:00Z"), 0), is(true));
    }

    @Test
    public void testMacros() {
        assertThat(CronSchedule.parse("@hourly").matches(Instant.parse("2024-01-01T01:00:00Z"), 60), is(true));
        assertThat(CronSchedule.parse("@hourly").matches(Instant.parse("2024-01-01T01:01:00Z"), 61), is(false));
        assertThat(CronSchedule.parse("@daily").matches(Instant.parse("2024-01-02T00:00:00Z"), 1440), is(true));
    }

    @Test
    public void testQuartzConversion() {
        assertThat(CronSchedule.toQuartz("*/5 * * * *"), is("0 */5 * * * ?"));
        assertThat(CronSchedule.toQuartz("0 0 * * 0"), is("0 0 0 ? * 1"));
        assertThat(CronSchedule.toQuartz("30 6 * * 1-5"), is("0 30 6 ? * 2-6"));
        assertThat(CronSchedule.toQuartz("0 12 1 * *"), is("0 0 12 1 * ?"));
    }

    @Test
    public void testInvalidSchedules() {
        assertThrows(InvalidResourceException.class, () -> CronSchedule.parse(null));
        assertThrows(InvalidResourceException.class, () -> CronSchedule.parse(" "));
        assertThrows(InvalidResourceException.class, () -> CronSchedule.parse("* * *"));
        assertThrows(InvalidResourceException.class, () -> CronSchedule.parse("@fortnightly"));
        assertThrows(InvalidResourceException.class, () -> CronSchedule.parse("every-0-ticks"));
        assertThrows(InvalidResourceException.class, () -> CronSchedule.parse("0 0 1 * 1"));
        assertThrows(InvalidResourceException.class, () -> CronSchedule.parse("90 * * * *"));
    }
}
