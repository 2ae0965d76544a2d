/*
 * Copyright Strimzi authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.kubesim.simulator.model;

import io.kubesim.common.model.InvalidResourceException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Schedule of a CronJob. Supported forms are the standard 5 field cron expressions (evaluated in UTC with Quartz),
 * the {@code @hourly} style macros and {@code every-N-ticks}, which fires on every tick divisible by N.
 */
public class CronSchedule {
    private static final Pattern EVERY_N_TICKS = Pattern.compile("^every-(\\d+)-ticks?$");
    private static final Map<String, String> MACROS = Map.of(
            "@yearly", "0 0 1 1 *",
            "@annually", "0 0 1 1 *",
            "@monthly", "0 0 1 * *",
            "@weekly", "0 0 * * 0",
            "@daily", "0 0 * * *",
            "@midnight", "0 0 * * *",
            "@hourly", "0 * * * *"
    );

    private final String expression;
    private final CronExpression cronExpression;
    private final long everyTicks;

    private CronSchedule(String expression, CronExpression cronExpression, long everyTicks) {
        this.expression = expression;
        this.cronExpression = cronExpression;
        this.everyTicks = everyTicks;
    }

    /**
     * Parses a schedule
     *
     * @param expression    Schedule expression
     *
     * @return  Parsed schedule
     *
     * @throws InvalidResourceException When the expression is not valid
     */
    public static CronSchedule parse(String expression) throws InvalidResourceException {
        if (expression == null || expression.isBlank()) {
            throw new InvalidResourceException("Schedule cannot be empty");
        }

        String trimmed = expression.trim();
        Matcher everyTicks = EVERY_N_TICKS.matcher(trimmed);

        if (everyTicks.matches()) {
            long ticks;
            try {
                ticks = Long.parseLong(everyTicks.group(1));
            } catch (NumberFormatException e) {
                throw new InvalidResourceException("Invalid schedule " + expression, e);
            }

            if (ticks <= 0) {
                throw new InvalidResourceException("Invalid schedule " + expression + ": the tick interval has to be positive");
            }

            return new CronSchedule(trimmed, null, ticks);
        }

        String cron = MACROS.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
        if (cron.startsWith("@")) {
            throw new InvalidResourceException("Invalid schedule " + expression + ": unknown macro");
        }

        try {
            CronExpression cronExpression = new CronExpression(toQuartz(cron));
            // Schedules are always evaluated in UTC
            cronExpression.setTimeZone(TimeZone.getTimeZone("GMT"));
            return new CronSchedule(trimmed, cronExpression, 0);
        } catch (ParseException e) {
            throw new InvalidResourceException("Invalid schedule " + expression + ": " + e.getMessage(), e);
        }
    }

    /**
     * Converts a standard 5 field cron expression into the Quartz format. Quartz needs a seconds field, counts the
     * days of week from 1 (Sunday) and requires one of the day fields to be {@code ?}.
     *
     * @param cron  5 field cron expression
     *
     * @return  Quartz cron expression
     */
    static String toQuartz(String cron) {
        String[] fields = cron.trim().split("\\s+");

        if (fields.length != 5) {
            throw new InvalidResourceException("Invalid schedule " + cron + ": expected 5 fields but found " + fields.length);
        }

        String dayOfMonth = fields[2];
        String dayOfWeek = fields[4];

        if ("*".equals(dayOfWeek) || "?".equals(dayOfWeek)) {
            dayOfWeek = "?";
        } else if ("*".equals(dayOfMonth) || "?".equals(dayOfMonth)) {
            dayOfMonth = "?";
            dayOfWeek = convertDaysOfWeek(dayOfWeek);
        } else {
            throw new InvalidResourceException("Invalid schedule " + cron + ": restricting both the day of month and the day of week is not supported");
        }

        return String.join(" ", "0", fields[0], fields[1], dayOfMonth, fields[3], dayOfWeek);
    }

    private static String convertDaysOfWeek(String field) {
        List<String> converted = new ArrayList<>();

        for (String token : field.split(",")) {
            String base = token;
            String suffix = "";

            int split = indexOfAny(token, '/', '#');
            if (split >= 0) {
                base = token.substring(0, split);
                suffix = token.substring(split);
            }

            if (!"*".equals(base)) {
                String[] range = base.split("-", -1);
                StringBuilder sb = new StringBuilder();

                for (int i = 0; i < range.length; i++) {
                    if (i > 0) {
                        sb.append('-');
                    }

                    sb.append(convertDayOfWeek(range[i]));
                }

                base = sb.toString();
            }

            converted.add(base + suffix);
        }

        return String.join(",", converted);
    }

    private static String convertDayOfWeek(String day) {
        if (day.chars().allMatch(Character::isDigit) && !day.isEmpty()) {
            int value = Integer.parseInt(day);

            if (value > 7) {
                throw new InvalidResourceException("Invalid day of week " + day);
            }

            return String.valueOf(value % 7 + 1);
        }

        // Names like MON are the same in both formats
        return day;
    }

    private static int indexOfAny(String str, char... chars) {
        for (int i = 0; i < str.length(); i++) {
            for (char c : chars) {
                if (str.charAt(i) == c) {
                    return i;
                }
            }
        }

        return -1;
    }

    /**
     * Checks whether the schedule fires at the given tick. Cron expressions are matched against the simulated time
     * truncated to the minute.
     *
     * @param time  Simulated time of the tick
     * @param tick  Tick number
     *
     * @return  True if a run should be started
     */
    public boolean matches(Instant time, long tick) {
        if (cronExpression == null) {
            return tick % everyTicks == 0;
        }

        return cronExpression.isSatisfiedBy(Date.from(time.truncatedTo(ChronoUnit.MINUTES)));
    }

    /**
     * @return  The original expression
     */
    public String expression() {
        return expression;
    }

    /**
     * @return  True if the schedule counts ticks instead of using the simulated time
     */
    public boolean isTickBased() {
        return cronExpression == null;
    }

    @Override
    public String toString() {
        return "CronSchedule(" + expression + ")";
    }
}
