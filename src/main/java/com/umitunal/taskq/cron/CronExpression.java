package com.umitunal.taskq.cron;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Parsed five-field cron expression: minute, hour, day-of-month, month, day-of-week.
 *
 * <p>Each field accepts {@code *}, a number, a range {@code A-B}, a step suffix {@code /N} on any of those,
 * and comma-separated lists. Day-of-week runs 0-7 with both 0 and 7 meaning Sunday. A time matches only
 * when all five fields match, including both day fields.
 *
 * <p>Instances are immutable and thread-safe; {@link #nextRun} has no side effects.
 */
public final class CronExpression {
    /**
     * How far ahead {@link #nextRun} searches before giving up.
     */
    public static final int HORIZON_YEARS = 4;

    private final String expression;
    private final CronField minutes;
    private final CronField hours;
    private final CronField daysOfMonth;
    private final CronField months;
    private final CronField daysOfWeek;

    private CronExpression(String expression, CronField[] fields) {
        this.expression = expression;
        this.minutes = fields[0];
        this.hours = fields[1];
        this.daysOfMonth = fields[2];
        this.months = fields[3];
        this.daysOfWeek = fields[4];
    }

    /**
     * @throws InvalidCronExpressionException if the expression is malformed or can never match
     */
    public static CronExpression parse(String expression) {
        if (expression == null) {
            throw new InvalidCronExpressionException("cron expression must not be null");
        }
        String[] parts = expression.trim().split("\\s+");
        if (parts.length != 5) {
            throw new InvalidCronExpressionException(
                    "Invalid cron expression '" + expression + "'. Format: minute hour day month dayOfWeek");
        }
        CronField.Type[] types = CronField.Type.values();
        CronField[] fields = new CronField[5];
        for (int i = 0; i < 5; i++) {
            fields[i] = CronField.parse(types[i], parts[i]);
        }
        CronExpression cron = new CronExpression(expression.trim(), fields);
        cron.requireSatisfiable();
        return cron;
    }

    /**
     * Shorthand for {@code parse(expression).nextRun(from)}.
     */
    public static Instant nextRun(String expression, Instant from) {
        return parse(expression).nextRun(from);
    }

    public Instant nextRun(Instant from) {
        return nextRun(from, ZoneOffset.UTC);
    }

    /**
     * Earliest matching minute strictly after {@code from}, evaluated in {@code zone}.
     *
     * @throws InvalidCronExpressionException if nothing matches within {@value #HORIZON_YEARS} years
     */
    public Instant nextRun(Instant from, ZoneId zone) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(zone, "zone");

        ZonedDateTime start = from.atZone(zone);
        ZonedDateTime limit = start.plusYears(HORIZON_YEARS);
        ZonedDateTime t = start.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);

        while (!t.isAfter(limit)) {
            if (!months.matches(t.getMonthValue())) {
                t = t.toLocalDate().withDayOfMonth(1).plusMonths(1).atStartOfDay(zone);
            } else if (!matchesDay(t)) {
                t = t.toLocalDate().plusDays(1).atStartOfDay(zone);
            } else if (!hours.matches(t.getHour())) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
            } else if (!minutes.matches(t.getMinute())) {
                t = t.plusMinutes(1);
            } else if (!t.toInstant().isAfter(from)) {
                // Only reachable around a DST fall-back where local times repeat
                t = t.plusMinutes(1);
            } else {
                return t.toInstant();
            }
        }
        throw new InvalidCronExpressionException(
                "No run time within " + HORIZON_YEARS + " years for cron expression '" + expression + "'");
    }

    /**
     * Check whether the minute containing {@code time} matches.
     */
    public boolean matches(ZonedDateTime time) {
        return minutes.matches(time.getMinute())
                && hours.matches(time.getHour())
                && months.matches(time.getMonthValue())
                && matchesDay(time);
    }

    public String getExpression() {
        return expression;
    }

    private boolean matchesDay(ZonedDateTime t) {
        return daysOfMonth.matches(t.getDayOfMonth())
                && daysOfWeek.matches(t.getDayOfWeek().getValue() % 7);
    }

    /**
     * Reject day-of-month values that no selected month can have, such as "0 0 31 2 *".
     */
    private void requireSatisfiable() {
        int[] longestMonth = {0, 31, 29, 31, 30, 31, 30, 31, 31, 30, 31, 30, 31};
        for (int month = 1; month <= 12; month++) {
            if (!months.matches(month)) {
                continue;
            }
            for (int day = 1; day <= longestMonth[month]; day++) {
                if (daysOfMonth.matches(day)) {
                    return;
                }
            }
        }
        throw new InvalidCronExpressionException(
                "Cron expression '" + expression + "' names a day that none of its months has");
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof CronExpression && expression.equals(((CronExpression) o).expression));
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
