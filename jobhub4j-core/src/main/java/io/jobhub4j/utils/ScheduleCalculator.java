package io.jobhub4j.utils;

import io.jobhub4j.core.Schedule;
import io.jobhub4j.core.ScheduleType;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Locale;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Turns a {@link Schedule} into concrete run times.
 * <p>
 * Supported expressions:
 * <ul>
 *   <li>Intervals: "30s", "5m", "5 minutes", "1 day 3 hours", or plain seconds ("600")</li>
 *   <li>Cron: 5-field ("*&#47;5 * * * *") or 6-field with seconds ("0 0 2 * * *"), evaluated with Quartz</li>
 * </ul>
 * <p>
 * Next runs are always computed from the moment the previous run finished, never from the original due
 * time, so a long pause does not cause a burst of catch-up runs.
 */
public final class ScheduleCalculator {
    private ScheduleCalculator() {
    }

    /**
     * Rejects schedules whose expression cannot be evaluated.
     *
     * @throws IllegalArgumentException with a human-readable reason
     */
    public static void validate(Schedule schedule) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        switch (schedule.type()) {
            case MANUAL, STARTUP -> {
                // no expression needed
            }
            case INTERVAL -> {
                if (schedule.expression() == null) {
                    throw new IllegalArgumentException("interval schedule requires an interval expression");
                }
                parseInterval(schedule.expression());
            }
            case CRON -> {
                if (schedule.expression() == null) {
                    throw new IllegalArgumentException("cron schedule requires a cron expression");
                }
                String cron = normalizeCron(schedule.expression());
                if (!CronExpression.isValidExpression(cron)) {
                    throw new IllegalArgumentException("invalid cron expression: " + schedule.expression());
                }
                if (schedule.timezone() != null) {
                    resolveZone(schedule.timezone());
                }
            }
        }
    }

    /**
     * First due time for a job that was just created, enabled or rescheduled.
     *
     * @param lastRunAt when the job last ran, or null if never; only consulted for startup schedules
     * @return the due time, or null when the schedule never triggers automatically from here
     */
    public static Instant firstRunAt(Schedule schedule, ZoneId defaultZone, Instant now, Instant lastRunAt) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(now, "now must not be null");

        if (schedule.type() == ScheduleType.STARTUP) {
            return lastRunAt == null ? now : null;
        }
        return nextRunAfter(schedule, defaultZone, now);
    }

    /**
     * Due time following a run that finished at {@code finishedAt}.
     *
     * @return next due time, or null for manual and startup schedules
     * @throws IllegalArgumentException when the schedule has no representable next occurrence
     */
    public static Instant nextRunAfter(Schedule schedule, ZoneId defaultZone, Instant finishedAt) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");

        return switch (schedule.type()) {
            case MANUAL, STARTUP -> null;
            case INTERVAL -> {
                Duration interval = parseInterval(schedule.expression());
                try {
                    yield finishedAt.plus(interval);
                } catch (DateTimeException | ArithmeticException ex) {
                    throw new IllegalArgumentException("interval produced no next execution time: " + schedule.expression(), ex);
                }
            }
            case CRON -> {
                ZoneId zone = schedule.timezone() != null ? resolveZone(schedule.timezone()) : defaultZone;
                yield nextCronOccurrence(normalizeCron(schedule.expression()), zone, finishedAt);
            }
        };
    }

    public static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone);
        } catch (Exception e) {
            throw new IllegalArgumentException("unknown timezone: " + timezone);
        }
    }

    /**
     * Normalize cron expressions for Quartz:
     * - Accepts 6-field cron with seconds.
     * - Accepts 5-field cron by prepending seconds "0".
     * - Quartz requires '?' in one of day-of-month / day-of-week.
     */
    public static String normalizeCron(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("cron expression must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("cron expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if (!"?".equals(dom) && !"?".equals(dow)) {
            if ("*".equals(dow)) {
                dow = "?";
            } else if ("*".equals(dom)) {
                dom = "?";
            }
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    /**
     * Returns true if the string can be parsed as a Quartz {@link CronExpression}.
     */
    public static boolean looksLikeCron(String spec) {
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (Exception ignored) {
            return false;
        }
    }

    /**
     * Next cron occurrence strictly after {@code from}.
     */
    public static Instant nextCronOccurrence(String cron, ZoneId zone, Instant from) {
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("invalid cron expression: " + cron, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone != null ? zone : ZoneId.systemDefault()));

        Date next = exp.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalArgumentException("cron expression produced no next execution time: " + cron);
        }
        return next.toInstant();
    }

    /**
     * Parses an interval expression into a positive {@link Duration}.
     */
    public static Duration parseInterval(String input) {
        Objects.requireNonNull(input, "interval must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new IllegalArgumentException("interval must not be empty");
        }

        Duration parsed;
        if (s.matches("^\\d+$")) {
            try {
                parsed = Duration.ofSeconds(Long.parseLong(s));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("interval seconds out of range: " + input);
            }
        } else if (s.matches("^\\d+\\s*(ms|[smhdw])$")) {
            parsed = parseCompact(s, input);
        } else {
            parsed = parseWords(s, input);
        }

        if (parsed.isZero() || parsed.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + input);
        }
        return parsed;
    }

    private static Duration parseCompact(String s, String input) {
        String digits = s.replaceAll("[^0-9]", "");
        String unit = s.replaceAll("[0-9\\s]", "");
        long n;
        try {
            n = Long.parseLong(digits);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("interval out of range: " + input);
        }
        try {
            return switch (unit) {
                case "ms" -> Duration.ofMillis(n);
                case "s" -> Duration.ofSeconds(n);
                case "m" -> Duration.ofMinutes(n);
                case "h" -> Duration.ofHours(n);
                case "d" -> Duration.ofDays(n);
                case "w" -> Duration.ofDays(Math.multiplyExact(7L, n));
                default -> throw new IllegalArgumentException("unsupported interval unit: " + unit);
            };
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("interval out of range: " + input, ex);
        }
    }

    // "1 day 3 hours"; each unit at most once
    private static Duration parseWords(String s, String input) {
        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("invalid interval format, expected pairs like '3 minutes': " + input);
        }

        boolean seenWeek = false, seenDay = false, seenHour = false, seenMinute = false, seenSecond = false;
        long totalSeconds = 0;

        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("invalid number in interval: " + parts[i]);
            }
            if (n < 0) {
                throw new IllegalArgumentException("interval values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            switch (unit) {
                case "week" -> {
                    if (seenWeek) throw new IllegalArgumentException("duplicate unit: week");
                    seenWeek = true;
                    totalSeconds = accumulate(totalSeconds, ChronoUnit.WEEKS.getDuration().toSeconds(), n, input);
                }
                case "day" -> {
                    if (seenDay) throw new IllegalArgumentException("duplicate unit: day");
                    seenDay = true;
                    totalSeconds = accumulate(totalSeconds, ChronoUnit.DAYS.getDuration().toSeconds(), n, input);
                }
                case "hour" -> {
                    if (seenHour) throw new IllegalArgumentException("duplicate unit: hour");
                    seenHour = true;
                    totalSeconds = accumulate(totalSeconds, ChronoUnit.HOURS.getDuration().toSeconds(), n, input);
                }
                case "minute", "min" -> {
                    if (seenMinute) throw new IllegalArgumentException("duplicate unit: minute");
                    seenMinute = true;
                    totalSeconds = accumulate(totalSeconds, ChronoUnit.MINUTES.getDuration().toSeconds(), n, input);
                }
                case "second", "sec" -> {
                    if (seenSecond) throw new IllegalArgumentException("duplicate unit: second");
                    seenSecond = true;
                    totalSeconds = accumulate(totalSeconds, 1, n, input);
                }
                default -> throw new IllegalArgumentException("unsupported interval unit: " + parts[i + 1]);
            }
        }

        return Duration.ofSeconds(totalSeconds);
    }

    private static long accumulate(long total, long unitSeconds, long n, String input) {
        try {
            return Math.addExact(total, Math.multiplyExact(unitSeconds, n));
        } catch (ArithmeticException ex) {
            throw new IllegalArgumentException("interval out of range: " + input, ex);
        }
    }
}
