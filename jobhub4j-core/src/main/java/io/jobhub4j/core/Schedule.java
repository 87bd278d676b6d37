package io.jobhub4j.core;

import java.util.Objects;

/**
 * When a job is triggered automatically.
 *
 * @param type       schedule kind
 * @param expression interval text or cron expression; null for {@link ScheduleType#MANUAL} and
 *                   {@link ScheduleType#STARTUP}
 * @param timezone   IANA zone id used for cron evaluation; null means the manager default
 */
public record Schedule(ScheduleType type, String expression, String timezone) {

    public Schedule {
        Objects.requireNonNull(type, "type must not be null");
        if (expression != null && expression.isBlank()) {
            expression = null;
        }
        if (timezone != null && timezone.isBlank()) {
            timezone = null;
        }
    }

    public static Schedule manual() {
        return new Schedule(ScheduleType.MANUAL, null, null);
    }

    public static Schedule startup() {
        return new Schedule(ScheduleType.STARTUP, null, null);
    }

    public static Schedule every(String interval) {
        return new Schedule(ScheduleType.INTERVAL, interval, null);
    }

    public static Schedule every(long seconds) {
        return new Schedule(ScheduleType.INTERVAL, Long.toString(seconds), null);
    }

    public static Schedule cron(String cron) {
        return new Schedule(ScheduleType.CRON, cron, null);
    }

    public static Schedule cron(String cron, String timezone) {
        return new Schedule(ScheduleType.CRON, cron, timezone);
    }

    public boolean isAutomatic() {
        return type.isAutomatic();
    }

    @Override
    public String toString() {
        return expression == null ? type.name() : type.name() + "(" + expression + ")";
    }
}
