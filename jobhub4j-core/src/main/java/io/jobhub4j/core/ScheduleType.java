package io.jobhub4j.core;

public enum ScheduleType {
    /** Never triggered by the scheduler loop. */
    MANUAL {
        @Override
        public boolean isAutomatic() {
            return false;
        }
    },
    /** Human interval ("30s", "5 minutes", "1 day 3 hours") or plain seconds. */
    INTERVAL {
        @Override
        public boolean isAutomatic() {
            return true;
        }
    },
    /** 5-field or 6-field cron expression. */
    CRON {
        @Override
        public boolean isAutomatic() {
            return true;
        }
    },
    /** Runs once as soon as the scheduler sees a job that never ran. */
    STARTUP {
        @Override
        public boolean isAutomatic() {
            return true;
        }
    };

    public abstract boolean isAutomatic();
}
