package io.jobhub4j.internal;

import io.jobhub4j.core.JobSpec;
import io.jobhub4j.core.ScheduleType;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SimpleJobBuilderTest {

    @Test
    void buildShouldDefaultToEnabledManualJob() {
        JobSpec spec = new SimpleJobBuilder("Optimize", "process", s -> null).build();

        assertNull(spec.id());
        assertEquals(ScheduleType.MANUAL, spec.schedule().type());
        assertTrue(spec.enabled());
        assertTrue(spec.config().isEmpty());
    }

    @Test
    void scheduleSettersShouldReplaceEachOther() {
        JobSpec spec = new SimpleJobBuilder("Scan", "process", s -> null)
                .id("source-files-scan")
                .cron("0 2 * * *")
                .timezone("Asia/Taipei")
                .every(86400)
                .config(Map.of("command", "python3"))
                .build();

        assertEquals("source-files-scan", spec.id());
        assertEquals(ScheduleType.INTERVAL, spec.schedule().type());
        assertEquals("86400", spec.schedule().expression());
        assertEquals("Asia/Taipei", spec.schedule().timezone());
        assertEquals("python3", spec.config().get("command"));
    }

    @Test
    void invalidArgumentsShouldFailFast() {
        SimpleJobBuilder builder = new SimpleJobBuilder("Scan", "process", s -> null);

        assertThrows(IllegalArgumentException.class, () -> builder.every(0));
        assertThrows(IllegalArgumentException.class, () -> builder.every(1.5));
        assertThrows(IllegalArgumentException.class, () -> builder.id(" "));
        assertThrows(RuntimeException.class, () -> builder.timezone("Not/AZone"));
    }
}
