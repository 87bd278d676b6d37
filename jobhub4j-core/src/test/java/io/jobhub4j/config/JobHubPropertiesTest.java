package io.jobhub4j.config;

import io.jobhub4j.core.JobSpec;
import io.jobhub4j.core.ScheduleType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobHubPropertiesTest {

    @Test
    void defaultsShouldMatchDocumentedValues() {
        JobHubProperties props = new JobHubProperties();

        assertTrue(props.isEnabled());
        assertEquals(Duration.ofSeconds(2), props.getTickInterval());
        assertEquals(100, props.getRetention());
        assertEquals(10, props.getSubscriberBufferSize());
        assertEquals(Duration.ofSeconds(30), props.getKeepAliveInterval());
        assertEquals("none", props.getPersistence());
    }

    @Test
    void configuredJobShouldConvertToSpec() {
        JobHubProperties.ConfiguredJob job = new JobHubProperties.ConfiguredJob();
        job.setId("source-files-scan");
        job.setName("Source Files Scan");
        job.setType("process");
        job.setScheduleType("Interval");
        job.setSchedule("24 hours");
        job.setTags(List.of("scan"));
        job.setConfig(Map.of("command", "python3"));

        JobSpec spec = job.toSpec();

        assertEquals("source-files-scan", spec.id());
        assertEquals(ScheduleType.INTERVAL, spec.schedule().type());
        assertEquals("24 hours", spec.schedule().expression());
        assertEquals(List.of("scan"), spec.tags());
        assertEquals("python3", spec.config().get("command"));

        job.setScheduleType("hourly");
        assertThrows(IllegalArgumentException.class, job::toSpec);
    }
}
