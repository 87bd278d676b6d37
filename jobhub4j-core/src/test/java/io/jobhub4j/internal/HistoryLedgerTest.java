package io.jobhub4j.internal;

import io.jobhub4j.core.Execution;
import io.jobhub4j.core.ExecutionStatus;
import io.jobhub4j.core.Trigger;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HistoryLedgerTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void appendShouldEvictOldestBeyondRetention() {
        HistoryLedger ledger = new HistoryLedger(3);
        for (long id = 1; id <= 5; id++) {
            ledger.append(started(id, "scan"));
        }

        List<Execution> all = ledger.list("scan", 10);
        assertEquals(List.of(5L, 4L, 3L), all.stream().map(Execution::executionId).toList());
        assertEquals(all.subList(0, 2), ledger.list("scan", 2));
    }

    @Test
    void replaceShouldUpdateRetainedRowAndIgnoreEvictedOne() {
        HistoryLedger ledger = new HistoryLedger(2);
        ledger.append(started(1, "scan"));
        ledger.append(started(2, "scan"));
        ledger.append(started(3, "scan"));

        ledger.replace(started(2, "scan").finish(ExecutionStatus.SUCCEEDED, T0.plusSeconds(1), "ok", null));
        ledger.replace(started(1, "scan").finish(ExecutionStatus.FAILED, T0.plusSeconds(1), "late", "late"));

        List<Execution> all = ledger.list("scan", 10);
        assertEquals(2, all.size());
        assertEquals(ExecutionStatus.RUNNING, all.get(0).status());
        assertEquals(ExecutionStatus.SUCCEEDED, all.get(1).status());
    }

    @Test
    void jobsShouldBeIndependent() {
        HistoryLedger ledger = new HistoryLedger(10);
        ledger.append(started(1, "a"));
        ledger.append(started(2, "b"));

        assertEquals(1, ledger.list("a", 10).size());
        ledger.remove("a");
        assertTrue(ledger.list("a", 10).isEmpty());
        assertEquals(1, ledger.list("b", 10).size());
    }

    @Test
    void seedShouldRestoreNewestFirstInput() {
        HistoryLedger ledger = new HistoryLedger(2);
        ledger.seed("scan", List.of(started(9, "scan"), started(8, "scan"), started(7, "scan")));

        assertEquals(List.of(9L, 8L), ledger.list("scan", 10).stream().map(Execution::executionId).toList());
    }

    @Test
    void retentionMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new HistoryLedger(0));
    }

    private static Execution started(long id, String jobId) {
        return Execution.started(id, jobId, Trigger.MANUAL, false, T0);
    }
}
