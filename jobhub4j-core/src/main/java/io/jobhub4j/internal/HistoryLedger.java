package io.jobhub4j.internal;

import io.jobhub4j.core.Execution;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-job execution log, oldest first internally.
 *
 * <p>Each job's log has its own monitor, so writers of different jobs never contend. When the log
 * exceeds {@code retention} the oldest rows are evicted.
 */
final class HistoryLedger {
    private final int retention;
    private final Map<String, List<Execution>> byJob = new ConcurrentHashMap<>();

    HistoryLedger(int retention) {
        if (retention <= 0) {
            throw new IllegalArgumentException("retention must be a positive number");
        }
        this.retention = retention;
    }

    int retention() {
        return retention;
    }

    void append(Execution execution) {
        List<Execution> log = byJob.computeIfAbsent(execution.jobId(), k -> new ArrayList<>());
        synchronized (log) {
            log.add(execution);
            while (log.size() > retention) {
                log.remove(0);
            }
        }
    }

    /**
     * Replaces the row with the same execution id. Rows already evicted stay evicted.
     */
    void replace(Execution execution) {
        List<Execution> log = byJob.get(execution.jobId());
        if (log == null) {
            return;
        }
        synchronized (log) {
            for (int i = log.size() - 1; i >= 0; i--) {
                if (log.get(i).executionId() == execution.executionId()) {
                    log.set(i, execution);
                    return;
                }
            }
        }
    }

    /**
     * At most {@code limit} rows, newest first.
     */
    List<Execution> list(String jobId, int limit) {
        List<Execution> log = byJob.get(jobId);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            int n = Math.min(limit, log.size());
            List<Execution> out = new ArrayList<>(n);
            for (int i = log.size() - 1; i >= log.size() - n; i--) {
                out.add(log.get(i));
            }
            return out;
        }
    }

    void remove(String jobId) {
        byJob.remove(jobId);
    }

    /**
     * Restores rows loaded from a repository, given newest first.
     */
    void seed(String jobId, List<Execution> newestFirst) {
        for (int i = newestFirst.size() - 1; i >= 0; i--) {
            Execution e = newestFirst.get(i);
            if (jobId.equals(e.jobId())) {
                append(e);
            }
        }
    }
}
