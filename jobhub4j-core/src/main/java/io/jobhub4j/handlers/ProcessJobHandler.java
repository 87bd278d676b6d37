package io.jobhub4j.handlers;

import io.jobhub4j.JobContext;
import io.jobhub4j.JobHandler;
import io.jobhub4j.core.JobCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command, e.g. a maintenance script.
 *
 * <p>Config:
 * <pre>{@code
 * {
 *   "command": "python3",
 *   "arguments": ["utils/Jobs/source_scan_job.py"],
 *   "workingDir": "/opt/app",
 *   "environment": {"LOG_LEVEL": "INFO"},
 *   "logOutput": true
 * }
 * }</pre>
 * The child inherits the manager's environment plus {@code environment}. Standard error is merged into
 * standard output; the last lines become the execution's result message. A non-zero exit code fails the
 * execution.
 */
public class ProcessJobHandler implements JobHandler<ProcessJobHandler.ProcessConfig> {
    private static final Logger log = LoggerFactory.getLogger(ProcessJobHandler.class);

    public static final String TYPE = "process";

    static final int TAIL_LINES = 20;
    private static final long POLL_MILLIS = 200;
    private static final long DESTROY_GRACE_SECONDS = 5;

    public record ProcessConfig(
            String command,
            List<String> arguments,
            String workingDir,
            Map<String, String> environment,
            boolean logOutput
    ) {
        public ProcessConfig {
            arguments = arguments == null ? List.of() : List.copyOf(arguments);
            environment = environment == null ? Map.of() : Map.copyOf(environment);
        }
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Class<ProcessConfig> configClass() {
        return ProcessConfig.class;
    }

    @Override
    public void validate(ProcessConfig config) {
        if (config == null || config.command() == null || config.command().isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
        if (config.workingDir() != null && !config.workingDir().isBlank()
                && !new File(config.workingDir()).isDirectory()) {
            throw new IllegalArgumentException("workingDir does not exist: " + config.workingDir());
        }
    }

    @Override
    public void execute(ProcessConfig config, JobContext context) throws Exception {
        List<String> command = new ArrayList<>();
        command.add(config.command());
        command.addAll(config.arguments());

        ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(true);
        if (config.workingDir() != null && !config.workingDir().isBlank()) {
            pb.directory(new File(config.workingDir()));
        }
        pb.environment().putAll(config.environment());

        log.debug("jobhub process starting id={} execution={} command={}", context.jobId(), context.executionId(), command);
        Process process = pb.start();
        OutputTail tail = new OutputTail(process, context, config.logOutput());
        Thread reader = new Thread(tail, "jobhub.process-output");
        reader.setDaemon(true);
        reader.start();

        try {
            while (!process.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (context.isCancelled()) {
                    terminate(process);
                    throw new JobCancelledException("job " + context.jobId() + " cancelled");
                }
            }
        } catch (InterruptedException e) {
            terminate(process);
            throw e;
        }
        reader.join(TimeUnit.SECONDS.toMillis(DESTROY_GRACE_SECONDS));

        int exit = process.exitValue();
        String output = tail.text();
        if (exit != 0) {
            throw new IllegalStateException("process exited with code " + exit
                    + (output.isEmpty() ? "" : ": " + tail.lastLine()));
        }
        if (!output.isEmpty()) {
            context.result(output);
        }
    }

    private static void terminate(Process process) throws InterruptedException {
        process.destroy();
        if (!process.waitFor(DESTROY_GRACE_SECONDS, TimeUnit.SECONDS)) {
            process.destroyForcibly();
        }
    }

    private static final class OutputTail implements Runnable {
        private final Process process;
        private final JobContext context;
        private final boolean logOutput;
        private final Deque<String> lines = new ArrayDeque<>();

        private OutputTail(Process process, JobContext context, boolean logOutput) {
            this.process = process;
            this.context = context;
            this.logOutput = logOutput;
        }

        @Override
        public void run() {
            try (BufferedReader in = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    if (logOutput) {
                        log.info("[{}] {}", context.jobId(), line);
                    }
                    synchronized (lines) {
                        lines.addLast(line);
                        if (lines.size() > TAIL_LINES) {
                            lines.removeFirst();
                        }
                    }
                }
            } catch (IOException e) {
                log.debug("jobhub process output closed id={} msg={}", context.jobId(), e.getMessage());
            }
        }

        String text() {
            synchronized (lines) {
                return String.join("\n", lines).trim();
            }
        }

        String lastLine() {
            synchronized (lines) {
                return lines.isEmpty() ? "" : lines.peekLast();
            }
        }
    }
}
