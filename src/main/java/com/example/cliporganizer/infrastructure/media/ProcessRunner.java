package com.example.cliporganizer.infrastructure.media;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an external tool with a timeout and captures its combined output.
 */
public final class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    private static final int MAX_OUTPUT_BYTES = 1024 * 1024;

    private static final long READER_JOIN_MILLIS = 2000L;

    private ProcessRunner() {
    }

    public static Result run(List<String> command, int timeoutSeconds) {
        Process process = null;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.redirectErrorStream(true);
            process = builder.start();

            OutputCollector collector = new OutputCollector(process.getInputStream());
            Thread reader = new Thread(collector, "process-output-" + command.get(0));
            reader.setDaemon(true);
            reader.start();

            boolean finished = process.waitFor(Math.max(1, timeoutSeconds), TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                reader.join(READER_JOIN_MILLIS);
                return new Result(false, -1, collector.output(), "Timed out after " + timeoutSeconds + "s");
            }
            reader.join(READER_JOIN_MILLIS);
            int exitCode = process.exitValue();
            return new Result(exitCode == 0, exitCode, collector.output(),
                    exitCode == 0 ? null : "Exit code " + exitCode);
        } catch (IOException e) {
            log.debug("Failed to run command={}", command.get(0), e);
            return new Result(false, -1, "", "Could not start " + command.get(0) + ": " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Result(false, -1, "", "Interrupted while running " + command.get(0));
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    /**
     * Drains the process output so the child never blocks on a full pipe. Keeps at most 1 MB.
     */
    private static final class OutputCollector implements Runnable {

        private final InputStream in;
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();

        private OutputCollector(InputStream in) {
            this.in = in;
        }

        @Override
        public void run() {
            byte[] buffer = new byte[8192];
            int read;
            try {
                while ((read = in.read(buffer)) != -1) {
                    synchronized (out) {
                        if (out.size() < MAX_OUTPUT_BYTES) {
                            out.write(buffer, 0, Math.min(read, MAX_OUTPUT_BYTES - out.size()));
                        }
                    }
                }
            } catch (IOException e) {
                log.debug("Process output stream closed early", e);
            }
        }

        private String output() {
            synchronized (out) {
                return new String(out.toByteArray(), StandardCharsets.UTF_8);
            }
        }
    }

    public static final class Result {

        private final boolean success;
        private final int exitCode;
        private final String output;
        private final String failureReason;

        public Result(boolean success, int exitCode, String output, String failureReason) {
            this.success = success;
            this.exitCode = exitCode;
            this.output = output;
            this.failureReason = failureReason;
        }

        public boolean isSuccess() {
            return success;
        }

        public int getExitCode() {
            return exitCode;
        }

        public String getOutput() {
            return output;
        }

        public String getFailureReason() {
            return failureReason;
        }
    }
}
