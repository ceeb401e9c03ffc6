/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.agent.tools;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.OperationCancelledException;
import me.golemcore.agent.domain.tool.CancellationSignal;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs external processes for tools, observing the turn's cancellation signal.
 *
 * <p>
 * Termination policy on cancel or timeout: release the process streams, send a
 * graceful destroy, and force-kill if the process is still alive after
 * {@link #GRACE_PERIOD_MS}.
 */
@Component
@Slf4j
public class ProcessRunner {

    static final long GRACE_PERIOD_MS = 500;
    private static final long OUTPUT_DRAIN_SECONDS = 1;

    private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "agent-process-reader");
        thread.setDaemon(true);
        return thread;
    });

    public enum Status {
        EXITED, TIMED_OUT, CANCELLED
    }

    /**
     * @param exitCode
     *            process exit code, -1 unless {@link Status#EXITED}
     */
    public record ProcessOutcome(Status status, int exitCode, String output, boolean truncated) {

        public boolean exited() {
            return status == Status.EXITED;
        }
    }

    /**
     * Starts {@code command} in {@code workDir} with stderr merged into stdout.
     *
     * @param environment
     *            replaces the inherited environment when non-null
     * @throws IOException
     *             when the process cannot be started (e.g. executable missing)
     */
    public ProcessOutcome run(List<String> command, Path workDir, Map<String, String> environment,
            long timeoutSeconds, int maxOutputChars, CancellationSignal signal) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workDir.toFile());
        pb.redirectErrorStream(true);
        if (environment != null) {
            pb.environment().clear();
            pb.environment().putAll(environment);
        }

        Process process = pb.start();
        process.getOutputStream().close();
        OutputCollector collector = new OutputCollector(maxOutputChars);
        Future<?> reader = executor.submit(() -> collector.drain(process));

        try {
            signal.await(process.onExit(), timeoutSeconds, TimeUnit.SECONDS);
        } catch (OperationCancelledException e) {
            log.debug("[Process] Cancelled, terminating {}", command.get(0));
            terminate(process, reader);
            return new ProcessOutcome(Status.CANCELLED, -1, collector.text(), collector.truncated);
        } catch (TimeoutException e) {
            log.warn("[Process] {} timed out after {}s, terminating", command.get(0), timeoutSeconds);
            terminate(process, reader);
            return new ProcessOutcome(Status.TIMED_OUT, -1, collector.text(), collector.truncated);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            terminate(process, reader);
            return new ProcessOutcome(Status.CANCELLED, -1, collector.text(), collector.truncated);
        } catch (ExecutionException e) {
            throw new IOException("Failed waiting for process: " + e.getCause().getMessage(), e.getCause());
        }

        awaitDrain(reader);
        return new ProcessOutcome(Status.EXITED, process.exitValue(), collector.text(), collector.truncated);
    }

    /**
     * Releases the streams first so the reader thread cannot block on a dead
     * source, then escalates from destroy to destroyForcibly.
     */
    void terminate(Process process, Future<?> reader) {
        closeQuietly(process.getInputStream());
        closeQuietly(process.getErrorStream());
        reader.cancel(true);

        process.destroy();
        try {
            if (!process.waitFor(GRACE_PERIOD_MS, TimeUnit.MILLISECONDS)) {
                log.debug("[Process] Still alive after {}ms, force-killing", GRACE_PERIOD_MS);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private static void awaitDrain(Future<?> reader) {
        try {
            reader.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            reader.cancel(true);
            log.debug("[Process] Output not drained within {}s", OUTPUT_DRAIN_SECONDS);
        } catch (ExecutionException e) {
            log.debug("[Process] Output reader failed: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("[Process] Failed to close stream: {}", e.getMessage());
        }
    }

    private static final class OutputCollector {

        private final int maxChars;
        private final StringBuilder output = new StringBuilder();
        private volatile boolean truncated;

        private OutputCollector(int maxChars) {
            this.maxChars = maxChars;
        }

        private void drain(Process process) {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line = reader.readLine();
                while (line != null) {
                    append(line);
                    line = reader.readLine();
                }
            } catch (IOException e) {
                // Expected once terminate() has closed the stream
                log.trace("[Process] Reader stopped: {}", e.getMessage());
            }
        }

        private synchronized void append(String line) {
            if (output.length() + line.length() + 1 > maxChars) {
                truncated = true;
                return;
            }
            output.append(line).append('\n');
        }

        private synchronized String text() {
            return output.toString();
        }
    }
}
