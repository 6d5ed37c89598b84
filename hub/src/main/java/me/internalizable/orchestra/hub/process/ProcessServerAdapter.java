package me.internalizable.orchestra.hub.process;

import me.internalizable.orchestra.api.hub.adapter.AdapterResult;
import me.internalizable.orchestra.api.hub.adapter.ProbeResult;
import me.internalizable.orchestra.api.hub.adapter.ServerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Adapter that runs a managed server as an operating system process.
 *
 * <p>Output of the process (stdout and stderr merged) is buffered line by
 * line. If a ready line is configured, {@link #doStart()} only succeeds once
 * the process has printed a line containing it.</p>
 */
public class ProcessServerAdapter implements ServerAdapter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessServerAdapter.class);

    static final int MAX_LOG_BUFFER = 1000;
    private static final long READY_POLL_MILLIS = 50;

    private final String serverId;
    private final List<String> command;
    private final Path workingDirectory;
    private final Map<String, String> environment;

    @Nullable
    private final String readyLine;

    private final LinkedList<String> logBuffer = new LinkedList<>();

    private volatile Process process;
    private volatile boolean ready = false;

    /**
     * Create a process adapter.
     *
     * @param serverId server identifier
     * @param command command and arguments
     * @param workingDirectory working directory of the process
     * @param environment extra environment variables
     * @param readyLine output fragment signalling a completed start, or null to treat launch as started
     */
    public ProcessServerAdapter(
            @Nonnull String serverId,
            @Nonnull List<String> command,
            @Nonnull Path workingDirectory,
            @Nonnull Map<String, String> environment,
            @Nullable String readyLine) {
        this.serverId = Objects.requireNonNull(serverId, "serverId");
        this.command = List.copyOf(Objects.requireNonNull(command, "command"));
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment"));
        this.readyLine = readyLine;

        if (this.command.isEmpty()) {
            throw new IllegalArgumentException("Command must not be empty");
        }
    }

    // ==================== Start ====================

    @Override
    @Nonnull
    public AdapterResult doStart() {
        if (process != null && process.isAlive()) {
            return AdapterResult.ok();
        }

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(workingDirectory.toFile());
        builder.redirectErrorStream(true);
        builder.environment().putAll(environment);

        LOGGER.debug("Launching '{}': {}", serverId, String.join(" ", command));

        Process started;
        try {
            started = builder.start();
        } catch (IOException e) {
            return AdapterResult.failure("Failed to launch process: " + e.getMessage());
        }

        process = started;
        ready = readyLine == null;
        startLogCapture(started);

        LOGGER.info("Launched process for '{}' (PID: {})", serverId, started.pid());

        if (readyLine == null) {
            return AdapterResult.ok();
        }

        // Bounded by the hub's startup timeout, which abandons this call
        try {
            while (!ready) {
                if (!started.isAlive()) {
                    return AdapterResult.failure(
                            "Process exited during startup with code " + started.exitValue());
                }
                Thread.sleep(READY_POLL_MILLIS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AdapterResult.failure("Interrupted while waiting for startup");
        }
        return AdapterResult.ok();
    }

    private void startLogCapture(Process target) {
        Thread logThread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(target.getInputStream(), StandardCharsets.UTF_8))) {

                String line;
                while ((line = reader.readLine()) != null) {
                    addLogLine(line);
                    if (!ready && readyLine != null && line.contains(readyLine)) {
                        ready = true;
                    }
                }
            } catch (IOException e) {
                if (target.isAlive()) {
                    LOGGER.error("Error capturing output for '{}': {}", serverId, e.getMessage());
                }
            }
        }, "LogCapture-" + serverId);
        logThread.setDaemon(true);
        logThread.start();
    }

    // ==================== Stop ====================

    /**
     * Request termination and wait for the process to exit.
     *
     * <p>Blocks until exit; the caller bounds the wait.</p>
     */
    @Override
    @Nonnull
    public AdapterResult doStop() {
        Process current = process;
        if (current == null || !current.isAlive()) {
            return AdapterResult.ok();
        }

        LOGGER.info("Requesting graceful shutdown for '{}'", serverId);
        current.destroy();
        try {
            int exitCode = current.waitFor();
            LOGGER.debug("Process for '{}' exited with code {}", serverId, exitCode);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AdapterResult.failure("Interrupted while waiting for exit");
        }
        return AdapterResult.ok();
    }

    @Override
    @Nonnull
    public AdapterResult forceStop() {
        Process current = process;
        if (current == null || !current.isAlive()) {
            return AdapterResult.ok();
        }

        LOGGER.warn("Killing process for '{}' (PID: {})", serverId, current.pid());
        current.destroyForcibly();
        try {
            if (!current.waitFor(5, TimeUnit.SECONDS)) {
                return AdapterResult.failure("Process " + current.pid() + " still alive after kill");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return AdapterResult.failure("Interrupted while waiting for kill");
        }
        return AdapterResult.ok();
    }

    // ==================== Probe ====================

    @Override
    @Nonnull
    public ProbeResult probe(@Nonnull Duration timeout) {
        Process current = process;
        if (current == null) {
            return ProbeResult.dead("Process not started");
        }
        if (!current.isAlive()) {
            return ProbeResult.dead("Process exited with code " + current.exitValue());
        }
        return ProbeResult.alive();
    }

    // ==================== Output ====================

    private synchronized void addLogLine(String line) {
        logBuffer.addLast(line);
        while (logBuffer.size() > MAX_LOG_BUFFER) {
            logBuffer.removeFirst();
        }
    }

    /**
     * Get recent output lines.
     *
     * @param count number of lines to retrieve
     * @return list of lines (most recent last)
     */
    @Nonnull
    public synchronized List<String> getRecentLogs(int count) {
        if (count <= 0) {
            return Collections.emptyList();
        }

        int size = logBuffer.size();
        if (count >= size) {
            return new ArrayList<>(logBuffer);
        }
        return new ArrayList<>(logBuffer.subList(size - count, size));
    }

    /**
     * Get the process ID.
     *
     * @return PID, or -1 if never launched
     */
    public long getPid() {
        Process current = process;
        return current != null ? current.pid() : -1;
    }

    @Nonnull
    public String getServerId() {
        return serverId;
    }

    @Nonnull
    public List<String> getCommand() {
        return command;
    }

    @Override
    public String toString() {
        return "ProcessServerAdapter{" +
                "serverId='" + serverId + '\'' +
                ", pid=" + getPid() +
                ", alive=" + (process != null && process.isAlive()) +
                '}';
    }
}
