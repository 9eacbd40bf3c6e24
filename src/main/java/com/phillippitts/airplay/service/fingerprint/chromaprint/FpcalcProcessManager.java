package com.phillippitts.airplay.service.fingerprint.chromaprint;

import com.phillippitts.airplay.config.properties.FingerprintProperties;
import com.phillippitts.airplay.exception.FingerprintException;
import com.phillippitts.airplay.util.LogSanitizer;
import com.phillippitts.airplay.util.ProcessTimeouts;
import com.phillippitts.airplay.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs the Chromaprint {@code fpcalc} tool and returns its JSON stdout.
 *
 * <p>Responsibilities:
 * - Build a deterministic CLI from {@link FingerprintProperties}
 * - Start the process via {@link ProcessFactory}
 * - Capture stdout (JSON) and stderr (diagnostics) concurrently with bounded buffers
 * - Enforce a timeout and terminate runaway processes
 * - Terminate the process when the calling worker is interrupted (poll deadline)
 *
 * <p>Every call owns its process, so one manager serves all pipeline workers at once.
 * Temp-file handling is performed by the caller.
 */
public final class FpcalcProcessManager {

    private static final Logger LOG = LogManager.getLogger(FpcalcProcessManager.class);

    private static final int STDERR_MAX_BYTES = 8 * 1024;
    private static final int ERROR_SNIPPET_MAX_CHARS = 400;

    private final ProcessFactory processFactory;
    private final FingerprintProperties props;

    /**
     * Holds process execution state including process reference and stream gobblers.
     */
    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    public FpcalcProcessManager(FingerprintProperties props) {
        this(new DefaultProcessFactory(), props);
    }

    FpcalcProcessManager(ProcessFactory processFactory, FingerprintProperties props) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Fingerprints {@code audioPath} and returns fpcalc's JSON output.
     *
     * <p>CLI contract:
     *   <pre>
     *   ${fpcalc} -json -length ${maxAudioSeconds} [-raw] ${file}
     *   </pre>
     *
     * @param audioPath audio file written by the caller
     * @param raw       true for the integer vector ({@code -raw}), false for the compressed string
     * @return stdout of fpcalc
     * @throws FingerprintException on timeout, non-zero exit, interruption or I/O error
     */
    public String run(Path audioPath, boolean raw) {
        Objects.requireNonNull(audioPath, "audioPath");
        List<String> command = buildCommand(audioPath, raw);
        long startTime = System.nanoTime();

        ProcessExecution exec = null;
        try {
            exec = startProcessWithGobblers(command, audioPath);
            waitForProcessCompletion(exec, startTime);
            return handleProcessResult(exec, startTime);
        } catch (IOException e) {
            throw fpcalcError("I/O failure: " + e.getMessage(), -1, null, startTime, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw fpcalcError("Interrupted", -1, null, startTime, e);
        } finally {
            if (exec != null) {
                cleanup(exec);
            }
        }
    }

    private ProcessExecution startProcessWithGobblers(List<String> command, Path audioPath) throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        Process process = processFactory.start(command, audioPath.toAbsolutePath().getParent());

        // Start gobblers before waiting to avoid deadlock on full pipes
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, "fpcalc-out", props.getMaxStdoutBytes());
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, "fpcalc-err", STDERR_MAX_BYTES);

        return new ProcessExecution(process, outGobbler, errGobbler, stdout, stderr);
    }

    private void waitForProcessCompletion(ProcessExecution exec, long startTime) throws InterruptedException {
        boolean finished = exec.process().waitFor(props.getTimeoutSeconds(), TimeUnit.SECONDS);
        if (!finished) {
            destroyProcess(exec.process());
            throw fpcalcError("Timeout after " + props.getTimeoutSeconds() + "s", -1, exec.stderr(), startTime, null);
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
    }

    private String handleProcessResult(ProcessExecution exec, long startTime) {
        int exitCode = exec.process().exitValue();
        if (exitCode != 0) {
            throw fpcalcError("Non-zero exit: " + exitCode, exitCode, exec.stderr(), startTime, null);
        }
        String output = exec.stdout().toString();
        LOG.debug("fpcalc stdout size={} bytes in {}ms", output.length(), TimeUtils.elapsedMillis(startTime));
        return output;
    }

    private List<String> buildCommand(Path audioPath, boolean raw) {
        List<String> cmd = new ArrayList<>();
        cmd.add(props.getFpcalcPath());
        cmd.add("-json");
        cmd.add("-length");
        cmd.add(String.valueOf(props.getMaxAudioSeconds()));
        if (raw) {
            cmd.add("-raw");
        }
        cmd.add(audioPath.toAbsolutePath().toString());
        return cmd;
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        StreamGobbler gobbler = new StreamGobbler(inputStream, sink, name, maxBytes);
        Thread thread = new Thread(gobbler, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a StringBuilder until capacity is reached, then keeps draining the
     * stream without accumulating so the process never blocks on a full pipe.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        if (line.length() > available) {
                            sink.append(line, 0, available);
                            LOG.warn("Stream '{}' reached {}B cap (truncated line)", name, maxBytes);
                            capReached = true;
                        } else {
                            sink.append(line);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void cleanup(ProcessExecution exec) {
        if (exec.process().isAlive()) {
            destroyProcess(exec.process());
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
    }

    private void destroyProcess(Process process) {
        // preserve the caller's interrupt while still waiting for the kill to land
        boolean interrupted = Thread.interrupted();
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("fpcalc still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
            process.destroyForcibly();
            LOG.warn("Interrupted while destroying fpcalc; forced kill issued");
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private FingerprintException fpcalcError(String msg, int exitCode, StringBuilder stderr,
                                             long startNano, Throwable cause) {
        long durationMs = TimeUtils.elapsedMillis(startNano);
        String stderrSnippet;
        if (stderr == null) {
            stderrSnippet = "";
        } else {
            synchronized (stderr) {
                stderrSnippet = LogSanitizer.truncate(stderr.toString(), ERROR_SNIPPET_MAX_CHARS);
            }
        }
        String detailed = "fpcalc " + msg + " (exitCode=" + exitCode + ", durationMs=" + durationMs
                + ", binary=" + props.getFpcalcPath() + ", stderr=" + stderrSnippet + ")";
        return cause == null
                ? new FingerprintException(detailed, exitCode)
                : new FingerprintException(detailed, exitCode, cause);
    }
}
