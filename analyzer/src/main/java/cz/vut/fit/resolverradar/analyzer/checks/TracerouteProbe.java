package cz.vut.fit.resolverradar.analyzer.checks;

import com.google.common.base.Ticker;
import cz.vut.fit.resolverradar.analyzer.AnalyzerSettings;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Runs the platform's path-tracing utility towards a resolver address. Every failure, including a missing
 * utility, is reported as a status; only an interrupt propagates.
 */
public class TracerouteProbe {
    private static final org.slf4j.Logger Logger = LoggerFactory.getLogger(TracerouteProbe.class);

    private final Function<String, List<String>> _commandFactory;
    private final Duration _timeout;
    private final Ticker _ticker;

    public TracerouteProbe(@NotNull AnalyzerSettings settings) {
        this(platformCommand(settings.tracerouteMaxHops(), settings.tracerouteHopTimeoutSeconds()),
                settings.tracerouteTimeout(), Ticker.systemTicker());
    }

    /**
     * @param commandFactory Creates the command line for a target address.
     * @param timeout        The time after which the utility is killed.
     * @param ticker         The time source for measuring the run time.
     */
    public TracerouteProbe(@NotNull Function<String, List<String>> commandFactory,
                           @NotNull Duration timeout, @NotNull Ticker ticker) {
        _commandFactory = commandFactory;
        _timeout = timeout;
        _ticker = ticker;
    }

    /**
     * Returns the command factory for the current OS: {@code tracert -d -h <hops> -w <ms>} on Windows,
     * {@code traceroute -n -m <hops> -w <s>} elsewhere. Name resolution of the hops is disabled.
     */
    public static Function<String, List<String>> platformCommand(int maxHops, int hopTimeoutSeconds) {
        final var os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.startsWith("windows")) {
            return target -> List.of("tracert", "-d", "-h", Integer.toString(maxHops),
                    "-w", Integer.toString(hopTimeoutSeconds * 1000), target);
        }

        return target -> List.of("traceroute", "-n", "-m", Integer.toString(maxHops),
                "-w", Integer.toString(hopTimeoutSeconds), target);
    }

    /**
     * Runs the utility towards the given address and waits for it to finish or time out.
     *
     * @param target The address to trace.
     * @return The result of the run.
     * @throws InterruptedException If interrupted while waiting; the utility is killed.
     */
    public @NotNull TracerouteResult trace(@NotNull String target) throws InterruptedException {
        final var command = _commandFactory.apply(target);
        final long start = _ticker.read();

        if (!isOnPath(command.get(0), System.getenv("PATH"), executableExtensions())) {
            Logger.warn("Traceroute utility {} not found on PATH", command.get(0));
            return notFound(start);
        }

        Path stdout = null, stderr = null;
        try {
            stdout = Files.createTempFile("traceroute-", ".out");
            stderr = Files.createTempFile("traceroute-", ".err");

            final Process process;
            try {
                process = new ProcessBuilder(command)
                        .redirectOutput(stdout.toFile())
                        .redirectError(stderr.toFile())
                        .start();
            } catch (IOException e) {
                if (isMissingExecutable(e)) {
                    Logger.warn("Traceroute utility {} not found", command.get(0));
                    return notFound(start);
                }
                throw e;
            }

            final boolean finished;
            try {
                finished = process.waitFor(_timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }

            if (!finished) {
                process.destroyForcibly();
                process.waitFor();
                Logger.warn("Traceroute to {} killed after {}", target, _timeout);
                return new TracerouteResult(false, TracerouteResult.STATUS_TIMEOUT,
                        "traceroute command timed out", elapsedMs(start));
            }

            final var elapsed = elapsedMs(start);
            final var exitCode = process.exitValue();
            final var charset = Charset.defaultCharset();
            var output = Files.readString(stdout, charset);
            if (output.isEmpty()) {
                output = Files.readString(stderr, charset);
            }

            final var status = exitCode == 0
                    ? TracerouteResult.STATUS_OK
                    : TracerouteResult.STATUS_EXIT_PREFIX + exitCode;
            Logger.debug("Traceroute to {} finished with {} in {} ms", target, status, elapsed);
            return new TracerouteResult(exitCode == 0, status, output, elapsed);
        } catch (IOException e) {
            Logger.warn("Traceroute to {} failed", target, e);
            return new TracerouteResult(false, TracerouteResult.STATUS_ERROR,
                    "Exception during traceroute: " + e.getMessage(), elapsedMs(start));
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private double elapsedMs(long startNanos) {
        return ((_ticker.read() - startNanos) / 1_000L) / 1000.0;
    }

    private TracerouteResult notFound(long start) {
        return new TracerouteResult(false, TracerouteResult.STATUS_NOT_FOUND,
                "traceroute/tracert command not found", elapsedMs(start));
    }

    /**
     * Checks whether an executable can be started, the way the OS resolves it. A name with a directory part
     * is checked as a file; a bare name is looked up in each {@code PATH} entry, trying every extension.
     * An unset {@code PATH} is not checked and the start attempt decides.
     *
     * @param executable The executable name or path.
     * @param path       The value of the {@code PATH} variable, may be null.
     * @param extensions The file name extensions to try; an empty string for the bare name.
     * @return True if the executable was found or cannot be checked.
     */
    static boolean isOnPath(@NotNull String executable, @Nullable String path, @NotNull List<String> extensions) {
        if (executable.indexOf('/') >= 0 || executable.indexOf('\\') >= 0) {
            return Files.isExecutable(Path.of(executable));
        }
        if (path == null || path.isBlank())
            return true;

        for (var dir : path.split(File.pathSeparator)) {
            if (dir.isBlank())
                continue;

            for (var extension : extensions) {
                final Path candidate;
                try {
                    candidate = Path.of(dir.trim(), executable + extension);
                } catch (InvalidPathException e) {
                    Logger.trace("Skipping invalid PATH entry {}", dir);
                    break;
                }
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate))
                    return true;
            }
        }
        return false;
    }

    private static List<String> executableExtensions() {
        final var os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (!os.startsWith("windows"))
            return List.of("");

        final var extensions = new ArrayList<String>();
        extensions.add("");
        final var pathExt = System.getenv("PATHEXT");
        for (var extension : (pathExt == null ? ".COM;.EXE;.BAT;.CMD" : pathExt).split(";")) {
            if (!extension.isBlank()) {
                extensions.add(extension.trim().toLowerCase(Locale.ROOT));
            }
        }
        return extensions;
    }

    // The start attempt still catches a utility that disappears between the lookup and the start.
    private static boolean isMissingExecutable(IOException e) {
        final var message = e.getMessage();
        return message != null && message.contains("error=2");
    }

    private static void deleteQuietly(Path path) {
        if (path == null)
            return;

        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            Logger.debug("Cannot delete temporary file {}: {}", path, e.getMessage());
        }
    }
}
