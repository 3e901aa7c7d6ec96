package com.barometer.core.system;

import com.barometer.core.provider.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands with a bounded wait.
 * <p>
 * Both output streams are drained on background threads so a chatty
 * process cannot block on a full pipe while we wait for it.
 */
public class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    private final Duration timeout;

    public CommandRunner(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * Runs the command and returns its output whatever the exit code.
     *
     * @throws ProviderException if the process cannot be started, times out or is interrupted
     */
    public CommandResult run(List<String> command) throws ProviderException {
        String display = String.join(" ", command);
        log.debug("Running: {}", display);
        Process process = start(command);
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ProviderException(command.get(0) + " timed out after " + timeout.toSeconds() + "s");
            }
            var result = new CommandResult(process.exitValue(), stdout.get().strip(), stderr.get().strip());
            log.debug("{} exited with {}", display, result.exitCode());
            return result;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ProviderException(command.get(0) + " was interrupted", e);
        } catch (ExecutionException e) {
            throw new ProviderException("failed to read output of " + command.get(0), e.getCause());
        }
    }

    /**
     * Runs the command and requires a zero exit code.
     *
     * @throws ProviderException on a non-zero exit, with stderr as the message when present
     */
    public CommandResult runChecked(List<String> command) throws ProviderException {
        CommandResult result = run(command);
        if (!result.succeeded()) {
            String detail = result.stderr().isBlank() ? "exit code " + result.exitCode() : result.stderr();
            throw new ProviderException(command.get(0) + " failed: " + detail.lines().findFirst().orElse(detail));
        }
        return result;
    }

    /** Locates an executable on {@code PATH}. */
    public static Optional<Path> which(String executable) {
        String path = System.getenv("PATH");
        if (path == null) {
            return Optional.empty();
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir, executable);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static Process start(List<String> command) throws ProviderException {
        try {
            Process process = new ProcessBuilder(command).start();
            process.getOutputStream().close();
            return process;
        } catch (IOException e) {
            throw new ProviderException("failed to run " + command.get(0) + ": " + e.getMessage(), e);
        }
    }

    private static String drain(InputStream stream) {
        try (stream; var buffer = new ByteArrayOutputStream()) {
            stream.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
