package io.github.hide212131.langchain4j.agent.runtime.execution;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/** Runs an external process, collecting stdout and stderr, and kills it when the timeout elapses. */
@SuppressWarnings("PMD.CloseResource")
final class ProcessRunner {

    private ProcessRunner() {
        throw new AssertionError("No instances");
    }

    static CommandResult run(List<String> command, Path workingDirectory, Duration timeout) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(timeout, "timeout");
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }
        Process process;
        try {
            process = builder.start();
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to start command: " + command.get(0), ex);
        }
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<String> stdoutFuture = executor.submit(() -> readStream(process.getInputStream()));
            Future<String> stderrFuture = executor.submit(() -> readStream(process.getErrorStream()));
            if (!waitForProcess(process, timeout)) {
                process.destroyForcibly();
                return CommandResult.failure("Command timed out", "timeout",
                        "Command exceeded " + timeout.toMillis() + "ms timeout");
            }
            String stdout = getFuture(stdoutFuture);
            String stderr = getFuture(stderrFuture);
            return CommandResult.of(process.exitValue(), stdout, stderr);
        } finally {
            shutdownExecutor(executor);
        }
    }

    private static String readStream(InputStream stream) throws IOException {
        try (InputStream input = stream) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static boolean waitForProcess(Process process, Duration timeout) {
        try {
            return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Command was interrupted", ex);
        }
    }

    private static String getFuture(Future<String> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reading command output", ex);
        } catch (ExecutionException ex) {
            throw new IllegalStateException("Failed to read command output", ex.getCause());
        }
    }

    private static void shutdownExecutor(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(3, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
