package app.listify.assets.support;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs external tools with a timeout, capturing combined stdout and stderr.
 */
public final class ProcessRunner {

    private static final int MAX_OUTPUT_CHARS = 300;

    private ProcessRunner() {
    }

    /**
     * @throws IOException if the process cannot be started or its output cannot be read
     * @throws IllegalStateException if the process times out or the caller is interrupted
     */
    public static ProcessResult run(List<String> command, Duration timeout) throws IOException {
        Path outputFile = Files.createTempFile("listify-process-", ".log");
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.redirectErrorStream(true);
            builder.redirectOutput(outputFile.toFile());
            Process process = builder.start();
            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
                throw new IllegalStateException(command.get(0) + " interrupted", ex);
            }
            if (!finished) {
                process.destroyForcibly();
                throw new IllegalStateException(command.get(0) + " timed out after " + timeout.toSeconds() + "s");
            }
            String output = Files.readString(outputFile, StandardCharsets.UTF_8);
            return new ProcessResult(process.exitValue(), output);
        } finally {
            Files.deleteIfExists(outputFile);
        }
    }

    /**
     * Checks whether an executable can be found, either at the given path or on {@code PATH}.
     */
    public static boolean isAvailable(String executable) {
        if (executable == null || executable.isBlank()) {
            return false;
        }
        if (executable.contains(File.separator)) {
            return Files.isExecutable(Path.of(executable));
        }
        String pathEnv = System.getenv("PATH");
        if (pathEnv == null || pathEnv.isBlank()) {
            return false;
        }
        for (String dir : pathEnv.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            if (Files.isExecutable(Path.of(dir, executable))) {
                return true;
            }
        }
        return false;
    }

    public record ProcessResult(int exitCode, String output) {

        public boolean succeeded() {
            return exitCode == 0;
        }

        public String summary() {
            if (output == null) {
                return "";
            }
            String trimmed = output.trim();
            if (trimmed.length() <= MAX_OUTPUT_CHARS) {
                return trimmed;
            }
            return trimmed.substring(0, MAX_OUTPUT_CHARS) + "...";
        }
    }
}
