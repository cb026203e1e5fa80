package com.texstyle.export;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link ToolRunner} backed by {@link ProcessBuilder}. Standard output is discarded;
 * standard error is inherited so tool diagnostics stay visible.
 *
 * @since 1.0.0
 */
public class ProcessToolRunner implements ToolRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessToolRunner.class);

    @Override
    public void run(List<String> command, Duration timeout) {
        Objects.requireNonNull(command, "Command must not be null");
        Objects.requireNonNull(timeout, "Timeout must not be null");
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Command must not be empty");
        }
        String executable = command.get(0);

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.INHERIT)
                    .start();
        } catch (IOException e) {
            throw new ExternalToolUnavailableException(executable, e);
        }

        LOG.debug("Started {}", command);
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ExternalToolException(executable,
                        executable + " did not finish within " + timeout);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ExternalToolException(executable, executable + " was interrupted", e);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new ExternalToolException(executable,
                    executable + " exited with status " + exitCode);
        }
    }
}
