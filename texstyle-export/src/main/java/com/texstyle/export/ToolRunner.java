package com.texstyle.export;

import java.time.Duration;
import java.util.List;

/**
 * Launches an external command and waits for it.
 *
 * @since 1.0.0
 */
public interface ToolRunner {

    /**
     * Run {@code command} to completion.
     *
     * @param command executable followed by its arguments
     * @param timeout maximum time to wait
     * @throws ExternalToolUnavailableException if the executable cannot be started
     * @throws ExternalToolException            if it exits non-zero, times out or the
     *                                          wait is interrupted
     */
    void run(List<String> command, Duration timeout);
}
