package org.ferry.postgres;

import org.ferry.connect.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external PostgreSQL client tool and captures its combined output.
 */
public class ProcessRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);

    private final Duration timeout;

    public ProcessRunner(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * @return the tool's exit code and output; {@link ToolResult#TOOL_UNAVAILABLE} if it could not be started
     */
    public ToolResult run(List<String> command, Map<String, String> environment) {
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        builder.environment().putAll(environment);

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            LOGGER.debug("Could not start {}: {}", command.get(0), e.getMessage());
            return new ToolResult(ToolResult.TOOL_UNAVAILABLE, command.get(0) + ": " + e.getMessage());
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));
        try {
            if (!process.waitFor(timeout.toSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return new ToolResult(124, output.getNow("") + "\nTerminated: " + command.get(0)
                        + " exceeded " + timeout.toSeconds() + "s");
            }
            return new ToolResult(process.exitValue(), output.join());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return new ToolResult(130, "Terminated: interrupted while waiting for " + command.get(0));
        }
    }

    private static String drain(InputStream in) {
        try (in; ByteArrayOutputStream buffer = new ByteArrayOutputStream()) {
            in.transferTo(buffer);
            return buffer.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "output unavailable: " + e.getMessage();
        }
    }
}
