package org.ferry.connect;

/**
 * Exit status and combined output of one script, dump or load.
 */
public record ToolResult(int exitCode, String output) {

    public static final int TOOL_UNAVAILABLE = 127;

    public ToolResult {
        output = output == null ? "" : output;
    }

    public static ToolResult success(String output) {
        return new ToolResult(0, output);
    }

    public static ToolResult failure(String output) {
        return new ToolResult(1, output);
    }

    public boolean succeeded() {
        return exitCode == 0;
    }

    public boolean toolUnavailable() {
        return exitCode == TOOL_UNAVAILABLE;
    }
}
