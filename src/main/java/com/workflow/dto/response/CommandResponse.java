package com.workflow.dto.response;

/**
 * The outcome of a shell command, rendered green on success and red on failure.
 *
 * @param success Whether the command achieved what was asked.
 * @param message The text shown to the operator.
 */
public record CommandResponse(boolean success, String message) {

    public static CommandResponse ok(String message) {
        return new CommandResponse(true, message);
    }

    public static CommandResponse error(String message) {
        return new CommandResponse(false, message);
    }

    /**
     * @return The message wrapped in ANSI colour codes, with the colour reset at the end.
     */
    public String toAnsiString() {
        String color = success ? "\u001B[32m" : "\u001B[31m"; // Green for success, Red for failure
        return color + message + "\u001B[0m";
    }
}
