package io.github.jakubt4.meridian.dto;

/**
 * Outcome of a request that was queued for the next frame.
 */
public record CommandResponse(String status, String message) {

    public static final String ACCEPTED = "ACCEPTED";
    public static final String REJECTED = "REJECTED";

    public static CommandResponse accepted(final String message) {
        return new CommandResponse(ACCEPTED, message);
    }

    public static CommandResponse rejected(final String message) {
        return new CommandResponse(REJECTED, message);
    }
}
