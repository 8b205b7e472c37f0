package io.github.jakubt4.meridian.clock;

import java.time.Duration;

/**
 * Operator offset added on top of the clock base.
 */
public record ManualDelta(long days, long hours, long minutes, long seconds) {

    public static final ManualDelta ZERO = new ManualDelta(0, 0, 0, 0);

    public Duration toDuration() {
        return Duration.ofDays(days).plusHours(hours).plusMinutes(minutes).plusSeconds(seconds);
    }
}
