package io.github.jakubt4.meridian.dto;

import io.github.jakubt4.meridian.clock.ManualDelta;

import java.time.Instant;

/**
 * Either field may be omitted.
 */
public record ManualTimeRequest(Instant time, ManualDelta delta) {
}
