package io.github.jakubt4.meridian.dto;

import java.time.Instant;

/**
 * One ISS Live parameter value, e.g. {@code USLAB000032} (position X, km).
 */
public record TelemetrySample(String parameter, double value, Instant timestamp) {
}
