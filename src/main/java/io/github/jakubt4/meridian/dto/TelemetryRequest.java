package io.github.jakubt4.meridian.dto;

import java.util.List;

public record TelemetryRequest(List<TelemetrySample> samples) {
}
