package io.github.jakubt4.meridian.clock;

import java.time.Instant;
import java.util.Objects;

/**
 * One file of a time-sliced TLE set, keyed by the epoch of its first entry.
 */
public record TimeSlicedFile(String filename, String content, Instant epoch) {

    public TimeSlicedFile {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(epoch, "epoch");
    }
}
