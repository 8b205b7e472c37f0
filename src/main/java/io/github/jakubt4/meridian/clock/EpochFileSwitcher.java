package io.github.jakubt4.meridian.clock;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * Keeps the file matching the simulated instant loaded, in either direction of time.
 *
 * @param <T> what a file is loaded into, e.g. a parsed TLE catalog
 */
@Slf4j
public class EpochFileSwitcher<T> {

    private final TimeSlicedFileSet fileSet;
    private final Function<TimeSlicedFile, T> loader;

    private int activeIndex = -1;
    private T active;

    public EpochFileSwitcher(final TimeSlicedFileSet fileSet, final Function<TimeSlicedFile, T> loader) {
        this.fileSet = Objects.requireNonNull(fileSet, "fileSet");
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    /**
     * Loads the file for {@code instant} if it differs from the one already loaded.
     *
     * @return {@code true} if a different file was loaded
     */
    public boolean switchIfNeeded(final Instant instant) {
        final var index = TimeSlicedFileSet.selectActiveFile(fileSet, instant);
        if (index < 0 || index == activeIndex) {
            return false;
        }
        final var file = fileSet.get(index);
        active = loader.apply(file);
        log.info("Switched to TLE file [{}] (epoch {}), index {} -> {}",
                file.filename(), file.epoch(), activeIndex, index);
        activeIndex = index;
        return true;
    }

    public int activeIndex() {
        return activeIndex;
    }

    public T active() {
        return active;
    }

    public TimeSlicedFileSet fileSet() {
        return fileSet;
    }
}
