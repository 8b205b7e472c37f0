package io.github.jakubt4.meridian.clock;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Files ordered by ascending epoch.
 */
public final class TimeSlicedFileSet {

    private final List<TimeSlicedFile> files;

    public TimeSlicedFileSet(final List<TimeSlicedFile> files) {
        this.files = files.stream()
                .sorted(Comparator.comparing(TimeSlicedFile::epoch))
                .toList();
    }

    public static TimeSlicedFileSet empty() {
        return new TimeSlicedFileSet(List.of());
    }

    public List<TimeSlicedFile> files() {
        return files;
    }

    public TimeSlicedFile get(final int index) {
        return files.get(index);
    }

    public int size() {
        return files.size();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    /**
     * Index of the latest file whose epoch is not after {@code instant}. Instants before the first
     * epoch select the first file.
     *
     * @return the index, or {@code -1} for an empty set
     */
    public static int selectActiveFile(final TimeSlicedFileSet fileSet, final Instant instant) {
        if (fileSet.isEmpty()) {
            return -1;
        }
        var low = 0;
        var high = fileSet.size() - 1;
        var found = 0;
        while (low <= high) {
            final var mid = (low + high) >>> 1;
            if (!fileSet.get(mid).epoch().isAfter(instant)) {
                found = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return found;
    }
}
