package io.github.jakubt4.meridian.dto;

import io.github.jakubt4.meridian.clock.TimeSlicedFile;
import io.github.jakubt4.meridian.clock.TimeSlicedFileSet;

import java.time.Instant;
import java.util.List;

public record FileSetResponse(String status, String message, List<FileEpoch> files) {

    public record FileEpoch(String filename, Instant epoch) {
    }

    public static FileSetResponse accepted(final TimeSlicedFileSet fileSet) {
        return new FileSetResponse(CommandResponse.ACCEPTED,
                fileSet.size() + " files ordered by epoch",
                fileSet.files().stream()
                        .map(FileSetResponse::toEpoch)
                        .toList());
    }

    public static FileSetResponse rejected(final String message) {
        return new FileSetResponse(CommandResponse.REJECTED, message, List.of());
    }

    private static FileEpoch toEpoch(final TimeSlicedFile file) {
        return new FileEpoch(file.filename(), file.epoch());
    }
}
