package io.github.jakubt4.meridian.ephemeris;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;

/**
 * Parses TLE catalog text: optional name line followed by the two data lines, repeated.
 *
 * <p>An entry that does not parse is dropped and recorded in {@link TleCatalog#rejected()};
 * parsing resumes at the next line that can start an entry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TleCatalogParser {

    private final EphemerisAdapter ephemerisAdapter;

    public TleCatalog parse(final String text) {
        if (text == null || text.isBlank()) {
            return TleCatalog.empty();
        }
        final var lines = text.lines()
                .map(String::stripTrailing)
                .filter(line -> !line.isBlank())
                .toList();

        final var satellites = new ArrayList<Satellite>();
        final var rejected = new ArrayList<String>();

        var i = 0;
        while (i < lines.size()) {
            final var current = lines.get(i);
            final String name;
            final int dataStart;
            if (isLine1(current)) {
                name = null;
                dataStart = i;
            } else {
                name = stripNamePrefix(current);
                dataStart = i + 1;
            }

            if (dataStart + 1 >= lines.size()
                    || !isLine1(lines.get(dataStart))
                    || !isLine2(lines.get(dataStart + 1))) {
                rejected.add("Line " + (i + 1) + ": expected TLE data lines after [" + current.strip() + "]");
                i++;
                continue;
            }

            final var line1 = lines.get(dataStart).strip();
            final var line2 = lines.get(dataStart + 1).strip();
            try {
                satellites.add(ephemerisAdapter.createSatellite(name, line1, line2, DisplayColor.DEFAULT));
            } catch (final RuntimeException e) {
                rejected.add("Line " + (i + 1) + ": " + e.getMessage());
            }
            i = dataStart + 2;
        }

        if (!rejected.isEmpty()) {
            log.warn("Dropped {} malformed TLE entries, loaded {}", rejected.size(), satellites.size());
            rejected.forEach(reason -> log.debug("TLE rejected — {}", reason));
        }
        return new TleCatalog(satellites, rejected);
    }

    private static boolean isLine1(final String line) {
        return line.startsWith("1 ");
    }

    private static boolean isLine2(final String line) {
        return line.startsWith("2 ");
    }

    // 3LE files prefix the name line with "0 "
    private static String stripNamePrefix(final String line) {
        final var stripped = line.strip();
        return stripped.startsWith("0 ") ? stripped.substring(2).strip() : stripped;
    }
}
