package io.github.jakubt4.meridian.ephemeris;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses satellite selection files: one {@code name,red,green,blue} entry per line.
 */
@Slf4j
public final class SatelliteColorMap {

    private SatelliteColorMap() {
    }

    /**
     * @return colors keyed by satellite name, in file order; malformed lines are skipped
     */
    public static Map<String, DisplayColor> parse(final String text) {
        final var colors = new LinkedHashMap<String, DisplayColor>();
        if (text == null) {
            return colors;
        }
        text.lines().forEach(line -> {
            final var parts = line.strip().split(",");
            if (parts.length < 4) {
                return;
            }
            try {
                colors.put(parts[0].strip(), new DisplayColor(
                        Integer.parseInt(parts[1].strip()),
                        Integer.parseInt(parts[2].strip()),
                        Integer.parseInt(parts[3].strip())));
            } catch (final IllegalArgumentException e) {
                log.warn("Skipping color entry [{}]: {}", line.strip(), e.getMessage());
            }
        });
        return colors;
    }
}
