package io.github.jakubt4.meridian.config;

import lombok.extern.slf4j.Slf4j;
import org.orekit.frames.EOPEntry;
import org.orekit.time.DateComponents;
import org.orekit.time.OffsetModel;
import org.orekit.time.TimeScale;
import org.orekit.time.TimeScales;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collections;
import java.util.List;

/**
 * Provides Orekit time scales built from an embedded leap-second table.
 *
 * <p>Nothing is read from {@code orekit-data}: TLE parsing and SGP4 only need UTC, and Earth
 * orientation is handled by {@link io.github.jakubt4.meridian.frame.FrameTransform}. Beans that
 * call Orekit take {@link TimeScale} {@code utc} from here instead of {@code TimeScalesFactory}.
 */
@Slf4j
@Configuration
public class OrekitConfig {

    // TAI - UTC in seconds from each date on (IERS Bulletin C)
    private static final List<OffsetModel> LEAP_SECONDS = List.of(
            leap(1972, 1, 1, 10), leap(1972, 7, 1, 11), leap(1973, 1, 1, 12),
            leap(1974, 1, 1, 13), leap(1975, 1, 1, 14), leap(1976, 1, 1, 15),
            leap(1977, 1, 1, 16), leap(1978, 1, 1, 17), leap(1979, 1, 1, 18),
            leap(1980, 1, 1, 19), leap(1981, 7, 1, 20), leap(1982, 7, 1, 21),
            leap(1983, 7, 1, 22), leap(1985, 7, 1, 23), leap(1988, 1, 1, 24),
            leap(1990, 1, 1, 25), leap(1991, 1, 1, 26), leap(1992, 7, 1, 27),
            leap(1993, 7, 1, 28), leap(1994, 7, 1, 29), leap(1996, 1, 1, 30),
            leap(1997, 7, 1, 31), leap(1999, 1, 1, 32), leap(2006, 1, 1, 33),
            leap(2009, 1, 1, 34), leap(2012, 7, 1, 35), leap(2015, 7, 1, 36),
            leap(2017, 1, 1, 37));

    @Bean
    public TimeScales timeScales() {
        final var timeScales = embeddedTimeScales();
        log.info("Orekit time scales initialized — embedded leap-second table, {} entries", LEAP_SECONDS.size());
        return timeScales;
    }

    @Bean
    public TimeScale utc(final TimeScales timeScales) {
        return timeScales.getUTC();
    }

    /**
     * Time scales without EOP corrections, for use outside the Spring context (tests, tools).
     */
    public static TimeScales embeddedTimeScales() {
        return TimeScales.of(LEAP_SECONDS, (conventions, timeScales) -> Collections.<EOPEntry>emptyList());
    }

    private static OffsetModel leap(final int year, final int month, final int day, final int taiMinusUtc) {
        return new OffsetModel(new DateComponents(year, month, day), taiMinusUtc);
    }
}
