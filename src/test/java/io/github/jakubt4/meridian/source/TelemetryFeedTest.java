package io.github.jakubt4.meridian.source;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TelemetryFeedTest {

    private static final Instant T0 = Instant.parse("2021-11-20T19:28:00Z");

    @Test
    void publishesOnlyWhenAllSixParametersArrived() {
        final var feed = new TelemetryFeed();

        for (int i = 0; i < 5; i++) {
            assertThat(feed.accept(TelemetryFeed.PARAMETERS.get(i), i + 1.0, T0)).isFalse();
        }
        assertThat(feed.latest()).isEmpty();

        assertThat(feed.accept("USLAB000037", 6.0, T0.plusSeconds(2))).isTrue();

        final var osv = feed.latest().orElseThrow();
        assertThat(osv.position().getX()).isEqualTo(1000.0);
        assertThat(osv.position().getZ()).isEqualTo(3000.0);
        assertThat(osv.velocity().getX()).isEqualTo(4.0);
        assertThat(osv.velocity().getZ()).isEqualTo(6.0);
        assertThat(osv.timestamp()).isEqualTo(T0.plusSeconds(2));
    }

    @Test
    void laterSampleOfSameParameterReplacesEarlierOne() {
        final var feed = new TelemetryFeed();
        feed.accept("USLAB000032", 1.0, T0);
        feed.accept("USLAB000032", 9.0, T0.plusSeconds(1));
        for (int i = 1; i < 6; i++) {
            feed.accept(TelemetryFeed.PARAMETERS.get(i), 0.0, T0);
        }

        final var osv = feed.latest().orElseThrow();
        assertThat(osv.position().getX()).isEqualTo(9000.0);
        assertThat(osv.timestamp()).isEqualTo(T0.plusSeconds(1));
    }

    @Test
    void seededFeedStartsFromReferenceState() {
        assertThat(TelemetryFeed.seeded().latest()).contains(TelemetryFeed.ISS_SAMPLE);
    }

    @Test
    void rejectsUnknownParameter() {
        assertThatThrownBy(() -> new TelemetryFeed().accept("USLAB000099", 1.0, T0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("USLAB000099");
    }
}
