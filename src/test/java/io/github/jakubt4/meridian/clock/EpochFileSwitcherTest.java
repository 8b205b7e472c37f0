package io.github.jakubt4.meridian.clock;

import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Instant;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EpochFileSwitcherTest {

    private static final TimeSlicedFile NOV01 =
            new TimeSlicedFile("iss-nov01.tle", "a", Instant.parse("2023-11-01T00:00:00Z"));
    private static final TimeSlicedFile NOV02 =
            new TimeSlicedFile("iss-nov02.tle", "b", Instant.parse("2023-11-02T00:00:00Z"));

    @SuppressWarnings("unchecked")
    private final Function<TimeSlicedFile, String> loader = Mockito.mock(Function.class);

    @Test
    void loadsEachFileOnlyWhenTheActiveIndexChanges() {
        when(loader.apply(any())).thenAnswer(invocation -> ((TimeSlicedFile) invocation.getArgument(0)).content());
        final var switcher = new EpochFileSwitcher<>(new TimeSlicedFileSet(List.of(NOV01, NOV02)), loader);

        assertThat(switcher.activeIndex()).isEqualTo(-1);
        assertThat(switcher.switchIfNeeded(Instant.parse("2023-11-01T12:00:00Z"))).isTrue();
        assertThat(switcher.switchIfNeeded(Instant.parse("2023-11-01T23:59:59Z"))).isFalse();
        assertThat(switcher.active()).isEqualTo("a");

        assertThat(switcher.switchIfNeeded(Instant.parse("2023-11-02T00:00:01Z"))).isTrue();
        assertThat(switcher.activeIndex()).isEqualTo(1);
        assertThat(switcher.active()).isEqualTo("b");

        verify(loader, times(1)).apply(NOV01);
        verify(loader, times(1)).apply(NOV02);
    }

    @Test
    void switchesBackWhenTimeRunsBackwards() {
        when(loader.apply(any())).thenAnswer(invocation -> ((TimeSlicedFile) invocation.getArgument(0)).content());
        final var switcher = new EpochFileSwitcher<>(new TimeSlicedFileSet(List.of(NOV01, NOV02)), loader);

        switcher.switchIfNeeded(Instant.parse("2023-11-02T06:00:00Z"));
        assertThat(switcher.switchIfNeeded(Instant.parse("2023-11-01T06:00:00Z"))).isTrue();

        assertThat(switcher.activeIndex()).isZero();
        assertThat(switcher.active()).isEqualTo("a");
    }

    @Test
    void emptySetNeverLoads() {
        final var switcher = new EpochFileSwitcher<>(TimeSlicedFileSet.empty(), loader);

        assertThat(switcher.switchIfNeeded(Instant.now())).isFalse();
        assertThat(switcher.active()).isNull();
        Mockito.verifyNoInteractions(loader);
    }
}
