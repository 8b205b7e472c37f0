package io.github.jakubt4.meridian.service;

import io.github.jakubt4.meridian.simulation.FrameSink;
import io.github.jakubt4.meridian.simulation.FrameSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Frame sink used when no render layer is configured: logs the primary target position.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "meridian.render.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingFrameSink implements FrameSink {

    private final long logEveryFrames;

    public LoggingFrameSink(@Value("${meridian.render.log-every-frames:10}") final long logEveryFrames) {
        this.logEveryFrames = Math.max(1, logEveryFrames);
    }

    @Override
    public void publish(final FrameSnapshot snapshot) {
        if (snapshot.frameNumber() % logEveryFrames != 0) {
            return;
        }
        snapshot.primaryTarget().ifPresentOrElse(primary -> {
            final var geodetic = primary.geodetic();
            log.info("[{}] {} Position — lat={} deg, lon={} deg, alt={} km, fleet={}",
                    primary.name(),
                    snapshot.instant(),
                    String.format("%.2f", geodetic.latitude()),
                    String.format("%.2f", geodetic.longitude()),
                    String.format("%.2f", geodetic.altitude() / 1000.0),
                    snapshot.fleet().size());
        }, () -> log.info("LOS — No primary target at {}, fleet={}", snapshot.instant(), snapshot.fleet().size()));
    }
}
