package io.github.jakubt4.meridian.client;

import io.github.jakubt4.meridian.dto.FrameSnapshotDto;
import io.github.jakubt4.meridian.simulation.FrameSink;
import io.github.jakubt4.meridian.simulation.FrameSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Pushes every frame to the render layer. A frame that still fails after retries is dropped.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "meridian.render.enabled", havingValue = "true")
public class RenderLayerClient implements FrameSink {

    private static final String FRAMES_PATH = "/api/frames";

    private final RestClient restClient;

    public RenderLayerClient(final RestClient.Builder restClientBuilder,
                             @Value("${meridian.render.base-url}") final String baseUrl) {
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .build();
    }

    @Override
    @Retryable(retryFor = RestClientException.class, maxAttempts = 2,
               backoff = @Backoff(delay = 20, maxDelay = 50))
    public void publish(final FrameSnapshot snapshot) {
        restClient.post()
                .uri(FRAMES_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .body(FrameSnapshotDto.from(snapshot))
                .retrieve()
                .toBodilessEntity();
    }

    @Recover
    public void recoverPublish(final RestClientException e, final FrameSnapshot snapshot) {
        log.warn("Frame {} dropped, render layer unreachable after retries: {}",
                snapshot.frameNumber(), e.getMessage());
    }
}
