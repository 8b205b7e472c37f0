package io.github.jakubt4.meridian.client;

import io.github.jakubt4.meridian.TestFrames;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RenderLayerClientTest {

    private static final String BASE_URL = "http://localhost:8090";

    private RenderLayerClient client;
    private MockRestServiceServer mockServer;

    @BeforeEach
    void setUp() {
        final var restTemplate = new RestTemplate();
        mockServer = MockRestServiceServer.bindTo(restTemplate).build();

        final var builder = RestClient.builder()
                .requestFactory(restTemplate.getRequestFactory());

        client = new RenderLayerClient(builder, BASE_URL);
    }

    @Test
    void publishPostsFrameJsonToFramesEndpoint() {
        mockServer.expect(requestTo(BASE_URL + "/api/frames"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.frameNumber").value(7))
                .andExpect(jsonPath("$.displayFrame").value("INERTIAL"))
                .andExpect(jsonPath("$.primary.name").value("ISS"))
                .andExpect(jsonPath("$.primary.source").value("TELEMETRY"))
                .andExpect(jsonPath("$.primary.displayState.position.length()").value(3))
                .andExpect(jsonPath("$.fleet[0].name").value("ISS (ZARYA)"))
                .andExpect(jsonPath("$.fleet[0].color.red").value(255))
                .andRespond(withSuccess());

        client.publish(TestFrames.issFrame(7));

        mockServer.verify();
    }

    @Test
    void publishThrowsOnServerError() {
        mockServer.expect(requestTo(BASE_URL + "/api/frames"))
                .andRespond(withServerError());

        assertThatThrownBy(() -> client.publish(TestFrames.issFrame(1)))
                .isInstanceOf(HttpServerErrorException.class);
    }
}
