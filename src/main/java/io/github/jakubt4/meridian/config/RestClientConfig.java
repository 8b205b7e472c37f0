package io.github.jakubt4.meridian.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Duration;

/**
 * Timeouts for outbound calls to the render layer. A frame waits at most this long per attempt.
 */
@Configuration
public class RestClientConfig {

    @Bean
    RestClientCustomizer restClientCustomizer(
            @Value("${meridian.render.connect-timeout:PT2S}") final Duration connectTimeout,
            @Value("${meridian.render.read-timeout:PT2S}") final Duration readTimeout) {
        return builder -> {
            final var requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(connectTimeout);
            requestFactory.setReadTimeout(readTimeout);
            builder.requestFactory(requestFactory);
        };
    }
}
