package com.marketpulse.backend.service.oracle;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.exception.OracleUnavailableException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.exactly;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpScoringOracleTest {

    private static final WireMockServer wireMock = new WireMockServer(0);

    static {
        wireMock.start();
    }

    private PulseProperties properties;

    @AfterAll
    static void stop() {
        wireMock.stop();
    }

    @BeforeEach
    void setUp() {
        wireMock.resetAll();
        properties = new PulseProperties();
        properties.getOracle().setBaseUrl("http://localhost:" + wireMock.port());
    }

    @Test
    void postsTextWithDomainAndReadsScore() {
        wireMock.stubFor(post(urlEqualTo("/score"))
                .withRequestBody(equalToJson("{\"text\": \"ETH breaks out\", \"domain\": \"news\"}"))
                .willReturn(okJson("{\"score\": 0.64, \"label\": \"positive\"}")));

        SentimentScore score = oracle(CircuitBreaker.ofDefaults("oracle")).score("ETH breaks out", DomainHint.NEWS);

        assertThat(score.score()).isEqualTo(0.64);
        assertThat(score.label()).isEqualTo("positive");
    }

    @Test
    void serverErrorsBecomeOracleUnavailable() {
        wireMock.stubFor(post(urlEqualTo("/score")).willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> oracle(CircuitBreaker.ofDefaults("oracle")).score("x", DomainHint.SOCIAL))
                .isInstanceOf(OracleUnavailableException.class);
    }

    @Test
    void missingScoreIsAFailure() {
        wireMock.stubFor(post(urlEqualTo("/score")).willReturn(okJson("{\"label\": \"neutral\"}")));

        assertThatThrownBy(() -> oracle(CircuitBreaker.ofDefaults("oracle")).score("x", DomainHint.NEWS))
                .isInstanceOf(OracleUnavailableException.class)
                .hasMessageContaining("no score");
    }

    @Test
    void openCircuitStopsCallingTheOracle() {
        wireMock.stubFor(post(urlEqualTo("/score")).willReturn(aResponse().withStatus(500)));
        CircuitBreaker breaker = CircuitBreaker.of("oracle", CircuitBreakerConfig.custom()
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofMinutes(5))
                .build());
        HttpScoringOracle oracle = oracle(breaker);

        for (int i = 0; i < 4; i++) {
            assertThatThrownBy(() -> oracle.score("x", DomainHint.NEWS)).isInstanceOf(OracleUnavailableException.class);
        }

        assertThat(breaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        wireMock.verify(exactly(2), postRequestedFor(urlEqualTo("/score")));
    }

    private HttpScoringOracle oracle(CircuitBreaker breaker) {
        return new HttpScoringOracle(properties, new RestTemplate(), breaker);
    }
}
