package com.marketpulse.backend.service.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.exception.OracleUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Scoring oracle over HTTP: {@code POST {base}/score} with {@code {text, domain}}, answering
 * {@code {score, label}}. Calls pass through a circuit breaker so a dead oracle is not hammered.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HttpScoringOracle implements ScoringOracle {

    private final PulseProperties properties;
    @Qualifier("oracleRestTemplate")
    private final RestTemplate oracleRestTemplate;
    private final CircuitBreaker oracleCircuitBreaker;

    @Override
    public SentimentScore score(String text, DomainHint hint) {
        try {
            return oracleCircuitBreaker.executeSupplier(() -> call(text, hint));
        } catch (CallNotPermittedException ex) {
            throw new OracleUnavailableException("Scoring oracle circuit open", ex);
        } catch (RestClientException ex) {
            throw new OracleUnavailableException("Scoring oracle call failed: " + ex.getMessage(), ex);
        }
    }

    private SentimentScore call(String text, DomainHint hint) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, Object> body = Map.of("text", text, "domain", hint.wireName());
        String url = properties.getOracle().getBaseUrl() + "/score";
        JsonNode response = oracleRestTemplate.postForObject(url, new HttpEntity<>(body, headers), JsonNode.class);
        if (response == null || !response.path("score").isNumber()) {
            throw new OracleUnavailableException("Scoring oracle returned no score");
        }
        String label = response.path("label").asText(hint == DomainHint.SOCIAL ? "tweet" : "news");
        return new SentimentScore(response.path("score").asDouble(), label);
    }
}
