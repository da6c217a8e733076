package com.marketpulse.backend.service.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.marketpulse.backend.config.PulseProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Minimal client for an Ollama-compatible {@code /api/generate} endpoint, non-streaming.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LlmClient {

    private final PulseProperties properties;
    @Qualifier("llmRestTemplate")
    private final RestTemplate llmRestTemplate;

    /**
     * Returns the model's raw completion text. HTTP and I/O failures propagate as
     * {@link org.springframework.web.client.RestClientException}.
     */
    public String generate(String prompt, boolean jsonMode) {
        PulseProperties.Classifier config = properties.getClassifier();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", config.getModel());
        body.put("prompt", prompt);
        body.put("stream", false);
        body.put("options", Map.of("temperature", 0));
        if (jsonMode) {
            body.put("format", "json");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        JsonNode response = llmRestTemplate.postForObject(config.getBaseUrl() + "/api/generate",
                new HttpEntity<>(body, headers), JsonNode.class);
        if (response == null) {
            return "";
        }
        return response.path("response").asText("");
    }
}
