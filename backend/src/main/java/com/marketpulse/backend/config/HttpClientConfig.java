package com.marketpulse.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * One RestTemplate per outbound collaborator so each carries its own read timeout.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate oracleRestTemplate(PulseProperties properties) {
        return build(properties.getHttp().getConnectTimeoutMs(), (int) properties.getOracle().getTimeoutMs());
    }

    @Bean
    public RestTemplate llmRestTemplate(PulseProperties properties) {
        return build(properties.getHttp().getConnectTimeoutMs(), (int) properties.getClassifier().getTimeoutMs());
    }

    @Bean
    public RestTemplate sourceRestTemplate(PulseProperties properties) {
        return build(properties.getHttp().getConnectTimeoutMs(), properties.getHttp().getReadTimeoutMs());
    }

    private RestTemplate build(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }
}
