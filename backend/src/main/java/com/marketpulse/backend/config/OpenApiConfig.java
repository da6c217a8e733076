package com.marketpulse.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI marketPulseOpenApi(PulseProperties properties) {
        return new OpenAPI()
                .info(new Info()
                        .title("Market Pulse API")
                        .description("Sentiment, activity and technical signal for " + properties.getAsset())
                        .version("1.0"));
    }
}
