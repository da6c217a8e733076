package com.marketpulse.backend.config;

import com.marketpulse.backend.service.notify.LoggingNotificationSink;
import com.marketpulse.backend.service.notify.NotificationSink;
import com.marketpulse.backend.service.notify.TelegramNotificationSink;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class NotificationConfig {

    @Bean
    public NotificationSink notificationSink(PulseProperties properties,
                                             @Qualifier("sourceRestTemplate") RestTemplate sourceRestTemplate) {
        if (properties.getNotify().isEnabled()) {
            return new TelegramNotificationSink(properties, sourceRestTemplate);
        }
        return new LoggingNotificationSink();
    }
}
