package com.marketpulse.backend.service.notify;

import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.model.Signal;
import com.marketpulse.backend.model.SignalAction;
import com.marketpulse.backend.service.signal.SignalTick;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestTemplate;

import java.util.Locale;
import java.util.Map;

/**
 * Sends action transitions to a Telegram chat through the Bot API {@code sendMessage} call.
 */
@Slf4j
@RequiredArgsConstructor
public class TelegramNotificationSink implements NotificationSink {

    private final PulseProperties properties;
    private final RestTemplate restTemplate;

    @Override
    public void notifyActionChange(SignalAction previous, SignalAction current, SignalTick tick) {
        PulseProperties.Notify config = properties.getNotify();
        String url = config.getBaseUrl() + "/bot" + config.getBotToken() + "/sendMessage";
        Map<String, Object> body = Map.of(
                "chat_id", config.getChatId(),
                "text", format(previous, current, tick.signal()),
                "disable_web_page_preview", true);
        restTemplate.postForObject(url, body, String.class);
        log.info("Telegram notification sent {} -> {}", previous, current);
    }

    static String format(SignalAction previous, SignalAction current, Signal signal) {
        StringBuilder text = new StringBuilder()
                .append(signal.getAsset()).append(": ")
                .append(previous.wireName()).append(" -> ").append(current.wireName().toUpperCase(Locale.ROOT))
                .append('\n')
                .append(String.format(Locale.ROOT, "alpha %.2f | ema15 %.2f | mentions %d (z %.2f)",
                        signal.getAlpha(), signal.getEma15(), signal.getMentions(), signal.getMentionsZ()));
        if (signal.getPriceClose() != null) {
            text.append('\n').append(String.format(Locale.ROOT, "close %.2f", signal.getPriceClose()));
            if (signal.getRsi14() != null) {
                text.append(String.format(Locale.ROOT, " | rsi %.1f", signal.getRsi14()));
            }
        }
        return text.toString();
    }
}
