package com.marketpulse.backend.service.notify;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.marketpulse.backend.config.PulseProperties;
import com.marketpulse.backend.model.Signal;
import com.marketpulse.backend.model.SignalAction;
import com.marketpulse.backend.service.signal.SignalTick;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TelegramNotificationSinkTest {

    private static final WireMockServer wireMock = new WireMockServer(0);

    static {
        wireMock.start();
    }

    private TelegramNotificationSink sink;

    @AfterAll
    static void stop() {
        wireMock.stop();
    }

    @BeforeEach
    void setUp() {
        wireMock.resetAll();
        PulseProperties properties = new PulseProperties();
        properties.getNotify().setEnabled(true);
        properties.getNotify().setBaseUrl("http://localhost:" + wireMock.port());
        properties.getNotify().setBotToken("123:abc");
        properties.getNotify().setChatId("-10042");
        sink = new TelegramNotificationSink(properties, new RestTemplate());
    }

    @Test
    void postsTransitionToTheChat() {
        wireMock.stubFor(post(urlEqualTo("/bot123:abc/sendMessage")).willReturn(okJson("{\"ok\":true}")));

        sink.notifyActionChange(SignalAction.HOLD, SignalAction.ACCUMULATE, tick(signal(3012.5, 61.23)));

        wireMock.verify(postRequestedFor(urlEqualTo("/bot123:abc/sendMessage"))
                .withRequestBody(equalToJson("{\"chat_id\":\"-10042\",\"disable_web_page_preview\":true,"
                        + "\"text\":\"ETH-USD: hold -> ACCUMULATE\\nalpha 0.41 | ema15 0.35 | mentions 11 (z 2.10)"
                        + "\\nclose 3012.50 | rsi 61.2\"}")));
    }

    @Test
    void formatOmitsMissingPrice() {
        String text = TelegramNotificationSink.format(SignalAction.ACCUMULATE, SignalAction.WAIT, signal(null, null));

        assertThat(text).isEqualTo("ETH-USD: accumulate -> WAIT\nalpha 0.41 | ema15 0.35 | mentions 11 (z 2.10)");
    }

    @Test
    void apiErrorsPropagate() {
        wireMock.stubFor(post(urlEqualTo("/bot123:abc/sendMessage")).willReturn(aResponse().withStatus(403)));

        assertThatThrownBy(() -> sink.notifyActionChange(SignalAction.HOLD, SignalAction.WAIT, tick(signal(null, null))))
                .isInstanceOf(HttpClientErrorException.class);
    }

    private static Signal signal(Double close, Double rsi) {
        return Signal.builder()
                .asset("ETH-USD")
                .ts(Instant.parse("2024-05-01T12:00:00Z"))
                .ema15(0.35)
                .mentions(11)
                .mentionsZ(2.1)
                .alpha(0.41)
                .action(SignalAction.ACCUMULATE)
                .priceClose(close)
                .rsi14(rsi)
                .build();
    }

    private static SignalTick tick(Signal signal) {
        return new SignalTick(signal, null, null, null);
    }
}
