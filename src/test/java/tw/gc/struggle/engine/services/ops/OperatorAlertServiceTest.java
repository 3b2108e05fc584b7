package tw.gc.struggle.engine.services.ops;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import tw.gc.struggle.engine.config.TelegramProperties;
import tw.gc.struggle.engine.testutil.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OperatorAlertServiceTest {

    @Mock
    private RestTemplate restTemplate;

    private TelegramProperties telegramProperties;
    private MutableClock clock;
    private OperatorAlertService service;

    @BeforeEach
    void setUp() {
        telegramProperties = new TelegramProperties();
        telegramProperties.setEnabled(true);
        telegramProperties.setBotToken("token");
        telegramProperties.setChatId("ops-chat");
        clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        service = new OperatorAlertService(restTemplate, telegramProperties, clock);
    }

    @Test
    @DisplayName("Escalations with the same key are throttled")
    @SuppressWarnings("unchecked")
    void throttlesPerKey() {
        assertThat(service.escalate("consent-store", "Consent store unreachable")).isTrue();
        assertThat(service.escalate("consent-store", "Consent store unreachable")).isFalse();
        assertThat(service.escalate("purge-7", "Purge failed")).isTrue();

        ArgumentCaptor<HttpEntity<Map<String, Object>>> request = ArgumentCaptor.forClass(HttpEntity.class);
        verify(restTemplate, times(2)).postForObject(eq("https://api.telegram.org/bottoken/sendMessage"),
                request.capture(), eq(String.class));
        assertThat(request.getAllValues().get(0).getBody())
                .containsEntry("chat_id", "ops-chat")
                .containsEntry("text", "🚨 Consent store unreachable");

        clock.advance(Duration.ofSeconds(301));
        assertThat(service.escalate("consent-store", "Consent store unreachable")).isTrue();
    }

    @Test
    @DisplayName("Disabled channel only logs")
    void disabled() {
        telegramProperties.setEnabled(false);

        assertThat(service.escalate("audit-store", "Audit writes failing")).isTrue();

        verifyNoInteractions(restTemplate);
    }

    @Test
    @DisplayName("Delivery failure is logged, never thrown")
    void deliveryFailure() {
        when(restTemplate.postForObject(any(String.class), any(), eq(String.class)))
                .thenThrow(new ResourceAccessException("timeout"));

        assertThatCode(() -> service.sendMessage("Purge escalated")).doesNotThrowAnyException();
    }
}
