package tw.gc.struggle.engine.services.ops;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import tw.gc.struggle.engine.config.TelegramProperties;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Escalates systemic failures to operators over Telegram.
 *
 * <p>Messages are throttled per alert key so that a store outage seen by thousands of
 * sessions produces one page, not thousands.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OperatorAlertService {

    private final RestTemplate restTemplate;
    private final TelegramProperties telegramProperties;
    private final Clock clock;

    private final Map<String, Instant> lastSentByKey = new ConcurrentHashMap<>();

    /**
     * Send an escalation unless one with the same key went out within the throttle window.
     *
     * @return true if the message was accepted for sending
     */
    public boolean escalate(String alertKey, String message) {
        Instant now = clock.instant();
        Instant cutoff = now.minusSeconds(telegramProperties.getThrottleSeconds());
        boolean[] accepted = {false};
        lastSentByKey.compute(alertKey, (key, last) -> {
            if (last != null && last.isAfter(cutoff)) {
                return last;
            }
            accepted[0] = true;
            return now;
        });
        if (!accepted[0]) {
            log.debug("Escalation throttled for key {}", alertKey);
            return false;
        }
        log.error("🚨 OPERATOR ALERT [{}]: {}", alertKey, message);
        sendMessage(message);
        return true;
    }

    public void sendMessage(String message) {
        if (message == null) {
            return;
        }
        if (!telegramProperties.isEnabled()) {
            log.info("[Telegram disabled] {}", message);
            return;
        }

        try {
            String url = String.format("%s/bot%s/sendMessage",
                    telegramProperties.getApiBaseUrl(), telegramProperties.getBotToken());

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            Map<String, Object> body = new HashMap<>();
            body.put("chat_id", telegramProperties.getChatId());
            body.put("text", "🚨 " + message);

            restTemplate.postForObject(url, new HttpEntity<>(body, headers), String.class);
            log.debug("Telegram escalation sent");
        } catch (Exception e) {
            log.warn("⚠️ Failed to send Telegram escalation: {}", e.getMessage());
        }
    }
}
