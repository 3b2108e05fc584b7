package tw.gc.struggle.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Operator escalation channel. Systemic failures (consent store down, purge escalation)
 * are pushed to this chat.
 */
@Data
@Component
@ConfigurationProperties(prefix = "telegram")
public class TelegramProperties {
    private String botToken;
    private String chatId;
    private boolean enabled = false;
    private String apiBaseUrl = "https://api.telegram.org";
    private long throttleSeconds = 300;
}
