package tw.gc.struggle.engine.services.intervention;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import tw.gc.struggle.engine.config.EngineProperties;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands intervention commands to the chat UI collaborator. Delivery is asynchronous; the
 * collaborator acknowledges through the delivered callback.
 */
@Component
@Slf4j
public class ChatDeliveryClient {

    private final RestTemplate restTemplate;
    private final EngineProperties properties;
    private final ExecutorService persistenceExecutor;

    public ChatDeliveryClient(RestTemplate restTemplate, EngineProperties properties,
                              @Qualifier("persistenceExecutor") ExecutorService persistenceExecutor) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.persistenceExecutor = persistenceExecutor;
    }

    public void dispatch(InterventionCommand command) {
        try {
            persistenceExecutor.execute(() -> send(command));
        } catch (RejectedExecutionException e) {
            log.warn("⚠️ Delivery of intervention {} not scheduled: {}", command.interventionId(), e.getMessage());
        }
    }

    void send(InterventionCommand command) {
        EngineProperties.Intervention config = properties.getIntervention();
        if (!config.isDeliveryEnabled()) {
            log.info("[Chat delivery disabled] {} {} intent={} ({})",
                    command.urgency(), command.type().getCode(), command.suggestedMessageIntent(), command.interventionId());
            return;
        }

        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            Map<String, Object> body = new HashMap<>();
            body.put("interventionId", command.interventionId());
            body.put("sessionId", command.sessionId());
            body.put("type", command.type().getCode());
            body.put("urgency", command.urgency().getCode());
            body.put("suggestedMessageIntent", command.suggestedMessageIntent());

            restTemplate.postForObject(config.getChatUrl(), new HttpEntity<>(body, headers), String.class);
            log.debug("Intervention {} handed to chat delivery", command.interventionId());
        } catch (RestClientException e) {
            log.warn("⚠️ Chat delivery failed for intervention {}: {}", command.interventionId(), e.getMessage());
        }
    }
}
