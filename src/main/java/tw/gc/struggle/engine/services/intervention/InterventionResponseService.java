package tw.gc.struggle.engine.services.intervention;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tw.gc.struggle.engine.config.EngineProperties;
import tw.gc.struggle.engine.entities.InterventionRecord;
import tw.gc.struggle.engine.enums.InterventionStatus;
import tw.gc.struggle.engine.enums.UserResponse;
import tw.gc.struggle.engine.exceptions.IllegalTransitionException;
import tw.gc.struggle.engine.exceptions.NotFoundException;
import tw.gc.struggle.engine.repositories.InterventionRecordRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Completion messages for interventions, keyed by intervention id: delivery acknowledgement,
 * learner response and the response timeout sweep.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class InterventionResponseService {

    private final InterventionRecordRepository interventionRepository;
    private final EngineProperties properties;
    private final Clock clock;

    @Transactional
    public InterventionRecord markDelivered(String interventionId) {
        InterventionRecord record = find(interventionId);
        if (record.getStatus() != InterventionStatus.TRIGGERED) {
            log.debug("Intervention {} already {}, delivery ack ignored", interventionId, record.getStatus());
            return record;
        }
        record.setStatus(InterventionStatus.DELIVERED);
        record.setDeliveredAt(LocalDateTime.now(clock));
        log.info("📬 Intervention {} delivered", interventionId);
        return interventionRepository.save(record);
    }

    @Transactional
    public InterventionRecord recordResponse(String interventionId, UserResponse response) {
        if (response == null) {
            throw new IllegalArgumentException("response is required");
        }
        InterventionRecord record = find(interventionId);
        switch (record.getStatus()) {
            case TRIGGERED -> throw new IllegalTransitionException(
                    "intervention " + interventionId + " has not been delivered");
            case RESPONDED -> {
                if (record.getUserResponse() == response) {
                    return record;
                }
                throw new IllegalTransitionException(
                        "intervention " + interventionId + " already answered with " + record.getUserResponse().getCode());
            }
            default -> {
            }
        }
        record.setStatus(InterventionStatus.RESPONDED);
        record.setUserResponse(response);
        record.setRespondedAt(LocalDateTime.now(clock));
        log.info("🗳️ Intervention {} response: {}", interventionId, response.getCode());
        return interventionRepository.save(record);
    }

    /**
     * Delivered interventions nobody answered become {@code timeout}.
     */
    @Scheduled(fixedDelayString = "${engine.intervention.timeout-sweep-ms:60000}")
    @Transactional
    public int sweepTimeouts() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime cutoff = now.minusMinutes(properties.getIntervention().getResponseTimeoutMinutes());
        List<InterventionRecord> expired = interventionRepository.findByStatusAndDeliveredAtBefore(
                InterventionStatus.DELIVERED, cutoff);
        for (InterventionRecord record : expired) {
            record.setStatus(InterventionStatus.RESPONDED);
            record.setUserResponse(UserResponse.TIMEOUT);
            record.setRespondedAt(now);
        }
        if (!expired.isEmpty()) {
            interventionRepository.saveAll(expired);
            log.info("⏱️ {} interventions timed out without response", expired.size());
        }
        return expired.size();
    }

    private InterventionRecord find(String interventionId) {
        return interventionRepository.findById(interventionId)
                .orElseThrow(() -> new NotFoundException("intervention not found: " + interventionId));
    }
}
