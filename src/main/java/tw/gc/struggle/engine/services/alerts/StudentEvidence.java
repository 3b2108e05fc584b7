package tw.gc.struggle.engine.services.alerts;

import tw.gc.struggle.engine.entities.InterventionRecord;
import tw.gc.struggle.engine.entities.StruggleEvent;
import tw.gc.struggle.engine.enums.StruggleFactor;
import tw.gc.struggle.engine.enums.UserResponse;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One student's struggle and intervention evidence inside an aggregation window.
 */
class StudentEvidence {

    private final String studentId;
    private int eventCount;
    private double maxRisk;
    private double confidenceSum;
    private final Set<String> highRiskSessions = new HashSet<>();
    private double highRiskSum;
    private int highRiskEvents;
    private int overloadEvents;
    private int interventionsTriggered;
    private int interventionsDelivered;
    private int suppressedEvents;
    private int negativeResponses;
    private final Map<StruggleFactor, Integer> factorCounts = new EnumMap<>(StruggleFactor.class);

    StudentEvidence(String studentId) {
        this.studentId = studentId;
    }

    void addEvent(StruggleEvent event, double highRiskThreshold, double overloadLoad, double overloadFatigue) {
        eventCount++;
        maxRisk = Math.max(maxRisk, event.getRiskLevel());
        confidenceSum += event.getConfidence();
        if (event.getRiskLevel() >= highRiskThreshold) {
            highRiskSessions.add(event.getSessionId());
            highRiskSum += event.getRiskLevel();
            highRiskEvents++;
        }
        if (event.getCognitiveLoad() != null && event.getFatigue() != null
                && event.getCognitiveLoad() > overloadLoad && event.getFatigue() > overloadFatigue) {
            overloadEvents++;
        }
        if (event.getSuppressionReason() != null) {
            suppressedEvents++;
        }
        String factors = event.getContributingFactors();
        if (factors != null && !factors.isBlank()) {
            for (String code : factors.split(",")) {
                factorCounts.merge(StruggleFactor.fromCode(code.trim()), 1, Integer::sum);
            }
        }
    }

    void addIntervention(InterventionRecord record) {
        interventionsTriggered++;
        if (record.getDeliveredAt() != null) {
            interventionsDelivered++;
        }
        UserResponse response = record.getUserResponse();
        if (response == UserResponse.DISMISSED || response == UserResponse.IGNORED || response == UserResponse.TIMEOUT) {
            negativeResponses++;
        }
    }

    String studentId() {
        return studentId;
    }

    int eventCount() {
        return eventCount;
    }

    double maxRisk() {
        return maxRisk;
    }

    double averageConfidence() {
        return eventCount == 0 ? 0 : confidenceSum / eventCount;
    }

    int highRiskSessionCount() {
        return highRiskSessions.size();
    }

    double averageHighRisk() {
        return highRiskEvents == 0 ? 0 : highRiskSum / highRiskEvents;
    }

    int overloadEvents() {
        return overloadEvents;
    }

    int negativeResponses() {
        return negativeResponses;
    }

    Map<StruggleFactor, Integer> factorCounts() {
        return factorCounts;
    }

    /**
     * Factors ordered by how often they contributed, most frequent first.
     */
    List<StruggleFactor> topFactors() {
        return factorCounts.entrySet().stream()
                .sorted(Map.Entry.<StruggleFactor, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.comparingByKey()))
                .map(Map.Entry::getKey)
                .toList();
    }

    Map<String, Object> evidenceCounts() {
        Map<String, Object> counts = new LinkedHashMap<>();
        counts.put("struggleEvents", eventCount);
        counts.put("highRiskSessions", highRiskSessions.size());
        counts.put("overloadEvents", overloadEvents);
        counts.put("interventionsTriggered", interventionsTriggered);
        counts.put("interventionsDelivered", interventionsDelivered);
        counts.put("suppressedDecisions", suppressedEvents);
        counts.put("declinedInterventions", negativeResponses);
        return counts;
    }
}
