package tw.gc.struggle.engine.services.alerts;

import tw.gc.struggle.engine.enums.AlertSeverity;
import tw.gc.struggle.engine.enums.AlertType;

import java.util.List;
import java.util.Map;

/**
 * An alert the aggregator wants to upsert, before ranking and the per-course limit.
 */
record AlertCandidate(String studentId, AlertType type, AlertSeverity severity, double riskScore,
                      Map<String, Object> evidenceCounts, List<String> specificConcerns,
                      List<String> recommendedActions) {
}
