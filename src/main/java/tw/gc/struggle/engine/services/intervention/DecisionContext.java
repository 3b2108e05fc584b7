package tw.gc.struggle.engine.services.intervention;

import tw.gc.struggle.engine.services.session.SessionFeatures;

/**
 * Session facts the decision engine needs beyond the assessment itself.
 */
public record DecisionContext(String tenantId, String courseId, String sessionId, String userId,
                              SessionFeatures features) {
}
