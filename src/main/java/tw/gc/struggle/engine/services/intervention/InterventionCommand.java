package tw.gc.struggle.engine.services.intervention;

import tw.gc.struggle.engine.enums.InterventionType;
import tw.gc.struggle.engine.enums.Urgency;

/**
 * Message handed to the chat-delivery collaborator. Carries intent, never prose.
 */
public record InterventionCommand(String interventionId, String sessionId, InterventionType type,
                                  Urgency urgency, String suggestedMessageIntent) {
}
