package tw.gc.struggle.engine.services.privacy;

import org.springframework.stereotype.Component;
import tw.gc.struggle.engine.enums.CollectionLevel;

/**
 * Strips or truncates page content carried by a signal according to the learner's
 * collection level.
 */
@Component
public class DataMinimizer {

    static final int STANDARD_CONTEXT_LIMIT = 256;
    static final int COMPREHENSIVE_CONTEXT_LIMIT = 2000;

    public String elementContext(String elementContext, CollectionLevel level) {
        if (elementContext == null || level == null || level == CollectionLevel.MINIMAL) {
            return null;
        }
        int limit = level == CollectionLevel.STANDARD ? STANDARD_CONTEXT_LIMIT : COMPREHENSIVE_CONTEXT_LIMIT;
        return elementContext.length() <= limit ? elementContext : elementContext.substring(0, limit);
    }

    public String pageContentHash(String pageContentHash, CollectionLevel level) {
        if (level == null || level == CollectionLevel.MINIMAL) {
            return null;
        }
        return pageContentHash;
    }
}
