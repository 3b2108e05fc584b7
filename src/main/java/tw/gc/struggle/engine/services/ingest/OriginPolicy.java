package tw.gc.struggle.engine.services.ingest;

import org.springframework.stereotype.Component;
import tw.gc.struggle.engine.config.EngineProperties;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Allow-list of LMS hosts that may post signals: exact origins plus host patterns.
 */
@Component
public class OriginPolicy {

    private final List<String> exactOrigins;
    private final List<Pattern> originPatterns;

    public OriginPolicy(EngineProperties properties) {
        this.exactOrigins = properties.getIngest().getAllowedOrigins().stream()
                .map(origin -> origin.toLowerCase(Locale.ROOT))
                .toList();
        this.originPatterns = properties.getIngest().getAllowedOriginPatterns().stream()
                .map(pattern -> Pattern.compile(pattern, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    public boolean isAllowed(String origin) {
        if (origin == null || origin.isBlank()) {
            return false;
        }
        String normalized = origin.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (exactOrigins.contains(normalized)) {
            return true;
        }
        for (Pattern pattern : originPatterns) {
            if (pattern.matcher(normalized).matches()) {
                return true;
            }
        }
        return false;
    }
}
