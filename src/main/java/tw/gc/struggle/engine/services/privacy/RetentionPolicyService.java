package tw.gc.struggle.engine.services.privacy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import tw.gc.struggle.engine.config.EngineProperties;
import tw.gc.struggle.engine.entities.TenantRetentionPolicy;
import tw.gc.struggle.engine.repositories.TenantRetentionPolicyRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-tenant retention horizon, falling back to the configured default.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetentionPolicyService {

    private final TenantRetentionPolicyRepository policyRepository;
    private final EngineProperties properties;
    private final Clock clock;
    private final Map<String, Integer> retentionDaysByTenant = new ConcurrentHashMap<>();

    public int retentionDays(String tenantId) {
        Integer cached = retentionDaysByTenant.get(tenantId);
        if (cached != null) {
            return cached;
        }
        int defaultDays = properties.getRetention().getDefaultRetentionDays();
        try {
            int days = policyRepository.findByTenantId(tenantId)
                    .map(TenantRetentionPolicy::getRetentionDays)
                    .filter(value -> value > 0)
                    .orElse(defaultDays);
            retentionDaysByTenant.put(tenantId, days);
            return days;
        } catch (DataAccessException e) {
            log.warn("⚠️ Retention policy lookup failed for tenant {}, using default: {}", tenantId, e.getMessage());
            return defaultDays;
        }
    }

    public LocalDateTime purgeAt(String tenantId, LocalDateTime createdAt) {
        return createdAt.plusDays(retentionDays(tenantId));
    }

    public LocalDateTime cutoff(String tenantId) {
        return LocalDateTime.now(clock).minusDays(retentionDays(tenantId));
    }

    public TenantRetentionPolicy updatePolicy(String tenantId, int retentionDays) {
        if (retentionDays <= 0) {
            throw new IllegalArgumentException("retentionDays must be positive");
        }
        TenantRetentionPolicy policy = policyRepository.findByTenantId(tenantId)
                .orElseGet(() -> TenantRetentionPolicy.builder().tenantId(tenantId).build());
        policy.setRetentionDays(retentionDays);
        policy.setUpdatedAt(LocalDateTime.now(clock));
        TenantRetentionPolicy saved = policyRepository.save(policy);
        retentionDaysByTenant.put(tenantId, retentionDays);
        log.info("📝 Retention for tenant {} set to {} days", tenantId, retentionDays);
        return saved;
    }

    public void refresh() {
        retentionDaysByTenant.clear();
    }
}
