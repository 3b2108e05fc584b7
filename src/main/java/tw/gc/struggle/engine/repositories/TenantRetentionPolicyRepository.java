package tw.gc.struggle.engine.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.struggle.engine.entities.TenantRetentionPolicy;

import java.util.Optional;

@Repository
public interface TenantRetentionPolicyRepository extends JpaRepository<TenantRetentionPolicy, Long> {

    Optional<TenantRetentionPolicy> findByTenantId(String tenantId);
}
