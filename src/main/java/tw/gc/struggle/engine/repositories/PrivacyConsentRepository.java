package tw.gc.struggle.engine.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import tw.gc.struggle.engine.entities.PrivacyConsent;

import java.util.Optional;

@Repository
public interface PrivacyConsentRepository extends JpaRepository<PrivacyConsent, Long> {

    Optional<PrivacyConsent> findByTenantIdAndUserId(String tenantId, String userId);

    @Modifying
    @Query("DELETE FROM PrivacyConsent c WHERE c.tenantId = :tenantId AND c.userId = :userId")
    int deleteByTenantAndUser(@Param("tenantId") String tenantId, @Param("userId") String userId);
}
