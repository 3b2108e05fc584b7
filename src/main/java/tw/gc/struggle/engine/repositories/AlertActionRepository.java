package tw.gc.struggle.engine.repositories;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import tw.gc.struggle.engine.entities.AlertAction;

import java.util.List;

@Repository
public interface AlertActionRepository extends JpaRepository<AlertAction, Long> {

    List<AlertAction> findByAlertIdOrderByActedAtAsc(Long alertId);
}
