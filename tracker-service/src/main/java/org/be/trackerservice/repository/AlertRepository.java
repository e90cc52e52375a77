package org.be.trackerservice.repository;

import org.be.trackerservice.entity.Alert;
import org.be.trackerservice.enums.AlertType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

@Repository
public interface AlertRepository extends JpaRepository<Alert, Long>, JpaSpecificationExecutor<Alert> {

    /**
     * 같은 유형의 활성 알림 존재 여부 (중복 억제)
     */
    boolean existsByAlertTypeAndActiveTrue(AlertType alertType);

    long countByActiveTrue();
}
