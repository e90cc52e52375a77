package org.be.trackerservice.repository;

import org.be.trackerservice.entity.AlertConfig;
import org.be.trackerservice.enums.AlertType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AlertConfigRepository extends JpaRepository<AlertConfig, Long> {

    List<AlertConfig> findByAlertTypeAndEnabledTrueOrderByIdAsc(AlertType alertType);

    List<AlertConfig> findAllByOrderByIdAsc();
}
