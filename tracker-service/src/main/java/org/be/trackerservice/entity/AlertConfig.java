package org.be.trackerservice.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.be.trackerservice.entity.base.TimestampEntity;
import org.be.trackerservice.enums.AlertType;

/**
 * 탐지 파라미터. threshold 는 spike 에서는 시그마 배수, sentiment_shift 에서는 퍼센트
 */
@Entity
@Table(name = "alert_configs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertConfig extends TimestampEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_type", nullable = false, length = 50)
    private AlertType alertType;

    @Column(nullable = false)
    private Double threshold;

    @Column(name = "window_hours", nullable = false)
    private Integer windowHours;

    @Column(name = "is_enabled", nullable = false)
    @Builder.Default
    private boolean enabled = true;
}
