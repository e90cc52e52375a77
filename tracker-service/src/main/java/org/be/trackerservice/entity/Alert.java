package org.be.trackerservice.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.be.trackerservice.enums.AlertSeverity;
import org.be.trackerservice.enums.AlertType;

import java.time.LocalDateTime;

/**
 * 이상 징후 알림.
 * 활성 알림은 {@code activeKey} 에 유형 코드를 가지며, 유니크 제약으로 유형당 하나만 존재한다.
 */
@Entity
@Table(name = "alerts",
        indexes = {
                @Index(name = "idx_alerts_type_active", columnList = "alert_type, is_active"),
                @Index(name = "idx_alerts_created_at", columnList = "created_at")
        },
        uniqueConstraints = @UniqueConstraint(name = "uk_alerts_active_key", columnNames = "active_key"))
@Data
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Alert {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_type", nullable = false, length = 50)
    private AlertType alertType;

    @Column(nullable = false)
    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AlertSeverity severity;

    /**
     * active, resolvedAt, activeKey 는 {@link #open} 과 {@link #resolve} 로만 바뀐다
     */
    @Setter(AccessLevel.NONE)
    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private boolean active = true;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Setter(AccessLevel.NONE)
    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @JsonIgnore
    @Setter(AccessLevel.NONE)
    @Column(name = "active_key", length = 50)
    private String activeKey;

    public static Alert open(AlertType type, AlertSeverity severity, String title,
                             String description, LocalDateTime createdAt) {
        return Alert.builder()
                .alertType(type)
                .severity(severity)
                .title(title)
                .description(description)
                .active(true)
                .createdAt(createdAt)
                .activeKey(activeKeyFor(type))
                .build();
    }

    /**
     * 해결 처리. 이미 해결된 알림이면 아무것도 바꾸지 않는다.
     *
     * @return 상태가 바뀌었으면 true
     */
    public boolean resolve(LocalDateTime resolvedAt) {
        if (!active) {
            return false;
        }
        this.active = false;
        this.resolvedAt = resolvedAt;
        this.activeKey = null;
        return true;
    }

    public static String activeKeyFor(AlertType type) {
        return type.getCode();
    }
}
