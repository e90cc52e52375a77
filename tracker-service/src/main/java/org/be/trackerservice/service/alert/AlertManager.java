package org.be.trackerservice.service.alert;

import jakarta.persistence.criteria.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.be.trackerservice.dto.DetectionReport;
import org.be.trackerservice.dto.SentimentShiftFinding;
import org.be.trackerservice.dto.SpikeFinding;
import org.be.trackerservice.dto.request.AlertFilterDto;
import org.be.trackerservice.entity.Alert;
import org.be.trackerservice.enums.AlertSeverity;
import org.be.trackerservice.enums.AlertType;
import org.be.trackerservice.enums.ShiftClassification;
import org.be.trackerservice.exception.AlertNotFoundException;
import org.be.trackerservice.metrics.TrackerMetrics;
import org.be.trackerservice.repository.AlertRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 탐지 결과를 알림으로 만들고 알림 수명주기를 관리한다.
 * 유형별로 활성 알림은 하나만 유지한다 (active_key 유니크 제약).
 */
@Slf4j
@Service
public class AlertManager {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 500;

    private final AlertRepository alertRepository;
    private final TrackerMetrics trackerMetrics;
    private final Optional<AlertEventPublisher> alertEventPublisher;
    private final Clock clock;

    public AlertManager(AlertRepository alertRepository,
                        TrackerMetrics trackerMetrics,
                        Optional<AlertEventPublisher> alertEventPublisher,
                        Clock clock) {
        this.alertRepository = alertRepository;
        this.trackerMetrics = trackerMetrics;
        this.alertEventPublisher = alertEventPublisher;
        this.clock = clock;
    }

    /**
     * 탐지 결과를 처리해 새로 생성된 알림을 반환한다.
     * 저장은 알림마다 개별 트랜잭션으로 수행한다.
     */
    public List<Alert> handleFindings(DetectionReport report) {
        List<Alert> created = new ArrayList<>();
        if (report == null || report.isEmpty()) {
            return created;
        }

        // 편차가 큰 급증부터
        List<SpikeFinding> spikes = new ArrayList<>(report.getSpikes());
        spikes.sort(Comparator.comparingDouble(SpikeFinding::getPercentageDeviation).reversed()
                .thenComparing(SpikeFinding::getCount, Comparator.reverseOrder()));
        for (SpikeFinding spike : spikes) {
            raise(AlertType.SPIKE, spikeSeverity(spike), "Mention Spike Detected", describe(spike))
                    .ifPresent(created::add);
        }

        SentimentShiftFinding shift = report.getSentimentShift();
        if (shift != null && shift.getShift() == ShiftClassification.NEGATIVE) {
            raise(AlertType.SENTIMENT_SHIFT, shiftSeverity(shift.negativePercentage()),
                    "Negative Sentiment Shift Detected", describe(shift))
                    .ifPresent(created::add);
        }

        if (!created.isEmpty()) {
            log.info("Raised {} alerts from detection report", created.size());
        }
        return created;
    }

    @Transactional
    public Alert resolve(Long id) {
        Alert alert = alertRepository.findById(id)
                .orElseThrow(() -> new AlertNotFoundException(id));

        if (alert.resolve(LocalDateTime.now(clock))) {
            alert = alertRepository.save(alert);
            log.info("Resolved alert {} ({})", id, alert.getAlertType().getCode());
        } else {
            log.debug("Alert {} already resolved", id);
        }
        return alert;
    }

    /**
     * 최신순 알림 목록 (createdAt desc, id desc)
     */
    @Transactional(readOnly = true)
    public List<Alert> list(AlertFilterDto filter) {
        int limit = filter.getLimit() != null ? filter.getLimit() : DEFAULT_LIMIT;
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        AlertType type = StringUtils.hasText(filter.getType()) ? AlertType.fromCode(filter.getType().trim()) : null;
        Boolean active = filter.getActive();

        Specification<Alert> spec = (root, query, criteriaBuilder) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (active != null) {
                predicates.add(criteriaBuilder.equal(root.get("active"), active));
            }
            if (type != null) {
                predicates.add(criteriaBuilder.equal(root.get("alertType"), type));
            }
            return criteriaBuilder.and(predicates.toArray(new Predicate[0]));
        };

        Sort sort = Sort.by(Sort.Direction.DESC, "createdAt").and(Sort.by(Sort.Direction.DESC, "id"));
        return alertRepository.findAll(spec, PageRequest.of(0, Math.min(limit, MAX_LIMIT), sort)).getContent();
    }

    @Transactional(readOnly = true)
    public Alert get(Long id) {
        return alertRepository.findById(id)
                .orElseThrow(() -> new AlertNotFoundException(id));
    }

    @Transactional
    public void delete(Long id) {
        Alert alert = get(id);
        alertRepository.delete(alert);
        log.info("Deleted alert {}", id);
    }

    private Optional<Alert> raise(AlertType type, AlertSeverity severity, String title, String description) {
        if (alertRepository.existsByAlertTypeAndActiveTrue(type)) {
            log.debug("Active {} alert exists, suppressing: {}", type.getCode(), description);
            trackerMetrics.incrementAlertDeduplicated(type);
            return Optional.empty();
        }

        Alert saved;
        try {
            saved = alertRepository.saveAndFlush(
                    Alert.open(type, severity, title, description, LocalDateTime.now(clock)));
        } catch (DataIntegrityViolationException e) {
            // 동시에 실행된 다른 사이클이 먼저 생성함
            log.info("Concurrent {} alert already active, suppressing: {}", type.getCode(), e.getMessage());
            trackerMetrics.incrementAlertDeduplicated(type);
            return Optional.empty();
        }

        log.info("Created {} alert {} ({}): {}", type.getCode(), saved.getId(), severity.getCode(), description);
        trackerMetrics.incrementAlertCreated(type);
        alertEventPublisher.ifPresent(publisher -> publisher.publish(saved));
        return Optional.of(saved);
    }

    static AlertSeverity spikeSeverity(SpikeFinding spike) {
        return spike.getPercentageDeviation() > 100 ? AlertSeverity.HIGH : AlertSeverity.MEDIUM;
    }

    static AlertSeverity shiftSeverity(double negativePercentage) {
        if (negativePercentage < 70) {
            return AlertSeverity.MEDIUM;
        }
        if (negativePercentage < 85) {
            return AlertSeverity.HIGH;
        }
        return AlertSeverity.CRITICAL;
    }

    private static String describe(SpikeFinding spike) {
        return String.format("Detected %.1f%% spike in mentions: %d mentions in bucket starting %s (baseline %.1f, threshold %.1f)",
                spike.getPercentageDeviation(), spike.getCount(), spike.getBucketStart(),
                spike.getBaselineMean(), spike.getThreshold());
    }

    private static String describe(SentimentShiftFinding shift) {
        return String.format("Negative sentiment at %.1f%% of %d mentions over the last %d hours",
                shift.negativePercentage(), shift.getTotal(), shift.getWindowHours());
    }
}
