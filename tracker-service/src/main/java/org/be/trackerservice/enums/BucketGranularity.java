package org.be.trackerservice.enums;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;

/**
 * 시계열 버킷 단위 (시간/일)
 */
public enum BucketGranularity {
    HOUR(ChronoUnit.HOURS),
    DAY(ChronoUnit.DAYS);

    private final ChronoUnit unit;

    BucketGranularity(ChronoUnit unit) {
        this.unit = unit;
    }

    public LocalDateTime truncate(LocalDateTime timestamp) {
        return timestamp.truncatedTo(unit);
    }

    public static BucketGranularity fromCode(String code) {
        return Arrays.stream(values())
                .filter(granularity -> granularity.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unsupported granularity: " + code + " (supported: hour, day)"));
    }
}
