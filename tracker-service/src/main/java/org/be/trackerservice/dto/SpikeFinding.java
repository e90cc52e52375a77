package org.be.trackerservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpikeFinding {

    /**
     * 급증이 관측된 버킷의 시작 시각 (UTC)
     */
    private LocalDateTime bucketStart;

    private long count;

    private double baselineMean;

    /**
     * 표본 표준편차
     */
    private double baselineStdDev;

    private double threshold;

    /**
     * (count - mean) / mean * 100, mean 이 0 이면 0
     */
    private double percentageDeviation;
}
