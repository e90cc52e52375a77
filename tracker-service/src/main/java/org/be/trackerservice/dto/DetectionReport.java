package org.be.trackerservice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 한 번의 탐지 사이클 결과
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DetectionReport {

    private List<SpikeFinding> spikes = new ArrayList<>();

    /**
     * 감성 분포 검사가 건너뛰어졌으면 null
     */
    private SentimentShiftFinding sentimentShift;

    public static DetectionReport empty() {
        return new DetectionReport(new ArrayList<>(), null);
    }

    public boolean isEmpty() {
        return spikes.isEmpty() && sentimentShift == null;
    }
}
