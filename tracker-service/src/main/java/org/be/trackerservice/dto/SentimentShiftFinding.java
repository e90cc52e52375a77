package org.be.trackerservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.be.trackerservice.enums.SentimentLabel;
import org.be.trackerservice.enums.ShiftClassification;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SentimentShiftFinding {

    private int windowHours;

    private Map<SentimentLabel, Long> distribution;

    private Map<SentimentLabel, Double> percentages;

    private long total;

    private ShiftClassification shift;

    public double negativePercentage() {
        if (percentages == null) {
            return 0.0;
        }
        return percentages.getOrDefault(SentimentLabel.NEGATIVE, 0.0);
    }
}
