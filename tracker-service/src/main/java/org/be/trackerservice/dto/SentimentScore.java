package org.be.trackerservice.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.be.trackerservice.enums.SentimentLabel;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SentimentScore {

    public static final SentimentScore NEUTRAL_FALLBACK = new SentimentScore(SentimentLabel.NEUTRAL, 0.5);

    private SentimentLabel label;
    private double confidence;
}
