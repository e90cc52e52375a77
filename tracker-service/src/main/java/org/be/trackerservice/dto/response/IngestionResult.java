package org.be.trackerservice.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.be.trackerservice.dto.SourceFetchResult;
import org.be.trackerservice.enums.MentionSource;
import org.be.trackerservice.enums.SkipReason;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResult {

    private String query;

    /**
     * 저장된 멘션 수
     */
    private int count;

    private List<SourceSummary> sources;

    private int alertsRaised;

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SourceSummary {
        private MentionSource source;
        private int fetched;
        private SkipReason skipReason;
        private String detail;

        public static SourceSummary from(SourceFetchResult result) {
            return SourceSummary.builder()
                    .source(result.getSource())
                    .fetched(result.getCandidates().size())
                    .skipReason(result.getSkipReason())
                    .detail(result.getDetail())
                    .build();
        }
    }
}
