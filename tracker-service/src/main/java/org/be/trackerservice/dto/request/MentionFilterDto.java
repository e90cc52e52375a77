package org.be.trackerservice.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MentionFilterDto {

    /**
     * 소스 코드 (twitter, reddit, news, blog)
     */
    private String source;

    /**
     * 감성 코드 (positive, negative, neutral)
     */
    private String sentiment;

    private String topic;

    /**
     * 최근 N일 (기본값: 7)
     */
    @Builder.Default
    private Integer days = 7;
}
