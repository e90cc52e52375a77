package org.be.trackerservice.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertFilterDto {

    /**
     * 활성 여부 필터, null 이면 전체
     */
    private Boolean active;

    /**
     * 알림 유형 코드 (spike, sentiment_shift, trend)
     */
    private String type;

    /**
     * 최대 건수 (기본값: 50)
     */
    @Builder.Default
    private Integer limit = 50;
}
