package org.be.trackerservice.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 감성/토픽 수동 보정. null 인 필드는 변경하지 않는다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MentionUpdateDto {

    private String sentiment;

    /**
     * 보정된 감성의 신뢰도, 생략 시 1.0
     */
    @DecimalMin(value = "0.0", message = "신뢰도는 0 이상이어야 합니다")
    @DecimalMax(value = "1.0", message = "신뢰도는 1 이하여야 합니다")
    private Double sentimentScore;

    @Size(max = 100, message = "토픽은 100자 이하여야 합니다")
    private String topic;
}
