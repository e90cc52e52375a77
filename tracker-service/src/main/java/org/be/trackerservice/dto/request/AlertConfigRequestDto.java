package org.be.trackerservice.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertConfigRequestDto {

    @NotBlank(message = "이름은 필수입니다")
    private String name;

    /**
     * 알림 유형 코드 (spike, sentiment_shift, trend)
     */
    @NotBlank(message = "알림 유형은 필수입니다")
    private String alertType;

    /**
     * spike: 시그마 배수, sentiment_shift: 퍼센트
     */
    @NotNull(message = "임계값은 필수입니다")
    @PositiveOrZero(message = "임계값은 0 이상이어야 합니다")
    private Double threshold;

    @NotNull(message = "윈도우 시간은 필수입니다")
    @Positive(message = "윈도우 시간은 1 이상이어야 합니다")
    private Integer windowHours;

    @Builder.Default
    private Boolean enabled = true;
}
