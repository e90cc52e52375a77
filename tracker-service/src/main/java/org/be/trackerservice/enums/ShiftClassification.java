package org.be.trackerservice.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 감성 분포 분류 결과. NEGATIVE 만 알림 대상이다.
 */
public enum ShiftClassification {
    POSITIVE("positive"),
    NEGATIVE("negative"),
    NEUTRAL("neutral"),
    NONE("none");

    private final String code;

    ShiftClassification(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
