package org.be.trackerservice.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertSeverity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String code;

    AlertSeverity(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
