package org.be.trackerservice.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum SentimentLabel {
    POSITIVE("positive"),
    NEGATIVE("negative"),
    NEUTRAL("neutral");

    private final String code;

    SentimentLabel(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static SentimentLabel fromCode(String code) {
        return Arrays.stream(values())
                .filter(label -> label.code.equalsIgnoreCase(code) || label.name().equalsIgnoreCase(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown sentiment label: " + code));
    }
}
