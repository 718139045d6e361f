package com.kazi.lifecycle.common.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 지원서 상태. label이 저장/전송 형태다. ("Saved", "Applied", ...)
 */
public enum ApplicationStatus {
    SAVED("Saved"),
    APPLIED("Applied"),
    INTERVIEW("Interview"),
    OFFER("Offer"),
    REJECTED("Rejected");

    private final String label;

    ApplicationStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    @JsonCreator
    public static ApplicationStatus fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("status label is required");
        }
        String v = raw.trim();
        for (ApplicationStatus s : values()) {
            if (s.label.equalsIgnoreCase(v) || s.name().equalsIgnoreCase(v)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown application status: " + raw);
    }
}
