package com.kazi.lifecycle.common.domain.enums;

import java.util.Optional;

/**
 * 거절 사유 카탈로그.
 * UI 선택지용이며 검증에는 쓰지 않는다. (공백이 아닌 문자열이면 모두 유효)
 */
public enum RejectionReason {
    OVERQUALIFIED("Overqualified", "You have too much experience for the role"),
    UNDERQUALIFIED("Underqualified", "You lack specific skills or experience"),
    BUDGET_CONSTRAINTS("Budget constraints", "Your salary expectations exceed their budget"),
    DIFFERENT_PRIORITIES("Different priorities", "Your goals don't align with the role"),
    CULTURE_FIT("Culture fit", "Didn't match team culture"),
    ALREADY_FILLED("Already filled", "Position was filled by another candidate"),
    NO_FEEDBACK("No feedback", "No reason provided"),
    OTHER("Other", "Different reason");

    private static final String OTHER_PREFIX = "Other:";

    private final String value;
    private final String description;

    RejectionReason(String value, String description) {
        this.value = value;
        this.description = description;
    }

    public String value() {
        return value;
    }

    public String description() {
        return description;
    }

    /** "Other: <text>" 형태의 저장 문자열 */
    public static String other(String text) {
        if (text == null || text.isBlank()) {
            return OTHER.value;
        }
        return OTHER_PREFIX + " " + text.trim();
    }

    /**
     * 저장된 사유 문자열을 카탈로그 항목으로 분류한다.
     * 카탈로그에 없는 문자열과 "Other: ..."는 OTHER, 공백은 empty.
     */
    public static Optional<RejectionReason> classify(String stored) {
        if (stored == null || stored.isBlank()) return Optional.empty();
        String v = stored.trim();
        for (RejectionReason r : values()) {
            if (r.value.equalsIgnoreCase(v)) return Optional.of(r);
        }
        return Optional.of(OTHER);
    }

    /** OTHER 계열이면 사용자가 적은 텍스트, 아니면 empty */
    public static Optional<String> freeText(String stored) {
        if (stored == null) return Optional.empty();
        String v = stored.trim();
        if (v.regionMatches(true, 0, OTHER_PREFIX, 0, OTHER_PREFIX.length())) {
            String text = v.substring(OTHER_PREFIX.length()).trim();
            return text.isEmpty() ? Optional.empty() : Optional.of(text);
        }
        if (classify(v).filter(r -> r != OTHER).isPresent() || v.isEmpty()
                || OTHER.value.equalsIgnoreCase(v)) {
            return Optional.empty();
        }
        return Optional.of(v);
    }
}
