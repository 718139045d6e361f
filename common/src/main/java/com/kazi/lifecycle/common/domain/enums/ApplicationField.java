package com.kazi.lifecycle.common.domain.enums;

import java.util.List;
import java.util.Optional;

/**
 * 전이 검증 에러에 노출되는 필드 이름.
 * - owner: 이 필드를 채우는 상태. 그 상태를 거치지 않은 지원서에는 값이 있으면 안 된다
 * - 날짜 필드 4개는 선언 순서가 곧 날짜 선후 순서 (applied < interview < offer < rejected)
 */
public enum ApplicationField {
    APPLIED_DATE("appliedDate", ApplicationStatus.APPLIED, true),
    INTERVIEW_DATE("interviewDate", ApplicationStatus.INTERVIEW, true),
    OFFER_DATE("offerDate", ApplicationStatus.OFFER, true),
    REJECTED_DATE("rejectedDate", ApplicationStatus.REJECTED, true),
    REJECTION_REASON("rejectionReason", ApplicationStatus.REJECTED, false),
    OFFER_DETAILS("offerDetails", ApplicationStatus.OFFER, false),
    OFFER_TITLE("offerDetails.title", ApplicationStatus.OFFER, false);

    private static final List<ApplicationField> DATE_PRECEDENCE =
            List.of(APPLIED_DATE, INTERVIEW_DATE, OFFER_DATE, REJECTED_DATE);

    private final String fieldName;
    private final ApplicationStatus owner;
    private final boolean date;

    ApplicationField(String fieldName, ApplicationStatus owner, boolean date) {
        this.fieldName = fieldName;
        this.owner = owner;
        this.date = date;
    }

    public String fieldName() {
        return fieldName;
    }

    public ApplicationStatus owner() {
        return owner;
    }

    public boolean isDate() {
        return date;
    }

    /** 날짜 선후 순서 (읽기 전용) */
    public static List<ApplicationField> datePrecedence() {
        return DATE_PRECEDENCE;
    }

    /** status에 진입할 때 채워지는 날짜 필드. SAVED는 없음 */
    public static Optional<ApplicationField> dateFieldOf(ApplicationStatus status) {
        for (ApplicationField f : DATE_PRECEDENCE) {
            if (f.owner == status) return Optional.of(f);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return fieldName;
    }
}
