package com.kazi.lifecycle.common.transition;

import com.kazi.lifecycle.common.domain.enums.ApplicationField;
import com.kazi.lifecycle.common.domain.enums.ApplicationStatus;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 목표 상태별 필수 필드 계약.
 * 목록 순서가 에러 리포트 순서다.
 */
public final class RequiredFieldContract {

    private static final Map<ApplicationStatus, List<ApplicationField>> REQUIRED = new EnumMap<>(ApplicationStatus.class);

    // Rejected 전이 시 interviewDate까지 요구하는 출발 상태
    private static final Set<ApplicationStatus> REJECTION_AFTER_INTERVIEW =
            EnumSet.of(ApplicationStatus.INTERVIEW, ApplicationStatus.OFFER);

    static {
        // 초기 상태 전용. 전이로는 도달하지 않지만 계약은 정의해 둔다
        REQUIRED.put(ApplicationStatus.SAVED, List.of());

        REQUIRED.put(ApplicationStatus.APPLIED, List.of(ApplicationField.APPLIED_DATE));

        REQUIRED.put(ApplicationStatus.INTERVIEW,
                List.of(ApplicationField.APPLIED_DATE, ApplicationField.INTERVIEW_DATE));

        REQUIRED.put(ApplicationStatus.OFFER,
                List.of(ApplicationField.INTERVIEW_DATE, ApplicationField.OFFER_DATE, ApplicationField.OFFER_TITLE));

        REQUIRED.put(ApplicationStatus.REJECTED,
                List.of(ApplicationField.REJECTION_REASON, ApplicationField.REJECTED_DATE));
    }

    private RequiredFieldContract() {}

    /** from -> to 전이에 필요한 필드 목록 */
    public static List<ApplicationField> requiredFor(ApplicationStatus from, ApplicationStatus to) {
        List<ApplicationField> base = REQUIRED.get(to);
        if (base == null) {
            throw new IllegalStateException("No field contract for status: " + to);
        }
        if (to == ApplicationStatus.REJECTED && REJECTION_AFTER_INTERVIEW.contains(from)) {
            List<ApplicationField> fields = new ArrayList<>(base);
            fields.add(ApplicationField.INTERVIEW_DATE);
            return List.copyOf(fields);
        }
        return base;
    }

    /** 계약 중 fields에서 비어 있는 항목 전부 */
    public static List<ApplicationField> missing(ApplicationStatus from, ApplicationStatus to, TransitionFields fields) {
        List<ApplicationField> missing = new ArrayList<>();
        for (ApplicationField f : requiredFor(from, to)) {
            if (!fields.isPresent(f)) {
                missing.add(f);
            }
        }
        return missing;
    }
}
