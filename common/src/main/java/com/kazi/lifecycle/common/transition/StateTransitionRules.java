package com.kazi.lifecycle.common.transition;

import com.kazi.lifecycle.common.domain.enums.ApplicationStatus;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 지원서 상태머신의 "허용 전이"만 정의한다.
 * - 필드 요구사항은 RequiredFieldContract 담당
 * - Rejected -> Applied (재지원)는 의도된 순환이다. 지우지 말 것
 */
public final class StateTransitionRules {

    private static final Map<ApplicationStatus, Set<ApplicationStatus>> ALLOWED = new EnumMap<>(ApplicationStatus.class);

    static {
        // SAVED -> APPLIED
        ALLOWED.put(ApplicationStatus.SAVED, EnumSet.of(ApplicationStatus.APPLIED));

        // APPLIED -> (INTERVIEW | REJECTED)
        ALLOWED.put(
                ApplicationStatus.APPLIED,
                EnumSet.of(ApplicationStatus.INTERVIEW, ApplicationStatus.REJECTED)
        );

        // INTERVIEW -> (OFFER | REJECTED)
        ALLOWED.put(
                ApplicationStatus.INTERVIEW,
                EnumSet.of(ApplicationStatus.OFFER, ApplicationStatus.REJECTED)
        );

        // OFFER -> REJECTED
        ALLOWED.put(ApplicationStatus.OFFER, EnumSet.of(ApplicationStatus.REJECTED));

        // REJECTED -> APPLIED (다른 포지션으로 재지원)
        ALLOWED.put(ApplicationStatus.REJECTED, EnumSet.of(ApplicationStatus.APPLIED));

        // 모든 상태는 (비어 있더라도) 엔트리가 있어야 한다
        for (ApplicationStatus s : ApplicationStatus.values()) {
            if (!ALLOWED.containsKey(s)) {
                throw new IllegalStateException("No transition entry for status " + s);
            }
        }
    }

    private StateTransitionRules() {}

    /** from -> to 전이가 허용되는지 */
    public static boolean isAllowed(ApplicationStatus from, ApplicationStatus to) {
        if (from == null || to == null) return false;
        Set<ApplicationStatus> next = ALLOWED.get(from);
        return next != null && next.contains(to);
    }

    /**
     * 현재 상태에서 갈 수 있는 다음 상태들(읽기 전용)
     * 엔트리가 없으면 설정 오류이므로 빈 Set 대신 예외
     */
    public static Set<ApplicationStatus> nextStatuses(ApplicationStatus from) {
        Set<ApplicationStatus> next = from == null ? null : ALLOWED.get(from);
        if (next == null) {
            throw new IllegalStateException("No transition entry for status: " + from);
        }
        return Set.copyOf(next);
    }
}
