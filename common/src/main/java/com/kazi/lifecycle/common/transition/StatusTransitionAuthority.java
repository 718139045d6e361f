package com.kazi.lifecycle.common.transition;

import com.kazi.lifecycle.common.domain.enums.ApplicationField;
import com.kazi.lifecycle.common.domain.enums.ApplicationStatus;

import java.util.List;
import java.util.Set;

/**
 * 전이 합법성 + 목표 상태별 필수 필드를 판정한다.
 * I/O 없음, 상태 없음. 어느 스레드에서 호출해도 된다.
 */
public class StatusTransitionAuthority {

    public boolean isTransitionAllowed(ApplicationStatus from, ApplicationStatus to) {
        return StateTransitionRules.isAllowed(from, to);
    }

    public Set<ApplicationStatus> allowedTargets(ApplicationStatus from) {
        return StateTransitionRules.nextStatuses(from);
    }

    public List<ApplicationField> requiredFields(ApplicationStatus from, ApplicationStatus to) {
        return RequiredFieldContract.requiredFor(from, to);
    }

    public TransitionResult validateTransition(TransitionRequest request) {
        ApplicationStatus from = request.fromStatus();
        ApplicationStatus to = request.toStatus();

        // 1) 그래프 검사
        if (!isTransitionAllowed(from, to)) {
            return new TransitionResult.Denied(new TransitionError.IllegalTransition(from, to));
        }

        // 2) 필수 필드 (누락 전부 수집)
        List<ApplicationField> missing = RequiredFieldContract.missing(from, to, request.suppliedFields());
        if (!missing.isEmpty()) {
            return new TransitionResult.Denied(new TransitionError.MissingRequiredFields(missing));
        }

        return new TransitionResult.Allowed(new ValidatedTransition(from, to, request.suppliedFields()));
    }
}
