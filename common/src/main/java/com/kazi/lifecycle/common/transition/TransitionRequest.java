package com.kazi.lifecycle.common.transition;

import com.kazi.lifecycle.common.domain.enums.ApplicationStatus;

import java.util.Objects;

/**
 * 단일 전이 평가 동안만 존재하는 요청 값.
 * suppliedFields는 레코드 값 + 호출자 입력을 합친 유효 필드 집합이다.
 */
public record TransitionRequest(
        ApplicationStatus fromStatus,
        ApplicationStatus toStatus,
        TransitionFields suppliedFields
) {
    public TransitionRequest {
        Objects.requireNonNull(fromStatus, "fromStatus");
        Objects.requireNonNull(toStatus, "toStatus");
        suppliedFields = suppliedFields == null ? TransitionFields.none() : suppliedFields;
    }
}
