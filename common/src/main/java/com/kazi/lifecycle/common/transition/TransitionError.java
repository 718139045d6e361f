package com.kazi.lifecycle.common.transition;

import com.kazi.lifecycle.common.domain.enums.ApplicationField;
import com.kazi.lifecycle.common.domain.enums.ApplicationStatus;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 전이 검증 에러 (값으로 반환, 예외 아님)
 *
 * - IllegalTransition: 그래프에 없는 전이
 * - MissingRequiredFields: 누락 필드 전체 목록 (collect-all)
 * - UnreachedStatusFields: 아직 거치지 않은 상태의 필드가 입력됨
 * - DateOrderViolation: 선후 순서가 뒤집힌 두 날짜
 * - StaleStatus: 저장 시점에 status가 이미 바뀌어 있음 (조건부 쓰기 실패)
 */
public sealed interface TransitionError
        permits TransitionError.IllegalTransition,
                TransitionError.MissingRequiredFields,
                TransitionError.UnreachedStatusFields,
                TransitionError.DateOrderViolation,
                TransitionError.StaleStatus {

    String message();

    record IllegalTransition(ApplicationStatus from, ApplicationStatus to) implements TransitionError {
        @Override
        public String message() {
            return "Cannot move an application from " + from.label() + " to " + to.label();
        }
    }

    record MissingRequiredFields(List<ApplicationField> fields) implements TransitionError {
        public MissingRequiredFields {
            fields = List.copyOf(fields);
        }

        @Override
        public String message() {
            return "Missing required fields: " + fields.stream()
                    .map(ApplicationField::fieldName)
                    .collect(Collectors.joining(", "));
        }
    }

    record UnreachedStatusFields(ApplicationStatus to, List<ApplicationField> fields) implements TransitionError {
        public UnreachedStatusFields {
            fields = List.copyOf(fields);
        }

        @Override
        public String message() {
            return "Fields not allowed when moving to " + to.label() + ": " + fields.stream()
                    .map(ApplicationField::fieldName)
                    .collect(Collectors.joining(", "));
        }
    }

    record DateOrderViolation(ApplicationField earlier, ApplicationField later) implements TransitionError {
        @Override
        public String message() {
            return earlier.fieldName() + " must not be after " + later.fieldName();
        }
    }

    record StaleStatus(ApplicationStatus expected) implements TransitionError {
        @Override
        public String message() {
            return "Application is no longer in status " + expected.label() + "; reload and try again";
        }
    }
}
