package com.kazi.lifecycle.common.transition;

/**
 * 전이 검증 결과
 *
 * - Allowed: 합법 전이 + 필수 필드 충족
 * - Denied: IllegalTransition 또는 MissingRequiredFields
 */
public sealed interface TransitionResult
        permits TransitionResult.Allowed, TransitionResult.Denied {

    default boolean isAllowed() {
        return this instanceof Allowed;
    }

    record Allowed(ValidatedTransition transition) implements TransitionResult {}

    record Denied(TransitionError error) implements TransitionResult {}
}
