package com.kazi.lifecycle.common.lifecycle;

import com.kazi.lifecycle.common.transition.TransitionError;

public sealed interface LifecycleResult
        permits LifecycleResult.Success, LifecycleResult.Failure {

    default boolean isSuccess() {
        return this instanceof Success;
    }

    record Success(ApplicationPatch patch) implements LifecycleResult {}

    record Failure(TransitionError error) implements LifecycleResult {}
}
