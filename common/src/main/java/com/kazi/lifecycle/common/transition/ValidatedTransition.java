package com.kazi.lifecycle.common.transition;

import com.kazi.lifecycle.common.domain.enums.ApplicationStatus;

public record ValidatedTransition(
        ApplicationStatus fromStatus,
        ApplicationStatus toStatus,
        TransitionFields fields
) {}
