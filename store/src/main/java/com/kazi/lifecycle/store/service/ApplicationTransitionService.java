package com.kazi.lifecycle.store.service;

import com.kazi.lifecycle.common.domain.enums.ApplicationStatus;
import com.kazi.lifecycle.common.domain.model.Application;
import com.kazi.lifecycle.common.domain.model.OfferDetails;
import com.kazi.lifecycle.common.lifecycle.ApplicationLifecycleService;
import com.kazi.lifecycle.common.lifecycle.ApplicationPatchWriter;
import com.kazi.lifecycle.common.lifecycle.LifecycleResult;
import com.kazi.lifecycle.common.lifecycle.WriteResult;
import com.kazi.lifecycle.common.transition.TransitionError;
import com.kazi.lifecycle.common.transition.TransitionFields;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 검증 -> 단일 조건부 쓰기.
 * 재시도하지 않는다. StaleStatus면 호출자가 다시 읽고 재요청.
 */
@Slf4j
@RequiredArgsConstructor
public class ApplicationTransitionService {

    private final ApplicationLifecycleService lifecycleService;
    private final ApplicationPatchWriter patchWriter;

    public LifecycleResult transition(Application current, ApplicationStatus to, TransitionFields supplied) {
        return persist(lifecycleService.prepare(current, to, supplied));
    }

    public LifecycleResult reviseOffer(Application current, OfferDetails revised) {
        return persist(lifecycleService.reviseOffer(current, revised));
    }

    private LifecycleResult persist(LifecycleResult prepared) {
        if (!(prepared instanceof LifecycleResult.Success success)) {
            return prepared;
        }

        WriteResult written = patchWriter.write(success.patch());
        if (written instanceof WriteResult.ConditionFailed) {
            // 다른 요청이 먼저 status를 바꿈
            log.info("[STALE STATUS] applicationId={} expected={}",
                    success.patch().applicationId(), success.patch().expectedStatus());
            return new LifecycleResult.Failure(
                    new TransitionError.StaleStatus(success.patch().expectedStatus()));
        }
        return prepared;
    }
}
