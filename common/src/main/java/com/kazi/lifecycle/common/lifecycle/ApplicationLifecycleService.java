package com.kazi.lifecycle.common.lifecycle;

import com.kazi.lifecycle.common.codec.DateOrderResult;
import com.kazi.lifecycle.common.codec.DateOrderValidator;
import com.kazi.lifecycle.common.codec.DecodedOfferDetails;
import com.kazi.lifecycle.common.codec.OfferDetailsCodec;
import com.kazi.lifecycle.common.domain.enums.ApplicationField;
import com.kazi.lifecycle.common.domain.enums.ApplicationStatus;
import com.kazi.lifecycle.common.domain.model.Application;
import com.kazi.lifecycle.common.domain.model.OfferDetails;
import com.kazi.lifecycle.common.time.Clock;
import com.kazi.lifecycle.common.transition.StatusTransitionAuthority;
import com.kazi.lifecycle.common.transition.TransitionError;
import com.kazi.lifecycle.common.transition.TransitionFields;
import com.kazi.lifecycle.common.transition.TransitionRequest;
import com.kazi.lifecycle.common.transition.TransitionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 스냅샷 + 입력 필드 -> 검증된 ApplicationPatch
 *
 * 흐름
 * 1) 스냅샷의 offer payload 디코딩 (깨져 있어도 진행)
 * 2) (옵션) 목표 상태 날짜 자동 기록
 * 3) 입력 값을 스냅샷 위에 merge 후 전이/필수 필드 검증
 * 4) 아직 거치지 않은 상태의 필드가 입력됐는지 검사
 * 5) 날짜 선후 검증
 * 6) 입력(+자동 기록)된 값만 patch에 싣는다. 저장된 값은 건드리지 않음
 *
 * 저장은 하지 않는다. (ApplicationPatchWriter 담당)
 */
@Slf4j
@RequiredArgsConstructor
public class ApplicationLifecycleService {

    private final StatusTransitionAuthority authority;
    private final DateOrderValidator dateOrderValidator;
    private final OfferDetailsCodec offerDetailsCodec;
    private final Clock clock;
    private final boolean autoStampDates;

    public LifecycleResult prepare(Application current, ApplicationStatus to, TransitionFields supplied) {
        ApplicationStatus from = current.getStatus();
        TransitionFields changes = supplied == null ? TransitionFields.none() : supplied;

        DecodedOfferDetails decoded = offerDetailsCodec.decodeWithStatus(current.getOfferDetails());
        if (decoded.degraded()) {
            log.warn("[OFFER PAYLOAD IGNORED] applicationId={} stored offer details unreadable", current.getId());
        }

        TransitionFields base = TransitionFields.of(current, decoded.details());
        Set<String> removed = new LinkedHashSet<>();

        // Rejected -> Applied: 새 appliedDate가 이전 사이클 날짜보다 늦을 때만 새 사이클로 본다
        boolean newCycle = from == ApplicationStatus.REJECTED && to == ApplicationStatus.APPLIED
                && conflictsWithPreviousCycle(current, changes.appliedDate());
        if (newCycle) {
            base = TransitionFields.none();
            removed.addAll(previousCycleAttributes(current));
        }

        if (autoStampDates) {
            changes = stampTargetDate(changes, base, to);
        }

        TransitionFields effective = changes.mergedOnto(base);

        TransitionResult result = authority.validateTransition(new TransitionRequest(from, to, effective));
        if (result instanceof TransitionResult.Denied denied) {
            return deny(current, to, denied.error());
        }

        List<ApplicationField> unreached = unreachedFields(from, to, base, changes, newCycle);
        if (!unreached.isEmpty()) {
            return deny(current, to, new TransitionError.UnreachedStatusFields(to, unreached));
        }

        DateOrderResult order = dateOrderValidator.validateDateOrder(effective);
        if (order instanceof DateOrderResult.OutOfOrder outOfOrder) {
            return deny(current, to, new TransitionError.DateOrderViolation(
                    outOfOrder.earlierField(), outOfOrder.laterField()));
        }

        Map<String, Object> attributes = toAttributes(changes);
        removed.removeAll(attributes.keySet());

        ApplicationPatch patch = new ApplicationPatch(current.getId(), from, to, attributes, removed);
        log.info("[TRANSITION PREPARED] applicationId={} {} -> {} attributes={} removed={}",
                current.getId(), from, to, attributes.keySet(), removed);
        return new LifecycleResult.Success(patch);
    }

    /**
     * Offer 상태 유지 중 offer payload 수정
     */
    public LifecycleResult reviseOffer(Application current, OfferDetails revised) {
        if (current.getStatus() != ApplicationStatus.OFFER) {
            return new LifecycleResult.Failure(
                    new TransitionError.IllegalTransition(current.getStatus(), ApplicationStatus.OFFER));
        }
        if (revised == null || !revised.hasTitle()) {
            return new LifecycleResult.Failure(
                    new TransitionError.MissingRequiredFields(List.of(ApplicationField.OFFER_TITLE)));
        }

        Map<String, Object> attributes = Map.of(ApplicationPatch.ATTR_OFFER_DETAILS, offerDetailsCodec.encode(revised));
        ApplicationPatch patch = new ApplicationPatch(
                current.getId(), ApplicationStatus.OFFER, ApplicationStatus.OFFER, attributes, Set.of());
        log.info("[OFFER REVISED] applicationId={}", current.getId());
        return new LifecycleResult.Success(patch);
    }

    private LifecycleResult deny(Application current, ApplicationStatus to, TransitionError error) {
        log.info("[TRANSITION DENIED] applicationId={} {} -> {} : {}",
                current.getId(), current.getStatus(), to, error.message());
        return new LifecycleResult.Failure(error);
    }

    /** 새 appliedDate보다 앞선 이전 사이클 날짜가 있는지 */
    private boolean conflictsWithPreviousCycle(Application current, LocalDate newAppliedDate) {
        if (newAppliedDate == null) return false;
        return isBefore(current.getInterviewDate(), newAppliedDate)
                || isBefore(current.getOfferDate(), newAppliedDate)
                || isBefore(current.getRejectedDate(), newAppliedDate);
    }

    private static boolean isBefore(LocalDate date, LocalDate other) {
        return date != null && date.isBefore(other);
    }

    /** 새 사이클 시작 시 지워야 하는 (현재 값이 있는) 이전 사이클 속성 */
    private Set<String> previousCycleAttributes(Application current) {
        Set<String> names = new LinkedHashSet<>();
        if (current.getInterviewDate() != null) names.add(ApplicationField.INTERVIEW_DATE.fieldName());
        if (current.getOfferDate() != null) names.add(ApplicationField.OFFER_DATE.fieldName());
        if (current.getRejectedDate() != null) names.add(ApplicationField.REJECTED_DATE.fieldName());
        if (current.getRejectionReason() != null) names.add(ApplicationField.REJECTION_REASON.fieldName());
        if (current.getOfferDetails() != null) names.add(ApplicationPatch.ATTR_OFFER_DETAILS);
        return names;
    }

    /**
     * 입력된 필드 중 owner 상태를 거치지 않은 것.
     * 거친 상태 = 목표 상태 + 현재 상태(새 사이클 제외) + 기록에 날짜가 남은 상태
     */
    private List<ApplicationField> unreachedFields(ApplicationStatus from, ApplicationStatus to,
                                                   TransitionFields base, TransitionFields changes,
                                                   boolean newCycle) {
        Set<ApplicationStatus> reached = EnumSet.of(to);
        if (!newCycle) {
            reached.add(from);
        }
        for (ApplicationField f : ApplicationField.datePrecedence()) {
            if (base.dateOf(f) != null) {
                reached.add(f.owner());
            }
        }

        List<ApplicationField> unreached = new ArrayList<>();
        for (ApplicationField f : ApplicationField.values()) {
            // title은 OFFER_DETAILS로 함께 판정
            if (f == ApplicationField.OFFER_TITLE) continue;
            if (changes.isPresent(f) && !reached.contains(f.owner())) {
                unreached.add(f);
            }
        }
        return unreached;
    }

    /** 입력도 기록도 없을 때만 목표 상태 날짜를 오늘로 */
    private TransitionFields stampTargetDate(TransitionFields changes, TransitionFields base, ApplicationStatus to) {
        return ApplicationField.dateFieldOf(to)
                .filter(f -> changes.dateOf(f) == null && base.dateOf(f) == null)
                .map(f -> changes.withDate(f, clock.today()))
                .orElse(changes);
    }

    /** 입력된 값만 속성으로. offer payload는 새로 입력됐을 때만 인코딩한다 */
    private Map<String, Object> toAttributes(TransitionFields fields) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (ApplicationField f : ApplicationField.datePrecedence()) {
            LocalDate d = fields.dateOf(f);
            if (d != null) {
                attributes.put(f.fieldName(), d);
            }
        }
        if (fields.rejectionReason() != null && !fields.rejectionReason().isBlank()) {
            attributes.put(ApplicationField.REJECTION_REASON.fieldName(), fields.rejectionReason().trim());
        }
        OfferDetails offer = fields.offerDetails();
        if (offer != null && !offer.isEmpty()) {
            attributes.put(ApplicationPatch.ATTR_OFFER_DETAILS, offerDetailsCodec.encode(offer));
        }
        return attributes;
    }
}
