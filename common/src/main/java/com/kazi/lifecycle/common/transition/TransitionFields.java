package com.kazi.lifecycle.common.transition;

import com.kazi.lifecycle.common.domain.enums.ApplicationField;
import com.kazi.lifecycle.common.domain.model.Application;
import com.kazi.lifecycle.common.domain.model.OfferDetails;
import lombok.Builder;

import java.time.LocalDate;

/**
 * 전이에 실려 오는 필드 값들. null = 미입력
 */
@Builder(toBuilder = true)
public record TransitionFields(
        LocalDate appliedDate,
        LocalDate interviewDate,
        LocalDate offerDate,
        LocalDate rejectedDate,
        String rejectionReason,
        OfferDetails offerDetails
) {

    private static final TransitionFields NONE = TransitionFields.builder().build();

    public static TransitionFields none() {
        return NONE;
    }

    /** 스냅샷의 현재 값 (offerDetails는 이미 디코딩된 값을 받는다) */
    public static TransitionFields of(Application application, OfferDetails decodedOffer) {
        return TransitionFields.builder()
                .appliedDate(application.getAppliedDate())
                .interviewDate(application.getInterviewDate())
                .offerDate(application.getOfferDate())
                .rejectedDate(application.getRejectedDate())
                .rejectionReason(application.getRejectionReason())
                .offerDetails(decodedOffer == null || decodedOffer.isEmpty() ? null : decodedOffer)
                .build();
    }

    /** base 위에 this를 덮어쓴 결과. this에서 null인 값은 base 값 유지 */
    public TransitionFields mergedOnto(TransitionFields base) {
        if (base == null) return this;
        return new TransitionFields(
                appliedDate != null ? appliedDate : base.appliedDate,
                interviewDate != null ? interviewDate : base.interviewDate,
                offerDate != null ? offerDate : base.offerDate,
                rejectedDate != null ? rejectedDate : base.rejectedDate,
                rejectionReason != null ? rejectionReason : base.rejectionReason,
                offerDetails != null ? offerDetails : base.offerDetails
        );
    }

    public LocalDate dateOf(ApplicationField field) {
        return switch (field) {
            case APPLIED_DATE -> appliedDate;
            case INTERVIEW_DATE -> interviewDate;
            case OFFER_DATE -> offerDate;
            case REJECTED_DATE -> rejectedDate;
            default -> throw new IllegalArgumentException("Not a date field: " + field);
        };
    }

    public TransitionFields withDate(ApplicationField field, LocalDate value) {
        TransitionFieldsBuilder b = toBuilder();
        switch (field) {
            case APPLIED_DATE -> b.appliedDate(value);
            case INTERVIEW_DATE -> b.interviewDate(value);
            case OFFER_DATE -> b.offerDate(value);
            case REJECTED_DATE -> b.rejectedDate(value);
            default -> throw new IllegalArgumentException("Not a date field: " + field);
        }
        return b.build();
    }

    /** required-field 계약 기준의 "입력됨" 여부 (문자열은 공백 불가) */
    public boolean isPresent(ApplicationField field) {
        return switch (field) {
            case APPLIED_DATE, INTERVIEW_DATE, OFFER_DATE, REJECTED_DATE -> dateOf(field) != null;
            case REJECTION_REASON -> rejectionReason != null && !rejectionReason.isBlank();
            case OFFER_DETAILS -> offerDetails != null && !offerDetails.isEmpty();
            case OFFER_TITLE -> offerDetails != null && offerDetails.hasTitle();
        };
    }
}
