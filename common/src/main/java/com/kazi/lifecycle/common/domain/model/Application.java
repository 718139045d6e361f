package com.kazi.lifecycle.common.domain.model;

import com.kazi.lifecycle.common.domain.enums.ApplicationStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * 호출자(UI/API 계층)가 들고 있는 지원서 스냅샷.
 * 코어는 이 객체를 수정하지 않고 검증된 patch만 돌려준다.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString(exclude = "offerDetails")
public class Application {

    private final String id;
    private final ApplicationStatus status;

    // 상태 이력 날짜
    private final LocalDate appliedDate;
    private final LocalDate interviewDate;
    private final LocalDate offerDate;
    private final LocalDate rejectedDate;

    private final String rejectionReason;

    // 인코딩된 OfferDetails (opaque string)
    private final String offerDetails;
}
