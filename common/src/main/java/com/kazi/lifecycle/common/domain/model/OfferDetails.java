package com.kazi.lifecycle.common.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.LocalDate;
import java.util.List;

/**
 * Offer 상태에 붙는 구조화 payload.
 * - 저장 시에는 OfferDetailsCodec이 JSON 문자열로 평탄화한다
 * - JSON 키는 기존 트래커가 쓰던 snake_case 그대로
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OfferDetails(
        @JsonProperty("title") String title,
        @JsonProperty("salary") String salary,
        @JsonProperty("currency") String currency,
        @JsonProperty("salary_frequency") String salaryFrequency,
        @JsonProperty("position_type") String positionType,
        @JsonProperty("location") String location,
        @JsonProperty("start_date") LocalDate startDate,
        @JsonProperty("offer_deadline") LocalDate offerDeadline,
        @JsonProperty("benefits") List<String> benefits,
        @JsonProperty("notes") String notes
) {

    private static final OfferDetails EMPTY = OfferDetails.builder().build();

    public OfferDetails {
        benefits = benefits == null ? null : List.copyOf(benefits);
    }

    public static OfferDetails empty() {
        return EMPTY;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return this.equals(EMPTY);
    }

    public boolean hasTitle() {
        return title != null && !title.isBlank();
    }
}
