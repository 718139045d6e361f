package com.kazi.lifecycle.common.codec;

import com.kazi.lifecycle.common.domain.enums.ApplicationField;
import com.kazi.lifecycle.common.transition.TransitionFields;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * applied < interview < offer < rejected 선후 순서 검증.
 * 비어 있는 날짜는 건너뛴다. (Applied -> Rejected 직행이면 interview 없이도 유효)
 */
public class DateOrderValidator {

    public DateOrderResult validateDateOrder(TransitionFields fields) {
        List<ApplicationField> populated = new ArrayList<>(4);
        for (ApplicationField f : ApplicationField.datePrecedence()) {
            if (fields.dateOf(f) != null) {
                populated.add(f);
            }
        }

        // 인접한 입력 날짜 쌍만 비교
        for (int i = 1; i < populated.size(); i++) {
            ApplicationField earlier = populated.get(i - 1);
            ApplicationField later = populated.get(i);
            LocalDate a = fields.dateOf(earlier);
            LocalDate b = fields.dateOf(later);
            if (a.isAfter(b)) {
                return new DateOrderResult.OutOfOrder(earlier, later);
            }
        }
        return DateOrderResult.IN_ORDER;
    }

    public DateOrderResult validateDateOrder(
            LocalDate appliedDate,
            LocalDate interviewDate,
            LocalDate offerDate,
            LocalDate rejectedDate
    ) {
        return validateDateOrder(TransitionFields.builder()
                .appliedDate(appliedDate)
                .interviewDate(interviewDate)
                .offerDate(offerDate)
                .rejectedDate(rejectedDate)
                .build());
    }
}
