package com.kazi.lifecycle.common.codec;

import com.kazi.lifecycle.common.domain.enums.ApplicationField;

public sealed interface DateOrderResult
        permits DateOrderResult.InOrder, DateOrderResult.OutOfOrder {

    DateOrderResult IN_ORDER = new InOrder();

    default boolean isInOrder() {
        return this instanceof InOrder;
    }

    record InOrder() implements DateOrderResult {}

    /** earlierField가 laterField보다 늦은 날짜 */
    record OutOfOrder(ApplicationField earlierField, ApplicationField laterField) implements DateOrderResult {}
}
