package com.kazi.lifecycle.common.codec;

import com.kazi.lifecycle.common.domain.model.OfferDetails;

/**
 * degraded = 비어 있지 않은 입력을 해석하지 못해 빈 OfferDetails로 대체됨
 */
public record DecodedOfferDetails(OfferDetails details, boolean degraded) {

    static DecodedOfferDetails absent() {
        return new DecodedOfferDetails(OfferDetails.empty(), false);
    }

    static DecodedOfferDetails degradedToEmpty() {
        return new DecodedOfferDetails(OfferDetails.empty(), true);
    }
}
