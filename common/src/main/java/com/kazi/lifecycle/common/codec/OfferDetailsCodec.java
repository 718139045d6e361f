package com.kazi.lifecycle.common.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kazi.lifecycle.common.domain.model.OfferDetails;
import lombok.extern.slf4j.Slf4j;

/**
 * OfferDetails <-> 저장용 문자열 (JSON)
 *
 * - encode: 키 알파벳 정렬, null 생략, 날짜는 ISO-8601 -> 같은 값이면 항상 같은 문자열
 * - decode: null/공백/깨진 입력이면 빈 OfferDetails. 절대 예외를 던지지 않는다
 *   (레거시/손상 payload 때문에 사용자가 지원서를 못 여는 일이 없어야 함)
 */
@Slf4j
public class OfferDetailsCodec {

    private final ObjectMapper objectMapper;

    public OfferDetailsCodec() {
        this.objectMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .disable(MapperFeature.SORT_CREATOR_PROPERTIES_FIRST)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .build();
    }

    public String encode(OfferDetails details) {
        OfferDetails value = details == null ? OfferDetails.empty() : details;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            // 문자열/날짜/리스트만 있는 레코드라 실제로는 발생하지 않음
            throw new IllegalStateException("Failed to encode offer details", e);
        }
    }

    public OfferDetails decode(String raw) {
        return decodeWithStatus(raw).details();
    }

    public DecodedOfferDetails decodeWithStatus(String raw) {
        if (raw == null || raw.isBlank()) {
            return DecodedOfferDetails.absent();
        }

        try {
            JsonNode node = objectMapper.readTree(raw);
            if (node == null || !node.isObject()) {
                log.warn("[OFFER DECODE DEGRADED] payload is not a JSON object (length={})", raw.length());
                return DecodedOfferDetails.degradedToEmpty();
            }
            OfferDetails details = objectMapper.treeToValue(node, OfferDetails.class);
            return new DecodedOfferDetails(details == null ? OfferDetails.empty() : details, false);
        } catch (Exception e) {
            log.warn("[OFFER DECODE DEGRADED] unreadable payload (length={}): {}", raw.length(), e.getMessage());
            return DecodedOfferDetails.degradedToEmpty();
        }
    }
}
