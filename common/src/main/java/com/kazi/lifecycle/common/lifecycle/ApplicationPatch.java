package com.kazi.lifecycle.common.lifecycle;

import com.kazi.lifecycle.common.domain.enums.ApplicationStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 검증을 통과한 update 요청. 영속 계층(ApplicationPatchWriter)에 그대로 넘긴다.
 *
 * - status는 attributes에 넣을 수 없음 (expectedStatus -> newStatus로만 변경)
 * - removedAttributes: 재지원(Rejected -> Applied)처럼 이전 사이클 값을 지워야 할 때
 */
public record ApplicationPatch(
        String applicationId,
        ApplicationStatus expectedStatus,
        ApplicationStatus newStatus,
        Map<String, Object> attributes,
        Set<String> removedAttributes
) {
    public static final String ATTR_STATUS = "status";
    public static final String ATTR_OFFER_DETAILS = "offerDetails";

    public ApplicationPatch {
        Objects.requireNonNull(applicationId, "applicationId");
        Objects.requireNonNull(expectedStatus, "expectedStatus");
        Objects.requireNonNull(newStatus, "newStatus");

        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        removedAttributes = removedAttributes == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(removedAttributes));

        if (attributes.containsKey(ATTR_STATUS) || removedAttributes.contains(ATTR_STATUS)) {
            throw new IllegalArgumentException(
                    "Do not patch 'status' directly. Use expectedStatus/newStatus."
            );
        }
        for (String name : removedAttributes) {
            if (attributes.containsKey(name)) {
                throw new IllegalArgumentException("Attribute both set and removed: " + name);
            }
        }
    }

    public boolean changesStatus() {
        return expectedStatus != newStatus;
    }
}
