package com.kazi.lifecycle.store.ddb;

import com.kazi.lifecycle.common.domain.enums.ApplicationStatus;
import com.kazi.lifecycle.common.lifecycle.ApplicationPatch;
import com.kazi.lifecycle.common.lifecycle.ApplicationPatchWriter;
import com.kazi.lifecycle.common.lifecycle.WriteResult;
import com.kazi.lifecycle.store.ddb.keys.DdbKeyFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * ApplicationPatch를 단일 UpdateItem으로 반영한다.
 * ConditionExpression: status == expectedStatus (compare-and-swap)
 */
@Slf4j
@RequiredArgsConstructor
public class DynamoApplicationPatchWriter implements ApplicationPatchWriter {

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;

    private static final String ATTR_PK = "PK";
    private static final String ATTR_SK = "SK";

    @Override
    public WriteResult write(ApplicationPatch patch) {
        // 1) PK / SK 생성 (문자열 하드코딩 금지)
        Map<String, AttributeValue> key = Map.of(
                ATTR_PK, AttributeValue.builder()
                        .s(DdbKeyFactory.applicationPk(patch.applicationId()))
                        .build(),
                ATTR_SK, AttributeValue.builder()
                        .s(DdbKeyFactory.metaSk())
                        .build()
        );

        // 2) UpdateExpression 구성
        UpdateParts parts = buildUpdateParts(patch.newStatus(), patch);

        // 3) ConditionExpression: status == expected
        Map<String, AttributeValue> values = new HashMap<>(parts.values);
        values.put(":expectedStatus", AttributeValue.builder().s(patch.expectedStatus().label()).build());

        UpdateItemRequest req = UpdateItemRequest.builder()
                .tableName(tableName)
                .key(key)
                .updateExpression(parts.updateExpression)
                .conditionExpression("#status = :expectedStatus")
                .expressionAttributeNames(parts.names)
                .expressionAttributeValues(values)
                .build();

        try {
            dynamoDbClient.updateItem(req);
            log.info("[PATCH WRITTEN] applicationId={} {} -> {}",
                    patch.applicationId(), patch.expectedStatus(), patch.newStatus());
            return new WriteResult.Success();
        } catch (ConditionalCheckFailedException e) {
            log.info("[PATCH CONDITION FAILED] applicationId={} expected status={}",
                    patch.applicationId(), patch.expectedStatus());
            return new WriteResult.ConditionFailed();
        }
    }

    /**
     * status는 항상 newStatus로 갱신
     * attributes -> SET, removedAttributes -> REMOVE
     */
    private UpdateParts buildUpdateParts(ApplicationStatus to, ApplicationPatch patch) {
        Map<String, String> names = new HashMap<>();
        Map<String, AttributeValue> values = new HashMap<>();

        StringBuilder set = new StringBuilder("SET ");

        // status
        names.put("#status", ApplicationPatch.ATTR_STATUS);
        values.put(":toStatus", AttributeValue.builder().s(to.label()).build());
        set.append("#status = :toStatus");

        int i = 0;
        for (Map.Entry<String, Object> e : patch.attributes().entrySet()) {
            String nKey = "#f" + i;
            String vKey = ":v" + i;

            names.put(nKey, e.getKey());
            values.put(vKey, toAttrValue(e.getValue()));

            set.append(", ").append(nKey).append(" = ").append(vKey);
            i++;
        }

        if (!patch.removedAttributes().isEmpty()) {
            StringBuilder remove = new StringBuilder(" REMOVE ");
            int r = 0;
            for (String field : patch.removedAttributes()) {
                String nKey = "#r" + r;
                names.put(nKey, field);
                if (r > 0) remove.append(", ");
                remove.append(nKey);
                r++;
            }
            set.append(remove);
        }

        return new UpdateParts(set.toString(), names, values);
    }

    /**
     * patch에 들어오는 타입만 지원
     */
    private AttributeValue toAttrValue(Object raw) {
        if (raw == null) {
            return AttributeValue.builder().nul(true).build();
        }
        if (raw instanceof String v) {
            return AttributeValue.builder().s(v).build();
        }
        if (raw instanceof LocalDate v) {
            return AttributeValue.builder().s(v.toString()).build();
        }

        throw new IllegalArgumentException(
                "Unsupported attribute type: " + raw.getClass()
        );
    }

    private record UpdateParts(
            String updateExpression,
            Map<String, String> names,
            Map<String, AttributeValue> values
    ) {}
}
