package com.kazi.lifecycle.store.ddb.keys;

/**
 * DynamoDB PK/SK 문자열 규칙을 단일 진실로 관리한다.
 *
 * ❗주의
 * - 절대 다른 곳에서 키 문자열을 직접 조합하지 말 것
 */
public final class DdbKeyFactory {

    // PK
    private static final String APP_PREFIX = "APP#";

    // SK
    private static final String META_SK = "META"; // Application Base SK

    private DdbKeyFactory() {
        // util class
    }

    /** Application PK: APP#<applicationId> */
    public static String applicationPk(String applicationId) {
        if (applicationId == null || applicationId.isBlank()) {
            throw new IllegalStateException("키 생성 오류: applicationId must not be blank");
        }
        return APP_PREFIX + applicationId;
    }

    // Application SK: META
    public static String metaSk() { return META_SK; }
}
