package com.kazi.lifecycle.common.lifecycle;

/**
 * patch 저장 결과
 *
 * - Success: 정상 반영
 * - ConditionFailed: status 불일치 (동시 전이/stale 스냅샷)
 */
public sealed interface WriteResult
        permits WriteResult.Success, WriteResult.ConditionFailed {

    record Success() implements WriteResult {}

    record ConditionFailed() implements WriteResult {}
}
