package com.kazi.lifecycle.common.lifecycle;

/**
 * 지원서 patch 저장 포트
 *
 * ❗규칙
 * - 저장된 status == patch.expectedStatus() 일 때만 반영 (compare-and-swap)
 * - 불일치면 아무것도 쓰지 않고 ConditionFailed
 * - 검증 후 단 한 번의 쓰기로 끝나야 한다
 */
public interface ApplicationPatchWriter {

    WriteResult write(ApplicationPatch patch);
}
