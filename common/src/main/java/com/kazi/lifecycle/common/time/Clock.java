package com.kazi.lifecycle.common.time;

import java.time.LocalDate;

/**
 * 날짜 획득을 추상화하기 위한 인터페이스.
 * - 테스트에서 "오늘"을 고정하기 위함
 */
public interface Clock {

    /** 설정된 타임존 기준 오늘 날짜 */
    LocalDate today();
}
