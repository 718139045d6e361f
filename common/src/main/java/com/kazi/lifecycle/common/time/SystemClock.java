package com.kazi.lifecycle.common.time;

import java.time.LocalDate;
import java.time.ZoneId;

/**
 * 실제 시스템 시간을 사용하는 기본 구현체
 */
public class SystemClock implements Clock {

    private final ZoneId zone;

    public SystemClock(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public LocalDate today() {
        return LocalDate.now(zone);
    }
}
