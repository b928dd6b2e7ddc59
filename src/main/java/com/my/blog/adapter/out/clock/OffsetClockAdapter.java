package com.my.blog.adapter.out.clock;

import com.my.blog.domain.port.out.ClockPort;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * 왜: 시스템 시간을 주입형으로 제공해 테스트와 타임스탬프 정규화(UTC) 일관성을 확보하기 위함.
 * <p>
 * TTL 과 요청 한도 계산은 벽시계 조정에 흔들리지 않도록 {@link #monotonicNanos()} 만 쓴다.
 */
public class OffsetClockAdapter implements ClockPort {

    private final ZoneId zoneId;

    private OffsetClockAdapter(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    public static OffsetClockAdapter system() {
        return new OffsetClockAdapter(ZoneOffset.UTC);
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(zoneId);
    }

    @Override
    public long monotonicNanos() {
        return System.nanoTime();
    }
}
