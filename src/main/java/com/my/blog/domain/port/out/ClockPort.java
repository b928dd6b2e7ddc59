package com.my.blog.domain.port.out;

import java.time.OffsetDateTime;

/**
 * 왜: 현재 시간을 주입형으로 분리하여 TTL 만료와 타임스탬프 로직을 테스트에서 제어하기 위함.
 */
public interface ClockPort {

    /** 글 메타데이터에 기록할 벽시계 시간. */
    OffsetDateTime now();

    /** 만료 판정용 단조 시계(나노초). 벽시계 조정의 영향을 받지 않는다. */
    long monotonicNanos();
}
