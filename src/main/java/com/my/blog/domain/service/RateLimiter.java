package com.my.blog.domain.service;

import com.my.blog.domain.port.out.ClockPort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 왜: 원격 API 호출을 슬라이딩 윈도우 안에서 maxRequests 건 이하로 묶어 외부 쿼터를 넘지 않도록 하기 위함.
 * <p>
 * 창이 가득 차면 호출 스레드만 대기한다. 대기 중에는 락을 놓기 때문에 여러 호출자가 동시에 대기할 수 있다.
 */
public class RateLimiter {

    private static final Logger log = Logger.getLogger(RateLimiter.class);

    private final int maxRequests;
    private final long windowNanos;
    private final ClockPort clock;
    private final Deque<Long> window = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotFreed = lock.newCondition();

    public RateLimiter(int maxRequests, Duration window, ClockPort clock) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests 는 1 이상이어야 합니다: " + maxRequests);
        }
        Objects.requireNonNull(window, "window");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window 는 양수여야 합니다: " + window);
        }
        this.maxRequests = maxRequests;
        this.windowNanos = window.toNanos();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * 슬롯이 날 때까지 대기한 뒤 호출 시각을 기록한다.
     *
     * @throws CancellationException 대기 중 인터럽트된 경우. 인터럽트 플래그는 복원된다.
     */
    public void acquire() {
        lock.lock();
        try {
            while (true) {
                long now = clock.monotonicNanos();
                prune(now);
                if (window.size() < maxRequests) {
                    window.addLast(now);
                    return;
                }
                long waitNanos = windowNanos - (now - window.peekFirst());
                if (waitNanos > 0) {
                    log.warnf("요청 한도 도달, %d ms 대기", TimeUnit.NANOSECONDS.toMillis(waitNanos));
                    slotFreed.awaitNanos(waitNanos);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("요청 한도 대기 중 인터럽트되었습니다.");
        } finally {
            lock.unlock();
        }
    }

    /** 현재 창 안에 남아 있는 기록 수. */
    public int inFlightWindowSize() {
        lock.lock();
        try {
            prune(clock.monotonicNanos());
            return window.size();
        } finally {
            lock.unlock();
        }
    }

    private void prune(long now) {
        boolean freed = false;
        while (!window.isEmpty() && now - window.peekFirst() >= windowNanos) {
            window.pollFirst();
            freed = true;
        }
        if (freed) {
            slotFreed.signalAll();
        }
    }
}
