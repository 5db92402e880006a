package com.teambind.snowflake.common.util;

import com.teambind.snowflake.common.time.TimeSource;
import lombok.Getter;

import java.time.Duration;
import java.util.concurrent.locks.LockSupport;

/**
 * Sleep-and-recheck 대기 전략
 * 대기 시간이 짧아 인터럽트가 와도 대기를 중단하지 않고, 반환 시 인터럽트 상태를 복구합니다.
 */
@Getter
public class SleepWaitStrategy implements WaitStrategy {

    private final Duration interval;

    public SleepWaitStrategy(Duration interval) {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Sleep interval must be positive: " + interval);
        }
        this.interval = interval;
    }

    @Override
    public void awaitUntil(TimeSource timeSource, long targetMillis) {
        long intervalNanos = interval.toNanos();
        boolean interrupted = false;
        while (timeSource.currentTimeMillis() < targetMillis) {
            LockSupport.parkNanos(intervalNanos);
            // parkNanos는 인터럽트 시 즉시 반환하므로 플래그를 지워야 다음 park가 동작함
            if (Thread.interrupted()) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
