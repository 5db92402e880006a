package com.teambind.snowflake.common.time;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("단조 증가 시각 소스 테스트")
class MonotonicTimeSourceTest {

    @Test
    @DisplayName("기준 시각에서 nanoTime 경과량만큼 전진")
    void advancesByElapsedNanos() {
        AtomicLong nanos = new AtomicLong(5_000_000L);
        MonotonicTimeSource timeSource = new MonotonicTimeSource(1_000L, nanos::get);

        assertThat(timeSource.currentTimeMillis()).isEqualTo(1_000L);

        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(3) + 999_999L);
        assertThat(timeSource.currentTimeMillis()).isEqualTo(1_003L);

        nanos.addAndGet(1L);
        assertThat(timeSource.currentTimeMillis()).isEqualTo(1_004L);
    }

    @Test
    @DisplayName("시스템 시각 기준으로 시작하고 뒤로 가지 않음")
    void startsNearWallClockAndNeverRegresses() {
        long before = System.currentTimeMillis();
        MonotonicTimeSource timeSource = new MonotonicTimeSource();

        long previous = timeSource.currentTimeMillis();
        assertThat(previous).isBetween(before, System.currentTimeMillis() + 5);

        for (int i = 0; i < 10_000; i++) {
            long current = timeSource.currentTimeMillis();
            assertThat(current).isGreaterThanOrEqualTo(previous);
            previous = current;
        }
    }

    @Test
    @DisplayName("시스템 시각 소스는 System.currentTimeMillis 반환")
    void systemTimeSourceReadsWallClock() {
        long before = System.currentTimeMillis();
        long now = SystemTimeSource.INSTANCE.currentTimeMillis();
        long after = System.currentTimeMillis();

        assertThat(now).isBetween(before, after);
    }
}
