package com.teambind.snowflake.common.time;

import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * 단조 증가 시각 소스
 *
 * 생성 시점에 벽시계 값을 한 번 기준으로 잡고, 이후에는 System.nanoTime() 경과량만큼 전진합니다.
 * 프로세스 안에서는 절대 뒤로 이동하지 않지만 장시간 실행 시 실제 벽시계와 조금씩 벌어질 수 있습니다.
 */
public class MonotonicTimeSource implements TimeSource {

    private final long baseMillis;
    private final long baseNanos;
    private final LongSupplier nanoClock;

    public MonotonicTimeSource() {
        this(System.currentTimeMillis(), System::nanoTime);
    }

    MonotonicTimeSource(long baseMillis, LongSupplier nanoClock) {
        this.baseMillis = baseMillis;
        this.nanoClock = nanoClock;
        this.baseNanos = nanoClock.getAsLong();
    }

    @Override
    public long currentTimeMillis() {
        long elapsedNanos = nanoClock.getAsLong() - baseNanos;
        return baseMillis + TimeUnit.NANOSECONDS.toMillis(elapsedNanos);
    }
}
