package com.teambind.snowflake.fixture;

import com.teambind.snowflake.common.time.TimeSource;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 테스트용 수동 시각 소스
 * 명시적으로 이동시키기 전까지 시각이 고정됩니다.
 */
public class ManualTimeSource implements TimeSource {

    private final AtomicLong millis;

    public ManualTimeSource(long millis) {
        this.millis = new AtomicLong(millis);
    }

    public static ManualTimeSource at(Instant instant) {
        return new ManualTimeSource(instant.toEpochMilli());
    }

    @Override
    public long currentTimeMillis() {
        return millis.get();
    }

    public void set(long millis) {
        this.millis.set(millis);
    }

    public void advance(long deltaMillis) {
        millis.addAndGet(deltaMillis);
    }

    public void rewind(long deltaMillis) {
        millis.addAndGet(-deltaMillis);
    }
}
