package com.teambind.snowflake.common.util;

import com.teambind.snowflake.common.time.TimeSource;

/**
 * Busy-wait 대기 전략 (기본값)
 */
public class SpinWaitStrategy implements WaitStrategy {

    @Override
    public void awaitUntil(TimeSource timeSource, long targetMillis) {
        while (timeSource.currentTimeMillis() < targetMillis) {
            Thread.onSpinWait();
        }
    }
}
