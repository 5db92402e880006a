package com.teambind.snowflake.common.util;

import com.teambind.snowflake.common.time.TimeSource;

/**
 * 시퀀스 소진 시 다음 밀리초까지 대기하는 전략
 *
 * SPIN은 지연이 가장 짧은 대신 대기 동안 CPU 코어 하나를 점유하고,
 * SLEEP은 CPU를 양보하는 대신 최소 한 번의 sleep 간격만큼 지연이 생깁니다.
 */
@FunctionalInterface
public interface WaitStrategy {

    /**
     * 시각 소스가 targetMillis 이상을 가리킬 때까지 대기
     *
     * @param timeSource   시각 소스
     * @param targetMillis Unix epoch 기준 목표 시각 (밀리초)
     */
    void awaitUntil(TimeSource timeSource, long targetMillis);

    enum Type {
        SPIN,
        SLEEP
    }
}
