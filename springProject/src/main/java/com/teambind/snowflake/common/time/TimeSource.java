package com.teambind.snowflake.common.time;

/**
 * ID 생성기가 참조하는 시각 소스
 * 테스트에서 시계의 전진, 역행, 밀리초 경계를 재현할 수 있도록 주입 가능하게 분리
 */
@FunctionalInterface
public interface TimeSource {

    /**
     * 현재 시각
     *
     * @return Unix epoch(1970-01-01T00:00:00Z) 기준 밀리초
     */
    long currentTimeMillis();
}
