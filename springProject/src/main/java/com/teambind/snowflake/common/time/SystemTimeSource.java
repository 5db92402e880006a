package com.teambind.snowflake.common.time;

/**
 * 시스템 벽시계 기반 시각 소스
 * NTP 보정 등으로 시각이 뒤로 이동할 수 있으며, 생성기는 이를 ClockRolledBack으로 보고합니다.
 */
public enum SystemTimeSource implements TimeSource {

    INSTANCE;

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }
}
