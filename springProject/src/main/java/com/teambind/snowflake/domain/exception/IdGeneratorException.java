package com.teambind.snowflake.domain.exception;

import com.teambind.snowflake.common.exceptions.ErrorCode;
import lombok.Getter;

/**
 * ID 생성기 예외
 * 모든 예외는 호출자에게 동기적으로 전달되며 생성기 내부에서 재시도하지 않습니다.
 */
@Getter
public abstract class IdGeneratorException extends RuntimeException {

    private final ErrorCode errorCode;

    protected IdGeneratorException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * 잘못된 생성기 설정 (머신 ID 범위 초과, 미래의 epoch 등)
     */
    public static class InvalidConfig extends IdGeneratorException {
        public InvalidConfig(String message) {
            super(ErrorCode.INVALID_CONFIG, message);
        }
    }

    /**
     * 시계 역행 감지
     * 마지막으로 관측한 시각보다 현재 시각이 이전인 경우
     */
    @Getter
    public static class ClockRolledBack extends IdGeneratorException {

        private final long driftMs;

        public ClockRolledBack(long driftMs) {
            super(ErrorCode.CLOCK_ROLLED_BACK,
                    ErrorCode.CLOCK_ROLLED_BACK.getMessage() + " - drift: " + driftMs + "ms");
            this.driftMs = driftMs;
        }
    }

    /**
     * epoch 이후 경과 시간이 41비트 타임스탬프 필드에 들어가지 않는 경우
     */
    @Getter
    public static class TimeRangeExceeded extends IdGeneratorException {

        private final long timestamp;

        public TimeRangeExceeded(long timestamp) {
            super(ErrorCode.TIME_RANGE_EXCEEDED,
                    ErrorCode.TIME_RANGE_EXCEEDED.getMessage() + " - timestamp: " + timestamp);
            this.timestamp = timestamp;
        }
    }
}
