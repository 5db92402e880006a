package com.teambind.snowflake.common.exceptions;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * ID 생성기 에러 코드
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    INVALID_CONFIG("INVALID_CONFIG", "ID 생성기 설정이 올바르지 않습니다"),
    CLOCK_ROLLED_BACK("CLOCK_ROLLED_BACK", "시스템 시계가 뒤로 이동했습니다"),
    TIME_RANGE_EXCEEDED("TIME_RANGE_EXCEEDED", "타임스탬프가 41비트 범위를 초과했습니다");

    private final String code;
    private final String message;
}
