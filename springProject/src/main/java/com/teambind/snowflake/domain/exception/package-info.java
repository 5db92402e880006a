/**
 * Domain Exceptions
 * ID 생성 과정에서 발생하는 예외 정의
 *
 * 예외 종류:
 * - InvalidConfig: 생성기 구성 시점의 설정 오류
 * - ClockRolledBack: 시계 역행 (driftMs 포함)
 * - TimeRangeExceeded: epoch 사용 가능 기간 소진
 */
package com.teambind.snowflake.domain.exception;
