/**
 * Time Sources
 * ID 생성기에 주입되는 시각 소스
 *
 * - SystemTimeSource: 시스템 벽시계
 * - MonotonicTimeSource: nanoTime 기반 단조 증가 시계
 */
package com.teambind.snowflake.common.time;
