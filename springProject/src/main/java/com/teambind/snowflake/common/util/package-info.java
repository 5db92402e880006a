/**
 * Snowflake ID Generator
 * 시퀀스 소진 시 대기 방식은 WaitStrategy로 분리 (SPIN / SLEEP)
 */
package com.teambind.snowflake.common.util;
