/**
 * Domain Models
 * Snowflake ID의 비트 구조와 값 객체
 */
package com.teambind.snowflake.domain.model;
