/**
 * Input Port Interfaces (Use Cases)
 * 애플리케이션의 유스케이스 정의
 *
 * 주요 Use Case:
 * - GenerateIdUseCase: Snowflake ID 발급 및 해석
 */
package com.teambind.snowflake.application.port.in;
