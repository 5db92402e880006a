package com.teambind.snowflake.common.config;

import com.teambind.snowflake.common.util.WaitStrategy;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.Instant;

/**
 * Snowflake ID Generator 설정 (snowflake.*)
 * 머신 ID는 배포 환경에서 인스턴스마다 유일하게 할당해야 합니다.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "snowflake")
public class SnowflakeProperties {

    @Min(value = 0, message = "머신 ID는 0 이상이어야 합니다")
    @Max(value = 1023, message = "머신 ID는 1023 이하여야 합니다")
    private int machineId = 1;

    @NotNull(message = "epoch는 필수입니다")
    private Instant epoch = Instant.parse("2021-01-01T00:00:00Z");

    @NotNull
    private TimeSourceType timeSource = TimeSourceType.SYSTEM;

    @NotNull
    private WaitStrategy.Type waitStrategy = WaitStrategy.Type.SPIN;

    /**
     * SLEEP 전략에서 시계 재확인 간격
     */
    @NotNull
    private Duration sleepInterval = Duration.ofNanos(100_000);

    @Min(value = 1, message = "배치 크기는 1 이상이어야 합니다")
    private int maxBatchSize = 10_000;

    public enum TimeSourceType {
        SYSTEM,
        MONOTONIC
    }
}
