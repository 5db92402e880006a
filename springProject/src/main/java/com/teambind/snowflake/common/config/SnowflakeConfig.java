package com.teambind.snowflake.common.config;

import com.teambind.snowflake.common.time.MonotonicTimeSource;
import com.teambind.snowflake.common.time.SystemTimeSource;
import com.teambind.snowflake.common.time.TimeSource;
import com.teambind.snowflake.common.util.SleepWaitStrategy;
import com.teambind.snowflake.common.util.SnowflakeIdGenerator;
import com.teambind.snowflake.common.util.SpinWaitStrategy;
import com.teambind.snowflake.common.util.WaitStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Snowflake ID Generator Configuration
 * 분산 환경에서 유니크한 ID 생성을 위한 설정
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SnowflakeProperties.class)
public class SnowflakeConfig {

    @Bean
    public TimeSource snowflakeTimeSource(SnowflakeProperties properties) {
        return switch (properties.getTimeSource()) {
            case SYSTEM -> SystemTimeSource.INSTANCE;
            case MONOTONIC -> new MonotonicTimeSource();
        };
    }

    @Bean
    public WaitStrategy snowflakeWaitStrategy(SnowflakeProperties properties) {
        return switch (properties.getWaitStrategy()) {
            case SPIN -> new SpinWaitStrategy();
            case SLEEP -> new SleepWaitStrategy(properties.getSleepInterval());
        };
    }

    @Bean
    public SnowflakeIdGenerator snowflakeIdGenerator(SnowflakeProperties properties,
                                                     TimeSource snowflakeTimeSource,
                                                     WaitStrategy snowflakeWaitStrategy) {
        log.info("Snowflake ID Generator 초기화 - machineId: {}, epoch: {}, timeSource: {}, waitStrategy: {}",
                properties.getMachineId(), properties.getEpoch(),
                properties.getTimeSource(), properties.getWaitStrategy());

        return new SnowflakeIdGenerator(
                properties.getEpoch(),
                properties.getMachineId(),
                snowflakeTimeSource,
                snowflakeWaitStrategy
        );
    }
}
