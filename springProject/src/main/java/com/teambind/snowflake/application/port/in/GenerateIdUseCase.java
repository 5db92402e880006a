package com.teambind.snowflake.application.port.in;

import com.teambind.snowflake.domain.model.SnowflakeId;

import java.time.Instant;
import java.util.List;

/**
 * ID 발급 UseCase
 * 애플리케이션 내부 호출자가 Snowflake ID를 발급받고 해석하는 기능
 */
public interface GenerateIdUseCase {

    /**
     * ID 1건 발급
     *
     * @return Snowflake ID
     * @throws com.teambind.snowflake.domain.exception.IdGeneratorException 시계 역행, 타임스탬프 범위 초과
     */
    long nextId();

    /**
     * ID 여러 건 발급
     *
     * @param count 발급 개수 (1 ~ snowflake.max-batch-size)
     * @return 발급 순서대로 정렬된 ID 목록
     * @throws IllegalArgumentException 발급 개수가 범위를 벗어난 경우
     */
    List<Long> nextIds(int count);

    /**
     * ID를 타임스탬프, 머신 ID, 시퀀스로 분해
     */
    SnowflakeId parse(long id);

    /**
     * ID가 발급된 시각 추출
     */
    Instant extractTimestamp(long id);
}
