package com.teambind.snowflake.application.service;

import com.teambind.snowflake.application.port.in.GenerateIdUseCase;
import com.teambind.snowflake.common.config.SnowflakeProperties;
import com.teambind.snowflake.common.util.SnowflakeIdGenerator;
import com.teambind.snowflake.domain.exception.IdGeneratorException.ClockRolledBack;
import com.teambind.snowflake.domain.exception.IdGeneratorException.TimeRangeExceeded;
import com.teambind.snowflake.domain.model.SnowflakeId;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * ID 발급 서비스
 * 생성기 예외는 기록만 하고 재시도 없이 호출자에게 그대로 전달
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdGenerationService implements GenerateIdUseCase {

    private final SnowflakeIdGenerator snowflakeIdGenerator;
    private final SnowflakeProperties snowflakeProperties;

    @Override
    public long nextId() {
        try {
            return snowflakeIdGenerator.nextId();
        } catch (ClockRolledBack e) {
            log.warn("시계 역행 감지 - machineId: {}, driftMs: {}",
                    snowflakeIdGenerator.getMachineId(), e.getDriftMs());
            throw e;
        } catch (TimeRangeExceeded e) {
            log.error("타임스탬프 범위 초과 - machineId: {}, epoch: {}, timestamp: {}",
                    snowflakeIdGenerator.getMachineId(), snowflakeIdGenerator.getEpoch(), e.getTimestamp());
            throw e;
        }
    }

    @Override
    public List<Long> nextIds(int count) {
        int maxBatchSize = snowflakeProperties.getMaxBatchSize();
        if (count < 1 || count > maxBatchSize) {
            throw new IllegalArgumentException("발급 개수는 1 ~ " + maxBatchSize + " 사이여야 합니다: " + count);
        }

        List<Long> ids = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            ids.add(nextId());
        }

        log.debug("ID 배치 발급 완료 - count: {}, first: {}, last: {}", count, ids.get(0), ids.get(count - 1));

        return ids;
    }

    @Override
    public SnowflakeId parse(long id) {
        return SnowflakeId.parse(id);
    }

    @Override
    public Instant extractTimestamp(long id) {
        return SnowflakeId.parse(id).toInstant(snowflakeIdGenerator.getEpoch());
    }
}
