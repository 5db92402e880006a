package com.teambind.snowflake.common.util;

import com.teambind.snowflake.common.time.SystemTimeSource;
import com.teambind.snowflake.common.time.TimeSource;
import com.teambind.snowflake.domain.exception.IdGeneratorException.ClockRolledBack;
import com.teambind.snowflake.domain.exception.IdGeneratorException.InvalidConfig;
import com.teambind.snowflake.domain.exception.IdGeneratorException.TimeRangeExceeded;
import com.teambind.snowflake.domain.model.SnowflakeId;

import java.time.Instant;

/**
 * 분산 환경에서 유니크한 ID를 생성하는 Snowflake ID Generator
 *
 * ID 구조는 {@link SnowflakeId} 참고 (41 bits 타임스탬프 + 10 bits 머신 ID + 12 bits 시퀀스).
 * 하나의 인스턴스 안에서 발급된 ID는 서로 다르며 발급 순서대로 증가합니다.
 * 머신 ID가 플릿 전체에서 유일한지는 외부에서 보장해야 합니다.
 *
 * 발생 가능한 예외는 로깅이나 재시도 없이 그대로 호출자에게 전달됩니다.
 */
public class SnowflakeIdGenerator {

    private final Instant epoch;
    private final long epochMillis;
    private final int machineId;
    private final TimeSource timeSource;
    private final WaitStrategy waitStrategy;

    // guarded by this
    private final State state = new State();

    public SnowflakeIdGenerator(Instant epoch, int machineId) {
        this(epoch, machineId, SystemTimeSource.INSTANCE, new SpinWaitStrategy());
    }

    public SnowflakeIdGenerator(Instant epoch, int machineId, TimeSource timeSource, WaitStrategy waitStrategy) {
        if (machineId < 0 || machineId > SnowflakeId.MAX_MACHINE_ID) {
            throw new InvalidConfig("Machine ID must be between 0 and " + SnowflakeId.MAX_MACHINE_ID + ": " + machineId);
        }
        if (epoch == null) {
            throw new InvalidConfig("Epoch must not be null");
        }
        if (timeSource == null || waitStrategy == null) {
            throw new InvalidConfig("Time source and wait strategy must not be null");
        }
        long now = timeSource.currentTimeMillis();
        if (epoch.toEpochMilli() > now) {
            throw new InvalidConfig("Epoch must not be in the future: " + epoch);
        }
        this.epoch = epoch;
        this.epochMillis = epoch.toEpochMilli();
        this.machineId = machineId;
        this.timeSource = timeSource;
        this.waitStrategy = waitStrategy;
    }

    /**
     * 다음 ID 발급
     *
     * @return 0 이상의 64비트 ID
     * @throws ClockRolledBack   시계가 마지막 발급 시각보다 뒤로 이동한 경우 (상태 변경 없음)
     * @throws TimeRangeExceeded epoch 이후 경과 시간이 41비트를 넘은 경우 (상태 변경 없음)
     */
    public synchronized long nextId() {
        long now = elapsedMillis();

        if (now < state.lastTimestamp) {
            throw new ClockRolledBack(state.lastTimestamp - now);
        }

        long timestamp;
        int sequence;
        if (now > state.lastTimestamp) {
            timestamp = now;
            sequence = 0;
        } else {
            timestamp = state.lastTimestamp;
            sequence = (state.sequence + 1) & SnowflakeId.MAX_SEQUENCE;
            if (sequence == 0) {
                // 이번 밀리초의 4096개를 모두 사용함
                timestamp++;
                waitStrategy.awaitUntil(timeSource, epochMillis + timestamp);
            }
        }

        if (timestamp > SnowflakeId.MAX_TIMESTAMP) {
            throw new TimeRangeExceeded(timestamp);
        }

        state.lastTimestamp = timestamp;
        state.sequence = sequence;

        return SnowflakeId.pack(timestamp, machineId, sequence);
    }

    /**
     * 다음 ID를 분해된 형태로 발급
     */
    public SnowflakeId nextSnowflakeId() {
        return SnowflakeId.parse(nextId());
    }

    public int getMachineId() {
        return machineId;
    }

    public Instant getEpoch() {
        return epoch;
    }

    private long elapsedMillis() {
        return timeSource.currentTimeMillis() - epochMillis;
    }

    /**
     * 생성기 상태
     * 첫 호출에서 시퀀스가 0이 되도록 최대값으로 초기화
     */
    private static final class State {
        private long lastTimestamp = -1L;
        private int sequence = SnowflakeId.MAX_SEQUENCE;
    }
}
