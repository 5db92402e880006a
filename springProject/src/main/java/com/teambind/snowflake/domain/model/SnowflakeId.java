package com.teambind.snowflake.domain.model;

import java.time.Instant;

/**
 * Snowflake ID 값 객체
 *
 * ID 구조 (64 bits):
 * - 1 bit: 부호 (항상 0)
 * - 41 bits: 타임스탬프 (epoch 기준 밀리초)
 * - 10 bits: 머신 ID
 * - 12 bits: 시퀀스 (같은 밀리초 내에서 증가)
 */
@lombok.Value
public class SnowflakeId {

    public static final int TIMESTAMP_BITS = 41;
    public static final int MACHINE_ID_BITS = 10;
    public static final int SEQUENCE_BITS = 12;

    public static final long MAX_TIMESTAMP = ~(-1L << TIMESTAMP_BITS);
    public static final int MAX_MACHINE_ID = ~(-1 << MACHINE_ID_BITS);
    public static final int MAX_SEQUENCE = ~(-1 << SEQUENCE_BITS);

    private static final int MACHINE_ID_SHIFT = SEQUENCE_BITS;
    private static final int TIMESTAMP_SHIFT = SEQUENCE_BITS + MACHINE_ID_BITS;

    long timestamp;
    int machineId;
    int sequence;

    /**
     * 필드 값을 64비트 ID로 조립
     *
     * @param timestamp epoch 기준 밀리초
     * @param machineId 머신 ID
     * @param sequence  시퀀스
     * @return 조립된 ID
     * @throws IllegalArgumentException 필드 값이 범위를 벗어난 경우
     */
    public static long pack(long timestamp, int machineId, int sequence) {
        if (timestamp < 0 || timestamp > MAX_TIMESTAMP) {
            throw new IllegalArgumentException("Timestamp must be between 0 and " + MAX_TIMESTAMP + ": " + timestamp);
        }
        if (machineId < 0 || machineId > MAX_MACHINE_ID) {
            throw new IllegalArgumentException("Machine ID must be between 0 and " + MAX_MACHINE_ID + ": " + machineId);
        }
        if (sequence < 0 || sequence > MAX_SEQUENCE) {
            throw new IllegalArgumentException("Sequence must be between 0 and " + MAX_SEQUENCE + ": " + sequence);
        }
        return (timestamp << TIMESTAMP_SHIFT)
                | ((long) machineId << MACHINE_ID_SHIFT)
                | sequence;
    }

    /**
     * 64비트 ID를 필드 단위로 분해
     *
     * @param id Snowflake ID
     * @return 분해된 ID
     * @throws IllegalArgumentException 부호 비트가 설정된 경우
     */
    public static SnowflakeId parse(long id) {
        if (id < 0) {
            throw new IllegalArgumentException("Snowflake ID must not be negative: " + id);
        }
        long timestamp = id >>> TIMESTAMP_SHIFT;
        int machineId = (int) ((id >>> MACHINE_ID_SHIFT) & MAX_MACHINE_ID);
        int sequence = (int) (id & MAX_SEQUENCE);
        return new SnowflakeId(timestamp, machineId, sequence);
    }

    public long toLong() {
        return pack(timestamp, machineId, sequence);
    }

    /**
     * ID가 발급된 시각
     *
     * @param epoch ID를 발급한 생성기의 epoch
     */
    public Instant toInstant(Instant epoch) {
        return epoch.plusMillis(timestamp);
    }
}
