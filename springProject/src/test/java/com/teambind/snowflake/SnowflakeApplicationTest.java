package com.teambind.snowflake;

import com.teambind.snowflake.application.port.in.GenerateIdUseCase;
import com.teambind.snowflake.domain.model.SnowflakeId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 애플리케이션 컨텍스트 통합 테스트
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("애플리케이션 컨텍스트 테스트")
class SnowflakeApplicationTest {

    @Autowired
    private GenerateIdUseCase generateIdUseCase;

    @Test
    @DisplayName("설정된 머신 ID로 ID 발급")
    void generatesIdWithConfiguredMachineId() {
        // given
        Instant before = Instant.now();

        // when
        long id = generateIdUseCase.nextId();
        Instant after = Instant.now();

        // then
        SnowflakeId parsed = generateIdUseCase.parse(id);
        Instant issuedAt = generateIdUseCase.extractTimestamp(id);

        assertThat(parsed.getMachineId()).isEqualTo(7);
        assertThat(issuedAt.toEpochMilli()).isBetween(before.toEpochMilli(), after.toEpochMilli());
    }

    @Test
    @DisplayName("배치 발급은 중복 없이 증가하는 ID 반환")
    void generatesBatch() {
        List<Long> ids = generateIdUseCase.nextIds(500);

        assertThat(ids).hasSize(500).isSorted();
        assertThat(new HashSet<>(ids)).hasSize(500);
    }

    @Test
    @DisplayName("최대 배치 크기를 넘으면 거부")
    void rejectsBatchAboveConfiguredLimit() {
        assertThatThrownBy(() -> generateIdUseCase.nextIds(501))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
