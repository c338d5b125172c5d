/* (C)2026 */
package com.ammann.idgap.service;

import static com.ammann.idgap.support.TestDataFactory.ENTITY_ID;
import static com.ammann.idgap.support.TestDataFactory.withResults;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.ammann.idgap.client.RecordStoreGateway;
import com.ammann.idgap.dto.AnalysisRequestDTO;
import com.ammann.idgap.dto.GapAnalysisResponseDTO;
import com.ammann.idgap.dto.GapRangeDTO;
import com.ammann.idgap.dto.IdBoundsDTO;
import com.ammann.idgap.dto.RecordPageDTO;
import com.ammann.idgap.exception.InvalidRangeException;
import com.ammann.idgap.health.AnalysisCacheHealthCheck;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import java.util.Optional;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Liveness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Runs the analysis through the CDI container with the record store mocked out.
 */
@QuarkusTest
class GapAnalysisServiceIntegrationTest {

    @InjectMock RecordStoreGateway gateway;

    @Inject GapAnalysisService service;

    @Inject @Liveness AnalysisCacheHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        service.invalidate(ENTITY_ID);
        when(gateway.getBounds(ENTITY_ID))
                .thenReturn(Optional.of(new IdBoundsDTO(ENTITY_ID, 1L, 10L, 6L)));
        when(gateway.listRecords(eq(ENTITY_ID), anyInt(), isNull()))
                .thenReturn(new RecordPageDTO(withResults(1, 2, 5, 6, 7, 10), null));
    }

    @Test
    void analyzesAndCachesThroughInjectedBeans() {
        GapAnalysisResponseDTO first = service.analyze(AnalysisRequestDTO.of(ENTITY_ID));
        GapAnalysisResponseDTO second = service.analyze(AnalysisRequestDTO.of(ENTITY_ID));

        assertThat(first.result().gaps())
                .containsExactly(GapRangeDTO.of(3, 4), GapRangeDTO.of(8, 9));
        assertThat(first.result().stats().coveragePercent()).isEqualTo(60.0);
        assertThat(first.fromCache()).isFalse();
        assertThat(second.fromCache()).isTrue();
        // configured page size
        verify(gateway, times(1)).listRecords(ENTITY_ID, 1000, null);
    }

    @Test
    void invalidRangeNeverReachesRecordStore() {
        assertThatThrownBy(
                        () ->
                                service.analyze(
                                        new AnalysisRequestDTO(ENTITY_ID, false, 9L, 3L, true, null)))
                .isInstanceOf(InvalidRangeException.class);

        verify(gateway, never()).getBounds(anyString());
        verify(gateway, never()).listRecords(anyString(), anyInt(), isNull());
    }

    @Test
    void cacheHealthIsUp() {
        service.analyze(AnalysisRequestDTO.of(ENTITY_ID));

        HealthCheckResponse response = healthCheck.call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData().orElseThrow()).containsKey("entries");
    }
}
