/* (C)2026 */
package com.ammann.idgap.service;

import static com.ammann.idgap.support.TestDataFactory.ENTITY_ID;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.idgap.exception.InvalidRangeException;
import com.ammann.idgap.exception.NoDataException;
import com.ammann.idgap.model.IdRange;
import com.ammann.idgap.support.InMemoryRecordStoreGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BoundsResolverServiceTest {

    private InMemoryRecordStoreGateway gateway;
    private BoundsResolverService service;

    @BeforeEach
    void setUp() {
        gateway = new InMemoryRecordStoreGateway();
        service = new BoundsResolverService(gateway);
    }

    @Test
    void defaultsToOneThroughHighestKnownId() {
        gateway.withHighestId(ENTITY_ID, 250);

        assertThat(service.resolveBounds(ENTITY_ID, null, null)).isEqualTo(new IdRange(1, 250));
    }

    @Test
    void explicitRangeSkipsBoundsLookup() {
        assertThat(service.resolveBounds(ENTITY_ID, 10L, 20L)).isEqualTo(new IdRange(10, 20));
        assertThat(service.resolveBounds(ENTITY_ID, null, 20L)).isEqualTo(new IdRange(1, 20));
        assertThat(gateway.boundsCalls.get()).isZero();
    }

    @Test
    void startOverrideUsesHighestKnownIdAsEnd() {
        gateway.withHighestId(ENTITY_ID, 250);

        assertThat(service.resolveBounds(ENTITY_ID, 100L, null)).isEqualTo(new IdRange(100, 250));
    }

    @Test
    void startBeyondHighestKnownIdIsInvalid() {
        gateway.withHighestId(ENTITY_ID, 250);

        assertThatThrownBy(() -> service.resolveBounds(ENTITY_ID, 300L, null))
                .isInstanceOf(InvalidRangeException.class)
                .hasMessageContaining("250");
    }

    @Test
    void malformedOverridesFailBeforeAnyNetworkCall() {
        assertThatThrownBy(() -> service.resolveBounds(ENTITY_ID, 20L, 10L))
                .isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> service.resolveBounds(ENTITY_ID, 0L, 10L))
                .isInstanceOf(InvalidRangeException.class);
        assertThatThrownBy(() -> service.resolveBounds(ENTITY_ID, null, 0L))
                .isInstanceOf(InvalidRangeException.class);
        assertThat(gateway.boundsCalls.get()).isZero();
    }

    @Test
    void missingBoundsMeanNoData() {
        assertThatThrownBy(() -> service.resolveBounds(ENTITY_ID, null, null))
                .isInstanceOf(NoDataException.class)
                .hasMessageContaining(ENTITY_ID);
    }

    @Test
    void boundsWithoutHighestIdMeanNoData() {
        gateway.withHighestId(ENTITY_ID, 0);

        assertThatThrownBy(() -> service.getBounds(ENTITY_ID)).isInstanceOf(NoDataException.class);
    }
}
