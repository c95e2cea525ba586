package com.flow.event;

import com.flow.model.InitiatorSide;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.flow.Fixtures.CALL_21900;
import static com.flow.Fixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderEventTest {

    @Test
    @DisplayName("Initiator flags and notional")
    void accessors() {
        OrderEvent event = new OrderEvent(CALL_21900, T0, 120.5, 10, InitiatorSide.ASK);
        assertThat(event.isAskInitiated()).isTrue();
        assertThat(event.isBidInitiated()).isFalse();
        assertThat(event.notional()).isEqualTo(1205.0);
    }

    @Test
    @DisplayName("Missing initiator is treated as unclassified")
    void nullInitiator() {
        assertThat(new OrderEvent(CALL_21900, T0, 1.0, 1, null).initiator()).isEqualTo(InitiatorSide.NONE);
    }

    @Test
    @DisplayName("Invalid fields are rejected")
    void validation() {
        assertThatThrownBy(() -> new OrderEvent(null, T0, 1.0, 1, InitiatorSide.BID))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OrderEvent(CALL_21900, 0, 1.0, 1, InitiatorSide.BID))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OrderEvent(CALL_21900, T0, 0.0, 1, InitiatorSide.BID))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OrderEvent(CALL_21900, T0, 1.0, -1, InitiatorSide.BID))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
