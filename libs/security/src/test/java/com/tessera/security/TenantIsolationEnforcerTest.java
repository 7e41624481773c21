package com.tessera.security;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TenantIsolationEnforcer")
class TenantIsolationEnforcerTest {

    @Test
    @DisplayName("workspace rows are reachable through their own workspace")
    void sameWorkspace() {
        assertThatCode(() -> TenantIsolationEnforcer.enforce("r", "u2", "ws", "u1", "ws"))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("workspace rows are not reachable from another workspace")
    void otherWorkspace() {
        assertThatThrownBy(() -> TenantIsolationEnforcer.enforce("r", "u1", "ws-2", "u1", "ws"))
                .isInstanceOf(TenantMismatchException.class)
                .hasMessageContaining("workspace ws");
    }

    @Test
    @DisplayName("personal rows belong to their owner only")
    void personal() {
        assertThatCode(() -> TenantIsolationEnforcer.enforce("r", "u1", null, "u1", null))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> TenantIsolationEnforcer.enforce("r", "u2", null, "u1", null))
                .isInstanceOf(TenantMismatchException.class);
        assertThatThrownBy(() -> TenantIsolationEnforcer.enforce("r", "u1", "ws", "u1", null))
                .isInstanceOf(TenantMismatchException.class);
    }
}
