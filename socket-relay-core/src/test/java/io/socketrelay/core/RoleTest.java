package io.socketrelay.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoleTest {

    @Test
    void parsesRoleClaimsIgnoringCase() {
        assertThat(Role.fromWire("Client")).isEqualTo(Role.CLIENT);
        assertThat(Role.fromWire("host")).isEqualTo(Role.HOST);
        assertThat(Role.fromWire(" COURIER ")).isEqualTo(Role.COURIER);
    }

    @Test
    void rejectsUnknownRoles() {
        assertThatThrownBy(() -> Role.fromWire("admin")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Role.fromWire(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void callTypesMatchExactly() {
        assertThat(CallType.fromWire("audio")).contains(CallType.AUDIO);
        assertThat(CallType.fromWire("video")).contains(CallType.VIDEO);
        assertThat(CallType.fromWire("Video")).isEmpty();
        assertThat(CallType.fromWire(null)).isEmpty();
    }

    @Test
    void onlyRoleMayCallNamesTheRole() {
        assertThat(Protocol.onlyRoleMayCall(Role.CLIENT)).isEqualTo("Only Client can initiate a call.");
    }
}
