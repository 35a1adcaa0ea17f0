package io.socketrelay.server.core;

import io.socketrelay.core.Role;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LivenessMonitorTest {

    @Test
    void probesEveryConnectionOnEachTick() {
        BrokerFixture fixture = new BrokerFixture();
        BrokerFixture.Client anonymous = fixture.connect();
        BrokerFixture.Client alice = fixture.login(Role.CLIENT, "alice");

        assertThat(fixture.broker.liveness().tick()).isZero();

        assertThat(anonymous.channel.pings()).isEqualTo(1);
        assertThat(alice.channel.pings()).isEqualTo(1);
        assertThat(alice.connection.isAlive()).isFalse();
    }

    @Test
    void answeredProbesKeepConnectionsAlive() {
        BrokerFixture fixture = new BrokerFixture();
        BrokerFixture.Client alice = fixture.login(Role.CLIENT, "alice");

        for (int i = 0; i < 3; i++) {
            fixture.broker.liveness().tick();
            fixture.broker.onPong(alice.connection);
        }

        assertThat(alice.channel.terminated()).isFalse();
        assertThat(alice.channel.pings()).isEqualTo(3);
        assertThat(fixture.broker.registry().isOnline("alice")).isTrue();
    }

    @Test
    void unansweredProbeTerminatesOnNextTick() {
        BrokerFixture fixture = new BrokerFixture();
        BrokerFixture.Client observer = fixture.login(Role.HOST, "observer");
        BrokerFixture.Client alice = fixture.login(Role.CLIENT, "alice");
        alice.send("{\"event\":\"subscribeToLocation\",\"targetUserId\":\"driver-1\"}");
        observer.channel.clear();

        fixture.broker.liveness().tick();
        fixture.broker.onPong(observer.connection);
        int evicted = fixture.broker.liveness().tick();

        assertThat(evicted).isEqualTo(1);
        assertThat(alice.channel.terminated()).isTrue();
        assertThat(observer.channel.terminated()).isFalse();
        assertThat(fixture.broker.registry().isOnline("alice")).isFalse();
        assertThat(fixture.broker.subscriptions().targets()).isEmpty();
        assertThat(observer.channel.events("userStatus")).hasSize(1);

        // the transport's own close notification after termination changes nothing
        fixture.broker.onClose(alice.connection);
        assertThat(observer.channel.events("userStatus")).hasSize(1);
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> new LivenessMonitor(new ConnectionRegistry(), connection -> { }, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void startAndCloseAreIdempotent() {
        LivenessMonitor monitor = new LivenessMonitor(new ConnectionRegistry(), connection -> { }, Duration.ofMillis(50));
        monitor.start();
        monitor.start();
        monitor.close();
        monitor.close();
    }
}
