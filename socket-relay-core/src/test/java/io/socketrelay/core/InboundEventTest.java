package io.socketrelay.core;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InboundEventTest {

    private static WireEnvelope envelope(String event) {
        return new WireEnvelope(event, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    @Test
    void authenticateNeedsToken() {
        assertThat(InboundEvent.from(envelope("authenticate")))
                .isEqualTo(new InboundEvent.Rejected("authenticate", Protocol.MSG_TOKEN_REQUIRED));

        WireEnvelope withToken = new WireEnvelope("authenticate", "abc", null, null, null, null, null, null, null, null, null, null, null);
        assertThat(InboundEvent.from(withToken)).isEqualTo(new InboundEvent.Authenticate("abc"));
    }

    @Test
    void locationUpdateNeedsBothCoordinates() {
        WireEnvelope onlyLat = new WireEnvelope("locationUpdate", null, 1.0, null, null, null, null, null, null, null, null, null, null);
        WireEnvelope both = new WireEnvelope("locationUpdate", null, 1.0, 2.0, null, null, null, null, null, null, null, null, null);

        InboundEvent rejected = InboundEvent.from(onlyLat);
        assertThat(rejected).isInstanceOf(InboundEvent.Rejected.class);
        assertThat(((InboundEvent.Rejected) rejected).silent()).isTrue();
        assertThat(InboundEvent.from(both)).isEqualTo(new InboundEvent.LocationUpdate(1.0, 2.0));
    }

    @Test
    void messageNeedsReceiverAndText() {
        WireEnvelope noText = new WireEnvelope("message", null, null, null, null, "bob", null, null, null, null, null, null, null);
        WireEnvelope ok = new WireEnvelope("message", null, null, null, null, "bob", "hi", null, null, null, null, null, null);

        assertThat(InboundEvent.from(noText))
                .isEqualTo(new InboundEvent.Rejected("message", Protocol.MSG_INVALID_MESSAGE_PAYLOAD));
        assertThat(InboundEvent.from(ok)).isEqualTo(new InboundEvent.SendMessage("bob", "hi", List.of()));
    }

    @Test
    void messageWithNullImageEntryIsRejected() {
        WireEnvelope withNull = new WireEnvelope("message", null, null, null, null, "bob", "hi",
                Arrays.asList("a.png", null), null, null, null, null, null);

        assertThat(InboundEvent.from(withNull))
                .isEqualTo(new InboundEvent.Rejected("message", Protocol.MSG_INVALID_MESSAGE_PAYLOAD));
    }

    @Test
    void callUserDefersTargetAndTypeChecks() {
        WireEnvelope call = new WireEnvelope("callUser", null, null, null, null, null, null, null, " ", null, null, null, "fax");

        assertThat(InboundEvent.from(call)).isEqualTo(new InboundEvent.CallUser(null, null, null));
    }

    @Test
    void relayEventsNeedTarget() {
        for (String event : List.of("answerCall", "iceCandidate", "disconnectCall")) {
            InboundEvent decoded = InboundEvent.from(envelope(event));
            assertThat(decoded).isInstanceOf(InboundEvent.Rejected.class);
            assertThat(decoded.name()).isEqualTo(event);
        }
    }

    @Test
    void unknownAndMissingTags() {
        assertThat(InboundEvent.from(envelope("dance"))).isEqualTo(new InboundEvent.Unknown("dance"));
        assertThat(InboundEvent.from(envelope(null)).name()).isNull();
        assertThat(InboundEvent.from(envelope("messageList"))).isEqualTo(new InboundEvent.MessageList());
    }
}
