package com.rebenew.watchParty.syncserver.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.watchParty.syncserver.core.SignalingRelay.RelayOutcome;
import com.rebenew.watchParty.syncserver.model.OutboundType;
import com.rebenew.watchParty.syncserver.support.TestRig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SignalingRelayTest {

    private static final String ROOM = "ROOM01";

    private TestRig rig;
    private SignalingRelay relay;

    @BeforeEach
    void setUp() {
        rig = new TestRig();
        relay = rig.signaling;
        rig.connect("host", "viewer", "chat");
        rig.coordinator.join("host", ROOM, "Host", true, false, null);
        rig.coordinator.join("viewer", ROOM, "Viewer", false, false, null);
        rig.coordinator.join("chat", ROOM, "Chatter", false, true, null);
        rig.gateway.clear();
    }

    @Test
    void peerIdIsAnnouncedToFollowers() {
        assertThat(relay.registerPeer(ROOM, "host", "peer-host", null)).isTrue();

        Map<String, Object> data = rig.gateway.lastTo("viewer", OutboundType.PEER_ID).getDataAsMap();
        assertThat(data).containsEntry("socketId", "host")
                .containsEntry("peerId", "peer-host")
                .containsEntry("isHost", true);
        assertThat(rig.gateway.sentTo("host", OutboundType.PEER_ID)).hasSize(1);
        assertThat(rig.gateway.sentTo("chat")).isEmpty();
        assertThat(relay.connectionForPeer("peer-host")).isEqualTo("host");
        assertThat(relay.peerForConnection("host")).isEqualTo("peer-host");
    }

    @Test
    void reRegistrationDropsStaleMapping() {
        relay.registerPeer(ROOM, "viewer", "peer-old", null);
        rig.connect("viewer-2");

        relay.registerPeer(ROOM, "viewer-2", "peer-new", "viewer");

        assertThat(relay.peerForConnection("viewer")).isNull();
        assertThat(relay.connectionForPeer("peer-old")).isNull();
        assertThat(relay.connectionForPeer("peer-new")).isEqualTo("viewer-2");
    }

    @Test
    void samePeerIdMovesToNewConnection() {
        relay.registerPeer(ROOM, "viewer", "peer-v", null);
        rig.connect("viewer-2");

        relay.registerPeer(ROOM, "viewer-2", "peer-v", null);

        assertThat(relay.connectionForPeer("peer-v")).isEqualTo("viewer-2");
        assertThat(relay.peerForConnection("viewer")).isNull();
    }

    @Test
    void blankPeerIdIsIgnored() {
        assertThat(relay.registerPeer(ROOM, "viewer", " ", null)).isFalse();
        assertThat(rig.gateway.sentTo("host")).isEmpty();
    }

    @Test
    void signalsAreForwardedWithSenderAsOrigin() throws Exception {
        JsonNode offer = new ObjectMapper().readTree("{\"sdp\":\"v=0\",\"type\":\"offer\"}");

        assertThat(relay.forwardSignal("host", "viewer", offer, "offer")).isTrue();

        Map<String, Object> data = rig.gateway.lastTo("viewer", OutboundType.SIGNAL).getDataAsMap();
        assertThat(data).containsEntry("from", "host").containsEntry("signalType", "offer");
        assertThat(data.get("signal")).isEqualTo(offer);
    }

    @Test
    void iceCandidatesCanTargetPeerIds() throws Exception {
        relay.registerPeer(ROOM, "viewer", "peer-v", null);
        JsonNode candidate = new ObjectMapper().readTree("{\"candidate\":\"candidate:1 1 udp\"}");

        assertThat(relay.forwardIceCandidate("host", "peer-v", candidate)).isTrue();

        assertThat(rig.gateway.lastTo("viewer", OutboundType.ICE_CANDIDATE).getDataAsMap())
                .containsEntry("from", "host");
    }

    @Test
    void forwardingToVanishedTargetFailsQuietly() {
        rig.gateway.close("viewer");

        assertThat(relay.forwardSignal("host", "viewer", null, "answer")).isFalse();
        assertThat(relay.forwardIceCandidate("host", null, null)).isFalse();
        assertThat(rig.gateway.sentTo("host")).isEmpty();
    }

    @Test
    void connectionFailureAsksTargetToReconnect() {
        relay.registerPeer(ROOM, "viewer", "peer-v", null);
        rig.gateway.clear();

        assertThat(relay.reportConnectionFailure(ROOM, "host", "peer-v")).isEqualTo(RelayOutcome.FORWARDED);
        assertThat(rig.gateway.lastTo("viewer", OutboundType.WEBRTC_RECONNECT_REQUESTED).getDataAsMap())
                .containsEntry("requestedBy", "host");
    }

    @Test
    void connectionFailureTowardsChatOnlyNeedsNoStream() {
        relay.registerPeer(ROOM, "chat", "peer-c", null);

        assertThat(relay.reportConnectionFailure(ROOM, "host", "peer-c")).isEqualTo(RelayOutcome.TARGET_CHAT_ONLY);
        assertThat(rig.gateway.sentTo("host", OutboundType.WEBRTC_NO_STREAM_NEEDED)).hasSize(1);
        assertThat(rig.gateway.sentTo("chat")).isEmpty();
    }

    @Test
    void connectionFailureTowardsUnknownPeerIsUnreachable() {
        assertThat(relay.reportConnectionFailure(ROOM, "host", "peer-x")).isEqualTo(RelayOutcome.TARGET_UNREACHABLE);
        assertThat(rig.gateway.lastTo("host", OutboundType.WEBRTC_TARGET_UNREACHABLE).getDataAsMap())
                .containsEntry("targetPeerId", "peer-x");
    }

    @Test
    void reconnectionRequestGoesToHost() {
        relay.registerPeer(ROOM, "viewer", "peer-v", null);

        assertThat(relay.requestReconnection(ROOM, "viewer", null)).isEqualTo(RelayOutcome.FORWARDED);
        assertThat(rig.gateway.lastTo("host", OutboundType.VIEWER_RECONNECTION_REQUEST).getDataAsMap())
                .containsEntry("viewerSocketId", "viewer")
                .containsEntry("viewerPeerId", "peer-v");
    }

    @Test
    void reconnectionRequestFailsWithoutHost() {
        rig.coordinator.leave("host");
        rig.gateway.clear();

        assertThat(relay.requestReconnection(ROOM, "viewer", "peer-v")).isEqualTo(RelayOutcome.NO_HOST);
        assertThat(rig.gateway.lastTo("viewer", OutboundType.RECONNECTION_FAILED).getDataAsMap())
                .containsEntry("reason", "host_not_available");

        assertThat(relay.requestReconnection("NOPE", "viewer", "peer-v")).isEqualTo(RelayOutcome.ROOM_NOT_FOUND);
    }

    @Test
    void disconnectForgetsPeerMapping() {
        relay.registerPeer(ROOM, "viewer", "peer-v", null);

        rig.drop("viewer");

        assertThat(relay.connectionForPeer("peer-v")).isNull();
    }
}
