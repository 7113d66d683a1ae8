package com.rebenew.watchParty.syncserver.core;

import com.rebenew.watchParty.syncserver.core.SyncStateEngine.UpdateOutcome;
import com.rebenew.watchParty.syncserver.model.OutboundType;
import com.rebenew.watchParty.syncserver.model.Participant;
import com.rebenew.watchParty.syncserver.model.Room;
import com.rebenew.watchParty.syncserver.model.SyncMsg;
import com.rebenew.watchParty.syncserver.model.SyncSnapshot;
import com.rebenew.watchParty.syncserver.model.VideoState;
import com.rebenew.watchParty.syncserver.support.TestRig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SyncStateEngineTest {

    private static final String ROOM = "ROOM01";

    private TestRig rig;
    private SyncStateEngine engine;

    @BeforeEach
    void setUp() {
        rig = new TestRig();
        engine = rig.syncEngine;
        rig.connect("host", "v1", "v2", "chat");
        rig.coordinator.join("host", ROOM, "Host", true, false, null);
        rig.coordinator.join("v1", ROOM, "Viewer 1", false, false, null);
        rig.coordinator.join("v2", ROOM, "Viewer 2", false, false, null);
        rig.coordinator.join("chat", ROOM, "Chatter", false, true, null);
        rig.gateway.clear();
    }

    @Test
    void hostUpdateReachesFollowersButNotHostOrChatOnly() {
        UpdateOutcome outcome = engine.applyHostUpdate(ROOM, "host", new VideoState(10.0, true, null));

        assertThat(outcome).isEqualTo(UpdateOutcome.ACCEPTED);
        SyncSnapshot sent = (SyncSnapshot) rig.gateway.lastTo("v1", OutboundType.VIDEO_STATE_UPDATE).getData();
        assertThat(sent.currentTime()).isEqualTo(10.0);
        assertThat(sent.isPlaying()).isTrue();
        assertThat(sent.producerId()).isEqualTo("host");
        assertThat(rig.gateway.sentTo("v2", OutboundType.VIDEO_STATE_UPDATE)).hasSize(1);
        assertThat(rig.gateway.sentTo("host")).isEmpty();
        assertThat(rig.gateway.sentTo("chat")).isEmpty();
    }

    @Test
    void smallDriftWithSamePlayStateIsAbsorbed() {
        engine.applyHostUpdate(ROOM, "host", new VideoState(10.0, true, null));
        rig.gateway.clear();

        assertThat(engine.applyHostUpdate(ROOM, "host", new VideoState(10.5, true, null)))
                .isEqualTo(UpdateOutcome.INSIGNIFICANT);
        assertThat(engine.applyHostUpdate(ROOM, "host", new VideoState(9.6, true, null)))
                .isEqualTo(UpdateOutcome.INSIGNIFICANT);

        assertThat(rig.gateway.sentTo("v1")).isEmpty();
        assertThat(rig.registry.getRoom(ROOM).getSyncState().currentTime()).isEqualTo(10.0);
    }

    @Test
    void playStateChangeIsSignificantEvenWithoutDrift() {
        engine.applyHostUpdate(ROOM, "host", new VideoState(10.0, true, null));
        rig.gateway.clear();

        assertThat(engine.applyHostUpdate(ROOM, "host", new VideoState(10.1, false, null)))
                .isEqualTo(UpdateOutcome.ACCEPTED);
        assertThat(rig.gateway.sentTo("v1", OutboundType.VIDEO_STATE_UPDATE)).hasSize(1);
    }

    @Test
    void nonHostUpdateIsDiscardedAndSenderGetsStoredState() {
        engine.applyHostUpdate(ROOM, "host", new VideoState(42.0, true, null));
        SyncSnapshot stored = rig.registry.getRoom(ROOM).getSyncState();
        rig.gateway.clear();

        UpdateOutcome outcome = engine.applyHostUpdate(ROOM, "v1", new VideoState(3.0, false, null));

        assertThat(outcome).isEqualTo(UpdateOutcome.REJECTED_NOT_HOST);
        assertThat(rig.registry.getRoom(ROOM).getSyncState()).isSameAs(stored);
        assertThat(rig.gateway.sentTo("v1")).hasSize(1);
        assertThat(rig.gateway.lastTo("v1", OutboundType.VIDEO_STATE_UPDATE).getData()).isEqualTo(stored);
        assertThat(rig.gateway.sentTo("v2")).isEmpty();
    }

    @Test
    void nonHostUpdateWithoutStoredStateSendsNothing() {
        assertThat(engine.applyHostUpdate(ROOM, "v1", new VideoState(3.0, false, null)))
                .isEqualTo(UpdateOutcome.REJECTED_NOT_HOST);

        assertThat(rig.registry.getRoom(ROOM).getSyncState()).isNull();
        assertThat(rig.gateway.sentTo("v1")).isEmpty();
    }

    @Test
    void invalidAndMissingRoomUpdatesAreReported() {
        assertThat(engine.applyHostUpdate("NOPE", "host", new VideoState(1.0, true, null)))
                .isEqualTo(UpdateOutcome.ROOM_NOT_FOUND);
        assertThat(engine.applyHostUpdate(ROOM, "host", new VideoState(null, true, null)))
                .isEqualTo(UpdateOutcome.INVALID);
        assertThat(engine.applyHostUpdate(ROOM, "host", new VideoState(-1.0, true, null)))
                .isEqualTo(UpdateOutcome.INVALID);
        assertThat(engine.applyHostUpdate(ROOM, "host", null)).isEqualTo(UpdateOutcome.INVALID);
    }

    @Test
    void seekReportsRelayLatency() {
        long now = rig.clock.millis();

        UpdateOutcome outcome = engine.applySeek(ROOM, "host", 120.0, true, now - 150);

        assertThat(outcome).isEqualTo(UpdateOutcome.ACCEPTED);
        Map<String, Object> data = rig.gateway.lastTo("v1", OutboundType.VIDEO_SEEK_OPERATION).getDataAsMap();
        assertThat(data.get("seekTime")).isEqualTo(120.0);
        assertThat(data.get("serverTimestamp")).isEqualTo(now);
        assertThat(data.get("relayLatencyMs")).isEqualTo(150L);
        assertThat(rig.gateway.sentTo("host")).isEmpty();
        assertThat(rig.gateway.sentTo("chat")).isEmpty();

        SyncSnapshot stored = rig.registry.getRoom(ROOM).getSyncState();
        assertThat(stored.currentTime()).isEqualTo(120.0);
        assertThat(stored.seek()).isTrue();
    }

    @Test
    void seekFollowsHostAuthorityAndThreshold() {
        assertThat(engine.applySeek(ROOM, "v1", 50.0, true, null)).isEqualTo(UpdateOutcome.REJECTED_NOT_HOST);

        engine.applySeek(ROOM, "host", 50.0, true, null);
        rig.gateway.clear();

        assertThat(engine.applySeek(ROOM, "host", 50.2, true, null)).isEqualTo(UpdateOutcome.INSIGNIFICANT);
        assertThat(rig.gateway.sentTo("v1")).isEmpty();
    }

    @Test
    void fallbackSyncGoesToNamedTargetOnly() {
        UpdateOutcome outcome = engine.fallbackSync(ROOM, "v1", 33.0, true, "v2");

        assertThat(outcome).isEqualTo(UpdateOutcome.ACCEPTED);
        assertThat(rig.gateway.sentTo("v2", OutboundType.FALLBACK_SYNC_STATE)).hasSize(1);
        assertThat(rig.gateway.sentTo("host")).isEmpty();
        assertThat(rig.registry.getRoom(ROOM).getSyncState().producerId()).isEqualTo("v1");
    }

    @Test
    void fallbackSyncWithUnknownTargetBroadcastsToFollowersExceptSender() {
        engine.fallbackSync(ROOM, "v1", 33.0, false, "gone");

        assertThat(rig.gateway.sentTo("v2", OutboundType.FALLBACK_SYNC_STATE)).hasSize(1);
        assertThat(rig.gateway.sentTo("host", OutboundType.FALLBACK_SYNC_STATE)).hasSize(1);
        assertThat(rig.gateway.sentTo("v1")).isEmpty();
        assertThat(rig.gateway.sentTo("chat")).isEmpty();
    }

    @Test
    void fallbackSyncFromOutsiderIsDropped() {
        assertThat(engine.fallbackSync(ROOM, "stranger", 33.0, true, null)).isEqualTo(UpdateOutcome.INVALID);
        assertThat(rig.registry.getRoom(ROOM).getSyncState()).isNull();
    }

    @Test
    void joinerSnapshotOnlyWhenFreshAndForFollowers() {
        engine.applyHostUpdate(ROOM, "host", new VideoState(10.0, true, null));
        Room room = rig.registry.getRoom(ROOM);
        Participant viewer = room.findParticipant("v1").orElseThrow();
        Participant host = room.findParticipant("host").orElseThrow();
        Participant chat = room.findParticipant("chat").orElseThrow();

        rig.clock.advance(Duration.ofSeconds(119));
        assertThat(engine.snapshotForJoiner(room, viewer)).isPresent();
        assertThat(engine.snapshotForJoiner(room, host)).isEmpty();
        assertThat(engine.snapshotForJoiner(room, chat)).isEmpty();

        rig.clock.advance(Duration.ofSeconds(2));
        assertThat(engine.snapshotForJoiner(room, viewer)).isEmpty();
    }

    @Test
    void rejectedSenderIsNotEchoedToOthers() {
        engine.applyHostUpdate(ROOM, "host", new VideoState(1.0, true, null));
        rig.gateway.clear();

        engine.applySeek(ROOM, "v2", 99.0, true, null);

        for (SyncMsg msg : rig.gateway.sentTo("v1")) {
            assertThat(msg.getType()).isNotEqualTo(OutboundType.VIDEO_SEEK_OPERATION);
        }
        assertThat(rig.gateway.sentTo("v2")).hasSize(1);
    }
}
