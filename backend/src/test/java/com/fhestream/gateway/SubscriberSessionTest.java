package com.fhestream.gateway;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriberSessionTest {

    private final SubscriberSession session =
            new SubscriberSession(new StreamRequest(StreamChannel.GLOBAL, null, "m0", null), Instant.EPOCH);

    @Test
    void liveCopyOfReplayedEvent_isSkippedOnceAndForgotten() {
        assertThat(session.markReplayed("m1")).isTrue();
        assertThat(session.markReplayed("m1")).isFalse();

        assertThat(session.acceptLive("m1")).isFalse();
        assertThat(session.replayedIdCount()).isZero();
        assertThat(session.acceptLive("m2")).isTrue();
        assertThat(session.watermarkEventId()).isEqualTo("m2");
    }

    @Test
    void liveEvents_doNotAccumulateIds() {
        for (int i = 0; i < 10_000; i++) {
            assertThat(session.acceptLive("live-" + i)).isTrue();
        }

        assertThat(session.replayedIdCount()).isZero();
        assertThat(session.watermarkEventId()).isEqualTo("live-9999");
    }

    @Test
    void replayedIds_areBounded_keepingTheNewest() {
        int replayed = SubscriberSession.MAX_REPLAYED_IDS * 3;
        for (int i = 0; i < replayed; i++) {
            session.markReplayed("r-" + i);
        }

        assertThat(session.replayedIdCount()).isEqualTo(SubscriberSession.MAX_REPLAYED_IDS);
        assertThat(session.acceptLive("r-" + (replayed - 1))).isFalse();
        assertThat(session.acceptLive("r-0")).isTrue();
    }
}
