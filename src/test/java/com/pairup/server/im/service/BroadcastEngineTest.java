package com.pairup.server.im.service;

import com.pairup.server.im.event.EventCodec;
import com.pairup.server.im.event.TypingEvent;
import com.pairup.server.im.exception.StoreUnavailableException;
import com.pairup.server.im.session.ConcurrentPresenceRegistry;
import com.pairup.server.im.support.InMemoryChatStore;
import com.pairup.server.im.support.RecordingConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BroadcastEngineTest {

    private InMemoryChatStore store;
    private ConcurrentPresenceRegistry presence;
    private BroadcastEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryChatStore();
        presence = new ConcurrentPresenceRegistry();
        engine = new BroadcastEngine(store, presence, new EventCodec());
        store.givenGroupChat("c1", 1L, 2L, 3L, 4L);
    }

    private static TypingEvent typing(long userId) {
        TypingEvent event = new TypingEvent();
        event.setChatId("c1");
        event.setUserId(userId);
        event.setTyping(true);
        return event;
    }

    @Test
    void slowConnectionDoesNotStopOthers() {
        RecordingConnection saturated = new RecordingConnection("a");
        saturated.refuseWrites();
        RecordingConnection healthy = new RecordingConnection("b");
        presence.register(1L, saturated);
        presence.register(2L, healthy);

        BroadcastReport report = engine.broadcast("c1", typing(9L));

        assertThat(healthy.frames()).hasSize(1);
        assertThat(report.getDelivered()).containsExactly(2L);
        assertThat(report.getFailed()).containsExactly(1L);
        assertThat(report.getOffline()).containsExactly(3L, 4L);
    }

    @Test
    void excludedUserGetsNothingAndIsNotOffline() {
        RecordingConnection conn1 = new RecordingConnection("a");
        presence.register(1L, conn1);

        BroadcastReport report = engine.broadcast("c1", typing(1L), 1L);

        assertThat(conn1.frames()).isEmpty();
        assertThat(report.getOffline()).containsExactly(2L, 3L, 4L);
    }

    @Test
    void onlineNonParticipantReceivesNothing() {
        RecordingConnection stranger = new RecordingConnection("x");
        presence.register(99L, stranger);

        engine.broadcast("c1", typing(1L));

        assertThat(stranger.frames()).isEmpty();
    }

    @Test
    void participantLookupFailureYieldsEmptyReport() {
        RecordingConnection conn1 = new RecordingConnection("a");
        presence.register(1L, conn1);
        store.failWith(new StoreUnavailableException("down", null));

        BroadcastReport report = engine.broadcast("c1", typing(2L));

        assertThat(conn1.frames()).isEmpty();
        assertThat(report.getDelivered()).isEmpty();
        assertThat(report.getOffline()).isEmpty();
    }

    @Test
    void connectionThrowingIsCountedAsFailed() {
        presence.register(1L, new RecordingConnection("a") {
            @Override
            public boolean send(String frame) {
                throw new IllegalStateException("broken pipe");
            }
        });
        RecordingConnection conn2 = new RecordingConnection("b");
        presence.register(2L, conn2);

        BroadcastReport report = engine.broadcast("c1", typing(3L));

        assertThat(report.getFailed()).containsExactly(1L);
        assertThat(conn2.frames()).hasSize(1);
    }
}
