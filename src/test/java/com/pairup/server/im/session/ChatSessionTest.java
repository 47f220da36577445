package com.pairup.server.im.session;

import com.pairup.server.im.event.ChatEvent;
import com.pairup.server.im.event.EventCodec;
import com.pairup.server.im.event.TypingEvent;
import com.pairup.server.im.handler.EventRouter;
import com.pairup.server.im.support.RecordingConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ChatSessionTest {

    private ConcurrentPresenceRegistry presence;
    private EventRouter router;
    private RecordingConnection connection;
    private ChatSession session;

    @BeforeEach
    void setUp() {
        presence = new ConcurrentPresenceRegistry();
        router = mock(EventRouter.class);
        connection = new RecordingConnection("conn");
        session = new ChatSession(1L, connection, presence, new EventCodec(), router);
    }

    @Test
    void openRegistersAndStartsReading() {
        session.open();

        assertThat(session.getState()).isEqualTo(SessionState.READING);
        assertThat(presence.lookup(1L)).containsSame(connection);
    }

    @Test
    void framesAreDecodedAndRoutedAsTheSessionUser() {
        session.open();

        session.onFrame("{\"type\":\"typing\",\"chat_id\":\"c1\",\"is_typing\":true}");

        ArgumentCaptor<ChatEvent> event = ArgumentCaptor.forClass(ChatEvent.class);
        verify(router).route(eq(1L), event.capture());
        assertThat(event.getValue()).isInstanceOf(TypingEvent.class);
        assertThat(((TypingEvent) event.getValue()).isTyping()).isTrue();
    }

    @Test
    void badFramesAreSkippedAndSessionStaysOpen() {
        session.open();

        session.onFrame("not json");
        session.onFrame("{\"type\":\"dance\",\"chat_id\":\"c1\"}");
        session.onFrame("{\"type\":\"typing\",\"chat_id\":\"c1\"}");

        verify(router, times(1)).route(anyLong(), any());
        assertThat(session.getState()).isEqualTo(SessionState.READING);
        assertThat(connection.isOpen()).isTrue();
    }

    @Test
    void routingFailureDoesNotEndSession() {
        doThrow(new IllegalStateException("boom")).when(router).route(anyLong(), any());
        session.open();

        session.onFrame("{\"type\":\"typing\",\"chat_id\":\"c1\"}");

        assertThat(session.getState()).isEqualTo(SessionState.READING);
    }

    @Test
    void closeIsIdempotentAndUnregisters() {
        session.open();

        session.close();
        session.close();

        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
        assertThat(presence.lookup(1L)).isEmpty();
        assertThat(connection.isOpen()).isFalse();
    }

    @Test
    void closingReplacedSessionKeepsNewerRegistration() {
        session.open();
        RecordingConnection newer = new RecordingConnection("newer");
        ChatSession replacement = new ChatSession(1L, newer, presence, new EventCodec(), router);
        replacement.open();

        session.close();

        assertThat(presence.lookup(1L)).containsSame(newer);
    }

    @Test
    void framesAfterCloseAreIgnored() {
        session.open();
        session.close();

        session.onFrame("{\"type\":\"typing\",\"chat_id\":\"c1\"}");

        verify(router, never()).route(anyLong(), any());
    }

    @Test
    void closedSessionCannotBeReopened() {
        session.close();
        session.open();

        assertThat(session.getState()).isEqualTo(SessionState.CLOSED);
        assertThat(presence.lookup(1L)).isEmpty();
    }
}
