package com.pairup.server.im.service;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONObject;
import com.pairup.server.im.event.EventCodec;
import com.pairup.server.im.exception.DuplicateIdException;
import com.pairup.server.im.exception.ErrorKind;
import com.pairup.server.im.exception.InvalidReactionCodeException;
import com.pairup.server.im.exception.MessagingException;
import com.pairup.server.im.exception.NotFoundException;
import com.pairup.server.im.exception.NotParticipantException;
import com.pairup.server.im.exception.StoreUnavailableException;
import com.pairup.server.im.profile.ProfileDirectory;
import com.pairup.server.im.profile.UserProfile;
import com.pairup.server.im.push.NotificationPayload;
import com.pairup.server.im.push.PushService;
import com.pairup.server.im.session.ConcurrentPresenceRegistry;
import com.pairup.server.im.store.Chat;
import com.pairup.server.im.store.StoredMessage;
import com.pairup.server.im.support.InMemoryChatStore;
import com.pairup.server.im.support.RecordingConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MessagingServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryChatStore store;
    private ConcurrentPresenceRegistry presence;
    private PushService pushService;
    private ProfileDirectory profiles;
    private ExecutorService pushExecutor;
    private ScheduledExecutorService scheduler;
    private MessagingService service;

    private RecordingConnection conn1;
    private RecordingConnection conn2;

    @BeforeEach
    void setUp() {
        store = new InMemoryChatStore();
        presence = new ConcurrentPresenceRegistry();
        pushService = mock(PushService.class);
        profiles = mock(ProfileDirectory.class);
        when(profiles.find(anyLong())).thenAnswer(inv -> {
            long id = inv.getArgument(0);
            return Optional.of(new UserProfile(id, "user" + id, null));
        });
        pushExecutor = Executors.newSingleThreadExecutor();
        scheduler = Executors.newSingleThreadScheduledExecutor();

        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        EventCodec codec = new EventCodec();
        BroadcastEngine engine = new BroadcastEngine(store, presence, codec);
        PresenceAwareNotifier notifier = new PresenceAwareNotifier(store, profiles, pushService, pushExecutor, scheduler, 5000);
        service = new MessagingService(store, engine, notifier, new DirectChatResolver(store, clock),
                new ReactionCatalog(List.of("like", "laugh", "clap", "heart", "wow")), profiles, clock, 50, 200);

        store.givenGroupChat("c1", 1L, 2L, 3L);
        conn1 = new RecordingConnection("conn-1");
        conn2 = new RecordingConnection("conn-2");
        presence.register(1L, conn1);
        presence.register(2L, conn2);
    }

    @AfterEach
    void tearDown() {
        pushExecutor.shutdownNow();
        scheduler.shutdownNow();
    }

    @Test
    void messageReachesOnlineParticipantsAndPushesOfflineOnes() {
        MessageResult result = service.sendMessage(1L, "c1", "m1", "hi");

        assertThat(result.isDuplicate()).isFalse();
        assertThat(result.getMessage().getSeq()).isEqualTo(1L);
        assertThat(result.getMessage().getSentAt()).isEqualTo(NOW);

        assertThat(conn1.frames()).hasSize(1);
        assertThat(conn2.frames()).hasSize(1);
        JSONObject frame = JSON.parseObject(conn2.frames().get(0));
        assertThat(frame.getString("type")).isEqualTo("chat_message");
        assertThat(frame.getString("chat_id")).isEqualTo("c1");
        assertThat(frame.getString("message_id")).isEqualTo("m1");
        assertThat(frame.getLong("sender_id")).isEqualTo(1L);
        assertThat(frame.getString("content")).isEqualTo("hi");
        assertThat(frame.getString("sent_at")).isEqualTo(NOW.toString());

        verify(pushService, timeout(1000)).sendNotification(eq(3L), any(NotificationPayload.class));
        verify(pushService, after(200).never()).sendNotification(eq(1L), any(NotificationPayload.class));
        verify(pushService, never()).sendNotification(eq(2L), any(NotificationPayload.class));
    }

    @Test
    void duplicateMessageIdIsIdempotent() {
        service.sendMessage(1L, "c1", "m1", "hi");
        MessageResult again = service.sendMessage(1L, "c1", "m1", "hi again");

        assertThat(again.isDuplicate()).isTrue();
        assertThat(again.getMessage().getMessageId()).isEqualTo("m1");
        assertThat(again.getMessage().getContent()).isEqualTo("hi");
        assertThat(store.messageCount()).isEqualTo(1);
        assertThat(service.messages(2L, "c1", null, null))
                .extracting(StoredMessage::getContent)
                .containsExactly("hi");
        assertThat(conn2.frames()).hasSize(1);
        verify(pushService, timeout(1000).times(1)).sendNotification(eq(3L), any(NotificationPayload.class));
    }

    @Test
    void duplicateIdOfAnotherSendersMessageIsRejected() {
        service.sendMessage(1L, "c1", "m1", "hi");

        assertThatThrownBy(() -> service.sendMessage(2L, "c1", "m1", "mine"))
                .isInstanceOf(DuplicateIdException.class);
        assertThat(conn1.frames()).hasSize(1);
    }

    @Test
    void senderWithoutConnectionIsNotPushed() {
        presence.unregister(1L);

        service.sendMessage(1L, "c1", "m1", "hi");

        verify(pushService, timeout(1000)).sendNotification(eq(3L), any(NotificationPayload.class));
        verify(pushService, after(200).never()).sendNotification(eq(1L), any(NotificationPayload.class));
    }

    @Test
    void nonParticipantCannotSend() {
        assertThatThrownBy(() -> service.sendMessage(9L, "c1", "m1", "hi"))
                .isInstanceOf(NotParticipantException.class);
        assertThat(store.messageInsertAttempts()).isZero();
        assertThat(conn1.frames()).isEmpty();
    }

    @Test
    void blankContentIsRejected() {
        assertThatThrownBy(() -> service.sendMessage(1L, "c1", "m1", "  "))
                .isInstanceOfSatisfying(MessagingException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_REQUEST));
    }

    @Test
    void storeFailureSurfacesWithoutBroadcast() {
        store.failWith(new StoreUnavailableException("down", null));

        assertThatThrownBy(() -> service.sendMessage(1L, "c1", "m1", "hi"))
                .isInstanceOf(StoreUnavailableException.class);
        assertThat(conn2.frames()).isEmpty();
    }

    @Test
    void reactionIsBroadcastOnce() {
        service.sendMessage(1L, "c1", "m1", "hi");

        assertThat(service.addReaction(2L, "r1", "m1", "like")).isTrue();
        assertThat(service.addReaction(2L, "r1", "m1", "like")).isFalse();

        assertThat(store.reactions()).hasSize(1);
        assertThat(conn1.frames()).hasSize(2);
        JSONObject frame = JSON.parseObject(conn1.frames().get(1));
        assertThat(frame.getString("type")).isEqualTo("reaction");
        assertThat(frame.getString("reaction_id")).isEqualTo("r1");
        assertThat(frame.getLong("user_id")).isEqualTo(2L);
        assertThat(frame.getString("reaction_code")).isEqualTo("like");
    }

    @Test
    void unknownReactionCodeIsRejectedBeforeAnyWrite() {
        service.sendMessage(1L, "c1", "m1", "hi");

        assertThatThrownBy(() -> service.addReaction(2L, "r1", "m1", "boo"))
                .isInstanceOf(InvalidReactionCodeException.class);
        assertThat(store.reactions()).isEmpty();
    }

    @Test
    void nonParticipantCannotReact() {
        service.sendMessage(1L, "c1", "m1", "hi");

        assertThatThrownBy(() -> service.addReaction(9L, "r1", "m1", "like"))
                .isInstanceOf(NotParticipantException.class);
        assertThat(store.reactions()).isEmpty();
        assertThat(conn2.frames()).hasSize(1);
    }

    @Test
    void reactionOnUnknownMessageIsNotFound() {
        assertThatThrownBy(() -> service.addReaction(1L, "r1", "nope", "like"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void removingAbsentReactionStillBroadcasts() {
        service.sendMessage(1L, "c1", "m1", "hi");

        int removed = service.removeReaction(2L, "m1", "heart");

        assertThat(removed).isZero();
        JSONObject frame = JSON.parseObject(conn1.frames().get(1));
        assertThat(frame.getString("type")).isEqualTo("remove_reaction");
        assertThat(frame.getString("reaction_code")).isEqualTo("heart");
    }

    @Test
    void removingReactionWithoutCodeIsRejected() {
        service.sendMessage(1L, "c1", "m1", "hi");

        assertThatThrownBy(() -> service.removeReaction(2L, "m1", " "))
                .isInstanceOfSatisfying(MessagingException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_REQUEST));
        assertThat(conn1.frames()).hasSize(1);
    }

    @Test
    void removingReactionDeletesAllOfUsersCode() {
        service.sendMessage(1L, "c1", "m1", "hi");
        service.addReaction(2L, "r1", "m1", "like");
        service.addReaction(2L, "r2", "m1", "like");
        service.addReaction(1L, "r3", "m1", "like");

        assertThat(service.removeReaction(2L, "m1", "like")).isEqualTo(2);
        assertThat(store.reactions()).extracting("reactionId").containsExactly("r3");
    }

    @Test
    void typingIsNotEchoedToSender() {
        service.typing(1L, "c1", true);

        assertThat(conn1.frames()).isEmpty();
        JSONObject frame = JSON.parseObject(conn2.frames().get(0));
        assertThat(frame.getString("type")).isEqualTo("typing");
        assertThat(frame.getBoolean("is_typing")).isTrue();
        assertThat(store.typingAt(1L, "c1")).contains(NOW);
    }

    @Test
    void readReceiptOnlyRaisesHighWaterMark() {
        service.sendMessage(1L, "c1", "m1", "one");
        service.sendMessage(1L, "c1", "m2", "two");

        service.readReceipt(2L, "c1", "m2");
        service.readReceipt(2L, "c1", "m1");

        assertThat(store.readMark(2L, "c1")).contains(2L);
        JSONObject frame = JSON.parseObject(conn1.frames().get(conn1.frames().size() - 1));
        assertThat(frame.getString("type")).isEqualTo("read_receipt");
        assertThat(frame.getString("message_id")).isEqualTo("m1");
    }

    @Test
    void readReceiptForMessageOfOtherChatIsNotFound() {
        store.givenGroupChat("c2", 1L, 2L);
        service.sendMessage(1L, "c2", "m9", "elsewhere");

        assertThatThrownBy(() -> service.readReceipt(2L, "c1", "m9"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void createdChatAlwaysContainsCreator() {
        String chatId = service.createChat(5L, null, "team", List.of(6L, 7L));

        Chat chat = store.findChat(chatId).orElseThrow();
        assertThat(chat.getParticipants()).containsExactly(5L, 6L, 7L);
        assertThat(chat.isGroup()).isTrue();
        assertThat(chat.getChatName()).isEqualTo("team");
    }

    @Test
    void createChatWithTakenIdIsDuplicate() {
        assertThatThrownBy(() -> service.createChat(1L, "c1", "again", List.of(2L)))
                .isInstanceOf(DuplicateIdException.class);
    }

    @Test
    void createChatNeedsParticipants() {
        assertThatThrownBy(() -> service.createChat(1L, null, "empty", List.of()))
                .isInstanceOfSatisfying(MessagingException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_REQUEST));
    }

    @Test
    void directChatIsNamedAfterOtherParticipant() {
        String chatId = service.getOrCreateDirectChat(1L, 4L);

        Chat seenBy1 = service.chat(1L, chatId);
        Chat seenBy4 = service.chat(4L, chatId);

        assertThat(seenBy1.getChatName()).isEqualTo("user4");
        assertThat(seenBy4.getChatName()).isEqualTo("user1");
    }

    @Test
    void messagesPageNewestFirstWithDefaultsAndCap() {
        for (int i = 1; i <= 5; i++) {
            service.sendMessage(1L, "c1", "m" + i, "text " + i);
        }

        List<StoredMessage> page = service.messages(2L, "c1", 2, 1);
        assertThat(page).extracting(StoredMessage::getMessageId).containsExactly("m4", "m3");

        assertThat(service.messages(2L, "c1", null, -3)).hasSize(5);
        assertThat(service.messages(2L, "c1", 10_000, 0)).hasSize(5);
    }

    @Test
    void participantsCanOnlyRemoveThemselves() {
        assertThatThrownBy(() -> service.removeParticipant(1L, "c1", 2L))
                .isInstanceOfSatisfying(MessagingException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.FORBIDDEN));

        service.removeParticipant(2L, "c1", 2L);
        assertThat(store.isParticipant(2L, "c1")).isFalse();
    }

    @Test
    void directChatsCannotGainParticipants() {
        String chatId = service.getOrCreateDirectChat(1L, 2L);

        assertThatThrownBy(() -> service.addParticipant(1L, chatId, 3L))
                .isInstanceOfSatisfying(MessagingException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_REQUEST));
    }

    @Test
    void addedParticipantReceivesLaterMessages() {
        RecordingConnection conn8 = new RecordingConnection("conn-8");
        presence.register(8L, conn8);

        service.addParticipant(1L, "c1", 8L);
        service.sendMessage(1L, "c1", "m1", "welcome");

        assertThat(conn8.frames()).hasSize(1);
    }
}
