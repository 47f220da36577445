package com.pairup.server.im.push;

import com.pairup.server.im.exception.ErrorKind;
import com.pairup.server.im.exception.MessagingException;
import com.pairup.server.im.exception.NotFoundException;
import com.pairup.server.im.exception.PushDeliveryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PushNotificationServiceTest {

    private static final NotificationPayload PAYLOAD = NotificationPayload.builder()
            .title("Ana").body("hi").sound("default").badge(1).build();

    private PushTokenRepository repository;
    private PushGateway gateway;
    private PushNotificationService service;

    @BeforeEach
    void setUp() {
        repository = mock(PushTokenRepository.class);
        gateway = mock(PushGateway.class);
        service = new PushNotificationService(repository, gateway,
                Clock.fixed(Instant.ofEpochMilli(1234), ZoneOffset.UTC));
    }

    private static PushToken token(String value) {
        return new PushToken(5L, value, Platform.IOS, "device-" + value, 0L);
    }

    @Test
    void savesParsedToken() {
        service.saveToken(5L, "tok", "Android", "pixel");

        ArgumentCaptor<PushToken> saved = ArgumentCaptor.forClass(PushToken.class);
        verify(repository).save(saved.capture());
        assertThat(saved.getValue().getPlatform()).isEqualTo(Platform.ANDROID);
        assertThat(saved.getValue().getLastSeenAt()).isEqualTo(1234L);
        assertThat(saved.getValue().getDeviceId()).isEqualTo("pixel");
    }

    @Test
    void rejectsUnknownPlatformAndEmptyToken() {
        assertThatThrownBy(() -> service.saveToken(5L, "tok", "windows", null))
                .isInstanceOfSatisfying(MessagingException.class, e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_REQUEST));
        assertThatThrownBy(() -> service.saveToken(5L, " ", "ios", null))
                .isInstanceOf(MessagingException.class);
        verify(repository, never()).save(any());
    }

    @Test
    void deletingForeignTokenIsNotFound() {
        when(repository.delete(5L, "tok")).thenReturn(false);

        assertThatThrownBy(() -> service.deleteToken(5L, "tok")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void oneSuccessfulDeliveryIsEnough() {
        when(repository.findByUser(5L)).thenReturn(List.of(token("a"), token("b")));
        when(gateway.deliver(token("a"), PAYLOAD)).thenReturn(DeliveryOutcome.FAILED);
        when(gateway.deliver(token("b"), PAYLOAD)).thenReturn(DeliveryOutcome.DELIVERED);

        service.sendNotification(5L, PAYLOAD);
    }

    @Test
    void invalidTokensAreForgotten() {
        when(repository.findByUser(5L)).thenReturn(List.of(token("stale"), token("good")));
        when(gateway.deliver(token("stale"), PAYLOAD)).thenReturn(DeliveryOutcome.INVALID_TOKEN);
        when(gateway.deliver(token("good"), PAYLOAD)).thenReturn(DeliveryOutcome.DELIVERED);

        service.sendNotification(5L, PAYLOAD);

        verify(repository).delete(5L, "stale");
        verify(repository, never()).delete(anyLong(), eq("good"));
    }

    @Test
    void failsWhenNothingWasDelivered() {
        when(repository.findByUser(5L)).thenReturn(List.of(token("a")));
        when(gateway.deliver(any(), any())).thenThrow(new IllegalStateException("provider down"));

        assertThatThrownBy(() -> service.sendNotification(5L, PAYLOAD)).isInstanceOf(PushDeliveryException.class);
    }

    @Test
    void failsWhenUserHasNoTokens() {
        when(repository.findByUser(5L)).thenReturn(List.of());

        assertThatThrownBy(() -> service.sendNotification(5L, PAYLOAD))
                .isInstanceOfSatisfying(PushDeliveryException.class, e -> assertThat(e.getKind()).isEqualTo(ErrorKind.PUSH_FAILED));
        verify(gateway, never()).deliver(any(), any());
        verify(repository, never()).delete(anyLong(), anyString());
    }
}
