package me.golemcore.cognition.adapter.outbound.notification;

import me.golemcore.cognition.domain.model.ProactiveMessage;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class NotificationAdapterFactoryTest {

    private BotProperties properties;
    private NotificationChannelAdapter webhook;
    private LogNotificationAdapter logAdapter;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        webhook = mock(NotificationChannelAdapter.class);
        when(webhook.getChannelType()).thenReturn("webhook");
        when(webhook.send(any())).thenReturn(CompletableFuture.completedFuture(true));
        logAdapter = new LogNotificationAdapter();
    }

    private NotificationAdapterFactory factory() {
        NotificationAdapterFactory factory = new NotificationAdapterFactory(properties, List.of(logAdapter, webhook));
        factory.init();
        return factory;
    }

    @Test
    void shouldUseConfiguredChannel() {
        properties.getNotification().setChannel("webhook");
        when(webhook.isAvailable()).thenReturn(true);

        NotificationAdapterFactory factory = factory();
        factory.send(ProactiveMessage.builder().content("hi").build());

        assertEquals("webhook", factory.getChannelType());
        verify(webhook).send(any());
    }

    @Test
    void shouldFallBackToLogWhenChannelUnusable() {
        properties.getNotification().setChannel("webhook");
        when(webhook.isAvailable()).thenReturn(false);

        assertEquals("log", factory().getChannelType());
    }

    @Test
    void shouldFallBackToLogForUnknownChannel() {
        properties.getNotification().setChannel("carrier-pigeon");

        NotificationAdapterFactory factory = factory();

        assertEquals("log", factory.getChannelType());
        assertTrue(factory.send(ProactiveMessage.builder().content("hi").build()).join());
    }
}
